package villagecompute.playlists.data.models;

/**
 * Lifecycle of a {@link JobExecution}. Transitions are RUNNING to SUCCESS or RUNNING to FAILED, once.
 *
 * <p>
 * Also used for {@link Schedule#lastStatus}, where only the two terminal values appear (null means never run).
 */
public enum ExecutionStatus {

    RUNNING("running"),

    SUCCESS("success"),

    FAILED("failed");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
