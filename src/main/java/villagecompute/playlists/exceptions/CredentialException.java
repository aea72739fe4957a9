package villagecompute.playlists.exceptions;

/**
 * Exception thrown when a stored credential cannot be used: the cipher was never initialized, the ciphertext fails
 * its integrity check, the user has no stored refresh token, or the token endpoint refuses the refresh.
 *
 * <p>
 * Terminal for the job run that hit it. The user has to sign in again before scheduled operations resume.
 */
public class CredentialException extends RuntimeException {

    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
