package villagecompute.playlists.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.playlists.shuffle.ShuffleAlgorithm;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Name-to-algorithm lookup over every CDI-managed {@link ShuffleAlgorithm}.
 */
@ApplicationScoped
public class ShuffleAlgorithmRegistry {

    private static final Logger LOG = Logger.getLogger(ShuffleAlgorithmRegistry.class);

    private final Map<String, ShuffleAlgorithm> algorithms;

    @Inject
    public ShuffleAlgorithmRegistry(Instance<ShuffleAlgorithm> discovered) {
        this(discovered.stream().toList());
    }

    ShuffleAlgorithmRegistry(Iterable<ShuffleAlgorithm> discovered) {
        Map<String, ShuffleAlgorithm> registry = new TreeMap<>();
        for (ShuffleAlgorithm algorithm : discovered) {
            ShuffleAlgorithm previous = registry.putIfAbsent(algorithm.name(), algorithm);
            if (previous != null) {
                throw new IllegalStateException("Duplicate shuffle algorithms registered as " + algorithm.name() + ": "
                        + previous.getClass().getName() + " and " + algorithm.getClass().getName());
            }
        }
        this.algorithms = Collections.unmodifiableMap(registry);
        LOG.infof("Registered %d shuffle algorithms: %s", algorithms.size(), algorithms.keySet());
    }

    public Optional<ShuffleAlgorithm> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(algorithms.get(name));
    }

    public Set<String> names() {
        return algorithms.keySet();
    }
}
