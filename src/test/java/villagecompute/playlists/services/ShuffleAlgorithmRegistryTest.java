package villagecompute.playlists.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import villagecompute.playlists.shuffle.BasicShuffleAlgorithm;
import villagecompute.playlists.shuffle.ShuffleAlgorithm;

/**
 * Unit tests for {@link ShuffleAlgorithmRegistry}.
 */
class ShuffleAlgorithmRegistryTest {

    private static ShuffleAlgorithm named(String name) {
        ShuffleAlgorithm algorithm = mock(ShuffleAlgorithm.class);
        when(algorithm.name()).thenReturn(name);
        return algorithm;
    }

    @Test
    void testFind_byName() {
        BasicShuffleAlgorithm basic = new BasicShuffleAlgorithm();
        ShuffleAlgorithm reverse = named("Reverse");

        ShuffleAlgorithmRegistry registry = new ShuffleAlgorithmRegistry(List.of(basic, reverse));

        assertSame(basic, registry.find("BasicShuffle").orElseThrow());
        assertSame(reverse, registry.find("Reverse").orElseThrow());
        assertTrue(registry.find("basicshuffle").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertEquals(Set.of("BasicShuffle", "Reverse"), registry.names());
    }

    @Test
    void testConstructor_rejectsDuplicateNames() {
        List<ShuffleAlgorithm> algorithms = List.of(named("Reverse"), named("Reverse"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new ShuffleAlgorithmRegistry(algorithms));
        assertTrue(e.getMessage().startsWith("Duplicate shuffle algorithms registered as Reverse"));
    }
}
