package villagecompute.playlists.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.playlists.data.models.User;
import villagecompute.playlists.exceptions.ResourceNotFoundException;

import java.time.Instant;
import java.util.Optional;

/**
 * Reads and replaces the stored refresh-token ciphertext, each in its own transaction so a rotated token is committed
 * even if the job that triggered the refresh later fails.
 */
@ApplicationScoped
public class UserCredentialStore {

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Optional<String> loadEncryptedRefreshToken(Long userId) {
        Optional<User> user = User.findByIdOptional(userId);
        return user.map(found -> found.encryptedRefreshToken);
    }

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void storeEncryptedRefreshToken(Long userId, String ciphertext) {
        Optional<User> found = User.findByIdOptional(userId);
        User user = found.orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));
        user.encryptedRefreshToken = ciphertext;
        user.updatedAt = Instant.now();
    }
}
