package villagecompute.playlists.services;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.playlists.exceptions.CredentialException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Encrypts refresh tokens at rest.
 *
 * <p>
 * The AES-256 key is derived from {@code playlistjobs.token.secret-key} with PBKDF2-HMAC-SHA256 over a fixed,
 * versioned salt. Changing the salt or the secret makes every stored token undecryptable and forces users to sign in
 * again.
 *
 * <p>
 * <b>Ciphertext format:</b> URL-safe base64 of {@code version(1) || iv(12) || ciphertext+tag}.
 *
 * <p>
 * Every failure raises {@link CredentialException}: encrypting or decrypting before a key is configured, empty input,
 * and ciphertext that fails authentication (wrong key or corrupted data). Decrypt never returns unverified bytes.
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    static final byte[] SALT = "playlistjobs-refresh-token-encryption-v1".getBytes(StandardCharsets.UTF_8);
    static final int KDF_ITERATIONS = 480_000;
    private static final int KEY_BITS = 256;
    private static final byte FORMAT_VERSION = 1;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecureRandom secureRandom = new SecureRandom();

    @ConfigProperty(
            name = "playlistjobs.token.secret-key")
    Optional<String> secretKey;

    private volatile SecretKey key;

    @PostConstruct
    void init() {
        if (secretKey != null && secretKey.isPresent() && !secretKey.get().isBlank()) {
            initialize(secretKey.get());
        } else {
            LOG.warn("playlistjobs.token.secret-key is not set; refresh tokens cannot be encrypted or decrypted");
        }
    }

    /**
     * Derives the encryption key from the server secret.
     *
     * @throws CredentialException
     *             if the secret is empty or the JVM lacks PBKDF2/AES support
     */
    public void initialize(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new CredentialException("Token encryption secret must not be empty");
        }
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), SALT, KDF_ITERATIONS, KEY_BITS);
            try {
                byte[] derived = factory.generateSecret(spec).getEncoded();
                this.key = new SecretKeySpec(derived, "AES");
            } finally {
                spec.clearPassword();
            }
            LOG.info("Token encryption initialized");
        } catch (GeneralSecurityException e) {
            throw new CredentialException("Failed to initialize token encryption", e);
        }
    }

    public boolean isInitialized() {
        return key != null;
    }

    public String encrypt(String plaintext) {
        SecretKey current = requireKey();
        if (plaintext == null || plaintext.isEmpty()) {
            throw new CredentialException("Cannot encrypt an empty token");
        }
        try {
            byte[] iv = new byte[IV_BYTES];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, current, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer out = ByteBuffer.allocate(1 + IV_BYTES + sealed.length);
            out.put(FORMAT_VERSION).put(iv).put(sealed);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(out.array());
        } catch (GeneralSecurityException e) {
            throw new CredentialException("Failed to encrypt token", e);
        }
    }

    public String decrypt(String ciphertext) {
        SecretKey current = requireKey();
        if (ciphertext == null || ciphertext.isEmpty()) {
            throw new CredentialException("Cannot decrypt an empty token");
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new CredentialException("Invalid token: not valid base64", e);
        }
        if (raw.length <= 1 + IV_BYTES || raw[0] != FORMAT_VERSION) {
            throw new CredentialException("Invalid token: unrecognized format");
        }
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, current, new GCMParameterSpec(TAG_BITS, raw, 1, IV_BYTES));
            byte[] plain = cipher.doFinal(raw, 1 + IV_BYTES, raw.length - 1 - IV_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new CredentialException("Invalid token: decryption failed (wrong key or corrupted data)", e);
        } catch (GeneralSecurityException e) {
            throw new CredentialException("Failed to decrypt token", e);
        }
    }

    private SecretKey requireKey() {
        SecretKey current = key;
        if (current == null) {
            throw new CredentialException("Token encryption is not initialized");
        }
        return current;
    }
}
