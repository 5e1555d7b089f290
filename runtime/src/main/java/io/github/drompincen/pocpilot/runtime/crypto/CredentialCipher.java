package io.github.drompincen.pocpilot.runtime.crypto;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

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

/**
 * Encrypts tenant model credentials at rest with AES-GCM.
 * <p>
 * The configured key is used as-is when it is a Base64 encoded 32-byte key, otherwise a key
 * is derived from it with PBKDF2. Tokens look like {@code v1:<base64(iv || ciphertext)>}.
 */
@Component
public class CredentialCipher {

    private static final String PREFIX = "v1:";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;
    private static final byte[] KDF_SALT = "pocpilot-credential-salt".getBytes(StandardCharsets.UTF_8);
    private static final int KDF_ITERATIONS = 100_000;

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    public CredentialCipher(@Value("${pocpilot.crypto.key:}") String configuredKey) {
        if (configuredKey == null || configuredKey.isBlank()) {
            throw new IllegalStateException(
                    "pocpilot.crypto.key must be set (POCPILOT_CRYPTO_KEY), or run with the dev profile");
        }
        this.key = resolveKey(configuredKey);
    }

    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext is required");
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] packed = ByteBuffer.allocate(iv.length + ciphertext.length).put(iv).put(ciphertext).array();
            return PREFIX + Base64.getEncoder().encodeToString(packed);
        } catch (GeneralSecurityException e) {
            throw new CredentialCipherException("Credential encryption failed", e);
        }
    }

    public String decrypt(String token) {
        if (token == null || !token.startsWith(PREFIX)) {
            throw new CredentialCipherException("Unsupported credential format");
        }
        try {
            byte[] packed = Base64.getDecoder().decode(token.substring(PREFIX.length()));
            if (packed.length <= IV_LENGTH) {
                throw new CredentialCipherException("Credential token is truncated");
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, packed, 0, IV_LENGTH));
            byte[] plaintext = cipher.doFinal(packed, IV_LENGTH, packed.length - IV_LENGTH);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new CredentialCipherException("Credential decryption failed", e);
        }
    }

    private static SecretKey resolveKey(String configuredKey) {
        byte[] raw = decodeRawKey(configuredKey);
        if (raw != null && raw.length == 32) {
            return new SecretKeySpec(raw, "AES");
        }
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            PBEKeySpec spec = new PBEKeySpec(configuredKey.toCharArray(), KDF_SALT, KDF_ITERATIONS, 256);
            byte[] derived = factory.generateSecret(spec).getEncoded();
            spec.clearPassword();
            return new SecretKeySpec(derived, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot derive credential key", e);
        }
    }

    private static byte[] decodeRawKey(String configuredKey) {
        try {
            return Base64.getDecoder().decode(configuredKey);
        } catch (IllegalArgumentException notBase64) {
            return null;
        }
    }
}
