package com.rightsparser.util;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption of published artifacts.
 *
 * Each call uses a fresh random key. The encrypted form is the 12-byte nonce followed by
 * the ciphertext and tag; the key is returned base64 encoded.
 */
public class PayloadEncryptor {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BITS = 256;
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private PayloadEncryptor() {
    }

    public static Encrypted encrypt(String plaintext) throws GeneralSecurityException {
        KeyGenerator generator = KeyGenerator.getInstance(ALGORITHM);
        generator.init(KEY_BITS, SECURE_RANDOM);
        SecretKey key = generator.generateKey();

        byte[] nonce = new byte[NONCE_BYTES];
        SECURE_RANDOM.nextBytes(nonce);

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
        byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

        byte[] data = ByteBuffer.allocate(nonce.length + ciphertext.length)
                .put(nonce)
                .put(ciphertext)
                .array();
        return new Encrypted(data, Base64.getEncoder().encodeToString(key.getEncoded()));
    }

    /**
     * Reverse of {@link #encrypt(String)}.
     *
     * @throws GeneralSecurityException on a wrong key or corrupted data
     */
    public static String decrypt(byte[] data, String base64Key) throws GeneralSecurityException {
        byte[] keyBytes = Base64.getDecoder().decode(base64Key);
        if (keyBytes.length != KEY_BITS / 8) {
            throw new GeneralSecurityException("Invalid key length: expected 32 bytes, got " + keyBytes.length);
        }
        if (data.length < NONCE_BYTES) {
            throw new GeneralSecurityException("Encrypted data too short");
        }

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(keyBytes, ALGORITHM),
                new GCMParameterSpec(TAG_BITS, data, 0, NONCE_BYTES));
        byte[] plaintext = cipher.doFinal(data, NONCE_BYTES, data.length - NONCE_BYTES);
        return new String(plaintext, StandardCharsets.UTF_8);
    }

    public static final class Encrypted {
        private final byte[] data;
        private final String key;

        public Encrypted(byte[] data, String key) {
            this.data = data;
            this.key = key;
        }

        public byte[] getData() {
            return data;
        }

        public String getKey() {
            return key;
        }
    }
}
