package com.questrail.pype.session;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Symmetric encryption of whole media units: AES/CBC without cipher padding.
 * Plaintext is zero-padded to the block size and trailing zero bytes are
 * stripped after decryption, so plaintexts must not end in zero bytes (JSON
 * text never does).
 */
public final class SessionCipher {

    static final String TRANSFORMATION = "AES/CBC/NoPadding";
    static final int BLOCK = 16;

    private static final ThreadLocal<Cipher> CIPHER = ThreadLocal.withInitial(() -> {
        try {
            return Cipher.getInstance(TRANSFORMATION);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Required crypto algorithm unavailable", e);
        }
    });

    private final SecretKeySpec key;
    private final IvParameterSpec iv;

    public SessionCipher(KeyMaterial material) {
        Objects.requireNonNull(material, "material");
        this.key = new SecretKeySpec(material.key(), "AES");
        this.iv = new IvParameterSpec(material.iv());
    }

    public byte[] encrypt(byte[] plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        int padded = ((plaintext.length + BLOCK - 1) / BLOCK) * BLOCK;
        byte[] input = Arrays.copyOf(plaintext, Math.max(padded, BLOCK));
        try {
            Cipher cipher = CIPHER.get();
            cipher.init(Cipher.ENCRYPT_MODE, key, iv);
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw new SessionCryptoException("Encryption failed", e);
        }
    }

    public byte[] decrypt(byte[] ciphertext) {
        Objects.requireNonNull(ciphertext, "ciphertext");
        if (ciphertext.length == 0 || ciphertext.length % BLOCK != 0) {
            throw new SessionCryptoException("Ciphertext length " + ciphertext.length
                    + " is not a positive multiple of " + BLOCK, null);
        }
        final byte[] plain;
        try {
            Cipher cipher = CIPHER.get();
            cipher.init(Cipher.DECRYPT_MODE, key, iv);
            plain = cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new SessionCryptoException("Decryption failed", e);
        }

        int end = plain.length;
        while (end > 0 && plain[end - 1] == 0) {
            end--;
        }
        return Arrays.copyOf(plain, end);
    }
}
