package com.questrail.pype.session;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Shared secret state of one call: AES key, CBC initialization vector and the
 * session nonce stamped into every media unit.
 */
public record KeyMaterial(byte[] key, byte[] iv, long sessionNonce) {

    public static final int KEY_BYTES = 16;
    public static final int IV_BYTES = 16;

    public KeyMaterial {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(iv, "iv");
        if (key.length != KEY_BYTES) {
            throw new IllegalArgumentException("key must be " + KEY_BYTES + " bytes");
        }
        if (iv.length != IV_BYTES) {
            throw new IllegalArgumentException("iv must be " + IV_BYTES + " bytes");
        }
        key = key.clone();
        iv = iv.clone();
    }

    /**
     * Fresh material for a call whose master is the local participant.
     */
    public static KeyMaterial generate(SecureRandom random) {
        byte[] key = new byte[KEY_BYTES];
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(key);
        random.nextBytes(iv);
        return new KeyMaterial(key, iv, random.nextLong());
    }

    @Override
    public byte[] key() {
        return key.clone();
    }

    @Override
    public byte[] iv() {
        return iv.clone();
    }
}
