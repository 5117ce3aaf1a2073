package com.questrail.pype.session;

import javax.crypto.Cipher;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.X509EncodedKeySpec;

/**
 * RSA-OAEP wrapping of the symmetric key during the call handshake.
 */
public final class KeyWrap {

    static final String TRANSFORMATION = "RSA/ECB/OAEPWithSHA-256AndMGF1Padding";
    static final int KEY_SIZE = 2048;

    private KeyWrap() {
    }

    public static KeyPair generateKeyPair(SecureRandom random) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(KEY_SIZE, random);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new SessionCryptoException("RSA key generation failed", e);
        }
    }

    /**
     * Encrypts {@code secret} under an X.509-encoded public key.
     */
    public static byte[] wrap(byte[] encodedPublicKey, byte[] secret) {
        try {
            PublicKey publicKey = KeyFactory.getInstance("RSA")
                    .generatePublic(new X509EncodedKeySpec(encodedPublicKey));
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, publicKey);
            return cipher.doFinal(secret);
        } catch (GeneralSecurityException e) {
            throw new SessionCryptoException("Key wrap failed", e);
        }
    }

    public static byte[] unwrap(PrivateKey privateKey, byte[] wrapped) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, privateKey);
            return cipher.doFinal(wrapped);
        } catch (GeneralSecurityException e) {
            throw new SessionCryptoException("Key unwrap failed", e);
        }
    }
}
