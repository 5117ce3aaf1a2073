package com.questrail.pype.session;

import com.questrail.pype.protocol.model.SessionMessage;

import java.nio.ByteBuffer;
import java.security.KeyPair;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * KeyExchange
 * =============================================================================
 * Both halves of the per-call handshake.
 *
 * <pre>
 *   peer                                   master
 *    |  begin(): fresh RSA key pair          |
 *    |---- PublicKeyOffer(source, pub) ----->|  answer(): wrap(key || nonce) under pub
 *    |&lt;--- KeyInfo(wrapped, iv) -------------|
 *    |  complete(): unwrap, install          |
 * </pre>
 *
 * <p>A peer-side instance is single use: one key pair, one offer, one completion.</p>
 */
public final class KeyExchange {

    private static final int SECRET_BYTES = KeyMaterial.KEY_BYTES + Long.BYTES;

    private final KeyPair keyPair;

    private KeyExchange(KeyPair keyPair) {
        this.keyPair = keyPair;
    }

    /**
     * Peer side: generate a key pair for one handshake.
     */
    public static KeyExchange begin(SecureRandom random) {
        return new KeyExchange(KeyWrap.generateKeyPair(random));
    }

    public SessionMessage.PublicKeyOffer offer(String source) {
        return new SessionMessage.PublicKeyOffer(source, keyPair.getPublic().getEncoded());
    }

    /**
     * Peer side: recover the call's key material from the master's answer.
     *
     * @throws SessionCryptoException if the answer was not wrapped for this key pair
     */
    public KeyMaterial complete(SessionMessage.KeyInfo info) {
        Objects.requireNonNull(info, "info");
        byte[] secret = KeyWrap.unwrap(keyPair.getPrivate(), info.wrappedKey());
        if (secret.length != SECRET_BYTES) {
            throw new SessionCryptoException("Unexpected key info length " + secret.length, null);
        }
        ByteBuffer buf = ByteBuffer.wrap(secret);
        byte[] key = new byte[KeyMaterial.KEY_BYTES];
        buf.get(key);
        return new KeyMaterial(key, info.iv(), buf.getLong());
    }

    /**
     * Master side: answer one public key offer with the call's material.
     */
    public static SessionMessage.KeyInfo answer(SessionMessage.PublicKeyOffer offer, KeyMaterial material) {
        Objects.requireNonNull(offer, "offer");
        Objects.requireNonNull(material, "material");
        byte[] secret = ByteBuffer.allocate(SECRET_BYTES)
                .put(material.key())
                .putLong(material.sessionNonce())
                .array();
        return new SessionMessage.KeyInfo(KeyWrap.wrap(offer.publicKey(), secret), material.iv());
    }
}
