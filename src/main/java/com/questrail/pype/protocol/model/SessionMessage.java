package com.questrail.pype.protocol.model;

import java.util.Objects;

/**
 * SessionMessage
 * -----------------------------------------------------------------------------
 * Wire {@code type = "session"}: everything exchanged once a call exists.
 *
 * <ul>
 *   <li>{@link Leave} goes from a participant to the directory server.</li>
 *   <li>{@link Content} carries one encrypted media unit over multicast.</li>
 *   <li>{@link Control} subtypes run the key handshake, rate feedback and
 *       per-medium state notices between participants.</li>
 * </ul>
 */
public sealed interface SessionMessage extends PypeMessage
        permits SessionMessage.Leave, SessionMessage.Content, SessionMessage.Control
{
    /** Participant leaves its current call. */
    record Leave() implements SessionMessage {
    }

    /**
     * Encrypted media envelope. {@code payload} is the ciphertext of a whole media
     * unit; the medium tag is a routing hint only and is re-checked after decryption.
     */
    record Content(Medium medium, byte[] payload) implements SessionMessage {
        public Content {
            Objects.requireNonNull(medium, "medium");
            Objects.requireNonNull(payload, "payload");
        }
    }

    /** Wire {@code subtype = "control"}, discriminated by {@code mode}. */
    sealed interface Control extends SessionMessage
            permits PublicKeyOffer, KeyInfo, Feedback, StateNotice
    {
    }

    /** Peer sends its encoded RSA public key to the master's key listener. */
    record PublicKeyOffer(String source, byte[] publicKey) implements Control {
        public PublicKeyOffer {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(publicKey, "publicKey");
        }
    }

    /**
     * Master answer: symmetric key and session nonce wrapped under the peer's
     * public key, and the initialization vector in the clear.
     */
    record KeyInfo(byte[] wrappedKey, byte[] iv) implements Control {
        public KeyInfo {
            Objects.requireNonNull(wrappedKey, "wrappedKey");
            Objects.requireNonNull(iv, "iv");
        }
    }

    /** Rate feedback: {@code source} can sustain {@code rate} video frames per second. */
    record Feedback(String source, int rate) implements Control {
        public Feedback {
            Objects.requireNonNull(source, "source");
            if (rate < 0) {
                throw new IllegalArgumentException("rate must be >= 0");
            }
        }
    }

    /** A participant switched sending of one medium on or off. */
    record StateNotice(String source, Medium medium, boolean enabled) implements Control {
        public StateNotice {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(medium, "medium");
        }
    }
}
