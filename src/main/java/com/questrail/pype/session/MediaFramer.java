package com.questrail.pype.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.pype.protocol.model.Medium;
import com.questrail.pype.protocol.model.SessionMessage;

import java.io.IOException;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * MediaFramer
 * =============================================================================
 * Seals media units into encrypted {@link SessionMessage.Content} envelopes and
 * opens them again.
 *
 * <h2>Sealing</h2>
 * The whole unit
 * {@code {medium, sequence, session_nonce, packet_nonce, source, timestamp, payload}}
 * is serialized to JSON and encrypted with the call's {@link SessionCipher}.
 *
 * <h2>Opening</h2>
 * A unit is discarded, without any signal back to the sender, when it fails to
 * decrypt or parse, when its medium differs from the envelope's, or when its
 * session nonce is not the locally held one. Replay and sequence-window checks
 * happen afterwards in the statistics tracker.
 */
public final class MediaFramer {

    private final ObjectMapper mapper;
    private final SessionCipher cipher;
    private final long sessionNonce;

    public MediaFramer(KeyMaterial material, ObjectMapper mapper) {
        Objects.requireNonNull(material, "material");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cipher = new SessionCipher(material);
        this.sessionNonce = material.sessionNonce();
    }

    public SessionMessage.Content seal(MediaUnit unit) {
        Objects.requireNonNull(unit, "unit");

        ObjectNode node = mapper.createObjectNode();
        node.put("medium", unit.medium().wireName());
        node.put("sequence", unit.sequence());
        node.put("session_nonce", unit.sessionNonce());
        node.put("packet_nonce", unit.packetNonce());
        node.put("source", unit.source());
        node.put("timestamp", unit.timestamp());
        node.put("payload", Base64.getEncoder().encodeToString(unit.payload()));

        final byte[] plaintext;
        try {
            plaintext = mapper.writeValueAsBytes(node);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize media unit", e);
        }
        return new SessionMessage.Content(unit.medium(), cipher.encrypt(plaintext));
    }

    /**
     * @return the unit, or empty if it must be dropped
     */
    public Optional<MediaUnit> open(SessionMessage.Content content) {
        Objects.requireNonNull(content, "content");

        final MediaUnit unit;
        try {
            JsonNode node = mapper.readTree(cipher.decrypt(content.payload()));
            unit = new MediaUnit(
                    Medium.fromWire(node.path("medium").asText()),
                    requireLong(node, "sequence"),
                    requireLong(node, "session_nonce"),
                    requireLong(node, "packet_nonce"),
                    node.path("source").asText(),
                    node.path("timestamp").asDouble(),
                    Base64.getDecoder().decode(node.path("payload").asText()));
        } catch (SessionCryptoException | IOException | IllegalArgumentException e) {
            return Optional.empty();
        }

        if (unit.sessionNonce() != sessionNonce || unit.medium() != content.medium() || unit.source().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(unit);
    }

    private static long requireLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new IllegalArgumentException("Missing field " + field);
        }
        return value.asLong();
    }
}
