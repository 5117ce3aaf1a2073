package com.questrail.pype.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.pype.protocol.model.Medium;
import com.questrail.pype.protocol.model.SessionMessage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MediaFramerTest
 * -----------------------------------------------------------------------------
 * Sealing and opening of encrypted media units.
 */
class MediaFramerTest {

    private final SecureRandom random = new SecureRandom();
    private final ObjectMapper mapper = new ObjectMapper();
    private final KeyMaterial material = KeyMaterial.generate(random);

    @Test
    void openRecoversEveryField() {
        MediaFramer framer = new MediaFramer(material, mapper);
        byte[] payload = "frame-bytes".getBytes(StandardCharsets.UTF_8);
        MediaUnit unit = new MediaUnit(Medium.VIDEO, 42, material.sessionNonce(), 99L, "alice", 1700000000.25, payload);

        SessionMessage.Content content = framer.seal(unit);
        MediaUnit opened = framer.open(content).orElseThrow();

        assertEquals(Medium.VIDEO, content.medium());
        assertEquals(0, content.payload().length % 16);
        assertEquals(Medium.VIDEO, opened.medium());
        assertEquals(42, opened.sequence());
        assertEquals(material.sessionNonce(), opened.sessionNonce());
        assertEquals(99L, opened.packetNonce());
        assertEquals("alice", opened.source());
        assertEquals(1700000000.25, opened.timestamp(), 1e-6);
        assertArrayEquals(payload, opened.payload());
    }

    @Test
    void unitFromAnotherSessionIsRejected() {
        MediaFramer framer = new MediaFramer(material, mapper);
        KeyMaterial sameKeyOtherNonce = new KeyMaterial(material.key(), material.iv(), material.sessionNonce() + 1);
        MediaFramer stale = new MediaFramer(sameKeyOtherNonce, mapper);

        SessionMessage.Content content = stale.seal(unit(Medium.AUDIO, sameKeyOtherNonce.sessionNonce()));

        assertEquals(Optional.empty(), framer.open(content));
    }

    @Test
    void unitUnderAnotherKeyIsRejected() {
        MediaFramer framer = new MediaFramer(material, mapper);
        KeyMaterial other = KeyMaterial.generate(random);

        SessionMessage.Content content = new MediaFramer(other, mapper).seal(unit(Medium.AUDIO, other.sessionNonce()));

        assertEquals(Optional.empty(), framer.open(content));
    }

    @Test
    void envelopeMediumMustMatchSealedMedium() {
        MediaFramer framer = new MediaFramer(material, mapper);
        SessionMessage.Content audio = framer.seal(unit(Medium.AUDIO, material.sessionNonce()));

        SessionMessage.Content relabelled = new SessionMessage.Content(Medium.VIDEO, audio.payload());

        assertEquals(Optional.empty(), framer.open(relabelled));
    }

    @Test
    void truncatedCiphertextIsRejected() {
        MediaFramer framer = new MediaFramer(material, mapper);

        assertEquals(Optional.empty(), framer.open(new SessionMessage.Content(Medium.CHAT, new byte[10])));
    }

    private static MediaUnit unit(Medium medium, long sessionNonce) {
        return new MediaUnit(medium, 0, sessionNonce, 7L, "bob", 1.0, new byte[]{5, 6, 7});
    }
}
