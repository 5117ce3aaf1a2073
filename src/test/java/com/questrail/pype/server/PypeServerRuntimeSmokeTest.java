package com.questrail.pype.server;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.pype.config.PypeServerConfig;
import com.questrail.pype.observability.Slf4jPypeObservabilitySink;
import com.questrail.pype.protocol.codec.PypeMessageDecoder;
import com.questrail.pype.protocol.codec.PypeMessageEncoder;
import com.questrail.pype.protocol.model.JoinMessage;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.protocol.model.UserInfo;
import com.questrail.pype.protocol.model.UserStatus;
import com.questrail.pype.protocol.model.UserUpdate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full server stack on loopback: Netty listener, JSON stream framing, event loop
 * and registry, driven by plain blocking sockets.
 */
class PypeServerRuntimeSmokeTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PypeMessageEncoder encoder = new PypeMessageEncoder(mapper);
    private final PypeMessageDecoder decoder = new PypeMessageDecoder(mapper);

    private PypeServerRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = PypeServerRuntime.builder()
                .withConfig(PypeServerConfig.builder()
                        .withBindAddress(new InetSocketAddress("127.0.0.1", 0)) // ephemeral
                        .build())
                .withObservabilitySink(new Slf4jPypeObservabilitySink())
                .build();
        runtime.start();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    void boundToEphemeralPort() {
        assertNotNull(runtime.boundAddress());
        assertNotEquals(0, runtime.boundAddress().getPort());
    }

    @Test
    void clientsJoinAndSeeEachOther() throws IOException {
        try (Client alice = new Client(); Client bob = new Client()) {
            alice.send(new JoinMessage.Request("alice"));
            JoinMessage.Response toAlice = assertInstanceOf(JoinMessage.Response.class, alice.read());
            assertTrue(toAlice.accepted());
            assertTrue(toAlice.users().isEmpty());

            bob.send(new JoinMessage.Request("bob"));
            JoinMessage.Response toBob = assertInstanceOf(JoinMessage.Response.class, bob.read());
            assertEquals(List.of(new UserInfo("alice", UserStatus.AVAILABLE)), toBob.users());
            assertEquals(new UserUpdate(UserUpdate.Kind.JOIN, "bob", UserStatus.AVAILABLE), alice.read());

            bob.close();
            assertEquals(new UserUpdate(UserUpdate.Kind.LEAVE, "bob", UserStatus.AVAILABLE), alice.read());
        }
    }

    @Test
    void objectsSplitAcrossWritesAreReassembled() throws IOException {
        try (Client alice = new Client()) {
            byte[] request = encoder.encode(new JoinMessage.Request("alice"));
            int half = request.length / 2;
            alice.out.write(request, 0, half);
            alice.out.flush();
            alice.out.write(request, half, request.length - half);
            alice.out.flush();

            JoinMessage.Response response = assertInstanceOf(JoinMessage.Response.class, alice.read());
            assertEquals("alice", response.name());
        }
    }

    // ---------------------------------------------------------------------

    private final class Client implements AutoCloseable {
        private final Socket socket = new Socket();
        private final OutputStream out;
        private final JsonParser in;

        Client() throws IOException {
            socket.connect(runtime.boundAddress(), 2000);
            socket.setSoTimeout(5000);
            out = socket.getOutputStream();
            in = mapper.getFactory().createParser(socket.getInputStream());
        }

        void send(PypeMessage message) throws IOException {
            out.write(encoder.encode(message));
            out.flush();
        }

        PypeMessage read() throws IOException {
            return decoder.decode(mapper.readTree(in));
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
