package com.questrail.pype.protocol.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.pype.protocol.model.CallInfo;
import com.questrail.pype.protocol.model.CallMessage;
import com.questrail.pype.protocol.model.CallUpdate;
import com.questrail.pype.protocol.model.JoinMessage;
import com.questrail.pype.protocol.model.LocalCommand;
import com.questrail.pype.protocol.model.Medium;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.protocol.model.SessionMessage;
import com.questrail.pype.protocol.model.UserInfo;
import com.questrail.pype.protocol.model.UserUpdate;

import java.util.Base64;
import java.util.Objects;

import static com.questrail.pype.protocol.codec.WireFields.*;

/**
 * PypeMessageEncoder
 * ============================================================================
 * Converts a semantic {@link PypeMessage} into the JSON object that travels on
 * the wire.
 *
 * <p>The outbound pipeline is:</p>
 * <pre>
 *   PypeMessage  ->  ObjectNode  ->  byte[] (UTF-8 JSON)
 *       (this)         (this)
 * </pre>
 *
 * <p>Byte arrays (ciphertext, public keys, IVs) are carried as base64 text.
 * Concatenated objects on a stream connection need no separator; the reader
 * splits them by brace matching.</p>
 */
public final class PypeMessageEncoder
{
    private final ObjectMapper mapper;

    public PypeMessageEncoder() {
        this(new ObjectMapper());
    }

    public PypeMessageEncoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Encodes a message to UTF-8 JSON bytes.
     */
    public byte[] encode(PypeMessage message) {
        ObjectNode node = toTree(message);
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            // A tree built from validated records always serializes.
            throw new IllegalStateException("Failed to serialize " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * Builds the JSON tree for a message.
     */
    public ObjectNode toTree(PypeMessage message) {
        Objects.requireNonNull(message, "message");

        if (message instanceof JoinMessage join) {
            return encodeJoin(join);
        }
        if (message instanceof UserUpdate update) {
            ObjectNode node = header(TYPE_USER_UPDATE, update.kind().wireName());
            node.put(NAME, update.name());
            node.put(STATUS, update.status().wireName());
            return node;
        }
        if (message instanceof CallMessage call) {
            return encodeCall(call);
        }
        if (message instanceof CallUpdate update) {
            ObjectNode node = header(TYPE_CALL_UPDATE, update.kind().wireName());
            node.put(MASTER, update.callKey());
            node.put(USER, update.user());
            node.set(INFO, callInfo(update.info()));
            return node;
        }
        if (message instanceof SessionMessage session) {
            return encodeSession(session);
        }
        if (message instanceof LocalCommand local) {
            return encodeLocal(local);
        }
        throw new IllegalArgumentException("Unsupported message: " + message.getClass().getName());
    }

    // ========================================================================
    // Directory traffic
    // ========================================================================

    private ObjectNode encodeJoin(JoinMessage join) {
        if (join instanceof JoinMessage.Request request) {
            ObjectNode node = header(TYPE_JOIN, "request");
            node.put(NAME, request.name());
            return node;
        }

        JoinMessage.Response response = (JoinMessage.Response) join;
        ObjectNode node = header(TYPE_JOIN, "response");
        node.put(STATUS, response.status().wireName());
        node.put(NAME, response.name());

        ArrayNode users = node.putArray(USER_INFO_LST);
        for (UserInfo u : response.users()) {
            ObjectNode entry = users.addObject();
            entry.put(NAME, u.name());
            entry.put(STATUS, u.status().wireName());
        }

        ArrayNode calls = node.putArray(CALL_INFO_LST);
        for (CallInfo c : response.calls()) {
            calls.add(callInfo(c));
        }
        return node;
    }

    private ObjectNode encodeCall(CallMessage call) {
        if (call instanceof CallMessage.Request request) {
            ObjectNode node = header(TYPE_CALL, "request");
            node.put(CALLEE, request.callee());
            return node;
        }
        if (call instanceof CallMessage.Participate participate) {
            ObjectNode node = header(TYPE_CALL, "participate");
            node.put(CALLER, participate.caller());
            return node;
        }

        CallMessage.CalleeResponse response = (CallMessage.CalleeResponse) call;
        ObjectNode node = header(TYPE_CALL, "callee_response");
        node.put(CALLER, response.caller());
        if (response.callee() != null) {
            node.put(CALLEE, response.callee());
        }
        node.put(STATUS, response.accepted() ? STATUS_ACCEPT : STATUS_REJECT);
        return node;
    }

    private ObjectNode callInfo(CallInfo info) {
        ObjectNode node = mapper.createObjectNode();
        node.put(MASTER, info.master());
        node.put(MASTER_HOST, info.masterHost());

        ArrayNode participants = node.putArray(PARTICIPANTS);
        info.participants().forEach(participants::add);

        ObjectNode addresses = node.putObject(ADDRESSES);
        for (Medium m : Medium.values()) {
            addresses.put(m.wireName(), info.addresses().forMedium(m));
        }
        return node;
    }

    // ========================================================================
    // Session traffic
    // ========================================================================

    private ObjectNode encodeSession(SessionMessage session) {
        if (session instanceof SessionMessage.Leave) {
            return header(TYPE_SESSION, "leave");
        }
        if (session instanceof SessionMessage.Content content) {
            ObjectNode node = header(TYPE_SESSION, "content");
            node.put(MEDIUM, content.medium().wireName());
            node.put(PAYLOAD, base64(content.payload()));
            return node;
        }

        ObjectNode node = header(TYPE_SESSION, "control");
        if (session instanceof SessionMessage.PublicKeyOffer offer) {
            node.put(MODE, "pubkey");
            node.put(SOURCE, offer.source());
            node.put(PUBLIC_KEY, base64(offer.publicKey()));
        } else if (session instanceof SessionMessage.KeyInfo keyInfo) {
            node.put(MODE, "key_info");
            node.put(KEY, base64(keyInfo.wrappedKey()));
            node.put(IV, base64(keyInfo.iv()));
        } else if (session instanceof SessionMessage.Feedback feedback) {
            node.put(MODE, "feedback");
            node.put(SOURCE, feedback.source());
            node.put(RATE, feedback.rate());
        } else if (session instanceof SessionMessage.StateNotice state) {
            node.put(MODE, "state");
            node.put(SOURCE, state.source());
            node.put(MEDIUM, state.medium().wireName());
            node.put(ENABLED, state.enabled());
        } else {
            throw new IllegalArgumentException("Unsupported session message: " + session.getClass().getName());
        }
        return node;
    }

    // ========================================================================
    // Local ingress
    // ========================================================================

    private ObjectNode encodeLocal(LocalCommand local) {
        if (local instanceof LocalCommand.Join join) {
            ObjectNode node = header(TYPE_LOCAL, "join");
            node.put(NAME, join.name());
            return node;
        }
        if (local instanceof LocalCommand.Call call) {
            ObjectNode node = header(TYPE_LOCAL, "call");
            node.put(CALLEE, call.callee());
            return node;
        }
        if (local instanceof LocalCommand.Respond respond) {
            ObjectNode node = header(TYPE_LOCAL, "respond");
            node.put(CALLER, respond.caller());
            node.put(ACCEPT, respond.accept());
            return node;
        }
        if (local instanceof LocalCommand.Leave) {
            return header(TYPE_LOCAL, "leave");
        }
        if (local instanceof LocalCommand.Chat chat) {
            ObjectNode node = header(TYPE_LOCAL, "chat");
            node.put(TEXT, chat.text());
            return node;
        }

        LocalCommand.ToggleMedium toggle = (LocalCommand.ToggleMedium) local;
        ObjectNode node = header(TYPE_LOCAL, "medium");
        node.put(MEDIUM, toggle.medium().wireName());
        node.put(ENABLED, toggle.enabled());
        return node;
    }

    // ------------------------------------------------------------------------

    private ObjectNode header(String type, String subtype) {
        ObjectNode node = mapper.createObjectNode();
        node.put(TYPE, type);
        node.put(SUBTYPE, subtype);
        return node;
    }

    private static String base64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }
}
