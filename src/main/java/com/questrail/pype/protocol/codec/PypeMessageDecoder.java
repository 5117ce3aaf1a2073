package com.questrail.pype.protocol.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.pype.protocol.model.CallInfo;
import com.questrail.pype.protocol.model.CallMessage;
import com.questrail.pype.protocol.model.CallUpdate;
import com.questrail.pype.protocol.model.JoinMessage;
import com.questrail.pype.protocol.model.LocalCommand;
import com.questrail.pype.protocol.model.MediaAddresses;
import com.questrail.pype.protocol.model.Medium;
import com.questrail.pype.protocol.model.PypeMessage;
import com.questrail.pype.protocol.model.SessionMessage;
import com.questrail.pype.protocol.model.UserInfo;
import com.questrail.pype.protocol.model.UserStatus;
import com.questrail.pype.protocol.model.UserUpdate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

import static com.questrail.pype.protocol.codec.WireFields.*;

/**
 * PypeMessageDecoder
 * ============================================================================
 * Converts one complete JSON object, as extracted from a stream connection or
 * carried by one datagram, into a semantic {@link PypeMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the <strong>only</strong> place that reads the string
 * {@code type}/{@code subtype}/{@code mode} tags of the wire format. Handlers
 * above it dispatch on the sealed message hierarchy.
 *
 * <h2>What this decoder assumes</h2>
 * The input holds exactly one JSON object. Splitting a TCP byte stream into
 * objects is done by the transport before bytes reach this class.
 *
 * <h2>What this decoder does NOT do</h2>
 * <ul>
 *   <li>Decrypt media content (see {@code MediaFramer})</li>
 *   <li>Check that a message is legal in the current state</li>
 *   <li>Perform transport I/O</li>
 * </ul>
 */
public final class PypeMessageDecoder
{
    private final ObjectMapper mapper;

    public PypeMessageDecoder() {
        this(new ObjectMapper());
    }

    public PypeMessageDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Decodes the raw bytes of one JSON object.
     *
     * @throws PypeDecodeException if the bytes are not a well-formed pype message
     */
    public PypeMessage decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");

        final JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new PypeDecodeException("Payload is not valid JSON", e);
        }
        return decode(root);
    }

    /**
     * Decodes an already parsed JSON tree.
     *
     * @throws PypeDecodeException if the tree is not a well-formed pype message
     */
    public PypeMessage decode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new PypeDecodeException("Message must be a JSON object");
        }

        String type = text(root, TYPE);
        try {
            return switch (type) {
                case TYPE_JOIN -> decodeJoin(root);
                case TYPE_USER_UPDATE -> decodeUserUpdate(root);
                case TYPE_CALL -> decodeCall(root);
                case TYPE_CALL_UPDATE -> decodeCallUpdate(root);
                case TYPE_SESSION -> decodeSession(root);
                case TYPE_LOCAL -> decodeLocal(root);
                default -> throw new PypeDecodeException("Unknown message type: " + type);
            };
        } catch (IllegalArgumentException | NullPointerException e) {
            // Enum lookups and record validation failures.
            throw new PypeDecodeException("Malformed '" + type + "' message: " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Directory traffic
    // ========================================================================

    private JoinMessage decodeJoin(JsonNode root) {
        String subtype = text(root, SUBTYPE);
        return switch (subtype) {
            case "request" -> new JoinMessage.Request(text(root, NAME));
            case "response" -> decodeJoinResponse(root);
            default -> throw unknownSubtype(TYPE_JOIN, subtype);
        };
    }

    private JoinMessage.Response decodeJoinResponse(JsonNode root) {
        JoinMessage.Status status = JoinMessage.Status.fromWire(text(root, STATUS));
        String name = optionalText(root, NAME);

        List<UserInfo> users = new ArrayList<>();
        for (JsonNode u : optionalArray(root, USER_INFO_LST)) {
            users.add(new UserInfo(text(u, NAME), UserStatus.fromWire(text(u, STATUS))));
        }

        List<CallInfo> calls = new ArrayList<>();
        for (JsonNode c : optionalArray(root, CALL_INFO_LST)) {
            calls.add(decodeCallInfo(c));
        }

        return new JoinMessage.Response(status, name == null ? "" : name, users, calls);
    }

    private UserUpdate decodeUserUpdate(JsonNode root) {
        UserUpdate.Kind kind = UserUpdate.Kind.fromWire(text(root, SUBTYPE));
        String status = optionalText(root, STATUS);
        UserStatus userStatus = status == null ? UserStatus.AVAILABLE : UserStatus.fromWire(status);
        return new UserUpdate(kind, text(root, NAME), userStatus);
    }

    private CallMessage decodeCall(JsonNode root) {
        String subtype = text(root, SUBTYPE);
        return switch (subtype) {
            case "request" -> new CallMessage.Request(text(root, CALLEE));
            case "participate" -> new CallMessage.Participate(text(root, CALLER));
            case "callee_response" -> new CallMessage.CalleeResponse(
                    text(root, CALLER),
                    optionalText(root, CALLEE),
                    decision(text(root, STATUS)));
            default -> throw unknownSubtype(TYPE_CALL, subtype);
        };
    }

    private CallUpdate decodeCallUpdate(JsonNode root) {
        CallUpdate.Kind kind = CallUpdate.Kind.fromWire(text(root, SUBTYPE));
        CallInfo info = decodeCallInfo(object(root, INFO));
        String user = optionalText(root, USER);
        return new CallUpdate(kind, text(root, MASTER), user == null ? info.master() : user, info);
    }

    private CallInfo decodeCallInfo(JsonNode node) {
        List<String> participants = new ArrayList<>();
        for (JsonNode p : array(node, PARTICIPANTS)) {
            participants.add(p.asText());
        }

        JsonNode addresses = object(node, ADDRESSES);
        MediaAddresses media = new MediaAddresses(
                text(addresses, Medium.AUDIO.wireName()),
                text(addresses, Medium.VIDEO.wireName()),
                text(addresses, Medium.CHAT.wireName()));

        String host = optionalText(node, MASTER_HOST);
        return new CallInfo(text(node, MASTER), host == null ? "" : host, participants, media);
    }

    // ========================================================================
    // Session traffic
    // ========================================================================

    private SessionMessage decodeSession(JsonNode root) {
        String subtype = text(root, SUBTYPE);
        return switch (subtype) {
            case "leave" -> new SessionMessage.Leave();
            case "content" -> new SessionMessage.Content(
                    Medium.fromWire(text(root, MEDIUM)),
                    base64(root, PAYLOAD));
            case "control" -> decodeControl(root);
            default -> throw unknownSubtype(TYPE_SESSION, subtype);
        };
    }

    private SessionMessage.Control decodeControl(JsonNode root) {
        String mode = text(root, MODE);
        return switch (mode) {
            case "pubkey" -> new SessionMessage.PublicKeyOffer(text(root, SOURCE), base64(root, PUBLIC_KEY));
            case "key_info" -> new SessionMessage.KeyInfo(base64(root, KEY), base64(root, IV));
            case "feedback" -> new SessionMessage.Feedback(text(root, SOURCE), integer(root, RATE));
            case "state" -> new SessionMessage.StateNotice(
                    text(root, SOURCE),
                    Medium.fromWire(text(root, MEDIUM)),
                    bool(root, ENABLED));
            default -> throw new PypeDecodeException("Unknown session control mode: " + mode);
        };
    }

    // ========================================================================
    // Local ingress
    // ========================================================================

    private LocalCommand decodeLocal(JsonNode root) {
        String subtype = text(root, SUBTYPE);
        return switch (subtype) {
            case "join" -> new LocalCommand.Join(text(root, NAME));
            case "call" -> new LocalCommand.Call(text(root, CALLEE));
            case "respond" -> new LocalCommand.Respond(text(root, CALLER), bool(root, ACCEPT));
            case "leave" -> new LocalCommand.Leave();
            case "chat" -> new LocalCommand.Chat(text(root, TEXT));
            case "medium" -> new LocalCommand.ToggleMedium(
                    Medium.fromWire(text(root, MEDIUM)),
                    bool(root, ENABLED));
            default -> throw unknownSubtype(TYPE_LOCAL, subtype);
        };
    }

    // ========================================================================
    // Field helpers
    // ========================================================================

    private static boolean decision(String status) {
        if (STATUS_ACCEPT.equals(status)) {
            return true;
        }
        if (STATUS_REJECT.equals(status)) {
            return false;
        }
        throw new PypeDecodeException("Unknown callee_response status: " + status);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new PypeDecodeException("Missing or non-text field '" + field + "'");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new PypeDecodeException("Non-text field '" + field + "'");
        }
        return value.asText();
    }

    private static int integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new PypeDecodeException("Missing or non-integer field '" + field + "'");
        }
        return value.asInt();
    }

    private static boolean bool(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isBoolean()) {
            throw new PypeDecodeException("Missing or non-boolean field '" + field + "'");
        }
        return value.asBoolean();
    }

    private static JsonNode object(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new PypeDecodeException("Missing or non-object field '" + field + "'");
        }
        return value;
    }

    private static JsonNode array(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new PypeDecodeException("Missing or non-array field '" + field + "'");
        }
        return value;
    }

    private static Iterable<JsonNode> optionalArray(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new PypeDecodeException("Non-array field '" + field + "'");
        }
        return value;
    }

    private static byte[] base64(JsonNode node, String field) {
        try {
            return Base64.getDecoder().decode(text(node, field));
        } catch (IllegalArgumentException e) {
            throw new PypeDecodeException("Field '" + field + "' is not valid base64", e);
        }
    }

    private static PypeDecodeException unknownSubtype(String type, String subtype) {
        return new PypeDecodeException("Unknown subtype '" + subtype + "' for type '" + type + "'");
    }
}
