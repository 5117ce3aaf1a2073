package com.questrail.pype.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * JoinMessage
 * -----------------------------------------------------------------------------
 * Wire {@code type = "join"}: registration of a user name with the directory.
 */
public sealed interface JoinMessage extends PypeMessage
        permits JoinMessage.Request, JoinMessage.Response
{
    /** Outcome of a join request. Rejection is a status, never an error. */
    enum Status {
        OK("ok"),
        NO("no");

        private final String wireName;

        Status(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Status fromWire(String value) {
            for (Status s : values()) {
                if (s.wireName.equals(value)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Unknown join status: " + value);
        }
    }

    /** Client asks to register {@code name}. */
    record Request(String name) implements JoinMessage {
        public Request {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Server answer. On {@link Status#OK} the rosters hold the directory as of the
     * moment the join was accepted, excluding the joining user.
     */
    record Response(Status status, String name, List<UserInfo> users, List<CallInfo> calls)
            implements JoinMessage
    {
        public Response {
            Objects.requireNonNull(status, "status");
            Objects.requireNonNull(name, "name");
            users = List.copyOf(Objects.requireNonNull(users, "users"));
            calls = List.copyOf(Objects.requireNonNull(calls, "calls"));
        }

        public static Response rejected(String name) {
            return new Response(Status.NO, name, List.of(), List.of());
        }

        public boolean accepted() {
            return status == Status.OK;
        }
    }
}
