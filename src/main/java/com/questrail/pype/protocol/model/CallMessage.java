package com.questrail.pype.protocol.model;

import java.util.Objects;

/**
 * CallMessage
 * -----------------------------------------------------------------------------
 * Wire {@code type = "call"}: call formation signaling between two users,
 * brokered by the directory server.
 */
public sealed interface CallMessage extends PypeMessage
        permits CallMessage.Request, CallMessage.Participate, CallMessage.CalleeResponse
{
    /** Caller asks the server to invite {@code callee}. */
    record Request(String callee) implements CallMessage {
        public Request {
            Objects.requireNonNull(callee, "callee");
        }
    }

    /** Server tells a callee that {@code caller} is inviting it. */
    record Participate(String caller) implements CallMessage {
        public Participate {
            Objects.requireNonNull(caller, "caller");
        }
    }

    /**
     * Callee answer to an invitation. When the server relays a rejection back to
     * the caller it also fills in {@code callee}; otherwise {@code callee} may be
     * {@code null}.
     */
    record CalleeResponse(String caller, String callee, boolean accepted) implements CallMessage {
        public CalleeResponse {
            Objects.requireNonNull(caller, "caller");
        }
    }
}
