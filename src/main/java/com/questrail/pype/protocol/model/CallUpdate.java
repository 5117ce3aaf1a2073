package com.questrail.pype.protocol.model;

import java.util.Objects;

/**
 * CallUpdate
 * -----------------------------------------------------------------------------
 * Wire {@code type = "call_update"}: call roster change broadcast to the whole
 * directory.
 *
 * <p>{@code callKey} is the master the call was registered under before the
 * update. After a master migration {@code info.master()} names the new master,
 * which is the key for every later update. {@code user} is the participant the
 * update is about.</p>
 */
public record CallUpdate(Kind kind, String callKey, String user, CallInfo info) implements PypeMessage {

    public enum Kind {
        CALL_ADD("call_add"),
        CALL_REMOVE("call_remove"),
        USER_JOIN("user_join"),
        USER_LEAVE("user_leave");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Kind fromWire(String value) {
            for (Kind k : values()) {
                if (k.wireName.equals(value)) {
                    return k;
                }
            }
            throw new IllegalArgumentException("Unknown call_update subtype: " + value);
        }
    }

    public CallUpdate {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(callKey, "callKey");
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(info, "info");
    }
}
