package com.questrail.pype.protocol.model;

import java.util.Objects;

/**
 * LocalCommand
 * -----------------------------------------------------------------------------
 * Wire {@code type = "local"}: commands sent by the presentation layer to its
 * peer process through the local ingress datagram endpoint.
 *
 * <p>The presentation layer only expresses user intent here. Whether an intent
 * is legal in the current state is decided by the peer.</p>
 */
public sealed interface LocalCommand extends PypeMessage
        permits LocalCommand.Join, LocalCommand.Call, LocalCommand.Respond,
                LocalCommand.Leave, LocalCommand.Chat, LocalCommand.ToggleMedium
{
    record Join(String name) implements LocalCommand {
        public Join {
            Objects.requireNonNull(name, "name");
        }
    }

    record Call(String callee) implements LocalCommand {
        public Call {
            Objects.requireNonNull(callee, "callee");
        }
    }

    record Respond(String caller, boolean accept) implements LocalCommand {
        public Respond {
            Objects.requireNonNull(caller, "caller");
        }
    }

    record Leave() implements LocalCommand {
    }

    record Chat(String text) implements LocalCommand {
        public Chat {
            Objects.requireNonNull(text, "text");
        }
    }

    record ToggleMedium(Medium medium, boolean enabled) implements LocalCommand {
        public ToggleMedium {
            Objects.requireNonNull(medium, "medium");
        }
    }
}
