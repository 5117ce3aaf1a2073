package com.questrail.pype.protocol.model;

/**
 * PypeMessage
 * -----------------------------------------------------------------------------
 * Root of the wire protocol model.
 *
 * <h2>Role in the architecture</h2>
 * Every JSON object that crosses a pype connection (control stream, local
 * ingress datagram, multicast media or control datagram) decodes into exactly
 * one {@link PypeMessage}. The {@code type}/{@code subtype} tags of the wire
 * format are resolved once, in the codec; everything above the codec
 * dispatches on the sealed hierarchy with {@code instanceof} patterns.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Messages are immutable value objects</li>
 *   <li>Messages carry no behavior beyond validation</li>
 *   <li>One category per top-level wire {@code type}</li>
 * </ul>
 */
public sealed interface PypeMessage
        permits JoinMessage, UserUpdate, CallMessage, CallUpdate, SessionMessage, LocalCommand
{
}
