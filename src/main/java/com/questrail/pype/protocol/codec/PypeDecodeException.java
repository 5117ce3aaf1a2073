package com.questrail.pype.protocol.codec;

/**
 * Indicates that bytes received on a pype connection could not be translated
 * into a valid {@link com.questrail.pype.protocol.model.PypeMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Bytes that are not a JSON object</li>
 *   <li>Unknown {@code type}, {@code subtype} or {@code mode} tag</li>
 *   <li>A missing or mistyped field for the message shape</li>
 * </ul>
 */
public final class PypeDecodeException extends RuntimeException
{
    public PypeDecodeException(String message) {
        super(message);
    }

    public PypeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
