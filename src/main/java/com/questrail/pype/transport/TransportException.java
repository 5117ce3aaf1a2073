package com.questrail.pype.transport;

/**
 * Unchecked failure of a transport operation: bind, connect or send.
 */
public final class TransportException extends RuntimeException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
