package com.questrail.pype.session;

/**
 * Unchecked wrapper for {@link java.security.GeneralSecurityException} raised by
 * session key handling or media encryption.
 */
public final class SessionCryptoException extends RuntimeException
{
    public SessionCryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
