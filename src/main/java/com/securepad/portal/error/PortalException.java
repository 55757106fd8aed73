package com.securepad.portal.error;

/**
 * Base of every failure the portal reports to its callers. The {@link ErrorKind} travels
 * unchanged to the HTTP layer so clients can branch on it.
 */
public class PortalException extends RuntimeException {
    private final ErrorKind kind;

    public PortalException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
