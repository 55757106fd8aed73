package com.securepad.portal.error;

public class NoPendingChallengeException extends PortalException {
    public NoPendingChallengeException(String message) {
        super(ErrorKind.NO_PENDING_CHALLENGE, message);
    }
}
