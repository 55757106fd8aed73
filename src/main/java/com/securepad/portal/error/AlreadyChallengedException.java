package com.securepad.portal.error;

public class AlreadyChallengedException extends PortalException {
    public AlreadyChallengedException(String message) {
        super(ErrorKind.ALREADY_CHALLENGED, message);
    }
}
