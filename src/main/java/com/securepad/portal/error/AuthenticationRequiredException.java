package com.securepad.portal.error;

public class AuthenticationRequiredException extends PortalException {
    public AuthenticationRequiredException(String message) {
        super(ErrorKind.AUTHENTICATION_REQUIRED, message);
    }
}
