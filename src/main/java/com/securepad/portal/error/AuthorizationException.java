package com.securepad.portal.error;

public class AuthorizationException extends PortalException {
    public AuthorizationException(String message) {
        super(ErrorKind.AUTHORIZATION_ERROR, message);
    }
}
