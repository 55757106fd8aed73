package com.securepad.portal.error;

public class NotFoundException extends PortalException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
