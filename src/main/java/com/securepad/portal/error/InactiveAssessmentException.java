package com.securepad.portal.error;

public class InactiveAssessmentException extends PortalException {
    public InactiveAssessmentException(String message) {
        super(ErrorKind.INACTIVE_ASSESSMENT, message);
    }
}
