package com.securepad.portal.error;

public class AssessmentLockedException extends PortalException {
    public AssessmentLockedException(String message) {
        super(ErrorKind.ASSESSMENT_LOCKED, message);
    }
}
