package com.securepad.portal.error;

public class DuplicateSubmissionException extends PortalException {
    public DuplicateSubmissionException() {
        super(ErrorKind.DUPLICATE_SUBMISSION, "You have already submitted this assessment");
    }
}
