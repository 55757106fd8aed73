package com.securepad.portal.error;

import java.util.List;

public class ValidationException extends PortalException {
    private final List<String> issues;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> issues) {
        super(ErrorKind.VALIDATION_ERROR, message);
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }
}
