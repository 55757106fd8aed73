package com.securepad.portal.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.securepad.portal.error.ErrorKind;
import com.securepad.portal.error.PortalException;
import com.securepad.portal.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Renders every failure as {@code {"kind": ..., "message": ...}} so clients can tell a
 * duplicate submission from an inactive assessment or a missing permission.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PortalException.class)
    public ResponseEntity<ApiError> handlePortal(PortalException ex) {
        List<String> issues = ex instanceof ValidationException ? ((ValidationException) ex).getIssues() : List.of();
        return ResponseEntity.status(ex.getKind().status())
                .body(new ApiError(ex.getKind(), ex.getMessage(), issues.isEmpty() ? null : issues));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleMalformed(Exception ex) {
        return ResponseEntity.badRequest()
                .body(new ApiError(ErrorKind.VALIDATION_ERROR, "Malformed request", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            ErrorKind kind = status.value() == 404 ? ErrorKind.NOT_FOUND : ErrorKind.VALIDATION_ERROR;
            return ResponseEntity.status(status).body(new ApiError(kind, ex.getMessage(), null));
        }
        log.error("Unhandled error", ex);
        return ResponseEntity.internalServerError()
                .body(new ApiError(ErrorKind.INTERNAL_ERROR, "Server Error", null));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ApiError(ErrorKind kind, String message, List<String> issues) {}
}
