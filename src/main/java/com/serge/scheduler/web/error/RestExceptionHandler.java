package com.serge.scheduler.web.error;

import com.serge.scheduler.config.logging.RequestIdFilter;
import com.serge.scheduler.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/** Error body for plain HTTP endpoints: {@code {error, code, requestId}}. */
@RestControllerAdvice
public class RestExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    /** Framework-level failures (unknown path, wrong method, unreadable body) keep their status. */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> frameworkError(Exception ex) {
        HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
        if (status == null) status = HttpStatus.BAD_REQUEST;
        log.debug("http.error.framework status={} type={}", status.value(), ex.getClass().getSimpleName());
        return ResponseEntity.status(status).body(body(status.getReasonPhrase(), codeFor(status).name()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handle(Exception ex) {
        if (ex instanceof ErrorResponse) {
            return frameworkError(ex);
        }
        NormalizedError error = NormalizedError.of(ex);
        if (error.isInternal()) {
            log.error("http.error.internal requestId={}", MDC.get(RequestIdFilter.MDC_KEY), ex);
        } else {
            log.info("http.error code={} message=\"{}\"", error.getCode(), error.getMessage());
        }
        return ResponseEntity.status(error.getCode().status())
                .body(body(error.getMessage(), error.getCode().name()));
    }

    static ErrorCode codeFor(HttpStatus status) {
        switch (status) {
            case UNAUTHORIZED:
                return ErrorCode.UNAUTHENTICATED;
            case FORBIDDEN:
                return ErrorCode.FORBIDDEN;
            case NOT_FOUND:
                return ErrorCode.NOT_FOUND;
            case CONFLICT:
                return ErrorCode.CONFLICT;
            default:
                return status.is4xxClientError() ? ErrorCode.BAD_USER_INPUT : ErrorCode.INTERNAL_SERVER_ERROR;
        }
    }

    private static Map<String, Object> body(String message, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        body.put("requestId", MDC.get(RequestIdFilter.MDC_KEY));
        return body;
    }
}
