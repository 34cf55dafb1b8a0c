package com.serge.scheduler.web.error;

import com.serge.scheduler.error.*;
import lombok.Value;
import org.springframework.dao.DuplicateKeyException;

import java.util.List;

/** The client-facing view of a fault: code, safe message and, for validation faults, details. */
@Value
public class NormalizedError {
    ErrorCode code;
    String message;
    List<FieldIssue> details;

    public boolean isInternal() {
        return code == ErrorCode.INTERNAL_SERVER_ERROR;
    }

    public static NormalizedError of(Throwable ex) {
        if (ex instanceof ValidationException) {
            ValidationException v = (ValidationException) ex;
            return new NormalizedError(v.getCode(), v.getMessage(), v.getDetails());
        }
        if (ex instanceof ApiException) {
            ApiException a = (ApiException) ex;
            return new NormalizedError(a.getCode(), a.getMessage(), null);
        }
        if ((ex instanceof StoreException && ((StoreException) ex).isDuplicateKey())
                || ex instanceof DuplicateKeyException) {
            return new NormalizedError(ErrorCode.CONFLICT, Messages.DUPLICATE_KEY, null);
        }
        return new NormalizedError(ErrorCode.INTERNAL_SERVER_ERROR, Messages.INTERNAL_ERROR, null);
    }
}
