package com.serge.scheduler.error;

import lombok.Getter;

import java.util.List;

@Getter
public class ValidationException extends ApiException {
    private final List<FieldIssue> details;

    public ValidationException(List<FieldIssue> details) {
        super(ErrorCode.BAD_USER_INPUT, Messages.VALIDATION_FAILED);
        this.details = List.copyOf(details);
    }

    public static ValidationException of(String field, String message) {
        return new ValidationException(List.of(new FieldIssue(field, message)));
    }
}
