package com.serge.scheduler.error;

import lombok.Value;

/** One per-field validation problem, rendered as {@code {field, message}}. */
@Value
public class FieldIssue {
    String field;
    String message;
}
