package com.serge.scheduler.validation;

import com.serge.scheduler.error.FieldIssue;
import com.serge.scheduler.error.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluates an operation's input schema at the boundary. Anything past this point may assume the
 * input is well formed.
 */
@Component
@RequiredArgsConstructor
public class InputValidator {
    private static final Logger log = LoggerFactory.getLogger(InputValidator.class);

    private final Validator validator;

    /**
     * @throws ValidationException with one {@link FieldIssue} per violation, ordered by field
     */
    public <T> T validate(String operation, T input) {
        if (input == null) {
            throw ValidationException.of("input", "Input is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(input);
        if (violations.isEmpty()) return input;

        List<FieldIssue> issues = violations.stream()
                .map(v -> new FieldIssue(fieldName(v.getPropertyPath()), v.getMessage()))
                .sorted(Comparator.comparing(FieldIssue::getField).thenComparing(FieldIssue::getMessage))
                .collect(Collectors.toList());
        log.debug("validation.failed operation={} issues={}", operation, issues.size());
        throw new ValidationException(issues);
    }

    /** {@code attendeeIds[1]} rather than {@code attendeeIds[1].<list element>}. */
    static String fieldName(Path path) {
        StringBuilder sb = new StringBuilder();
        for (Path.Node node : path) {
            String name = node.getName();
            if (name != null && !name.startsWith("<")) {
                if (sb.length() > 0) sb.append('.');
                sb.append(name);
            }
            if (node.getIndex() != null) {
                sb.append('[').append(node.getIndex()).append(']');
            }
        }
        return sb.length() == 0 ? "input" : sb.toString();
    }
}
