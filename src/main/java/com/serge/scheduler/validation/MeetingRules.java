package com.serge.scheduler.validation;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Time-window rules shared by meeting creation and meeting updates.
 */
public final class MeetingRules {
    public static final Duration MIN_DURATION = Duration.ofMinutes(5);
    public static final Duration MAX_DURATION = Duration.ofHours(8);

    private MeetingRules() {
    }

    /** The first rule the window breaks, if any. */
    public static Optional<String> windowProblem(Instant start, Instant end) {
        if (!start.isBefore(end)) {
            return Optional.of(Patterns.START_BEFORE_END);
        }
        Duration length = Duration.between(start, end);
        if (length.compareTo(MIN_DURATION) < 0 || length.compareTo(MAX_DURATION) > 0) {
            return Optional.of(Patterns.DURATION_BOUNDS);
        }
        return Optional.empty();
    }
}
