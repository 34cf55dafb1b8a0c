package com.serge.scheduler.validation;

/** Shared input patterns and their messages. */
public final class Patterns {
    private Patterns() {
    }

    public static final String NAME = "^[a-zA-Z\\s'-]+$";
    public static final String EMAIL = "^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$";
    /** At least one lowercase, one uppercase, one digit and one of {@code @$!%*?&}. */
    public static final String PASSWORD = "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[@$!%*?&]).*$";

    public static final String NAME_REQUIRED = "Name is required";
    public static final String NAME_MIN = "Name must be at least 2 characters";
    public static final String NAME_MAX = "Name must be less than 50 characters";
    public static final String NAME_PATTERN = "Name can only contain letters, spaces, hyphens, and apostrophes";
    public static final String EMAIL_INVALID = "Invalid email format";
    public static final String PASSWORD_MIN = "Password must be at least 8 characters";
    public static final String PASSWORD_COMPLEXITY =
            "Password must contain at least one lowercase letter, one uppercase letter, one number, and one special character";
    public static final String TITLE_REQUIRED = "Title is required";
    public static final String TITLE_MAX = "Title too long";
    public static final String START_BEFORE_END = "startTime must be before endTime";
    public static final String DURATION_BOUNDS = "Meeting duration must be between 5 minutes and 8 hours";
    public static final String INVALID_URL = "Please enter a valid URL";
}
