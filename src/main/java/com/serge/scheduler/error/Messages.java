package com.serge.scheduler.error;

/**
 * Client-visible message catalog.
 */
public final class Messages {
    private Messages() {
    }

    public static final String VALIDATION_FAILED = "Validation failed";
    public static final String NOT_AUTHENTICATED = "Not authenticated";
    public static final String FORBIDDEN = "Forbidden";
    public static final String NOT_FOUND = "Resource not found";
    public static final String DUPLICATE_KEY = "Duplicate key violation";
    public static final String INTERNAL_ERROR = "An unexpected error occurred";

    public static final String INVALID_CREDENTIALS = "Invalid credentials";
    public static final String EMAIL_IN_USE = "Email already in use";
    public static final String JWT_MISSING = "Server misconfiguration: JWT secret missing";

    public static final String USER_NOT_FOUND = "User not found";
    public static final String MEETING_NOT_FOUND = "Meeting not found";
    public static final String EVENT_NOT_FOUND = "Event not found";
    public static final String BOOKING_NOT_FOUND = "Booking not found";
    public static final String ALREADY_BOOKED = "Event already booked";
    public static final String CANNOT_DELETE_SELF = "Administrators cannot delete their own account";
}
