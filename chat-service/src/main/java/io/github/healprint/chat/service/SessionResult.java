package io.github.healprint.chat.service;

/** Outcome of a session engine call. {@code value} is only set when the status is OK. */
public record SessionResult<T>(Status status, T value, String message) {

    public enum Status {
        OK,
        NOT_FOUND,
        CLOSED,
        INVALID,
        UNAVAILABLE,
        ERROR
    }

    public static <T> SessionResult<T> ok(T value) {
        return new SessionResult<>(Status.OK, value, null);
    }

    public static <T> SessionResult<T> notFound(String message) {
        return new SessionResult<>(Status.NOT_FOUND, null, message);
    }

    public static <T> SessionResult<T> closed(String message) {
        return new SessionResult<>(Status.CLOSED, null, message);
    }

    public static <T> SessionResult<T> invalid(String message) {
        return new SessionResult<>(Status.INVALID, null, message);
    }

    public static <T> SessionResult<T> unavailable(String message) {
        return new SessionResult<>(Status.UNAVAILABLE, null, message);
    }

    public static <T> SessionResult<T> error(String message) {
        return new SessionResult<>(Status.ERROR, null, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
