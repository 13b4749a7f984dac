package io.github.healprint.chat.store;

/** The document store could not serve a call. Fatal for the call, safe for the caller to retry. */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Conversation store unavailable during " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
