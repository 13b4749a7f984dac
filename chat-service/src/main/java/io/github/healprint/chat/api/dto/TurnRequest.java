package io.github.healprint.chat.api.dto;

public class TurnRequest {

    private String message;

    public TurnRequest() {}

    public TurnRequest(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
