package com.taskboard.servicebackend.security;

public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        INVALID("Invalid token"),
        EXPIRED("Token expired");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, Throwable cause) {
        super(reason.message(), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
