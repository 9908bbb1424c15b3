package org.queryguard.model;

// Why a candidate query was refused; the message is handed to the agent as-is
public enum RejectionReason {
    WRITE_OPERATION_FORBIDDEN("ERROR: write operations are not allowed."),
    MULTIPLE_STATEMENTS_FORBIDDEN("ERROR: multiple statements are not allowed."),
    ONLY_SELECT_ALLOWED("ERROR: only SELECT statements are allowed.");

    private final String message;

    RejectionReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
