package com.edusync.sync.deadline.exception;

public class InvalidDateFormatException extends DeadlineParseException {

    public InvalidDateFormatException(String message) {
        super(message);
    }

    public InvalidDateFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
