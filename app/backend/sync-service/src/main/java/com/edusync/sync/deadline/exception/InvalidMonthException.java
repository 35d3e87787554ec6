package com.edusync.sync.deadline.exception;

public class InvalidMonthException extends DeadlineParseException {

    public InvalidMonthException(String monthToken) {
        super("Unknown Persian month: " + monthToken);
    }
}
