package com.edusync.sync.credential.exception;

public class AuthFlowNotStartedException extends RuntimeException {

    public AuthFlowNotStartedException(String message) {
        super(message);
    }
}
