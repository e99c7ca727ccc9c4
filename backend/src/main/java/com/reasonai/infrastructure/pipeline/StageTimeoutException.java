package com.reasonai.infrastructure.pipeline;

public class StageTimeoutException extends RuntimeException {

    public StageTimeoutException(String message) {
        super(message);
    }
}
