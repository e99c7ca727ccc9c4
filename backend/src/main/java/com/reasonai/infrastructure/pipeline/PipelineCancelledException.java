package com.reasonai.infrastructure.pipeline;

public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String message) {
        super(message);
    }
}
