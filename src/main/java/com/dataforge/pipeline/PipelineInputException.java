package com.dataforge.pipeline;

public class PipelineInputException extends RuntimeException {
    public PipelineInputException(String message) {
        super(message);
    }
}
