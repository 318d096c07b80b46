package com.dataforge.pipeline;

public class StepConfigException extends IllegalArgumentException {
    private final String step;

    public StepConfigException(String step, String message) {
        super(message);
        this.step = step;
    }

    public String step() {
        return step;
    }
}
