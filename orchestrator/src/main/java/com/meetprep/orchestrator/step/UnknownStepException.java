package com.meetprep.orchestrator.step;

public class UnknownStepException extends RuntimeException {
    public UnknownStepException(String name) {
        super("No step registered with name: '" + name + "'");
    }
}
