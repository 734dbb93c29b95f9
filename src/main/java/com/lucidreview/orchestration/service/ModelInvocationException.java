package com.lucidreview.orchestration.service;

public class ModelInvocationException extends RuntimeException {

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
