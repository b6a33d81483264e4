package com.agentvet.validation.integrity;

public class HashRegistryException extends RuntimeException {

    public HashRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
