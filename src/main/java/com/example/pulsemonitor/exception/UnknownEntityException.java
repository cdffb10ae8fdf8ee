package com.example.pulsemonitor.exception;

public class UnknownEntityException extends RuntimeException {

    public UnknownEntityException(String kind, String id) {
        super(String.format("Unknown %s: %s", kind, id));
    }
}
