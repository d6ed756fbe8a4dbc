package com.wavesmith.workers.governor;

public class ResourceExhaustedException extends RuntimeException {

    public ResourceExhaustedException(String message) {
        super(message);
    }
}
