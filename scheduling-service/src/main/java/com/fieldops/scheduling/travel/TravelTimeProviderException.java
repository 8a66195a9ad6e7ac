package com.fieldops.scheduling.travel;

public class TravelTimeProviderException extends RuntimeException {

    public TravelTimeProviderException(String message) {
        super(message);
    }

    public TravelTimeProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
