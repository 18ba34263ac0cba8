package com.creditgate.gate;

public class SearchProviderException extends RuntimeException {

    public SearchProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
