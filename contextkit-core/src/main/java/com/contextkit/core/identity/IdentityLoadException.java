package com.contextkit.core.identity;

public class IdentityLoadException extends RuntimeException {

    public IdentityLoadException(String message) {
        super(message);
    }

    public IdentityLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
