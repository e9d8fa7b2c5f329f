package com.pressplay.orchestration.bridge;

/**
 * Raised by bridge implementations when the backend rejects a call.
 */
public class BridgeException extends RuntimeException {

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
