package com.layout.exception;

/**
 * Base exception for the layout policy engine.
 */
public class LayoutPolicyException extends RuntimeException {

    public LayoutPolicyException(String message) {
        super(message);
    }

    public LayoutPolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
