package com.fieldops.dismantle.exception;

/**
 * Base of the chat error taxonomy. {@link #code()} is the short machine name
 * sent back in realtime error frames.
 */
public abstract class ChatException extends RuntimeException {

    protected ChatException(String message) {
        super(message);
    }

    public abstract String code();
}
