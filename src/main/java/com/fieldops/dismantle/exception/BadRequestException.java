package com.fieldops.dismantle.exception;

/** Malformed or incomplete request / action frame. */
public class BadRequestException extends ChatException {

    public BadRequestException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "bad_request";
    }
}
