package com.fieldops.dismantle.exception;

public class ForbiddenException extends ChatException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "forbidden";
    }
}
