package com.fieldops.dismantle.exception;

/** Referenced room, technician or coordinator does not exist. */
public class NotFoundException extends ChatException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "not_found";
    }
}
