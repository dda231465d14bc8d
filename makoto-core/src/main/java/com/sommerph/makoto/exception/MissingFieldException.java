package com.sommerph.makoto.exception;

import lombok.Getter;

@Getter
public class MissingFieldException extends MakotoException {

    private final String field;

    public MissingFieldException(String field) {
        super("Missing required field: " + field);
        this.field = field;
    }

}
