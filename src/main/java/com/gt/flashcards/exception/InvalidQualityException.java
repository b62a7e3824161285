package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidQualityException extends RuntimeException {

    public InvalidQualityException(String msg) {
        super(msg);
    }

    public InvalidQualityException(String msg, Exception ex) {
        super(msg, ex);
    }
}
