package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when card content fails validation, before any store call
@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String msg) {
        super(msg);
    }

    public InvalidInputException(String msg, Exception ex) {
        super(msg, ex);
    }
}
