package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a review session operation is not valid in the session's current phase
@ResponseStatus(value = HttpStatus.CONFLICT)
public class IllegalSessionStateException extends RuntimeException {

    public IllegalSessionStateException(String msg) {
        super(msg);
    }

    public IllegalSessionStateException(String msg, Exception ex) {
        super(msg, ex);
    }
}
