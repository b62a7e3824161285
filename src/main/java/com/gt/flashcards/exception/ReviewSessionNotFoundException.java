package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a review session handle is unknown, expired or owned by another user
@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class ReviewSessionNotFoundException extends RuntimeException {

    public ReviewSessionNotFoundException(String msg) {
        super(msg);
    }

    public ReviewSessionNotFoundException(String msg, Exception ex) {
        super(msg, ex);
    }
}
