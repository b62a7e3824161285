package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class PersistenceException extends RuntimeException {

    public PersistenceException(String msg) {
        super(msg);
    }

    public PersistenceException(String msg, Exception ex) {
        super(msg, ex);
    }
}
