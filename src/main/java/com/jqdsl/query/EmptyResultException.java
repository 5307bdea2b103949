package com.jqdsl.query;

import java.util.NoSuchElementException;

public class EmptyResultException extends NoSuchElementException {
    public EmptyResultException(String message) {
        super(message);
    }
}
