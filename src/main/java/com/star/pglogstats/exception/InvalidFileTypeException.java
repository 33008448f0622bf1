package com.star.pglogstats.exception;

public class InvalidFileTypeException extends LogProcessingException {
    public InvalidFileTypeException(String message) {
        super(message);
    }
}
