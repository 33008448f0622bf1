package com.star.pglogstats.exception;

public class FileUploadException extends LogProcessingException {
    public FileUploadException(String message) {
        super(message);
    }
}
