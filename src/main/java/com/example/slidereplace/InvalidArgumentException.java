package com.example.slidereplace;

public class InvalidArgumentException extends SlideReplaceException {
    public InvalidArgumentException(String message) {
        super(message);
    }
}
