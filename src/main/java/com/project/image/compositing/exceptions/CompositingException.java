package com.project.image.compositing.exceptions;

/** Domain-specific exception for compositing errors. */
public class CompositingException extends RuntimeException {
    public CompositingException(String message) { super(message); }
    public CompositingException(String message, Throwable cause) { super(message, cause); }
}
