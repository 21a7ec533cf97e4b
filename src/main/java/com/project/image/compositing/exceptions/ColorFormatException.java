package com.project.image.compositing.exceptions;

/** Raised when a background colour is not a 6-digit hex string. */
public class ColorFormatException extends CompositingException {
    public ColorFormatException(String message) { super(message); }
}
