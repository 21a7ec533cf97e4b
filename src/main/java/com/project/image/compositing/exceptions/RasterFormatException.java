package com.project.image.compositing.exceptions;

/** Raised when a pixel buffer does not match its declared geometry. */
public class RasterFormatException extends CompositingException {
    public RasterFormatException(String message) { super(message); }
}
