package com.project.image.compositing.model;

/** Width and height in pixels. */
public record Size(int width, int height) {
    public Size {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Size must be positive, got " + width + "x" + height);
        }
    }

    public boolean fitsWithin(Size other) {
        return width <= other.width && height <= other.height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
