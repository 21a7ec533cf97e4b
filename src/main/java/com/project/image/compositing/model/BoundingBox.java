package com.project.image.compositing.model;

/**
 * Half-open pixel rectangle [x0, x1) x [y0, y1). Never empty.
 */
public record BoundingBox(int x0, int y0, int x1, int y1) {
    public BoundingBox {
        if (x0 < 0 || y0 < 0 || x1 <= x0 || y1 <= y0) {
            throw new IllegalArgumentException(
                    "Invalid bounding box (" + x0 + "," + y0 + "," + x1 + "," + y1 + ")");
        }
    }

    public static BoundingBox of(Size size) {
        return new BoundingBox(0, 0, size.width(), size.height());
    }

    public int width() {
        return x1 - x0;
    }

    public int height() {
        return y1 - y0;
    }

    public Size size() {
        return new Size(width(), height());
    }

    public boolean contains(int x, int y) {
        return x >= x0 && x < x1 && y >= y0 && y < y1;
    }
}
