package com.project.image.compositing.model;

import com.project.image.compositing.exceptions.RasterFormatException;

import java.util.Arrays;

/**
 * Single-channel 8-bit coverage buffer, row-major. Operations return new masks.
 */
public final class AlphaMask {
    private final int width;
    private final int height;
    private final byte[] values;

    /** Takes ownership of {@code values}. */
    public AlphaMask(int width, int height, byte[] values) {
        if (width <= 0 || height <= 0) {
            throw new RasterFormatException("Mask dimensions must be positive, got " + width + "x" + height);
        }
        if (values == null || values.length != (long) width * height) {
            throw new RasterFormatException("Mask buffer length " + (values == null ? 0 : values.length)
                    + " does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public Size size() {
        return new Size(width, height);
    }

    public int get(int x, int y) {
        return values[y * width + x] & 0xFF;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(values, values.length);
    }

    /** 255 where the value exceeds {@code threshold}, 0 elsewhere. */
    public AlphaMask binarize(int threshold) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (values[i] & 0xFF) > threshold ? (byte) 255 : 0;
        }
        return new AlphaMask(width, height, out);
    }

    /** Zeroes values below {@code floor} and saturates values above {@code ceiling}. */
    public AlphaMask snap(int floor, int ceiling) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            int v = values[i] & 0xFF;
            if (v < floor) {
                v = 0;
            } else if (v > ceiling) {
                v = 255;
            }
            out[i] = (byte) v;
        }
        return new AlphaMask(width, height, out);
    }

    /** Multiplies every value by {@code factor}, truncating toward zero. */
    public AlphaMask scale(double factor) {
        if (factor < 0.0 || factor > 1.0) {
            throw new IllegalArgumentException("Scale factor must be within [0,1], got " + factor);
        }
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) (int) ((values[i] & 0xFF) * factor);
        }
        return new AlphaMask(width, height, out);
    }

    /**
     * Copies this mask into an otherwise empty mask of {@code canvas} size with its top-left
     * corner at {@code at}. Parts falling outside the canvas are clipped.
     */
    public AlphaMask placeOn(Size canvas, Position at) {
        byte[] out = new byte[canvas.width() * canvas.height()];
        int xStart = Math.max(0, at.x());
        int yStart = Math.max(0, at.y());
        int xEnd = Math.min(canvas.width(), at.x() + width);
        int yEnd = Math.min(canvas.height(), at.y() + height);
        if (xEnd <= xStart || yEnd <= yStart) {
            return new AlphaMask(canvas.width(), canvas.height(), out);
        }
        for (int y = yStart; y < yEnd; y++) {
            int srcRow = (y - at.y()) * width;
            System.arraycopy(values, srcRow + (xStart - at.x()), out, y * canvas.width() + xStart, xEnd - xStart);
        }
        return new AlphaMask(canvas.width(), canvas.height(), out);
    }

    public int max() {
        int max = 0;
        for (byte v : values) {
            max = Math.max(max, v & 0xFF);
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlphaMask other)) return false;
        return width == other.width && height == other.height && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(values);
    }
}
