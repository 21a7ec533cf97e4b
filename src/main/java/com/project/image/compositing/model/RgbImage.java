package com.project.image.compositing.model;

import com.project.image.compositing.exceptions.RasterFormatException;

import java.util.Arrays;

/**
 * Opaque RGB raster, 8 bits per channel, row-major and interleaved. The final product photo.
 */
public final class RgbImage {
    public static final int CHANNELS = 3;

    private final int width;
    private final int height;
    private final byte[] rgb;

    /** Takes ownership of {@code rgb}. */
    public RgbImage(int width, int height, byte[] rgb) {
        if (width <= 0 || height <= 0) {
            throw new RasterFormatException("Image dimensions must be positive, got " + width + "x" + height);
        }
        if (rgb == null || rgb.length != (long) width * height * CHANNELS) {
            throw new RasterFormatException("RGB buffer length " + (rgb == null ? 0 : rgb.length)
                    + " does not match " + width + "x" + height + "x" + CHANNELS);
        }
        this.width = width;
        this.height = height;
        this.rgb = rgb;
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

    public RgbColor pixel(int x, int y) {
        int o = (y * width + x) * CHANNELS;
        return new RgbColor(rgb[o] & 0xFF, rgb[o + 1] & 0xFF, rgb[o + 2] & 0xFF);
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(rgb, rgb.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RgbImage other)) return false;
        return width == other.width && height == other.height && Arrays.equals(rgb, other.rgb);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgb);
    }

    @Override
    public String toString() {
        return "RgbImage[" + width + "x" + height + "]";
    }
}
