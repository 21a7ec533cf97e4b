package com.project.image.compositing.model;

import com.project.image.compositing.exceptions.RasterFormatException;

import java.util.Arrays;

/**
 * RGBA raster, 8 bits per channel, straight (non-premultiplied) alpha, row-major and interleaved.
 * Instances are never mutated after construction; stages copy the buffer and build a new image.
 */
public final class RasterImage {
    public static final int CHANNELS = 4;
    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;
    public static final int ALPHA = 3;

    private final int width;
    private final int height;
    private final byte[] rgba;

    /** Takes ownership of {@code rgba}. */
    public RasterImage(int width, int height, byte[] rgba) {
        if (width <= 0 || height <= 0) {
            throw new RasterFormatException("Raster dimensions must be positive, got " + width + "x" + height);
        }
        if (rgba == null || rgba.length != (long) width * height * CHANNELS) {
            throw new RasterFormatException("Raster buffer length " + (rgba == null ? 0 : rgba.length)
                    + " does not match " + width + "x" + height + "x" + CHANNELS);
        }
        this.width = width;
        this.height = height;
        this.rgba = rgba;
    }

    public static RasterImage transparent(Size size) {
        return new RasterImage(size.width(), size.height(), new byte[size.width() * size.height() * CHANNELS]);
    }

    public static RasterImage filled(Size size, RgbColor color, int alpha) {
        byte[] px = new byte[size.width() * size.height() * CHANNELS];
        for (int i = 0; i < px.length; i += CHANNELS) {
            px[i + RED] = (byte) color.red();
            px[i + GREEN] = (byte) color.green();
            px[i + BLUE] = (byte) color.blue();
            px[i + ALPHA] = (byte) alpha;
        }
        return new RasterImage(size.width(), size.height(), px);
    }

    /** A layer of {@code color} whose per-pixel alpha is taken from {@code mask}. */
    public static RasterImage fromMask(AlphaMask mask, RgbColor color) {
        byte[] a = mask.toByteArray();
        byte[] px = new byte[a.length * CHANNELS];
        for (int i = 0; i < a.length; i++) {
            int o = i * CHANNELS;
            px[o + RED] = (byte) color.red();
            px[o + GREEN] = (byte) color.green();
            px[o + BLUE] = (byte) color.blue();
            px[o + ALPHA] = a[i];
        }
        return new RasterImage(mask.width(), mask.height(), px);
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

    public int channel(int x, int y, int channel) {
        return rgba[(y * width + x) * CHANNELS + channel] & 0xFF;
    }

    public int alpha(int x, int y) {
        return channel(x, y, ALPHA);
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(rgba, rgba.length);
    }

    public AlphaMask alphaMask() {
        byte[] a = new byte[width * height];
        for (int i = 0; i < a.length; i++) {
            a[i] = rgba[i * CHANNELS + ALPHA];
        }
        return new AlphaMask(width, height, a);
    }

    /** Same colour channels, alpha replaced by {@code mask}. */
    public RasterImage withAlpha(AlphaMask mask) {
        if (mask.width() != width || mask.height() != height) {
            throw new RasterFormatException("Mask " + mask.size() + " does not match raster " + size());
        }
        byte[] px = toByteArray();
        byte[] a = mask.toByteArray();
        for (int i = 0; i < a.length; i++) {
            px[i * CHANNELS + ALPHA] = a[i];
        }
        return new RasterImage(width, height, px);
    }

    public RasterImage crop(BoundingBox box) {
        if (box.x1() > width || box.y1() > height) {
            throw new RasterFormatException("Crop box " + box + " exceeds raster " + size());
        }
        int w = box.width();
        int h = box.height();
        byte[] px = new byte[w * h * CHANNELS];
        for (int y = 0; y < h; y++) {
            System.arraycopy(rgba, ((box.y0() + y) * width + box.x0()) * CHANNELS,
                    px, y * w * CHANNELS, w * CHANNELS);
        }
        return new RasterImage(w, h, px);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RasterImage other)) return false;
        return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgba);
    }

    @Override
    public String toString() {
        return "RasterImage[" + width + "x" + height + "]";
    }
}
