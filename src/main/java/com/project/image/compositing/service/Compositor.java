package com.project.image.compositing.service;

import com.project.image.compositing.exceptions.RasterFormatException;
import com.project.image.compositing.model.Position;
import com.project.image.compositing.model.RasterImage;
import com.project.image.compositing.model.RgbColor;
import com.project.image.compositing.model.RgbImage;
import org.springframework.stereotype.Service;

import static com.project.image.compositing.model.RasterImage.ALPHA;
import static com.project.image.compositing.model.RasterImage.CHANNELS;

/**
 * Porter-Duff "over" on straight-alpha RGBA buffers, and flattening onto a solid colour.
 * Every operation returns a new buffer.
 */
@Service
public class Compositor {

    /** {@code top} over {@code bottom}; both must have the same size. */
    public RasterImage over(RasterImage bottom, RasterImage top) {
        if (!bottom.size().equals(top.size())) {
            throw new RasterFormatException("Layer " + top.size() + " does not match " + bottom.size());
        }
        byte[] dst = bottom.toByteArray();
        byte[] src = top.toByteArray();
        for (int i = 0; i < dst.length; i += CHANNELS) {
            blend(dst, i, src, i);
        }
        return new RasterImage(bottom.width(), bottom.height(), dst);
    }

    /** {@code top} over {@code bottom} with its top-left corner at {@code at}, clipped to {@code bottom}. */
    public RasterImage overAt(RasterImage bottom, RasterImage top, Position at) {
        byte[] dst = bottom.toByteArray();
        byte[] src = top.toByteArray();
        int xStart = Math.max(0, at.x());
        int yStart = Math.max(0, at.y());
        int xEnd = Math.min(bottom.width(), at.x() + top.width());
        int yEnd = Math.min(bottom.height(), at.y() + top.height());

        for (int y = yStart; y < yEnd; y++) {
            for (int x = xStart; x < xEnd; x++) {
                int d = (y * bottom.width() + x) * CHANNELS;
                int s = ((y - at.y()) * top.width() + (x - at.x())) * CHANNELS;
                blend(dst, d, src, s);
            }
        }
        return new RasterImage(bottom.width(), bottom.height(), dst);
    }

    /** Composites {@code layer} over an opaque fill of {@code background} and drops alpha. */
    public RgbImage flatten(RasterImage layer, RgbColor background) {
        RasterImage fill = RasterImage.filled(layer.size(), background, 255);
        return dropAlpha(over(fill, layer));
    }

    public RgbImage dropAlpha(RasterImage image) {
        byte[] px = image.toByteArray();
        byte[] rgb = new byte[image.width() * image.height() * RgbImage.CHANNELS];
        for (int i = 0, o = 0; i < px.length; i += CHANNELS, o += RgbImage.CHANNELS) {
            rgb[o] = px[i];
            rgb[o + 1] = px[i + 1];
            rgb[o + 2] = px[i + 2];
        }
        return new RgbImage(image.width(), image.height(), rgb);
    }

    // out_a = ta + ba(1 - ta); out_c = (tc*ta + bc*ba*(1 - ta)) / out_a
    private static void blend(byte[] dst, int d, byte[] src, int s) {
        int topAlpha = src[s + ALPHA] & 0xFF;
        if (topAlpha == 0) {
            return;
        }
        if (topAlpha == 255) {
            System.arraycopy(src, s, dst, d, CHANNELS);
            return;
        }
        double ta = topAlpha / 255.0;
        double bw = (dst[d + ALPHA] & 0xFF) / 255.0 * (1.0 - ta);
        double outA = ta + bw;
        for (int c = 0; c < ALPHA; c++) {
            double v = ((src[s + c] & 0xFF) * ta + (dst[d + c] & 0xFF) * bw) / outA;
            dst[d + c] = (byte) clamp((int) Math.round(v));
        }
        dst[d + ALPHA] = (byte) clamp((int) Math.round(outA * 255.0));
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }
}
