package com.project.image.compositing.service;

import com.project.image.compositing.exceptions.CompositingException;
import com.project.image.compositing.exceptions.RasterFormatException;
import com.project.image.compositing.model.RasterImage;
import com.project.image.compositing.model.RgbImage;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Moves pixels between encoded files / {@link BufferedImage} and the compositing buffers.
 */
@Service
public class ImageCodec {

    /** Largest accepted width or height of an uploaded image, in pixels. */
    public static final int MAX_DIMENSION = 4000;

    /**
     * Decodes an uploaded image. The dimensions are read from the file header and checked
     * against {@link #MAX_DIMENSION} before any pixel data is decoded.
     */
    public RasterImage decode(byte[] encoded) {
        BufferedImage image;
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(encoded))) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                throw new CompositingException("File is not a valid image or is corrupted.");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                checkDimensions(reader.getWidth(0), reader.getHeight(0));
                image = reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new CompositingException("Failed to decode image", e);
        }
        if (image == null) {
            throw new CompositingException("File is not a valid image or is corrupted.");
        }
        return toRaster(image);
    }

    private static void checkDimensions(int width, int height) {
        if (width > MAX_DIMENSION || height > MAX_DIMENSION) {
            throw new RasterFormatException("Image is too large: " + width + "x" + height
                    + ". Maximum size: " + MAX_DIMENSION + "x" + MAX_DIMENSION + " pixels");
        }
    }

    /** Straight-alpha RGBA copy of {@code image}; images without alpha come out fully opaque. */
    public RasterImage toRaster(BufferedImage image) {
        final int w = image.getWidth(), h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        byte[] px = new byte[w * h * RasterImage.CHANNELS];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            int o = i * RasterImage.CHANNELS;
            px[o + RasterImage.RED] = (byte) (p >> 16);
            px[o + RasterImage.GREEN] = (byte) (p >> 8);
            px[o + RasterImage.BLUE] = (byte) p;
            px[o + RasterImage.ALPHA] = (byte) (p >>> 24);
        }
        return new RasterImage(w, h, px);
    }

    public BufferedImage toBufferedImage(RgbImage image) {
        final int w = image.width(), h = image.height();
        byte[] rgb = image.toByteArray();
        int[] packed = new int[w * h];
        for (int i = 0; i < packed.length; i++) {
            int o = i * RgbImage.CHANNELS;
            packed[i] = ((rgb[o] & 0xFF) << 16) | ((rgb[o + 1] & 0xFF) << 8) | (rgb[o + 2] & 0xFF);
        }
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, w, h, packed, 0, w);
        return out;
    }

    public byte[] toPng(RgbImage image) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(toBufferedImage(image), "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new CompositingException("Failed to encode image", e);
        }
    }
}
