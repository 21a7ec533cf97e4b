package com.project.image.compositing.service;

import com.project.image.compositing.model.RasterImage;
import com.project.image.compositing.model.Size;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import static com.project.image.compositing.model.RasterImage.ALPHA;
import static com.project.image.compositing.model.RasterImage.CHANNELS;

/**
 * Resamples RGBA rasters. Colour is premultiplied by alpha while resampling, so fully transparent
 * pixels never tint the edge of the object.
 */
@Service
public class ImageScaler {
    private static final Logger log = LoggerFactory.getLogger(ImageScaler.class);

    static {
        OpenCvLoader.ensureLoaded();
    }

    public RasterImage resize(RasterImage image, Size target) {
        if (image.size().equals(target)) {
            return image;
        }
        log.debug("Resampling {} to {}", image.size(), target);

        byte[] px = image.toByteArray();
        float[] premultiplied = new float[px.length];
        for (int i = 0; i < px.length; i += CHANNELS) {
            float a = px[i + ALPHA] & 0xFF;
            for (int c = 0; c < ALPHA; c++) {
                premultiplied[i + c] = (px[i + c] & 0xFF) * a / 255f;
            }
            premultiplied[i + ALPHA] = a;
        }

        Mat src = new Mat(image.height(), image.width(), CvType.CV_32FC4);
        Mat dst = new Mat();
        float[] resampled = new float[target.width() * target.height() * CHANNELS];
        try {
            src.put(0, 0, premultiplied);
            Imgproc.resize(src, dst, new org.opencv.core.Size(target.width(), target.height()), 0, 0,
                    Imgproc.INTER_AREA);
            dst.get(0, 0, resampled);
        } finally {
            src.release();
            dst.release();
        }

        byte[] out = new byte[resampled.length];
        for (int i = 0; i < resampled.length; i += CHANNELS) {
            float a = Math.max(0f, Math.min(255f, resampled[i + ALPHA]));
            int alpha = Math.round(a);
            if (alpha == 0) {
                continue;
            }
            for (int c = 0; c < ALPHA; c++) {
                out[i + c] = (byte) clamp(Math.round(resampled[i + c] * 255f / a));
            }
            out[i + ALPHA] = (byte) alpha;
        }
        return new RasterImage(target.width(), target.height(), out);
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }
}
