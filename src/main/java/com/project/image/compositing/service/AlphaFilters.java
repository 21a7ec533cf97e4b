package com.project.image.compositing.service;

import com.project.image.compositing.model.AlphaMask;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Neighbourhood filters over single-channel masks, backed by OpenCV.
 */
public final class AlphaFilters {

    static {
        OpenCvLoader.ensureLoaded();
    }

    private AlphaFilters() {
    }

    /**
     * 3x3 minimum filter applied {@code passes} times. Pixels outside the mask do not take part,
     * so the border behaves like edge replication.
     */
    public static AlphaMask erode3x3(AlphaMask mask, int passes) {
        if (passes <= 0) {
            return mask;
        }
        Mat src = toMat(mask);
        Mat dst = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
        try {
            Imgproc.erode(src, dst, kernel, new Point(-1, -1), passes);
            return toMask(dst, mask.width(), mask.height());
        } finally {
            src.release();
            dst.release();
            kernel.release();
        }
    }

    /**
     * Gaussian blur with standard deviation {@code radius}. The kernel spans two standard deviations
     * each side, so a radius of 0.5 is a 3x3 kernel. Computed in floating point and rounded once.
     */
    public static AlphaMask gaussianBlur(AlphaMask mask, double radius) {
        if (radius <= 0.0) {
            return mask;
        }
        int kernelSize = 2 * (int) Math.ceil(2.0 * radius) + 1;
        Mat src = toMat(mask);
        Mat work = new Mat();
        Mat blurred = new Mat();
        Mat dst = new Mat();
        try {
            src.convertTo(work, CvType.CV_32F);
            Imgproc.GaussianBlur(work, blurred, new Size(kernelSize, kernelSize), radius, radius,
                    Core.BORDER_REPLICATE);
            blurred.convertTo(dst, CvType.CV_8U);
            return toMask(dst, mask.width(), mask.height());
        } finally {
            src.release();
            work.release();
            blurred.release();
            dst.release();
        }
    }

    private static Mat toMat(AlphaMask mask) {
        Mat mat = new Mat(mask.height(), mask.width(), CvType.CV_8UC1);
        mat.put(0, 0, mask.toByteArray());
        return mat;
    }

    private static AlphaMask toMask(Mat mat, int width, int height) {
        byte[] data = new byte[width * height];
        mat.get(0, 0, data);
        return new AlphaMask(width, height, data);
    }
}
