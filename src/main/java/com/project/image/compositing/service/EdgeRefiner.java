package com.project.image.compositing.service;

import com.project.image.compositing.model.AlphaMask;
import com.project.image.compositing.model.EdgeStrength;
import com.project.image.compositing.model.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import static com.project.image.compositing.model.RasterImage.ALPHA;
import static com.project.image.compositing.model.RasterImage.CHANNELS;

/**
 * Cleans the edge of a cutout: removes background colour bleed from semi-transparent pixels,
 * then tightens and softens the alpha channel.
 */
@Service
public class EdgeRefiner {
    private static final Logger log = LoggerFactory.getLogger(EdgeRefiner.class);

    static final int EDGE_ALPHA_MIN = 5;     // exclusive
    static final int SOLID_ALPHA_MIN = 240;  // exclusive; also the edge upper bound
    static final int ALPHA_FLOOR = 8;
    static final int ALPHA_CEILING = 245;
    static final double FEATHER_RADIUS = 0.5;

    private static final double SOLID_WEIGHT = 0.3;
    private static final double OWN_WEIGHT = 0.7;

    /**
     * Decontaminate, hard threshold, erode with a 3x3 minimum filter, feather and threshold again.
     */
    public RasterImage refine(RasterImage image, EdgeStrength strength) {
        log.debug("Refining edges of {} with strength {} ({} erosion passes)",
                image.size(), strength, strength.erosionPasses());

        RasterImage decontaminated = decontaminate(image);

        AlphaMask alpha = decontaminated.alphaMask().snap(ALPHA_FLOOR, ALPHA_CEILING);
        alpha = AlphaFilters.erode3x3(alpha, strength.erosionPasses());
        alpha = AlphaFilters.gaussianBlur(alpha, FEATHER_RADIUS).snap(ALPHA_FLOOR, ALPHA_CEILING);

        return decontaminated.withAlpha(alpha);
    }

    /**
     * Pulls the colour of each edge pixel part of the way toward the mean colour of the solid
     * pixels, weighted by how transparent the edge pixel is. The two weights are deliberately not
     * normalised against the blend factor. Returns the input unchanged when nothing is solid.
     */
    public RasterImage decontaminate(RasterImage image) {
        byte[] px = image.toByteArray();

        double[] solidSum = new double[ALPHA];
        long solidCount = 0;
        boolean anyEdge = false;
        for (int i = 0; i < px.length; i += CHANNELS) {
            int a = px[i + ALPHA] & 0xFF;
            if (a > SOLID_ALPHA_MIN) {
                for (int c = 0; c < ALPHA; c++) {
                    solidSum[c] += px[i + c] & 0xFF;
                }
                solidCount++;
            } else if (a > EDGE_ALPHA_MIN && a < SOLID_ALPHA_MIN) {
                anyEdge = true;
            }
        }
        if (solidCount == 0 || !anyEdge) {
            log.debug("Skipping decontamination: solidPixels={}, edgePixels={}", solidCount, anyEdge);
            return image;
        }

        double[] solidMean = new double[ALPHA];
        for (int c = 0; c < ALPHA; c++) {
            solidMean[c] = solidSum[c] / solidCount;
        }

        for (int i = 0; i < px.length; i += CHANNELS) {
            int a = px[i + ALPHA] & 0xFF;
            if (a <= EDGE_ALPHA_MIN || a >= SOLID_ALPHA_MIN) {
                continue;
            }
            double bf = a / 255.0;
            for (int c = 0; c < ALPHA; c++) {
                double own = px[i + c] & 0xFF;
                double v = own * bf + (solidMean[c] * SOLID_WEIGHT + own * OWN_WEIGHT) * (1.0 - bf);
                px[i + c] = (byte) clamp((int) v);
            }
        }
        return new RasterImage(image.width(), image.height(), px);
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }
}
