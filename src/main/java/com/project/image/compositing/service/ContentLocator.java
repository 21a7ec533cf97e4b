package com.project.image.compositing.service;

import com.project.image.compositing.model.BoundingBox;
import com.project.image.compositing.model.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ContentLocator {
    private static final Logger log = LoggerFactory.getLogger(ContentLocator.class);

    public static final int DEFAULT_THRESHOLD = 10;

    public BoundingBox bbox(RasterImage image) {
        return bbox(image, DEFAULT_THRESHOLD);
    }

    /**
     * Tightest box around pixels with alpha above {@code threshold}; the whole image if there are none.
     */
    public BoundingBox bbox(RasterImage image, int threshold) {
        final int w = image.width(), h = image.height();
        int minX = w, minY = h, maxX = -1, maxY = -1;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (image.alpha(x, y) > threshold) {
                    if (x < minX) minX = x;
                    if (x > maxX) maxX = x;
                    if (y < minY) minY = y;
                    maxY = y;
                }
            }
        }

        if (maxX < 0) {
            log.debug("No pixel above alpha {} in {}, using full extent", threshold, image.size());
            return BoundingBox.of(image.size());
        }
        return new BoundingBox(minX, minY, maxX + 1, maxY + 1);
    }

    public RasterImage crop(RasterImage image) {
        return image.crop(bbox(image));
    }
}
