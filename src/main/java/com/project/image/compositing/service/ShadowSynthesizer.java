package com.project.image.compositing.service;

import com.project.image.compositing.model.AlphaMask;
import com.project.image.compositing.model.Position;
import com.project.image.compositing.model.RasterImage;
import com.project.image.compositing.model.RgbColor;
import com.project.image.compositing.model.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the two-layer drop shadow that grounds a product: a tight, dark contact shadow and a
 * larger, softer cast shadow offset away from the light, both derived from one silhouette.
 */
@Service
public class ShadowSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(ShadowSynthesizer.class);

    static final int SILHOUETTE_THRESHOLD = 20;
    static final Position CONTACT_OFFSET = new Position(2, 4);
    static final double CONTACT_BLUR_RADIUS = 5;
    static final double CONTACT_OPACITY = 0.4;

    private final Compositor compositor;

    public ShadowSynthesizer(Compositor compositor) {
        this.compositor = compositor;
    }

    /**
     * Canvas-sized black layer: the cast shadow composited over the contact shadow.
     *
     * @param foreground the foreground exactly as it will be pasted
     * @param canvas     output canvas size
     * @param paste      where the foreground's top-left corner lands
     * @param offset     cast shadow displacement from {@code paste}
     * @param blurRadius cast shadow softness
     * @param opacity    cast shadow strength, applied after blurring
     */
    public RasterImage synthesize(RasterImage foreground, Size canvas, Position paste,
                                  Position offset, double blurRadius, double opacity) {
        AlphaMask silhouette = silhouette(foreground);
        log.debug("Synthesizing shadow on {} at ({},{}), offset=({},{}), blur={}, opacity={}",
                canvas, paste.x(), paste.y(), offset.x(), offset.y(), blurRadius, opacity);

        AlphaMask contact = contactShadow(silhouette, canvas, paste);
        AlphaMask cast = castShadow(silhouette, canvas, paste, offset, blurRadius, opacity);
        return compositor.over(
                RasterImage.fromMask(contact, RgbColor.BLACK),
                RasterImage.fromMask(cast, RgbColor.BLACK));
    }

    public AlphaMask silhouette(RasterImage foreground) {
        return foreground.alphaMask().binarize(SILHOUETTE_THRESHOLD);
    }

    public AlphaMask castShadow(AlphaMask silhouette, Size canvas, Position paste,
                                Position offset, double blurRadius, double opacity) {
        return shadow(silhouette, canvas, paste.translate(offset), blurRadius, opacity);
    }

    public AlphaMask contactShadow(AlphaMask silhouette, Size canvas, Position paste) {
        return shadow(silhouette, canvas, paste.translate(CONTACT_OFFSET), CONTACT_BLUR_RADIUS, CONTACT_OPACITY);
    }

    // opacity must be applied after the blur, not before
    private static AlphaMask shadow(AlphaMask silhouette, Size canvas, Position at, double blurRadius, double opacity) {
        AlphaMask placed = silhouette.placeOn(canvas, at);
        return AlphaFilters.gaussianBlur(placed, blurRadius).scale(opacity);
    }
}
