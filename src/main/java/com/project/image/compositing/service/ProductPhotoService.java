package com.project.image.compositing.service;

import com.project.image.compositing.DTOs.CompositionOptions;
import com.project.image.compositing.DTOs.CompositionResult;
import com.project.image.compositing.model.BoundingBox;
import com.project.image.compositing.model.EdgeStrength;
import com.project.image.compositing.model.Placement;
import com.project.image.compositing.model.RasterImage;
import com.project.image.compositing.model.RgbColor;
import com.project.image.compositing.model.RgbImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Turns a foreground cutout into a finished product photo. Stateless; each call owns its buffers,
 * so concurrent calls need no coordination.
 */
@Service
public class ProductPhotoService {
    private static final Logger log = LoggerFactory.getLogger(ProductPhotoService.class);

    static final EdgeStrength EDGE_STRENGTH = EdgeStrength.LIGHT;

    private final EdgeRefiner edgeRefiner;
    private final ContentLocator contentLocator;
    private final LayoutEngine layoutEngine;
    private final ImageScaler imageScaler;
    private final ShadowSynthesizer shadowSynthesizer;
    private final Compositor compositor;

    public ProductPhotoService(EdgeRefiner edgeRefiner, ContentLocator contentLocator, LayoutEngine layoutEngine,
                               ImageScaler imageScaler, ShadowSynthesizer shadowSynthesizer, Compositor compositor) {
        this.edgeRefiner = edgeRefiner;
        this.contentLocator = contentLocator;
        this.layoutEngine = layoutEngine;
        this.imageScaler = imageScaler;
        this.shadowSynthesizer = shadowSynthesizer;
        this.compositor = compositor;
    }

    public RgbImage render(RasterImage foreground, CompositionOptions options) {
        return process(foreground, options).image();
    }

    public CompositionResult process(RasterImage foreground, CompositionOptions options) {
        Objects.requireNonNull(foreground, "foreground");
        Objects.requireNonNull(options, "options");
        RgbColor background = RgbColor.parseHex(options.backgroundColor());

        log.info("Starting composition for cutout {}, output={}, padding={}, shadow={}, background={}",
                foreground.size(), options.outputSize(), options.padding(), options.shadow(), background.toHex());

        RasterImage refined = edgeRefiner.refine(foreground, EDGE_STRENGTH);

        BoundingBox content = contentLocator.bbox(refined);
        RasterImage cropped = refined.crop(content);
        log.debug("Content box {} -> {}", content, cropped.size());

        Placement placement = layoutEngine.place(cropped.size(), options.outputSize(), options.padding());
        RasterImage scaled = placement.scaled()
                ? imageScaler.resize(cropped, placement.scaledSize())
                : cropped;

        RasterImage canvas = RasterImage.transparent(options.outputSize());
        if (options.shadow()) {
            RasterImage shadowLayer = shadowSynthesizer.synthesize(scaled, options.outputSize(),
                    placement.pastePosition(), options.shadowOffset(),
                    options.shadowBlurRadius(), options.shadowOpacity());
            canvas = compositor.over(canvas, shadowLayer);
        }
        canvas = compositor.overAt(canvas, scaled, placement.pastePosition());

        RgbImage result = compositor.flatten(canvas, background);

        log.info("Composition completed: {} placed at ({},{}) on {}",
                placement.scaledSize(), placement.pastePosition().x(), placement.pastePosition().y(), result.size());
        return new CompositionResult(result, content, placement, options.shadow());
    }
}
