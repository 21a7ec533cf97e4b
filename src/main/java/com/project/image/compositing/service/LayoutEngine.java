package com.project.image.compositing.service;

import com.project.image.compositing.model.Placement;
import com.project.image.compositing.model.Position;
import com.project.image.compositing.model.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.IntToDoubleFunction;

/**
 * Fits a foreground into the padded interior of a canvas and centres it.
 */
@Service
public class LayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    public Placement place(Size foreground, Size canvas, double padding) {
        if (!(padding >= 0.0 && padding < 0.5)) {
            throw new IllegalArgumentException("Padding must be within [0, 0.5), got " + padding);
        }
        Size inner = new Size(
                Math.max(1, (int) Math.floor(canvas.width() * (1 - 2 * padding))),
                Math.max(1, (int) Math.floor(canvas.height() * (1 - 2 * padding))));

        Size scaled = fitWithin(foreground, inner);
        Position paste = new Position(
                Math.floorDiv(canvas.width() - scaled.width(), 2),
                Math.floorDiv(canvas.height() - scaled.height(), 2));

        log.debug("Layout: foreground={}, inner={}, scaled={}, paste=({},{})",
                foreground, inner, scaled, paste.x(), paste.y());
        return new Placement(scaled, paste, !scaled.equals(foreground));
    }

    /**
     * Thumbnail semantics: shrinks to fit {@code box} keeping the aspect ratio, never enlarges.
     * Each rounded side is whichever of floor/ceil keeps the aspect ratio closest to the source.
     */
    public Size fitWithin(Size source, Size box) {
        if (source.fitsWithin(box)) {
            return source;
        }
        final double aspect = (double) source.width() / source.height();
        final int x = box.width();
        final int y = box.height();

        if ((double) x / y >= aspect) {
            int w = roundAspect(y * aspect, n -> Math.abs(aspect - (double) n / y));
            return new Size(w, y);
        }
        int h = roundAspect(x / aspect, n -> n == 0 ? 0 : Math.abs(aspect - (double) x / n));
        return new Size(x, h);
    }

    private static int roundAspect(double value, IntToDoubleFunction error) {
        int lo = (int) Math.floor(value);
        int hi = (int) Math.ceil(value);
        int best = error.applyAsDouble(hi) < error.applyAsDouble(lo) ? hi : lo;
        return Math.max(best, 1);
    }
}
