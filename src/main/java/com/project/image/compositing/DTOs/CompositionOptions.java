package com.project.image.compositing.DTOs;

import com.project.image.compositing.model.Position;
import com.project.image.compositing.model.Size;

import java.util.Objects;

/**
 * Parameters of one product-photo render. The background colour is kept as the raw hex string
 * and parsed by the pipeline before any pixel work starts.
 */
public record CompositionOptions(
        String backgroundColor,
        double padding,
        boolean shadow,
        Size outputSize,
        Position shadowOffset,
        double shadowBlurRadius,
        double shadowOpacity
) {
    public static final String DEFAULT_BACKGROUND = "FFFFFF";
    public static final double DEFAULT_PADDING = 0.1;
    public static final Size DEFAULT_OUTPUT_SIZE = new Size(1200, 1200);
    public static final Position DEFAULT_SHADOW_OFFSET = new Position(6, 14);
    public static final double DEFAULT_SHADOW_BLUR_RADIUS = 22;
    public static final double DEFAULT_SHADOW_OPACITY = 0.35;

    public CompositionOptions {
        if (!(padding >= 0.0 && padding < 0.5)) {
            throw new IllegalArgumentException("Padding must be within [0, 0.5), got " + padding);
        }
        if (!(shadowOpacity >= 0.0 && shadowOpacity <= 1.0)) {
            throw new IllegalArgumentException("Shadow opacity must be within [0, 1], got " + shadowOpacity);
        }
        if (!(shadowBlurRadius >= 0.0)) {
            throw new IllegalArgumentException("Shadow blur radius must not be negative, got " + shadowBlurRadius);
        }
        Objects.requireNonNull(outputSize, "outputSize");
        Objects.requireNonNull(shadowOffset, "shadowOffset");
    }

    public static CompositionOptions defaults() {
        return new CompositionOptions(DEFAULT_BACKGROUND, DEFAULT_PADDING, true, DEFAULT_OUTPUT_SIZE,
                DEFAULT_SHADOW_OFFSET, DEFAULT_SHADOW_BLUR_RADIUS, DEFAULT_SHADOW_OPACITY);
    }

    public CompositionOptions withBackgroundColor(String color) {
        return new CompositionOptions(color, padding, shadow, outputSize, shadowOffset, shadowBlurRadius, shadowOpacity);
    }

    public CompositionOptions withPadding(double value) {
        return new CompositionOptions(backgroundColor, value, shadow, outputSize, shadowOffset, shadowBlurRadius, shadowOpacity);
    }

    public CompositionOptions withShadow(boolean enabled) {
        return new CompositionOptions(backgroundColor, padding, enabled, outputSize, shadowOffset, shadowBlurRadius, shadowOpacity);
    }

    public CompositionOptions withOutputSize(Size size) {
        return new CompositionOptions(backgroundColor, padding, shadow, size, shadowOffset, shadowBlurRadius, shadowOpacity);
    }
}
