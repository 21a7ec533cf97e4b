package com.project.image.compositing.config;

import com.project.image.compositing.DTOs.CompositionOptions;
import com.project.image.compositing.model.Position;
import com.project.image.compositing.model.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Default render parameters, used for any request parameter the caller leaves out.
 */
@ConfigurationProperties(prefix = "app.compositing")
public record CompositingProperties(
        @DefaultValue("FFFFFF") String backgroundColor,
        @DefaultValue("0.1") double padding,
        @DefaultValue("true") boolean shadow,
        @DefaultValue("1200") int outputWidth,
        @DefaultValue("1200") int outputHeight,
        @DefaultValue("6") int shadowOffsetX,
        @DefaultValue("14") int shadowOffsetY,
        @DefaultValue("22") double shadowBlurRadius,
        @DefaultValue("0.35") double shadowOpacity
) {
    public CompositionOptions toOptions() {
        return new CompositionOptions(backgroundColor, padding, shadow,
                new Size(outputWidth, outputHeight),
                new Position(shadowOffsetX, shadowOffsetY),
                shadowBlurRadius, shadowOpacity);
    }
}
