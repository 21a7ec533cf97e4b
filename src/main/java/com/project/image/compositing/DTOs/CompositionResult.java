package com.project.image.compositing.DTOs;

import com.project.image.compositing.model.BoundingBox;
import com.project.image.compositing.model.Placement;
import com.project.image.compositing.model.RgbImage;

public record CompositionResult(
        RgbImage image,
        BoundingBox contentBox,   // in the refined input's coordinates
        Placement placement,      // on the output canvas
        boolean shadowApplied
) {}
