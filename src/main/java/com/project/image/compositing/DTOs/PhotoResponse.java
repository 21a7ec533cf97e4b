package com.project.image.compositing.DTOs;

import com.project.image.compositing.model.BoundingBox;
import com.project.image.compositing.model.Placement;

public record PhotoResponse(
        String originalPath,
        String resultPath,
        int width,
        int height,
        String backgroundColor,
        BoundingBox contentBox,
        Placement placement,
        boolean shadow
) {}
