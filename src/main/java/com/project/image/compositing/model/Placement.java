package com.project.image.compositing.model;

/** Where a (possibly shrunk) foreground lands on the canvas. */
public record Placement(Size scaledSize, Position pastePosition, boolean scaled) {

    public BoundingBox footprint() {
        return new BoundingBox(pastePosition.x(), pastePosition.y(),
                pastePosition.x() + scaledSize.width(), pastePosition.y() + scaledSize.height());
    }
}
