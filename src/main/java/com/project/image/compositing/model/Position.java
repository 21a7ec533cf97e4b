package com.project.image.compositing.model;

/** Top-left pixel coordinate, or a displacement when used as an offset. May be negative. */
public record Position(int x, int y) {
    public static final Position ORIGIN = new Position(0, 0);

    public Position translate(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }

    public Position translate(Position offset) {
        return translate(offset.x, offset.y);
    }
}
