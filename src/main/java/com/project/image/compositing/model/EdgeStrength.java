package com.project.image.compositing.model;

/** How aggressively the alpha edge is eroded. */
public enum EdgeStrength {
    LIGHT(1),
    MEDIUM(2),
    HEAVY(3);

    private final int erosionPasses;

    EdgeStrength(int erosionPasses) {
        this.erosionPasses = erosionPasses;
    }

    public int erosionPasses() {
        return erosionPasses;
    }
}
