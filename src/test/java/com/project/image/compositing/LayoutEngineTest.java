package com.project.image.compositing;

import com.project.image.compositing.model.Placement;
import com.project.image.compositing.model.Position;
import com.project.image.compositing.model.Size;
import com.project.image.compositing.service.LayoutEngine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LayoutEngineTest {
    private final LayoutEngine layout = new LayoutEngine();

    @Test
    void place_foregroundThatFits_isCentredWithoutScaling() {
        Placement p = layout.place(new Size(500, 500), new Size(800, 800), 0.1);

        assertThat(p.scaled()).isFalse();
        assertThat(p.scaledSize()).isEqualTo(new Size(500, 500));
        assertThat(p.pastePosition()).isEqualTo(new Position(150, 150));
    }

    @Test
    void place_neverEnlarges() {
        Placement p = layout.place(new Size(10, 10), new Size(1200, 1200), 0.1);

        assertThat(p.scaledSize()).isEqualTo(new Size(10, 10));
        assertThat(p.pastePosition()).isEqualTo(new Position(595, 595));
    }

    @Test
    void place_wideForeground_shrinksToInnerWidth() {
        Placement p = layout.place(new Size(1000, 500), new Size(800, 800), 0.1);

        assertThat(p.scaled()).isTrue();
        assertThat(p.scaledSize()).isEqualTo(new Size(640, 320));
        assertThat(p.pastePosition()).isEqualTo(new Position(80, 240));
    }

    @Test
    void place_tallForeground_keepsAspectRatio() {
        Placement p = layout.place(new Size(300, 900), new Size(800, 800), 0.1);

        assertThat(p.scaledSize()).isEqualTo(new Size(213, 640));
        assertThat(p.pastePosition()).isEqualTo(new Position(293, 80));
    }

    @Test
    void place_usesFloorDivisionForOddRemainders() {
        Placement p = layout.place(new Size(100, 101), new Size(801, 800), 0.1);

        assertThat(p.pastePosition()).isEqualTo(new Position(350, 349));
    }

    @Test
    void place_zeroPadding_fillsCanvas() {
        Placement p = layout.place(new Size(1000, 1000), new Size(800, 800), 0.0);

        assertThat(p.scaledSize()).isEqualTo(new Size(800, 800));
        assertThat(p.pastePosition()).isEqualTo(Position.ORIGIN);
        assertThat(p.footprint().width()).isEqualTo(800);
    }

    @Test
    void place_rejectsPaddingOutOfRange() {
        assertThatThrownBy(() -> layout.place(new Size(10, 10), new Size(100, 100), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> layout.place(new Size(10, 10), new Size(100, 100), -0.01))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fitWithin_shrinksOnlyTheOverflowingSide() {
        assertThat(layout.fitWithin(new Size(700, 100), new Size(640, 640))).isEqualTo(new Size(640, 91));
        assertThat(layout.fitWithin(new Size(600, 700), new Size(640, 640))).isEqualTo(new Size(549, 640));
    }
}
