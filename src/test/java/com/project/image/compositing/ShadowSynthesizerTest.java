package com.project.image.compositing;

import com.project.image.compositing.model.AlphaMask;
import com.project.image.compositing.model.Position;
import com.project.image.compositing.model.RasterImage;
import com.project.image.compositing.model.RgbColor;
import com.project.image.compositing.model.Size;
import com.project.image.compositing.service.Compositor;
import com.project.image.compositing.service.ShadowSynthesizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ShadowSynthesizerTest {
    private final ShadowSynthesizer synthesizer = new ShadowSynthesizer(new Compositor());

    private final Size canvas = new Size(300, 300);
    private final Position paste = new Position(50, 50);
    private final RasterImage square = RasterImage.filled(new Size(100, 100), RgbColor.WHITE, 255);

    @Test
    void silhouette_binarizesAboveTwenty() {
        RasterImage fg = new RasterImage(3, 1, new byte[]{0, 0, 0, 20, 0, 0, 0, 21, 0, 0, 0, (byte) 255});

        AlphaMask silhouette = synthesizer.silhouette(fg);

        assertThat(silhouette.toByteArray()).containsExactly(0, (byte) 255, (byte) 255);
    }

    @Test
    void castShadow_appliesOpacityAfterBlur() {
        AlphaMask cast = synthesizer.castShadow(synthesizer.silhouette(square), canvas, paste,
                new Position(6, 14), 22, 0.35);

        // the blur kernel fits inside the square, so the centre is fully covered before scaling
        assertThat(cast.get(106, 114)).isEqualTo(89);
        assertThat(cast.max()).isEqualTo(89);
        assertThat(cast.get(0, 0)).isZero();
        assertThat(cast.get(299, 299)).isZero();
    }

    @Test
    void castShadow_followsOffset() {
        AlphaMask silhouette = synthesizer.silhouette(square);
        AlphaMask centred = synthesizer.castShadow(silhouette, canvas, paste, Position.ORIGIN, 22, 0.35);
        AlphaMask shifted = synthesizer.castShadow(silhouette, canvas, paste, new Position(10, 20), 22, 0.35);

        for (int[] p : new int[][]{{40, 40}, {100, 100}, {150, 60}, {60, 155}, {30, 120}}) {
            assertThat(shifted.get(p[0] + 10, p[1] + 20))
                    .isCloseTo(centred.get(p[0], p[1]), within(1));
        }
    }

    @Test
    void contactShadow_isTightAndDarker() {
        AlphaMask contact = synthesizer.contactShadow(synthesizer.silhouette(square), canvas, paste);

        assertThat(contact.get(102, 104)).isEqualTo(102);
        // blur radius 5 reaches only ten pixels past the silhouette
        assertThat(contact.get(52 + 100 + 11, 104)).isZero();
        assertThat(contact.get(52 - 12, 104)).isZero();
    }

    @Test
    void synthesize_layersCastOverContact() {
        RasterImage layer = synthesizer.synthesize(square, canvas, paste, new Position(6, 14), 22, 0.35);

        assertThat(layer.size()).isEqualTo(canvas);
        assertThat(layer.alpha(104, 110)).isEqualTo(155);
        assertThat(layer.alpha(0, 0)).isZero();
        for (int y = 0; y < 300; y += 13) {
            for (int x = 0; x < 300; x += 11) {
                assertThat(layer.channel(x, y, RasterImage.RED)).isZero();
                assertThat(layer.channel(x, y, RasterImage.GREEN)).isZero();
                assertThat(layer.channel(x, y, RasterImage.BLUE)).isZero();
            }
        }
    }

    @Test
    void synthesize_emptySilhouette_givesEmptyLayer() {
        RasterImage clear = RasterImage.transparent(new Size(40, 40));

        RasterImage layer = synthesizer.synthesize(clear, canvas, paste, new Position(6, 14), 22, 0.35);

        assertThat(layer.alphaMask().max()).isZero();
    }
}
