package com.project.image.compositing;

import com.project.image.compositing.exceptions.RasterFormatException;
import com.project.image.compositing.model.AlphaMask;
import com.project.image.compositing.model.BoundingBox;
import com.project.image.compositing.model.Position;
import com.project.image.compositing.model.RasterImage;
import com.project.image.compositing.model.RgbColor;
import com.project.image.compositing.model.RgbImage;
import com.project.image.compositing.model.Size;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterImageTest {

    @Test
    void constructor_rejectsZeroDimensionsAndWrongChannelCount() {
        assertThatThrownBy(() -> new RasterImage(0, 5, new byte[0])).isInstanceOf(RasterFormatException.class);
        assertThatThrownBy(() -> new RasterImage(2, 2, new byte[12])).isInstanceOf(RasterFormatException.class);
        assertThatThrownBy(() -> new RasterImage(2, 2, null)).isInstanceOf(RasterFormatException.class);
    }

    @Test
    void constructor_rejectsBufferWhoseExpectedLengthOverflowsInt() {
        // 65536 * 65536 wraps to 0 in int arithmetic
        assertThatThrownBy(() -> new RasterImage(65536, 16384, new byte[0])).isInstanceOf(RasterFormatException.class);
        assertThatThrownBy(() -> new AlphaMask(65536, 65536, new byte[0])).isInstanceOf(RasterFormatException.class);
        assertThatThrownBy(() -> new RgbImage(65536, 65536, new byte[0])).isInstanceOf(RasterFormatException.class);
    }

    @Test
    void crop_copiesTheBoxedPixels() {
        RasterImage image = TestImages.rectangle(10, 8, 2, 3, 4, 2, new RgbColor(1, 2, 3));

        RasterImage cropped = image.crop(new BoundingBox(2, 3, 6, 5));

        assertThat(cropped.size()).isEqualTo(new Size(4, 2));
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 4; x++) {
                assertThat(cropped.alpha(x, y)).isEqualTo(255);
                assertThat(cropped.channel(x, y, RasterImage.BLUE)).isEqualTo(3);
            }
        }
    }

    @Test
    void withAlpha_replacesOnlyAlpha() {
        RasterImage image = RasterImage.filled(new Size(3, 1), new RgbColor(9, 8, 7), 255);

        RasterImage out = image.withAlpha(new AlphaMask(3, 1, new byte[]{0, (byte) 128, (byte) 255}));

        assertThat(out.alpha(1, 0)).isEqualTo(128);
        assertThat(out.channel(1, 0, RasterImage.RED)).isEqualTo(9);
        assertThat(image.alpha(1, 0)).isEqualTo(255);
    }

    @Test
    void placeOn_clipsAtCanvasEdges() {
        AlphaMask full = new AlphaMask(3, 3, new byte[]{
                (byte) 255, (byte) 255, (byte) 255,
                (byte) 255, (byte) 255, (byte) 255,
                (byte) 255, (byte) 255, (byte) 255});

        AlphaMask placed = full.placeOn(new Size(4, 4), new Position(-1, 2));

        assertThat(placed.get(0, 2)).isEqualTo(255);
        assertThat(placed.get(1, 3)).isEqualTo(255);
        assertThat(placed.get(2, 3)).isZero();
        assertThat(placed.get(0, 1)).isZero();
        assertThat(full.placeOn(new Size(4, 4), new Position(10, 10)).max()).isZero();
    }

    @Test
    void boundingBox_neverEmpty() {
        assertThatThrownBy(() -> new BoundingBox(3, 0, 3, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThat(BoundingBox.of(new Size(7, 4))).isEqualTo(new BoundingBox(0, 0, 7, 4));
    }
}
