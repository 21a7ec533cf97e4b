package com.project.image.compositing;

import com.project.image.compositing.exceptions.CompositingException;
import com.project.image.compositing.exceptions.RasterFormatException;
import com.project.image.compositing.model.RasterImage;
import com.project.image.compositing.service.ImageCodec;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import javax.imageio.ImageIO;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageCodecTest {

    private final ImageCodec codec = new ImageCodec();

    @Test
    void decode_acceptsImagesUpToTheSizeLimit() throws Exception {
        RasterImage image = codec.decode(grayPng(ImageCodec.MAX_DIMENSION, 2));

        assertThat(image.width()).isEqualTo(ImageCodec.MAX_DIMENSION);
        assertThat(image.height()).isEqualTo(2);
        assertThat(image.alpha(0, 0)).isEqualTo(255);
    }

    @Test
    void decode_rejectsWideImageBeforeDecodingPixels() throws Exception {
        byte[] wide = grayPng(ImageCodec.MAX_DIMENSION + 1, 2);

        assertThatThrownBy(() -> codec.decode(wide))
                .isInstanceOf(RasterFormatException.class)
                .hasMessageContaining("4001x2");
    }

    @Test
    void decode_rejectsTallImage() throws Exception {
        byte[] tall = grayPng(2, 6000);

        assertThatThrownBy(() -> codec.decode(tall)).isInstanceOf(RasterFormatException.class);
    }

    @Test
    void decode_rejectsBytesThatAreNotAnImage() {
        assertThatThrownBy(() -> codec.decode("not an image".getBytes()))
                .isInstanceOf(CompositingException.class)
                .hasMessageContaining("not a valid image");
    }

    // blank grayscale images compress to a few hundred bytes
    static byte[] grayPng(int width, int height) throws Exception {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }
}
