package com.phillippitts.poseidon.service.extraction.ocr;

import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.exception.ExtractionException;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageEnhancerTest {

    @Test
    void upscalesByConfiguredFactor() throws IOException {
        ImageEnhancer enhancer = new ImageEnhancer(2.0, 1.5);

        BufferedImage out = enhancer.enhance(png(40, 20));

        assertThat(out.getWidth()).isEqualTo(80);
        assertThat(out.getHeight()).isEqualTo(40);
    }

    @Test
    void undecodableBytesAreMalformed() {
        ImageEnhancer enhancer = new ImageEnhancer(2.0, 1.5);

        assertThatThrownBy(() -> enhancer.enhance(new byte[]{1, 2, 3, 4}))
                .isInstanceOf(ExtractionException.class)
                .satisfies(e -> assertThat(((ExtractionException) e).getKind())
                        .isEqualTo(FailureKind.MALFORMED_OUTPUT));
    }

    @Test
    void rejectsNonPositiveSettings() {
        assertThatThrownBy(() -> new ImageEnhancer(0, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ImageEnhancer(1.0, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    static byte[] png(int width, int height) throws IOException {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        img.setRGB(width / 2, height / 2, 0xFFFFFF);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }
}
