package com.phillippitts.poseidon.service.extraction.ocr;

import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.exception.ExtractionExceptionBuilder;
import com.phillippitts.poseidon.service.extraction.BackendNames;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.awt.image.RescaleOp;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Prepares a screenshot for OCR: upscale, contrast boost, sharpen.
 * Small forecast table digits are otherwise misread.
 */
final class ImageEnhancer {

    private static final float[] SHARPEN = {
            0f, -1f, 0f,
            -1f, 5f, -1f,
            0f, -1f, 0f
    };

    private final double scaleFactor;
    private final float contrast;

    ImageEnhancer(double scaleFactor, double contrast) {
        if (scaleFactor <= 0 || contrast <= 0) {
            throw new IllegalArgumentException("scaleFactor and contrast must be positive");
        }
        this.scaleFactor = scaleFactor;
        this.contrast = (float) contrast;
    }

    /**
     * Decodes and enhances the image.
     *
     * @throws com.phillippitts.poseidon.exception.ExtractionException with
     *         {@link FailureKind#MALFORMED_OUTPUT} if the bytes are not a decodable image
     */
    BufferedImage enhance(byte[] imageBytes) {
        BufferedImage source;
        try {
            source = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw unreadable(e);
        }
        if (source == null) {
            throw unreadable(null);
        }
        return enhance(source);
    }

    BufferedImage enhance(BufferedImage source) {
        BufferedImage scaled = scale(source);
        // Offset keeps mid-grey roughly in place while stretching contrast
        float offset = 128f * (1f - contrast);
        BufferedImage contrasted = new RescaleOp(contrast, offset, null).filter(scaled, null);
        return new ConvolveOp(new Kernel(3, 3, SHARPEN), ConvolveOp.EDGE_NO_OP, null).filter(contrasted, null);
    }

    private BufferedImage scale(BufferedImage source) {
        int width = Math.max(1, (int) Math.round(source.getWidth() * scaleFactor));
        int height = Math.max(1, (int) Math.round(source.getHeight() * scaleFactor));
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static RuntimeException unreadable(Throwable cause) {
        return ExtractionExceptionBuilder.create("Image bytes could not be decoded")
                .backend(BackendNames.OCR)
                .kind(FailureKind.MALFORMED_OUTPUT)
                .cause(cause)
                .build();
    }
}
