package org.buaa.imagesearch.service.impl;

import org.buaa.imagesearch.common.consts.SystemConstants;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dto.ProcessedMedia;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ImageIoMediaTransformerTest {

    private final ImageIoMediaTransformer transformer = new ImageIoMediaTransformer(new IngestionProperties());

    private static byte[] png(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(image, "png", output);
        return output.toByteArray();
    }

    @Test
    void testLargeImageIsScaledToMaxDimensionAndEncodedAsJpeg() throws IOException {
        ProcessedMedia media = transformer.transform(png(1600, 400), Map.of("source_url", "http://example.com/a.png"));

        assertEquals(800, media.getWidth());
        assertEquals(200, media.getHeight());
        assertEquals(SystemConstants.PROCESSED_CONTENT_TYPE, media.getContentType());
        assertEquals("http://example.com/a.png", media.getMetadata().get("source_url"));

        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(media.getContent()));
        assertNotNull(decoded);
        assertEquals(800, decoded.getWidth());
    }

    @Test
    void testSmallImageKeepsItsSize() throws IOException {
        ProcessedMedia media = transformer.transform(png(120, 60), null);

        assertEquals(120, media.getWidth());
        assertEquals(60, media.getHeight());
        assertEquals(0, media.getMetadata().size());
    }

    @Test
    void testScaledSizeKeepsAspectRatio() {
        assertArrayEquals(new int[]{600, 800}, ImageIoMediaTransformer.scaledSize(1200, 1600, 800));
        assertArrayEquals(new int[]{800, 1}, ImageIoMediaTransformer.scaledSize(4000, 2, 800));
    }

    @Test
    void testUndecodableBytesAreRejected() {
        assertThrows(ValidationException.class, () -> transformer.transform(new byte[]{1, 2, 3}, null));
        assertThrows(ValidationException.class, () -> transformer.transform(new byte[0], null));
    }
}
