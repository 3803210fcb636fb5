package org.buaa.imagesearch.service.impl;

import org.buaa.imagesearch.common.consts.SystemConstants;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dto.ProcessedMedia;
import org.buaa.imagesearch.service.MediaTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * 基于 ImageIO 的图片归一化
 * 去除透明通道、等比缩放到最长边不超过配置值，再以固定质量编码为 JPEG
 */
@Service
public class ImageIoMediaTransformer implements MediaTransformer {

    private static final Logger log = LoggerFactory.getLogger(ImageIoMediaTransformer.class);

    private final IngestionProperties.Media mediaConfig;

    public ImageIoMediaTransformer(IngestionProperties properties) {
        this.mediaConfig = properties.getMedia();
    }

    @Override
    public ProcessedMedia transform(byte[] raw, Map<String, String> metadata) {
        if (raw == null || raw.length == 0) {
            throw new ValidationException("图片内容为空");
        }

        BufferedImage source = decode(raw);
        int[] size = scaledSize(source.getWidth(), source.getHeight(), mediaConfig.getMaxDimension());
        BufferedImage normalized = drawRgb(source, size[0], size[1]);
        byte[] encoded = encodeJpeg(normalized, mediaConfig.getJpegQuality());

        log.debug("图片归一化完成 - 原始: {}x{}, 结果: {}x{}, {} 字节",
            source.getWidth(), source.getHeight(), size[0], size[1], encoded.length);
        return new ProcessedMedia(encoded, SystemConstants.PROCESSED_CONTENT_TYPE, size[0], size[1], metadata);
    }

    private BufferedImage decode(byte[] raw) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(raw));
            if (image == null) {
                throw new ValidationException("无法识别的图片格式");
            }
            return image;
        } catch (IOException e) {
            throw new ValidationException("图片解码失败: " + e.getMessage(), e);
        }
    }

    /**
     * 计算等比缩放后的尺寸，未超限时保持原尺寸
     */
    static int[] scaledSize(int width, int height, int maxDimension) {
        int longest = Math.max(width, height);
        if (maxDimension <= 0 || longest <= maxDimension) {
            return new int[]{width, height};
        }
        double ratio = (double) maxDimension / longest;
        int scaledWidth = Math.max(1, (int) Math.round(width * ratio));
        int scaledHeight = Math.max(1, (int) Math.round(height * ratio));
        return new int[]{scaledWidth, scaledHeight};
    }

    private BufferedImage drawRgb(BufferedImage source, int width, int height) {
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            // 透明区域以白色填充
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, width, height);
            graphics.drawImage(source, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return target;
    }

    private byte[] encodeJpeg(BufferedImage image, float quality) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IllegalStateException("当前运行环境缺少 JPEG 编码器");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (ImageOutputStream imageOutput = ImageIO.createImageOutputStream(output)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.setOutput(imageOutput);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new ValidationException("图片编码失败: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
        return output.toByteArray();
    }
}
