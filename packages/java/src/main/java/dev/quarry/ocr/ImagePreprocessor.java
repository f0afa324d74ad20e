package dev.quarry.ocr;

import dev.quarry.QuarryException;
import dev.quarry.config.ImageExtractionConfig;
import dev.quarry.config.ImagePreprocessingConfig;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import javax.imageio.ImageIO;

/**
 * Prepares an image for OCR: optional rescale, a bound on the longest side, then the
 * pixel operations configured in {@link ImagePreprocessingConfig}. Output is always PNG.
 */
public final class ImagePreprocessor {
    private final ImagePreprocessingConfig preprocessing;
    private final int targetDpi;
    private final int maxDimension;

    /**
     * @param preprocessing pixel operations, or null to only rescale and bound
     * @param images DPI and dimension settings, or null for the defaults
     */
    public ImagePreprocessor(ImagePreprocessingConfig preprocessing, ImageExtractionConfig images) {
        ImageExtractionConfig effective = images != null ? images : ImageExtractionConfig.builder().build();
        this.preprocessing = preprocessing;
        this.targetDpi = effective.getTargetDpi();
        this.maxDimension = effective.getMaxImageDimension();
    }

    /**
     * Preprocess an encoded image.
     *
     * @param encoded image bytes in any format {@link ImageIO} reads
     * @param sourceDpi resolution the image was produced at, or null when unknown
     * @return PNG bytes
     * @throws QuarryException.ImageProcessing if the image cannot be decoded or encoded
     */
    public byte[] process(byte[] encoded, Integer sourceDpi) throws QuarryException {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(encoded));
        } catch (IOException e) {
            throw new QuarryException.ImageProcessing("Image decode failed: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new QuarryException.ImageProcessing("Image decode failed: unsupported or corrupt image data");
        }
        return encode(process(image, sourceDpi));
    }

    BufferedImage process(BufferedImage image, Integer sourceDpi) {
        double scale = 1.0;
        if (sourceDpi != null && sourceDpi > 0 && sourceDpi != targetDpi) {
            scale = (double) targetDpi / sourceDpi;
        }
        int longest = Math.max(image.getWidth(), image.getHeight());
        if (longest * scale > maxDimension) {
            scale = (double) maxDimension / longest;
        }
        BufferedImage result = scale == 1.0 ? toRgb(image) : resize(image, scale);
        if (preprocessing == null) {
            return result;
        }
        int width = result.getWidth();
        int height = result.getHeight();
        boolean gray = preprocessing.isGrayscale() || !"none".equals(preprocessing.getBinarizationMethod());
        if (!gray) {
            if (preprocessing.isInvertColors()) {
                invertRgb(result);
            }
            return result;
        }
        int[] luma = luminance(result);
        if (preprocessing.isDenoise()) {
            luma = median(luma, width, height);
        }
        if (preprocessing.isContrastEnhance()) {
            stretch(luma);
        }
        switch (preprocessing.getBinarizationMethod()) {
            case "otsu":
                binarize(luma, otsu(luma));
                break;
            case "threshold":
                binarize(luma, preprocessing.getThreshold());
                break;
            default:
                break;
        }
        if (preprocessing.isInvertColors()) {
            for (int i = 0; i < luma.length; i++) {
                luma[i] = 255 - luma[i];
            }
        }
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        out.getRaster().setPixels(0, 0, width, height, luma);
        return out;
    }

    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, java.awt.Color.WHITE, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static BufferedImage resize(BufferedImage image, double scale) {
        int width = Math.max(1, (int) Math.round(image.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(image.getHeight() * scale));
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, width, height, java.awt.Color.WHITE, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private static int[] luminance(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        int[] luma = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            int r = (rgb[i] >> 16) & 0xFF;
            int g = (rgb[i] >> 8) & 0xFF;
            int b = rgb[i] & 0xFF;
            luma[i] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
        }
        return luma;
    }

    private static void invertRgb(BufferedImage image) {
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                image.setRGB(x, y, ~image.getRGB(x, y) & 0xFFFFFF);
            }
        }
    }

    static int[] median(int[] luma, int width, int height) {
        int[] out = new int[luma.length];
        int[] window = new int[9];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int n = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int yy = Math.min(height - 1, Math.max(0, y + dy));
                        int xx = Math.min(width - 1, Math.max(0, x + dx));
                        window[n++] = luma[yy * width + xx];
                    }
                }
                Arrays.sort(window);
                out[y * width + x] = window[4];
            }
        }
        return out;
    }

    static void stretch(int[] luma) {
        int min = 255;
        int max = 0;
        for (int value : luma) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (max - min < 2 || (min == 0 && max == 255)) {
            return;
        }
        double range = max - min;
        for (int i = 0; i < luma.length; i++) {
            luma[i] = (int) Math.round((luma[i] - min) * 255.0 / range);
        }
    }

    static int otsu(int[] luma) {
        int[] histogram = new int[256];
        for (int value : luma) {
            histogram[value]++;
        }
        long total = luma.length;
        double sum = 0;
        for (int i = 0; i < 256; i++) {
            sum += (double) i * histogram[i];
        }
        double sumBackground = 0;
        long background = 0;
        double best = -1;
        int threshold = 128;
        for (int t = 0; t < 256; t++) {
            background += histogram[t];
            if (background == 0) {
                continue;
            }
            long foreground = total - background;
            if (foreground == 0) {
                break;
            }
            sumBackground += (double) t * histogram[t];
            double meanBackground = sumBackground / background;
            double meanForeground = (sum - sumBackground) / foreground;
            double between = (double) background * foreground
                * (meanBackground - meanForeground) * (meanBackground - meanForeground);
            if (between > best) {
                best = between;
                threshold = t;
            }
        }
        return threshold;
    }

    private static void binarize(int[] luma, int threshold) {
        for (int i = 0; i < luma.length; i++) {
            luma[i] = luma[i] > threshold ? 255 : 0;
        }
    }

    private static byte[] encode(BufferedImage image) throws QuarryException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) {
                throw new QuarryException.ImageProcessing("No PNG writer available");
            }
        } catch (IOException e) {
            throw new QuarryException.ImageProcessing("Image encode failed: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }
}
