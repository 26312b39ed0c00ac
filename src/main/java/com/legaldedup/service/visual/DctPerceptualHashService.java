package com.legaldedup.service.visual;

import com.legaldedup.exception.VisualHashException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * 64-bit DCT perceptual hash: 32x32 grayscale, 2-D DCT-II, top-left 8x8 block
 * compared against its median, bits written row-major as 16 hex characters.
 */
@Slf4j
@Service
public class DctPerceptualHashService implements PerceptualHashService {

    private static final int HASH_SIZE = 8;
    private static final int SAMPLE_SIZE = HASH_SIZE * 4;

    private static final double[][] COSINES = new double[SAMPLE_SIZE][SAMPLE_SIZE];

    static {
        for (int k = 0; k < SAMPLE_SIZE; k++) {
            for (int n = 0; n < SAMPLE_SIZE; n++) {
                COSINES[k][n] = Math.cos(Math.PI * k * (2 * n + 1) / (2.0 * SAMPLE_SIZE));
            }
        }
    }

    @Override
    public String perceptualHash(String imageRef) {
        Path path = resolve(imageRef);
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new VisualHashException("Cannot read image " + imageRef, e);
        }
        if (image == null) {
            throw new VisualHashException("Unsupported image format: " + imageRef);
        }

        String hash = hash(image);
        log.debug("Perceptual hash for {}: {}", imageRef, hash);
        return hash;
    }

    public String hash(BufferedImage image) {
        double[][] pixels = grayscale(image);
        double[][] dct = dct2d(pixels);

        double[] lowFrequencies = new double[HASH_SIZE * HASH_SIZE];
        for (int row = 0; row < HASH_SIZE; row++) {
            System.arraycopy(dct[row], 0, lowFrequencies, row * HASH_SIZE, HASH_SIZE);
        }
        double median = median(lowFrequencies);

        StringBuilder hex = new StringBuilder(HASH_SIZE * HASH_SIZE / 4);
        int nibble = 0;
        for (int i = 0; i < lowFrequencies.length; i++) {
            nibble = (nibble << 1) | (lowFrequencies[i] > median ? 1 : 0);
            if (i % 4 == 3) {
                hex.append(Character.forDigit(nibble, 16));
                nibble = 0;
            }
        }
        return hex.toString();
    }

    private Path resolve(String imageRef) {
        if (imageRef == null || imageRef.isBlank()) {
            throw new VisualHashException("Image reference is empty");
        }
        try {
            Path path = imageRef.startsWith("file:") ? Path.of(URI.create(imageRef)) : Path.of(imageRef);
            if (!Files.isReadable(path)) {
                throw new VisualHashException("Image not readable: " + imageRef);
            }
            return path;
        } catch (IllegalArgumentException e) {
            throw new VisualHashException("Invalid image reference: " + imageRef, e);
        }
    }

    private double[][] grayscale(BufferedImage image) {
        BufferedImage scaled = new BufferedImage(SAMPLE_SIZE, SAMPLE_SIZE, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(image, 0, 0, SAMPLE_SIZE, SAMPLE_SIZE, null);
        } finally {
            graphics.dispose();
        }

        Raster raster = scaled.getRaster();
        double[][] pixels = new double[SAMPLE_SIZE][SAMPLE_SIZE];
        for (int y = 0; y < SAMPLE_SIZE; y++) {
            for (int x = 0; x < SAMPLE_SIZE; x++) {
                pixels[y][x] = raster.getSample(x, y, 0);
            }
        }
        return pixels;
    }

    // Unnormalized DCT-II along columns, then rows
    private double[][] dct2d(double[][] pixels) {
        double[][] columns = new double[SAMPLE_SIZE][SAMPLE_SIZE];
        for (int x = 0; x < SAMPLE_SIZE; x++) {
            for (int k = 0; k < SAMPLE_SIZE; k++) {
                double sum = 0.0;
                for (int n = 0; n < SAMPLE_SIZE; n++) {
                    sum += pixels[n][x] * COSINES[k][n];
                }
                columns[k][x] = 2.0 * sum;
            }
        }

        double[][] result = new double[SAMPLE_SIZE][SAMPLE_SIZE];
        for (int y = 0; y < SAMPLE_SIZE; y++) {
            for (int k = 0; k < SAMPLE_SIZE; k++) {
                double sum = 0.0;
                for (int n = 0; n < SAMPLE_SIZE; n++) {
                    sum += columns[y][n] * COSINES[k][n];
                }
                result[y][k] = 2.0 * sum;
            }
        }
        return result;
    }

    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        return sorted.length % 2 == 0
                ? (sorted[middle - 1] + sorted[middle]) / 2.0
                : sorted[middle];
    }
}
