package eu.virtualparadox.lexqa.ingest.extractor.backend;

import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.HashMap;
import java.util.Map;

/**
 * Pix2Struct screenshot-parsing model. Expects the encoder/decoder export under
 * {@code <models>/pix2struct}.
 */
@Component
public class Pix2StructExtractor extends AbstractOnnxVisionExtractor {

    public static final String NAME = "pix2struct";

    static final int PATCH = 16;
    static final int MAX_PATCHES = 2048;
    /** Row id, column id and the RGB values of one patch. */
    static final int PATCH_WIDTH = 2 + PATCH * PATCH * 3;

    public Pix2StructExtractor(final ApplicationConfig config, final TextQualityScorer qualityScorer) {
        super(NAME,
                config.getModels().resolve(NAME),
                config.getExtraction().getMaxDecodeTokens(),
                config.getExtraction().effectiveConcurrency(),
                qualityScorer);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.VISUAL_QA;
    }

    @Override
    protected Map<String, OnnxTensor> encoderInputs(final OrtEnvironment env, final BufferedImage image) throws OrtException {
        final FlattenedPatches patches = flattenedPatches(image);
        final Map<String, OnnxTensor> inputs = new HashMap<>();
        inputs.put("flattened_patches", OnnxTensor.createTensor(env, patches.values()));
        try {
            inputs.put("attention_mask", OnnxTensor.createTensor(env, patches.mask()));
        } catch (OrtException e) {
            inputs.values().forEach(OnnxTensor::close);
            throw e;
        }
        return inputs;
    }

    @Override
    protected long[] decoderPrompt(final HuggingFaceTokenizer tokenizer) {
        // decoder starts from the pad token
        return new long[]{tokenId(tokenizer, "<pad>")};
    }

    /**
     * Resizes the page so that at most {@link #MAX_PATCHES} patches cover it, standardizes the
     * pixels over the whole image and emits one row per patch, zero-padded to the maximum.
     */
    static FlattenedPatches flattenedPatches(final BufferedImage page) {
        final double scale = Math.sqrt(MAX_PATCHES * ((double) PATCH / page.getHeight()) * ((double) PATCH / page.getWidth()));
        final int rows = Math.max(1, Math.min((int) Math.floor(scale * page.getHeight() / PATCH), MAX_PATCHES));
        final int cols = Math.max(1, Math.min((int) Math.floor(scale * page.getWidth() / PATCH), MAX_PATCHES / rows));

        final int width = cols * PATCH;
        final int height = rows * PATCH;
        final BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(page, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }

        final float[] pixels = new float[width * height * 3];
        double sum = 0.0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final int rgb = resized.getRGB(x, y);
                final int base = (y * width + x) * 3;
                pixels[base] = (rgb >> 16) & 0xFF;
                pixels[base + 1] = (rgb >> 8) & 0xFF;
                pixels[base + 2] = rgb & 0xFF;
                sum += pixels[base] + pixels[base + 1] + pixels[base + 2];
            }
        }
        final double mean = sum / pixels.length;
        double variance = 0.0;
        for (final float p : pixels) {
            variance += (p - mean) * (p - mean);
        }
        final double std = Math.max(Math.sqrt(variance / pixels.length), 1.0 / Math.sqrt(pixels.length));

        final float[][][] values = new float[1][MAX_PATCHES][PATCH_WIDTH];
        final long[][] mask = new long[1][MAX_PATCHES];
        int patch = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                final float[] row = values[0][patch];
                row[0] = r + 1;
                row[1] = c + 1;
                int k = 2;
                for (int py = 0; py < PATCH; py++) {
                    for (int px = 0; px < PATCH; px++) {
                        final int base = ((r * PATCH + py) * width + (c * PATCH + px)) * 3;
                        for (int ch = 0; ch < 3; ch++) {
                            row[k++] = (float) ((pixels[base + ch] - mean) / std);
                        }
                    }
                }
                mask[0][patch] = 1L;
                patch++;
            }
        }
        return new FlattenedPatches(values, mask, patch);
    }

    record FlattenedPatches(float[][][] values, long[][] mask, int patchCount) {
    }
}
