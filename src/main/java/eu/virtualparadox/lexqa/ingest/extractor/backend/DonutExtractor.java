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
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Donut document-understanding model, prompted with the DocVQA task to read the page.
 * Expects the encoder/decoder export under {@code <models>/donut}.
 */
@Component
public class DonutExtractor extends AbstractOnnxVisionExtractor {

    public static final String NAME = "donut";

    private static final int INPUT_WIDTH = 1920;
    private static final int INPUT_HEIGHT = 2560;

    private static final String TASK_PROMPT =
            "<s_docvqa><s_question>What is the full text of this document?</s_question><s_answer>";

    private static final Pattern TASK_TAGS = Pattern.compile("</?s_[^>]*>");

    public DonutExtractor(final ApplicationConfig config, final TextQualityScorer qualityScorer) {
        super(NAME,
                config.getModels().resolve(NAME),
                config.getExtraction().getMaxDecodeTokens(),
                config.getExtraction().effectiveConcurrency(),
                qualityScorer);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.DOCUMENT_UNDERSTANDING;
    }

    @Override
    protected Map<String, OnnxTensor> encoderInputs(final OrtEnvironment env, final BufferedImage image) throws OrtException {
        return Map.of("pixel_values", OnnxTensor.createTensor(env, pixelValues(image)));
    }

    @Override
    protected long[] decoderPrompt(final HuggingFaceTokenizer tokenizer) {
        return tokenizer.encode(TASK_PROMPT, false, false).getIds();
    }

    @Override
    protected String postProcess(final String decoded) {
        String text = decoded;
        final int end = text.indexOf("</s_answer>");
        if (end >= 0) {
            text = text.substring(0, end);
        }
        return TASK_TAGS.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Fits the page into the model canvas keeping its aspect ratio, pads the rest with black
     * and scales channels to {@code [-1, 1]}.
     */
    static float[][][][] pixelValues(final BufferedImage page) {
        final double scale = Math.min((double) INPUT_WIDTH / page.getWidth(), (double) INPUT_HEIGHT / page.getHeight());
        final int width = Math.max(1, (int) Math.round(page.getWidth() * scale));
        final int height = Math.max(1, (int) Math.round(page.getHeight() * scale));

        final BufferedImage canvas = new BufferedImage(INPUT_WIDTH, INPUT_HEIGHT, BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(page, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }

        final float[][][][] values = new float[1][3][INPUT_HEIGHT][INPUT_WIDTH];
        for (int y = 0; y < INPUT_HEIGHT; y++) {
            for (int x = 0; x < INPUT_WIDTH; x++) {
                final int rgb = canvas.getRGB(x, y);
                values[0][0][y][x] = (((rgb >> 16) & 0xFF) / 255f - 0.5f) / 0.5f;
                values[0][1][y][x] = (((rgb >> 8) & 0xFF) / 255f - 0.5f) / 0.5f;
                values[0][2][y][x] = ((rgb & 0xFF) / 255f - 0.5f) / 0.5f;
            }
        }
        return values;
    }
}
