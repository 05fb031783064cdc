package eu.virtualparadox.lexqa.ingest.extractor.backend;

import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.lexqa.util.ModelHandle;
import eu.virtualparadox.lexqa.util.OrtInitializer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for image-to-text transformers exported to ONNX as an encoder/decoder pair.
 * <p>
 * The model directory must hold {@code encoder_model.onnx}, {@code decoder_model.onnx} and
 * {@code tokenizer.json}. Decoding is greedy and runs without a key/value cache; the decoder is
 * re-run over the whole prefix for each generated token.
 * <p>
 * Confidence is the mean probability of the generated tokens scaled by the
 * {@link TextQualityScorer} score of the decoded text.
 */
@Slf4j
public abstract class AbstractOnnxVisionExtractor implements ExtractorBackend {

    static final String ENCODER_FILE = "encoder_model.onnx";
    static final String DECODER_FILE = "decoder_model.onnx";
    static final String TOKENIZER_FILE = "tokenizer.json";

    private final String name;
    private final Path modelDir;
    private final int maxDecodeTokens;
    private final TextQualityScorer qualityScorer;
    private final ModelHandle<VisionModel> model;

    protected AbstractOnnxVisionExtractor(final String name,
                                          final Path modelDir,
                                          final int maxDecodeTokens,
                                          final int concurrentSessions,
                                          final TextQualityScorer qualityScorer) {
        this.name = name;
        this.modelDir = modelDir;
        this.maxDecodeTokens = maxDecodeTokens;
        this.qualityScorer = qualityScorer;
        this.model = new ModelHandle<>(name, () -> VisionModel.load(modelDir, concurrentSessions));
    }

    /**
     * Builds the encoder inputs for one page; the caller closes the returned tensors.
     */
    protected abstract Map<String, OnnxTensor> encoderInputs(OrtEnvironment env, BufferedImage image) throws OrtException;

    /**
     * Token ids the decoder starts from.
     */
    protected abstract long[] decoderPrompt(HuggingFaceTokenizer tokenizer);

    /**
     * Turns the decoded token sequence into page text.
     */
    protected String postProcess(final String decoded) {
        return decoded.strip();
    }

    protected String eosToken() {
        return "</s>";
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isReady() {
        if (!Files.isRegularFile(modelDir.resolve(ENCODER_FILE))
                || !Files.isRegularFile(modelDir.resolve(DECODER_FILE))
                || !Files.isRegularFile(modelDir.resolve(TOKENIZER_FILE))) {
            log.debug("Backend {} not installed under {}", name, modelDir);
            return false;
        }
        return model.ensureLoaded();
    }

    @Override
    public ExtractedText extract(final BufferedImage image, final int pageIndex) throws ExtractionException {
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            throw new ExtractionException(name, "Empty page image");
        }

        try (ModelHandle<VisionModel>.Lease lease = model.acquire()) {
            final VisionModel vm = lease.get();
            final OrtEnvironment env = OrtEnvironment.getEnvironment();

            final Map<String, OnnxTensor> encoderInputs = encoderInputs(env, image);
            try (OrtSession.Result encoded = vm.encoder.run(encoderInputs)) {
                final OnnxTensor hiddenStates = (OnnxTensor) encoded.get(0);
                final Decoded decoded = greedyDecode(env, vm, hiddenStates, encoderInputs.get("attention_mask"), pageIndex);

                final String text = postProcess(vm.tokenizer.decode(decoded.ids(), true));
                final double confidence = decoded.meanProbability() * qualityScorer.score(text);
                log.debug("{} page {}: {} tokens, confidence {}", name, pageIndex, decoded.ids().length, confidence);
                return new ExtractedText(text, confidence);
            } finally {
                encoderInputs.values().forEach(OnnxValue::close);
            }
        } catch (OrtException e) {
            throw new ExtractionException(name, "Inference failed on page " + pageIndex + ": " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new ExtractionException(name, e.getMessage(), e);
        }
    }

    private Decoded greedyDecode(final OrtEnvironment env,
                                 final VisionModel vm,
                                 final OnnxTensor hiddenStates,
                                 final OnnxTensor encoderMask,
                                 final int pageIndex) throws OrtException, ExtractionException {
        final long eos = tokenId(vm.tokenizer, eosToken());
        final long[] prompt = decoderPrompt(vm.tokenizer);

        final List<Long> sequence = new ArrayList<>();
        for (final long id : prompt) {
            sequence.add(id);
        }

        final List<Long> generated = new ArrayList<>();
        double probabilitySum = 0.0;

        for (int step = 0; step < maxDecodeTokens; step++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ExtractionException(name, "Decoding interrupted on page " + pageIndex);
            }

            final long[][] ids = new long[1][sequence.size()];
            for (int i = 0; i < sequence.size(); i++) {
                ids[0][i] = sequence.get(i);
            }

            try (OnnxTensor idsTensor = OnnxTensor.createTensor(env, ids)) {
                final Map<String, OnnxTensor> inputs = new HashMap<>();
                for (final String input : vm.decoder.getInputNames()) {
                    switch (input) {
                        case "input_ids", "decoder_input_ids" -> inputs.put(input, idsTensor);
                        case "encoder_hidden_states" -> inputs.put(input, hiddenStates);
                        case "encoder_attention_mask" -> {
                            if (encoderMask != null) {
                                inputs.put(input, encoderMask);
                            }
                        }
                        default -> log.debug("{} decoder input {} left unset", name, input);
                    }
                }

                try (OrtSession.Result out = vm.decoder.run(inputs)) {
                    final float[][][] logits = (float[][][]) out.get(0).getValue();
                    final float[] last = logits[0][logits[0].length - 1];

                    final int best = argmax(last);
                    if (best == eos) {
                        break;
                    }
                    probabilitySum += softmaxAt(last, best);
                    generated.add((long) best);
                    sequence.add((long) best);
                }
            }
        }

        final long[] result = generated.stream().mapToLong(Long::longValue).toArray();
        final double mean = result.length == 0 ? 0.0 : probabilitySum / result.length;
        return new Decoded(result, mean);
    }

    /**
     * Resolves a single-token string such as {@code </s>} to its id.
     */
    protected static long tokenId(final HuggingFaceTokenizer tokenizer, final String token) {
        final long[] ids = tokenizer.encode(token, false, false).getIds();
        if (ids.length != 1) {
            throw new IllegalStateException("Token " + token + " is not a single vocabulary entry");
        }
        return ids[0];
    }

    static int argmax(final float[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    static double softmaxAt(final float[] logits, final int index) {
        final double max = logits[argmax(logits)];
        double sum = 0.0;
        for (final float logit : logits) {
            sum += Math.exp(logit - max);
        }
        return Math.exp(logits[index] - max) / sum;
    }

    @PreDestroy
    public void close() {
        model.close();
    }

    private record Decoded(long[] ids, double meanProbability) {
    }

    /**
     * Encoder and decoder sessions plus the tokenizer of one model.
     */
    static final class VisionModel implements AutoCloseable {

        private final OrtSession encoder;
        private final OrtSession decoder;
        private final HuggingFaceTokenizer tokenizer;

        private VisionModel(final OrtSession encoder, final OrtSession decoder, final HuggingFaceTokenizer tokenizer) {
            this.encoder = encoder;
            this.decoder = decoder;
            this.tokenizer = tokenizer;
        }

        static VisionModel load(final Path dir, final int concurrentSessions) throws OrtException, IOException {
            final OrtEnvironment env = OrtEnvironment.getEnvironment();
            final OrtSession encoder = env.createSession(dir.resolve(ENCODER_FILE).toString(),
                    OrtInitializer.initializeOrt(concurrentSessions));
            OrtSession decoder = null;
            try {
                decoder = env.createSession(dir.resolve(DECODER_FILE).toString(),
                        OrtInitializer.initializeOrt(concurrentSessions));
                final HuggingFaceTokenizer tokenizer = HuggingFaceTokenizer.newInstance(dir.resolve(TOKENIZER_FILE));
                return new VisionModel(encoder, decoder, tokenizer);
            } catch (OrtException | IOException | RuntimeException e) {
                if (decoder != null) {
                    decoder.close();
                }
                encoder.close();
                throw e;
            }
        }

        @Override
        public void close() throws OrtException {
            tokenizer.close();
            try {
                decoder.close();
            } finally {
                encoder.close();
            }
        }
    }
}
