package eu.virtualparadox.lexqa.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import eu.virtualparadox.lexqa.util.ModelHandle;
import eu.virtualparadox.lexqa.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Legal-domain BERT encoder (InLegalBERT exported to ONNX) under {@code <models>/embedding}.
 * <p>
 * Token vectors are mean-pooled over the attention mask and L2-normalized. The model loads on
 * first use; its version is the configured model id plus a digest of the model file.
 */
@Service
@Slf4j
public final class OnnxEmbeddingService implements EmbeddingService {

    private final String modelId;
    private final int maxTokens;
    private final Path modelPath;
    private final Path tokenizerPath;
    private final ModelHandle<EncoderModel> model;

    private String modelVersion;
    private volatile int dimension;

    public OnnxEmbeddingService(final ApplicationConfig config) {
        final Path embeddingRoot = config.getModels().resolve("embedding");
        this.modelId = config.getEmbedding().getModelId();
        this.maxTokens = config.getEmbedding().getMaxTokens();
        this.modelPath = embeddingRoot.resolve("model.onnx");
        this.tokenizerPath = embeddingRoot.resolve("tokenizer.json");
        this.model = new ModelHandle<>("embedding " + modelId, this::load);
    }

    @PostConstruct
    public void init() {
        this.modelVersion = modelId + "@" + digest(modelPath);
        log.info("Embedding model version {}", modelVersion);
    }

    @PreDestroy
    public void cleanup() {
        model.close();
    }

    private EncoderModel load() throws OrtException, IOException {
        final OrtEnvironment env = OrtEnvironment.getEnvironment();
        final OrtSession session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt(1));
        try {
            final HuggingFaceTokenizer tokenizer = HuggingFaceTokenizer.builder()
                    .optTokenizerPath(tokenizerPath)
                    .optMaxLength(maxTokens)
                    .optTruncation(true)
                    .optPadding(false)
                    .build();
            log.info("Embedding model expects inputs: {}", session.getInputNames());
            return new EncoderModel(session, tokenizer);
        } catch (IOException | RuntimeException e) {
            session.close();
            throw e;
        }
    }

    @Override
    public float[] embed(final String text) throws EmbeddingException {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) throws EmbeddingException {
        if (texts.isEmpty()) {
            return List.of();
        }

        try (ModelHandle<EncoderModel>.Lease lease = model.acquire()) {
            final List<float[]> vectors = run(lease.get(), texts);
            if (dimension == 0) {
                dimension = vectors.get(0).length;
            }
            return vectors;
        } catch (IllegalStateException e) {
            throw new EmbeddingException(e.getMessage(), e);
        } catch (OrtException e) {
            throw new EmbeddingException("Failed to embed batch of " + texts.size(), e);
        }
    }

    private List<float[]> run(final EncoderModel encoder, final List<String> texts) throws OrtException {
        final OrtEnvironment env = OrtEnvironment.getEnvironment();
        final List<Encoding> encodings = new ArrayList<>(texts.size());
        int maxLen = 0;

        for (final String text : texts) {
            final Encoding e = encoder.tokenizer.encode(text);
            encodings.add(e);
            maxLen = Math.max(maxLen, e.getIds().length);
        }
        maxLen = Math.min(maxLen, maxTokens);

        final int batchSize = encodings.size();
        final long[][] inputIdArr = new long[batchSize][maxLen];
        final long[][] attnMaskArr = new long[batchSize][maxLen];
        final long[][] tokenTypeArr = new long[batchSize][maxLen];

        for (int i = 0; i < batchSize; i++) {
            final long[] ids = encodings.get(i).getIds();
            final long[] mask = encodings.get(i).getAttentionMask();
            final int len = Math.min(ids.length, maxLen);

            System.arraycopy(ids, 0, inputIdArr[i], 0, len);
            System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
        }

        try (OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
             OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
             OnnxTensor tokenTypes = OnnxTensor.createTensor(env, tokenTypeArr)) {

            final Map<String, OnnxTensor> inputs = new HashMap<>();
            if (encoder.session.getInputNames().contains("input_ids")) {
                inputs.put("input_ids", inputIds);
            }
            if (encoder.session.getInputNames().contains("attention_mask")) {
                inputs.put("attention_mask", attentionMask);
            }
            if (encoder.session.getInputNames().contains("token_type_ids")) {
                inputs.put("token_type_ids", tokenTypes);
            }

            try (OrtSession.Result result = encoder.session.run(inputs)) {
                final float[][][] hidden = (float[][][]) result.get(0).getValue();

                final List<float[]> out = new ArrayList<>(batchSize);
                for (int i = 0; i < batchSize; i++) {
                    final float[] vec = meanPool(hidden[i], attnMaskArr[i]);
                    normalize(vec);
                    out.add(vec);
                }
                return out;
            }
        }
    }

    @Override
    public String modelVersion() {
        return modelVersion;
    }

    @Override
    public int dimension() throws EmbeddingException {
        if (dimension == 0) {
            embed("dimension probe");
        }
        return dimension;
    }

    static float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length && i < attentionMask.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    static void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }

    /**
     * Short SHA-256 of the model file, or {@code unavailable} when it cannot be read.
     */
    private static String digest(final Path file) {
        if (!Files.isRegularFile(file)) {
            log.warn("Embedding model not found at {}", file);
            return "unavailable";
        }
        try {
            final MessageDigest sha = MessageDigest.getInstance("SHA-256");
            try (InputStream in = new DigestInputStream(Files.newInputStream(file), sha)) {
                in.transferTo(OutputStream.nullOutputStream());
            }
            return HexFormat.of().formatHex(sha.digest()).substring(0, 12);
        } catch (IOException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot fingerprint embedding model " + file, e);
        }
    }

    private static final class EncoderModel implements AutoCloseable {

        private final OrtSession session;
        private final HuggingFaceTokenizer tokenizer;

        private EncoderModel(final OrtSession session, final HuggingFaceTokenizer tokenizer) {
            this.session = session;
            this.tokenizer = tokenizer;
        }

        @Override
        public void close() throws OrtException {
            tokenizer.close();
            session.close();
        }
    }
}
