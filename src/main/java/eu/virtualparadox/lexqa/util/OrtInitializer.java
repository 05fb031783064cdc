package eu.virtualparadox.lexqa.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Session options for a model that shares the machine with {@code concurrentSessions}
     * other sessions running at the same time (page workers each drive one inference).
     *
     * @param concurrentSessions number of inferences expected to run in parallel, at least 1
     * @return configured session options
     */
    public static OrtSession.SessionOptions initializeOrt(final int concurrentSessions) {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            final int cores = Runtime.getRuntime().availableProcessors();
            final int intraThreads = Math.max(1, cores / Math.max(1, concurrentSessions));

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("ONNX session options: intra-op threads {}, inter-op threads {}", intraThreads, 1);
            return opts;
        }
        catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
