package eu.virtualparadox.lexqa.rag.retriever.fusion;

import eu.virtualparadox.lexqa.rag.index.ScoredChunk;
import eu.virtualparadox.lexqa.rag.retriever.model.FusedHit;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted fusion of a dense and a sparse candidate list.
 * <p>
 * Each list is scaled on its own into {@code [0, 1]} by dividing by its best score, so a chunk
 * found by one side always keeps a share of that side's weight; only a list holding negative
 * scores is shifted by its minimum first (plain min-max). A list whose scores are all equal
 * normalizes to 1.0. Every chunk found by either side gets
 * {@code denseWeight * normalizedDense + sparseWeight * normalizedSparse}, a missing side
 * counting 0. Ties on the combined score are broken by the higher of the two normalized
 * scores, then by chunk id.
 */
public final class ScoreFusion {

    static final Comparator<FusedHit> RANKING = Comparator
            .comparingDouble(FusedHit::combinedScore).reversed()
            .thenComparing(Comparator.comparingDouble(FusedHit::bestNormalized).reversed())
            .thenComparing(FusedHit::chunkId);

    private final double denseWeight;
    private final double sparseWeight;

    public ScoreFusion(final double denseWeight, final double sparseWeight) {
        if (denseWeight < 0.0 || sparseWeight < 0.0 || denseWeight + sparseWeight <= 0.0) {
            throw new IllegalArgumentException("Fusion weights must be >= 0 and not both 0");
        }
        this.denseWeight = denseWeight;
        this.sparseWeight = sparseWeight;
    }

    /**
     * @param dense  dense candidates, any order
     * @param sparse sparse candidates, any order
     * @param k      maximum number of hits to return
     * @return fused hits, best first
     */
    public List<FusedHit> fuse(final List<ScoredChunk> dense, final List<ScoredChunk> sparse, final int k) {
        final Map<String, Double> normalizedDense = normalize(dense);
        final Map<String, Double> normalizedSparse = normalize(sparse);
        final Map<String, Double> rawDense = raw(dense);
        final Map<String, Double> rawSparse = raw(sparse);

        final Map<String, String> docIds = new LinkedHashMap<>();
        dense.forEach(hit -> docIds.putIfAbsent(hit.chunkId(), hit.docId()));
        sparse.forEach(hit -> docIds.putIfAbsent(hit.chunkId(), hit.docId()));

        return docIds.entrySet().stream()
                .map(entry -> {
                    final String chunkId = entry.getKey();
                    final double nd = normalizedDense.getOrDefault(chunkId, 0.0);
                    final double ns = normalizedSparse.getOrDefault(chunkId, 0.0);
                    return new FusedHit(chunkId, entry.getValue(),
                            rawDense.get(chunkId), rawSparse.get(chunkId),
                            nd, ns, denseWeight * nd + sparseWeight * ns);
                })
                .sorted(RANKING)
                .limit(Math.max(0, k))
                .toList();
    }

    static Map<String, Double> normalize(final List<ScoredChunk> hits) {
        final Map<String, Double> normalized = new HashMap<>();
        if (hits.isEmpty()) {
            return normalized;
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (final ScoredChunk hit : hits) {
            min = Math.min(min, hit.score());
            max = Math.max(max, hit.score());
        }

        // BM25 and cosine scores are >= 0: the floor stays at 0 and the scale is max
        final double floor = Math.min(0.0, min);
        final double range = max - floor;
        for (final ScoredChunk hit : hits) {
            final double value = max == min ? 1.0 : (hit.score() - floor) / range;
            normalized.merge(hit.chunkId(), value, Math::max);
        }
        return normalized;
    }

    private static Map<String, Double> raw(final List<ScoredChunk> hits) {
        final Map<String, Double> scores = new HashMap<>();
        for (final ScoredChunk hit : hits) {
            scores.merge(hit.chunkId(), (double) hit.score(), Math::max);
        }
        return scores;
    }
}
