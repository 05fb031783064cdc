package eu.virtualparadox.lexqa.query.model;

import eu.virtualparadox.lexqa.rag.retriever.model.ERetrievalOutcome;

import java.util.List;

/**
 * Everything an answer generator needs for one query: the ranked passages with their citation
 * markers, the documents they cite and how retrieval went.
 */
public record AnswerContext(String query,
                            List<Passage> passages,
                            List<SourceCitation> sources,
                            ERetrievalOutcome outcome) {

    public AnswerContext {
        passages = List.copyOf(passages);
        sources = List.copyOf(sources);
    }

    public boolean isEmpty() {
        return passages.isEmpty();
    }

    /**
     * Renders the passages as a numbered block, one per paragraph:
     * {@code [1] (ipc.pdf p. 3) text}.
     */
    public String asPromptContext() {
        final StringBuilder sb = new StringBuilder();
        for (final Passage passage : passages) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(passage.label())
                    .append(" (").append(passage.title()).append(" p. ").append(passage.pages().asString()).append(") ")
                    .append(passage.text());
        }
        return sb.toString();
    }
}
