package eu.virtualparadox.lexqa.console;

import eu.virtualparadox.lexqa.catalog.EDocumentStatus;
import eu.virtualparadox.lexqa.catalog.entity.DocumentEntity;
import eu.virtualparadox.lexqa.catalog.entity.PageRecord;
import eu.virtualparadox.lexqa.ingest.extractor.ExtractionOrchestrator;
import eu.virtualparadox.lexqa.ingest.extractor.model.EPageOutcome;
import eu.virtualparadox.lexqa.ingest.lifecycle.IngestionService;
import eu.virtualparadox.lexqa.query.AnswerContextService;
import eu.virtualparadox.lexqa.query.model.AnswerContext;
import eu.virtualparadox.lexqa.rag.index.DenseIndex;
import eu.virtualparadox.lexqa.rag.index.IndexRebuildService;
import eu.virtualparadox.lexqa.rag.index.SparseIndex;
import eu.virtualparadox.lexqa.rag.retriever.model.ERetrievalOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ConsoleCommandRunnerTest {

    private final IngestionService ingestionService = mock(IngestionService.class);
    private final AnswerContextService answerContextService = mock(AnswerContextService.class);
    private ConsoleCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ConsoleCommandRunner(ingestionService, answerContextService, mock(IndexRebuildService.class),
                mock(ExtractionOrchestrator.class), mock(DenseIndex.class), mock(SparseIndex.class));
        final AnswerContext empty = new AnswerContext("q", List.of(), List.of(), ERetrievalOutcome.OK);
        when(answerContextService.answerContext(anyString())).thenReturn(empty);
        when(answerContextService.answerContext(anyString(), anyInt())).thenReturn(empty);
    }

    @Test
    @DisplayName("a question starting with a section number is searched as written")
    void ask_leadingNumber_partOfQuestion() throws Exception {
        runner.run("ask", "302", "IPC", "punishment");

        verify(answerContextService).answerContext("302 IPC punishment");
        verify(answerContextService, never()).answerContext(anyString(), anyInt());
    }

    @Test
    @DisplayName("-k sets the number of passages")
    void ask_withK() throws Exception {
        runner.run("ask", "-k", "3", "302", "IPC");

        verify(answerContextService).answerContext("302 IPC", 3);
    }

    @Test
    @DisplayName("an out-of-range or malformed -k is reported, not thrown")
    void ask_invalidK_rejected() {
        assertDoesNotThrow(() -> runner.run("ask", "-k", "0", "murder"));
        assertDoesNotThrow(() -> runner.run("ask", "-k", "99999999999", "murder"));
        assertDoesNotThrow(() -> runner.run("ask", "-k", "101", "murder"));
        assertDoesNotThrow(() -> runner.run("ask", "-k", "ten", "murder"));
        assertDoesNotThrow(() -> runner.run("ask", "-k"));
        assertDoesNotThrow(() -> runner.run("ask", "-k", "3"));

        verifyNoInteractions(answerContextService);
    }

    @Test
    @DisplayName("deleting an unknown document is reported and the remaining ids are still deleted")
    void delete_unknownId_reported() throws Exception {
        doThrow(new IllegalArgumentException("Document not found: nope")).when(ingestionService).deleteDocument("nope");

        assertDoesNotThrow(() -> runner.run("delete", "nope", "doc1"));

        verify(ingestionService).deleteDocument("doc1");
    }

    @Test
    @DisplayName("list reports the mean page confidence")
    void list_averageConfidence() throws Exception {
        final List<PageRecord> pages = List.of(
                PageRecord.builder().pageNumber(1).confidence(0.9).outcome(EPageOutcome.EXTRACTED).build(),
                PageRecord.builder().pageNumber(2).confidence(0.0).outcome(EPageOutcome.NO_TEXT).build(),
                PageRecord.builder().pageNumber(3).confidence(0.85).outcome(EPageOutcome.EXTRACTED).build());
        when(ingestionService.listAll()).thenReturn(List.of(DocumentEntity.builder()
                .id("doc1").title("ipc.pdf").status(EDocumentStatus.INDEXED).pages(pages).build()));

        assertEquals(0.5833, ConsoleCommandRunner.averageConfidence(pages), 1e-4);
        assertEquals(0.0, ConsoleCommandRunner.averageConfidence(List.of()));
        assertDoesNotThrow(() -> runner.run("list"));
        verify(ingestionService).listAll();
    }
}
