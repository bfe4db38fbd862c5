package com.eyelevel.documentanalysis.service.analysis;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.exception.InvalidModelException;
import com.eyelevel.documentanalysis.exception.ModelInvocationException;
import com.eyelevel.documentanalysis.exception.StatusConflictException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.AsyncStage;
import com.eyelevel.documentanalysis.model.ExtractionMethod;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.model.RunStatus;
import com.eyelevel.documentanalysis.service.llm.BedrockModelClient;
import com.eyelevel.documentanalysis.store.CappedText;
import com.eyelevel.documentanalysis.store.InMemoryRunStore;
import com.eyelevel.documentanalysis.store.RunMutations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("AnalysisCoordinator Tests")
class AnalysisCoordinatorTest {

    private static final String USER = "web-user";

    private final PromptTemplateRegistry promptTemplateRegistry = new PromptTemplateRegistry();
    private InMemoryRunStore runStore;
    private BedrockModelClient bedrockModelClient;
    private DocumentAnalysisConfig analysisConfig;
    private AnalysisCoordinator coordinator;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.systemUTC();
        runStore = new InMemoryRunStore(clock);
        bedrockModelClient = mock(BedrockModelClient.class);
        analysisConfig = new DocumentAnalysisConfig();
        analysisConfig.getAnalysis().setSyncBudgetSeconds(5);
        coordinator = new AnalysisCoordinator(runStore, promptTemplateRegistry, bedrockModelClient,
                                              new SimpleAsyncTaskExecutor("analysis-test-"), analysisConfig, clock);
    }

    private void extractedRun(final String runId, final String text) {
        runStore.createRun(USER, runId, null, "uploads/" + runId + ".pdf");
        runStore.updateRun(USER, runId, RunMutations.claimExtraction(), RunStatus.UPLOADED);
        runStore.updateRun(USER, runId, RunMutations.extracted(CappedText.of(text, analysisConfig.getInputCap()),
                                                               "extracted/" + runId + ".txt",
                                                               ExtractionMethod.TEXTRACT, clock.instant()),
                           RunStatus.EXTRACTING);
    }

    @Test
    @DisplayName("Should send the variant template followed by the extracted text and store the result")
    void testSynchronousAnalysis() {
        final String text = "d".repeat(500);
        extractedRun("r1", text);
        when(bedrockModelClient.complete(anyString(), anyInt(), anyDouble())).thenReturn("Análisis del documento");

        AnalysisRun run = coordinator.analyze(USER, "r1", "A", "extracted/r1.txt");

        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals(ModelVariant.A, run.getModelVariant());
        assertEquals("Análisis del documento", run.getAnalysisResult());
        assertFalse(run.isAnalysisResultTruncated());
        assertNotNull(run.getCompletedAt());
        verify(bedrockModelClient).complete(eq(promptTemplateRegistry.templateFor(ModelVariant.A) + "\n\n" + text),
                                            eq(10_000), eq(0.1));
    }

    @Test
    @DisplayName("Should cut the analysis result to the output cap")
    void testOutputCap() {
        extractedRun("r1", "texto");
        when(bedrockModelClient.complete(anyString(), anyInt(), anyDouble())).thenReturn("r".repeat(10_500));

        AnalysisRun run = coordinator.analyze(USER, "r1", "B", null);

        assertEquals(10_000, run.getAnalysisResult().length());
        assertTrue(run.isAnalysisResultTruncated());
    }

    @Test
    @DisplayName("Should reject an unknown variant without touching the run")
    void testInvalidVariant() {
        extractedRun("r1", "texto");

        assertThrows(InvalidModelException.class, () -> coordinator.analyze(USER, "r1", "C", null));

        assertEquals(RunStatus.EXTRACTED, runStore.getRun(USER, "r1").getStatus());
        verifyNoInteractions(bedrockModelClient);
    }

    @Test
    @DisplayName("Should refuse to analyze before extraction has completed")
    void testNotExtracted() {
        runStore.createRun(USER, "r1", null, "uploads/r1.pdf");

        StatusConflictException exception = assertThrows(StatusConflictException.class,
                                                         () -> coordinator.analyze(USER, "r1", "A", null));

        assertEquals(RunStatus.UPLOADED, exception.getCurrentStatus());
        verifyNoInteractions(bedrockModelClient);
    }

    @Test
    @DisplayName("Should fail the run when the model call fails")
    void testModelFailure() {
        extractedRun("r1", "texto");
        when(bedrockModelClient.complete(anyString(), anyInt(), anyDouble()))
                .thenThrow(new ModelInvocationException("Model invocation failed: throttled"));

        AnalysisRun run = coordinator.analyze(USER, "r1", "A", null);

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals("Analysis failed: Model invocation failed: throttled", run.getErrorMessage());
        assertNull(run.getAnalysisResult());
    }

    @Test
    @DisplayName("Should hand a slow model call off to the background and record it when it returns")
    void testSlowModelContinuesInBackground() throws Exception {
        analysisConfig.getAnalysis().setSyncBudgetSeconds(1);
        extractedRun("r1", "texto");
        CountDownLatch release = new CountDownLatch(1);
        when(bedrockModelClient.complete(anyString(), anyInt(), anyDouble())).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return "Análisis tardío";
        });

        AnalysisRun deferred = coordinator.analyze(USER, "r1", "A", null);

        assertEquals(RunStatus.PROCESSING_ASYNC, deferred.getStatus());
        assertEquals(AsyncStage.ANALYSIS, deferred.getAsyncStage());

        AnalysisRun repeated = coordinator.analyze(USER, "r1", "A", null);
        assertEquals(RunStatus.PROCESSING_ASYNC, repeated.getStatus());

        release.countDown();
        AnalysisRun finished = awaitStatus("r1", RunStatus.COMPLETED);

        assertEquals("Análisis tardío", finished.getAnalysisResult());
        assertNull(finished.getAsyncStage());
        verify(bedrockModelClient, times(1)).complete(anyString(), anyInt(), anyDouble());
    }

    @Test
    @DisplayName("Should fail the run when the model call cannot be scheduled")
    void testExecutorRejection() {
        extractedRun("r1", "texto");
        AnalysisCoordinator saturated = new AnalysisCoordinator(
                runStore, promptTemplateRegistry, bedrockModelClient, new TaskExecutorAdapter(task -> {
                    throw new TaskRejectedException("pool saturated");
                }), analysisConfig, clock);

        AnalysisRun run = saturated.analyze(USER, "r1", "A", null);

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertTrue(run.getErrorMessage().startsWith("Analysis could not be scheduled"));
        assertEquals(RunStatus.FAILED, saturated.analyze(USER, "r1", "A", null).getStatus());
        assertEquals(RunStatus.FAILED, runStore.getRun(USER, "r1").getStatus());
        verifyNoInteractions(bedrockModelClient);
    }

    @Test
    @DisplayName("Should return the stored result on repeated triggers")
    void testIdempotentTrigger() {
        extractedRun("r1", "texto");
        when(bedrockModelClient.complete(anyString(), anyInt(), anyDouble())).thenReturn("resultado");
        coordinator.analyze(USER, "r1", "A", null);

        AnalysisRun again = coordinator.analyze(USER, "r1", "A", null);

        assertEquals(RunStatus.COMPLETED, again.getStatus());
        assertEquals("resultado", again.getAnalysisResult());
        verify(bedrockModelClient, times(1)).complete(anyString(), anyInt(), anyDouble());
    }

    @Test
    @DisplayName("Should call the model once for concurrent triggers")
    void testConcurrentTriggers() throws Exception {
        extractedRun("r1", "texto");
        when(bedrockModelClient.complete(anyString(), anyInt(), anyDouble())).thenReturn("resultado");

        int triggers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(triggers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AnalysisRun>> results = new ArrayList<>();
        try {
            for (int i = 0; i < triggers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return coordinator.analyze(USER, "r1", "A", null);
                }));
            }
            start.countDown();
            for (Future<AnalysisRun> result : results) {
                assertNotEquals(RunStatus.FAILED, result.get(10, TimeUnit.SECONDS).getStatus());
            }
        } finally {
            pool.shutdownNow();
        }

        verify(bedrockModelClient, times(1)).complete(anyString(), anyInt(), anyDouble());
        assertEquals(RunStatus.COMPLETED, runStore.getRun(USER, "r1").getStatus());
    }

    private AnalysisRun awaitStatus(final String runId, final RunStatus status) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + 10_000;
        AnalysisRun run = runStore.getRun(USER, runId);
        while (run.getStatus() != status && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
            run = runStore.getRun(USER, runId);
        }
        assertEquals(status, run.getStatus());
        return run;
    }
}
