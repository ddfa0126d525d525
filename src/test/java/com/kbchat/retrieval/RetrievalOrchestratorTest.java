package com.kbchat.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.kbchat.embedding.FixedVectorEncoder;
import com.kbchat.error.DimensionMismatchException;
import com.kbchat.error.GenerationException;
import com.kbchat.error.InvalidRequestException;
import com.kbchat.error.NoMatchException;
import com.kbchat.index.FlatVectorIndex;
import com.kbchat.index.IndexHolder;
import com.kbchat.inference.Generator;
import com.kbchat.inference.GeneratorHandle;
import com.kbchat.knowledge.InMemoryKnowledgeSource;

class RetrievalOrchestratorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final float SQRT_099 = (float) Math.sqrt(0.99);

    private final List<RetrievalOrchestrator> opened = new ArrayList<>();
    private final InMemoryKnowledgeSource source = new InMemoryKnowledgeSource()
            .put(10, "How do I reset my password?", "Use the reset link.", T0)
            .put(20, "What are the opening hours?", "Nine to five.", T0)
            .put(30, "How do I cancel?", "Use the account page.", T0);
    private final FixedVectorEncoder encoder = new FixedVectorEncoder(3)
            .with("when are you open", 0, 1, 0)
            .with("something vague", 0.1f, SQRT_099, 0);

    @AfterEach
    void tearDown() {
        opened.forEach(RetrievalOrchestrator::close);
    }

    @Test
    void shouldReturnExactMatchFirstWithFullConfidence() {
        RetrievalOrchestrator orchestrator = orchestrator(threeEntryIndex(), GeneratorHandle.unavailable("disabled"));

        RetrievalResult result = orchestrator.retrieve(new RetrievalRequest("When are you open?", null, 2));

        assertEquals(20L, result.sourceIds().get(0));
        assertEquals(2, result.sourceIds().size());
        assertEquals(1.0, result.confidence(), 1e-6);
        assertEquals("Nine to five.", result.answer());
        assertEquals(AnswerMode.STORED_ANSWER, result.answerMode());
    }

    @Test
    void shouldHedgeLowConfidenceAnswers() {
        FlatVectorIndex index = FlatVectorIndex.createEmpty(3);
        index.add(List.of(new float[] { 1, 0, 0 }), List.of(10L));
        RetrievalOrchestrator orchestrator = orchestrator(index, GeneratorHandle.unavailable("disabled"));

        RetrievalResult result = orchestrator.retrieve(new RetrievalRequest("q", new float[] { 0.1f, SQRT_099, 0 }, 1));

        assertEquals(0.55, result.confidence(), 1e-5);
        assertTrue(result.answer().startsWith(RetrievalSettings.DEFAULT_HEDGE_PREFIX));
        assertTrue(result.answer().endsWith("Use the reset link."));
    }

    @Test
    void shouldNotHedgeAtOrAboveThreshold() {
        RetrievalOrchestrator orchestrator = orchestrator(threeEntryIndex(), GeneratorHandle.unavailable("disabled"));

        RetrievalResult result = orchestrator.retrieve(new RetrievalRequest("q", new float[] { 0, 1, 0 }, null));

        assertFalse(result.answer().startsWith(RetrievalSettings.DEFAULT_HEDGE_PREFIX));
        assertEquals(List.of(20L, 10L, 30L), result.sourceIds());
    }

    @Test
    void shouldReportNoMatchForEmptyIndex() {
        RetrievalOrchestrator orchestrator = orchestrator(FlatVectorIndex.createEmpty(3), GeneratorHandle.unavailable("disabled"));

        assertThrows(NoMatchException.class, () -> orchestrator.retrieve(RetrievalRequest.of("when are you open")));
    }

    @Test
    void shouldReportNoMatchWhenMatchedEntriesWereRemoved() {
        RetrievalOrchestrator orchestrator = orchestrator(threeEntryIndex(), GeneratorHandle.unavailable("disabled"));
        source.clear();

        assertThrows(NoMatchException.class, () -> orchestrator.retrieve(RetrievalRequest.of("when are you open")));
    }

    @Test
    void shouldDropEntriesNoLongerActiveAndKeepRankOrder() {
        RetrievalOrchestrator orchestrator = orchestrator(threeEntryIndex(), GeneratorHandle.unavailable("disabled"));
        source.deactivate(20, T0.plusSeconds(1));

        RetrievalResult result = orchestrator.retrieve(new RetrievalRequest("q", new float[] { 0, 1, 0.1f }, 3));

        assertEquals(List.of(30L, 10L), result.sourceIds());
        assertEquals(0.55, result.confidence(), 1e-5);
        assertTrue(result.answer().startsWith(RetrievalSettings.DEFAULT_HEDGE_PREFIX));
        assertTrue(result.answer().endsWith("Use the account page."));
    }

    @Test
    void shouldScoreConfidenceFromTheEntryActuallyAnswered() {
        FlatVectorIndex index = FlatVectorIndex.createEmpty(3);
        index.add(List.of(new float[] { 1, 0, 0 }, new float[] { 0, 1, 0 }), List.of(10L, 20L));
        RetrievalOrchestrator orchestrator = orchestrator(index, GeneratorHandle.unavailable("disabled"));
        source.deactivate(10, T0.plusSeconds(1));

        RetrievalResult result = orchestrator.retrieve(new RetrievalRequest("q", new float[] { 1, 0, 0 }, 2));

        assertEquals(List.of(20L), result.sourceIds());
        assertEquals(0.5, result.confidence(), 1e-6);
        assertEquals(RetrievalSettings.DEFAULT_HEDGE_PREFIX + "Nine to five.", result.answer());
    }

    @Test
    void shouldRejectSuppliedEmbeddingOfWrongDimension() {
        RetrievalOrchestrator orchestrator = orchestrator(threeEntryIndex(), GeneratorHandle.unavailable("disabled"));

        assertThrows(DimensionMismatchException.class,
                () -> orchestrator.retrieve(new RetrievalRequest("q", new float[] { 1, 0 }, 1)));
    }

    @Test
    void shouldRejectNonPositiveKAndCapLargeK() {
        RetrievalOrchestrator orchestrator = orchestrator(threeEntryIndex(), GeneratorHandle.unavailable("disabled"));

        assertThrows(InvalidRequestException.class, () -> orchestrator.retrieve(RetrievalRequest.of("when are you open", 0)));
        assertEquals(3, orchestrator.retrieve(RetrievalRequest.of("when are you open", 500)).sourceIds().size());
    }

    @Test
    void shouldPassRankedContextToGenerator() {
        List<String> contexts = new ArrayList<>();
        Generator recording = new Generator() {
            @Override
            public String generate(String question, String context) {
                contexts.add(context);
                return "Generated: " + question;
            }

            @Override
            public String describe() {
                return "recording";
            }
        };
        RetrievalOrchestrator orchestrator = orchestrator(threeEntryIndex(), GeneratorHandle.available(recording));

        RetrievalResult result = orchestrator.retrieve(new RetrievalRequest("When are you open?", null, 2));

        assertEquals("Generated: When are you open?", result.answer());
        assertEquals(AnswerMode.GENERATED, result.answerMode());
        assertEquals("Q: What are the opening hours?\nA: Nine to five.\n\nQ: How do I reset my password?\nA: Use the reset link.",
                contexts.get(0));
    }

    @Test
    void shouldFallBackToStoredAnswerWhenGenerationFails() {
        Generator failing = new Generator() {
            @Override
            public String generate(String question, String context) {
                throw new GenerationException("model crashed");
            }

            @Override
            public String describe() {
                return "failing";
            }
        };
        RetrievalOrchestrator orchestrator = orchestrator(threeEntryIndex(), GeneratorHandle.available(failing));

        RetrievalResult result = orchestrator.retrieve(RetrievalRequest.of("when are you open"));

        assertEquals("Nine to five.", result.answer());
        assertEquals(AnswerMode.STORED_ANSWER_AFTER_GENERATION_FAILURE, result.answerMode());
    }

    @Test
    void shouldFallBackToStoredAnswerWhenGenerationTimesOut() {
        CountDownLatch release = new CountDownLatch(1);
        Generator slow = new Generator() {
            @Override
            public String generate(String question, String context) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "too late";
            }

            @Override
            public String describe() {
                return "slow";
            }
        };
        RetrievalSettings settings = new RetrievalSettings(5, 50, 0.65, null, Duration.ofMillis(100));
        RetrievalOrchestrator orchestrator = track(new RetrievalOrchestrator(
                encoder, new IndexHolder(threeEntryIndex()), source, GeneratorHandle.available(slow), settings));

        RetrievalResult result = orchestrator.retrieve(RetrievalRequest.of("when are you open"));
        release.countDown();

        assertEquals("Nine to five.", result.answer());
        assertEquals(AnswerMode.STORED_ANSWER_AFTER_GENERATION_FAILURE, result.answerMode());
    }

    private RetrievalOrchestrator orchestrator(FlatVectorIndex index, GeneratorHandle generator) {
        return track(new RetrievalOrchestrator(encoder, new IndexHolder(index), source, generator, RetrievalSettings.defaults()));
    }

    private RetrievalOrchestrator track(RetrievalOrchestrator orchestrator) {
        opened.add(orchestrator);
        return orchestrator;
    }

    private static FlatVectorIndex threeEntryIndex() {
        FlatVectorIndex index = FlatVectorIndex.createEmpty(3);
        index.add(List.of(new float[] { 1, 0, 0 }, new float[] { 0, 1, 0 }, new float[] { 0, 0, 1 }),
                List.of(10L, 20L, 30L));
        return index;
    }
}
