package com.kbchat.retrieval;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbchat.embedding.TextNormalizer;
import com.kbchat.embedding.VectorEncoder;
import com.kbchat.error.DimensionMismatchException;
import com.kbchat.error.InvalidRequestException;
import com.kbchat.error.NoMatchException;
import com.kbchat.index.IndexHolder;
import com.kbchat.index.SearchHits;
import com.kbchat.index.VectorIndex;
import com.kbchat.inference.Generator;
import com.kbchat.inference.GeneratorHandle;
import com.kbchat.knowledge.KnowledgeEntry;
import com.kbchat.knowledge.KnowledgeSource;

/**
 * Answers a question from the published index: embed, search, resolve entries, generate,
 * then score and optionally hedge the answer.
 */
public class RetrievalOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    private final VectorEncoder encoder;
    private final IndexHolder indexHolder;
    private final KnowledgeSource source;
    private final GeneratorHandle generator;
    private final RetrievalSettings settings;
    private final ExecutorService generationExecutor;

    public RetrievalOrchestrator(
            VectorEncoder encoder,
            IndexHolder indexHolder,
            KnowledgeSource source,
            GeneratorHandle generator,
            RetrievalSettings settings) {
        this(encoder, indexHolder, source, generator, settings, newGenerationExecutor());
    }

    public RetrievalOrchestrator(
            VectorEncoder encoder,
            IndexHolder indexHolder,
            KnowledgeSource source,
            GeneratorHandle generator,
            RetrievalSettings settings,
            ExecutorService generationExecutor) {
        this.encoder = encoder;
        this.indexHolder = indexHolder;
        this.source = source;
        this.generator = generator;
        this.settings = settings;
        this.generationExecutor = generationExecutor;
    }

    public RetrievalResult retrieve(RetrievalRequest request) {
        long started = System.nanoTime();
        int k = resolveTopK(request.topK());
        String question = request.question() == null ? "" : request.question().strip();

        float[] queryVector = embed(question, request.embedding());

        VectorIndex index = indexHolder.current();
        if (index.size() == 0) {
            throw new NoMatchException("The index is empty");
        }
        SearchHits hits = index.search(queryVector, k);
        if (hits.isEmpty()) {
            throw new NoMatchException("No neighbors found");
        }

        List<Long> rankedIds = index.mapToSourceIds(hits.positions());
        if (rankedIds.get(0) == VectorIndex.INVALID_ID) {
            throw new NoMatchException("Best match has no source entry");
        }
        List<RankedEntry> entries = resolveInRankOrder(rankedIds, hits.scores());
        if (entries.isEmpty()) {
            throw new NoMatchException("Matched entries are no longer present in the knowledge source");
        }

        String context = entries.stream()
                .map(ranked -> ranked.entry().formatForContext())
                .collect(Collectors.joining("\n\n"));
        KnowledgeEntry best = entries.get(0).entry();

        AnswerMode mode;
        String answer;
        if (generator instanceof GeneratorHandle.Available available) {
            String generated = generateWithTimeout(available.generator(), question, context);
            if (generated != null) {
                answer = generated;
                mode = AnswerMode.GENERATED;
            } else {
                answer = best.answer();
                mode = AnswerMode.STORED_ANSWER_AFTER_GENERATION_FAILURE;
            }
        } else {
            answer = best.answer();
            mode = AnswerMode.STORED_ANSWER;
        }

        // Scored against the entry actually answered, which is not rank 1 when that one was dropped.
        float rawScore = entries.get(0).score();
        double confidence = Confidence.fromSimilarity(rawScore);
        if (confidence < settings.confidenceThreshold()) {
            answer = settings.hedgePrefix() + answer;
            log.info("retrieval.hedged confidence={} threshold={}",
                    String.format(Locale.ROOT, "%.3f", confidence), settings.confidenceThreshold());
        }

        List<Long> sourceIds = entries.stream().map(ranked -> ranked.entry().id()).toList();
        long latencyMs = (System.nanoTime() - started) / 1_000_000;
        log.info("retrieval.completed k={} hits={} sources={} rawScore={} mode={} latencyMs={}",
                k, hits.size(), sourceIds.size(), String.format(Locale.ROOT, "%.4f", rawScore), mode, latencyMs);
        return new RetrievalResult(answer, confidence, sourceIds, latencyMs, mode);
    }

    @Override
    public void close() {
        generationExecutor.shutdownNow();
    }

    private int resolveTopK(Integer requested) {
        if (requested == null) {
            return settings.defaultTopK();
        }
        if (requested < 1) {
            throw new InvalidRequestException("k must be >= 1, got " + requested);
        }
        return Math.min(requested, settings.maxTopK());
    }

    private float[] embed(String question, float[] supplied) {
        if (supplied != null) {
            if (supplied.length != encoder.dimension()) {
                throw new DimensionMismatchException(encoder.dimension(), supplied.length);
            }
            return supplied;
        }
        return encoder.encode(TextNormalizer.normalize(question));
    }

    private List<RankedEntry> resolveInRankOrder(List<Long> rankedIds, float[] scores) {
        List<Long> valid = rankedIds.stream().filter(id -> id != VectorIndex.INVALID_ID).distinct().toList();
        Map<Long, KnowledgeEntry> byId = new HashMap<>();
        for (KnowledgeEntry entry : source.fetchEntriesByIds(valid)) {
            byId.put(entry.id(), entry);
        }
        List<RankedEntry> ordered = new ArrayList<>(valid.size());
        Set<Long> seen = new HashSet<>();
        for (int rank = 0; rank < rankedIds.size(); rank++) {
            long id = rankedIds.get(rank);
            if (id == VectorIndex.INVALID_ID || !seen.add(id)) {
                continue;
            }
            KnowledgeEntry entry = byId.get(id);
            if (entry != null) {
                ordered.add(new RankedEntry(entry, scores[rank]));
            } else {
                log.debug("retrieval.entry.missing id={}", id);
            }
        }
        return ordered;
    }

    /**
     * @return the generated text, or null when generation failed or timed out
     */
    private String generateWithTimeout(Generator active, String question, String context) {
        long timeoutMs = settings.generationTimeout().toMillis();
        Future<String> future = generationExecutor.submit(() -> active.generate(question, context));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("retrieval.generation.timeout timeoutMs={} generator={}", timeoutMs, active.describe());
            return null;
        } catch (ExecutionException e) {
            log.warn("retrieval.generation.failed generator={} error={}", active.describe(), e.getCause().getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("retrieval.generation.interrupted generator={}", active.describe());
            return null;
        }
    }

    private record RankedEntry(KnowledgeEntry entry, float score) {
    }

    private static ExecutorService newGenerationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "generation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
