package com.kbchat.sync;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbchat.embedding.VectorEncoder;
import com.kbchat.error.EncodingException;
import com.kbchat.error.KbChatException;
import com.kbchat.error.RebuildException;
import com.kbchat.index.FlatVectorIndex;
import com.kbchat.index.IndexHolder;
import com.kbchat.index.IndexPaths;
import com.kbchat.index.VectorIndexStore;
import com.kbchat.knowledge.KnowledgeEntry;
import com.kbchat.knowledge.KnowledgeSource;

/**
 * Builds a fresh index from every active entry, persists it and publishes it. The published
 * index is only replaced after the new one has been saved.
 */
public class IndexRebuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexRebuilder.class);

    private final KnowledgeSource source;
    private final VectorEncoder encoder;
    private final VectorIndexStore store;
    private final IndexPaths paths;
    private final IndexHolder holder;
    private final int batchSize;

    public IndexRebuilder(
            KnowledgeSource source,
            VectorEncoder encoder,
            VectorIndexStore store,
            IndexPaths paths,
            IndexHolder holder,
            int batchSize) {
        this.source = source;
        this.encoder = encoder;
        this.store = store;
        this.paths = paths;
        this.holder = holder;
        this.batchSize = Math.max(1, batchSize);
    }

    public RebuildStats rebuild() {
        long started = System.nanoTime();
        try {
            List<KnowledgeEntry> entries = source.listActiveEntries();
            if (entries.isEmpty()) {
                throw new RebuildException("No active entries in the knowledge source");
            }

            FlatVectorIndex index = FlatVectorIndex.createEmpty(encoder.dimension());
            int skipped = 0;
            for (int from = 0; from < entries.size(); from += batchSize) {
                List<KnowledgeEntry> batch = entries.subList(from, Math.min(entries.size(), from + batchSize));
                skipped += addBatch(index, batch);
                log.debug("index.rebuild.batch encoded={} total={}", from + batch.size(), entries.size());
            }
            if (index.size() == 0) {
                throw new RebuildException("None of the " + entries.size() + " active entries could be encoded");
            }

            long sizeBytes = store.save(index, paths);
            holder.publish(index);

            Duration duration = Duration.ofNanos(System.nanoTime() - started);
            log.info("index.rebuilt entries={} skipped={} dimension={} bytes={} durationMs={} encoder={}",
                    index.size(), skipped, index.dimension(), sizeBytes, duration.toMillis(), encoder.version());
            return new RebuildStats(index.size(), duration, sizeBytes, index.dimension());
        } catch (RebuildException e) {
            throw e;
        } catch (IOException e) {
            throw new RebuildException("Failed to persist rebuilt index: " + e.getMessage(), e);
        } catch (KbChatException e) {
            throw new RebuildException("Rebuild failed: " + e.getMessage(), e);
        }
    }

    /**
     * Encodes one batch into the index. When the batch is rejected, its entries are retried one
     * by one and those that still cannot be encoded are left out.
     *
     * @return the number of entries left out
     */
    private int addBatch(FlatVectorIndex index, List<KnowledgeEntry> batch) {
        List<String> texts = new ArrayList<>(batch.size());
        List<Long> ids = new ArrayList<>(batch.size());
        for (KnowledgeEntry entry : batch) {
            texts.add(entry.indexText());
            ids.add(entry.id());
        }
        try {
            index.add(encoder.encodeBatch(texts), ids);
            return 0;
        } catch (EncodingException e) {
            if (e.getCause() instanceof IOException) {
                throw e;
            }
        }

        int skipped = 0;
        for (KnowledgeEntry entry : batch) {
            float[] vector;
            try {
                vector = encoder.encode(entry.indexText());
            } catch (EncodingException e) {
                if (e.getCause() instanceof IOException) {
                    throw e;
                }
                log.warn("index.rebuild.skipped id={} error={}", entry.id(), e.getMessage());
                skipped++;
                continue;
            }
            index.add(List.of(vector), List.of(entry.id()));
        }
        return skipped;
    }
}
