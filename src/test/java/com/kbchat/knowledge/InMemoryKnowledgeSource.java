package com.kbchat.knowledge;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.kbchat.error.SourceUnavailableException;

/**
 * Test double for {@link KnowledgeSource} with controllable contents, uptime and availability.
 */
public class InMemoryKnowledgeSource implements KnowledgeSource {
    private final Map<Long, Row> rows = new TreeMap<>();
    private final AtomicInteger listCalls = new AtomicInteger();
    private volatile long uptimeSeconds = 86_400;
    private volatile boolean unavailable;

    public synchronized InMemoryKnowledgeSource put(long id, String question, String answer, Instant modified) {
        rows.put(id, new Row(new KnowledgeEntry(id, question, answer), true, modified));
        return this;
    }

    public synchronized void deactivate(long id, Instant modified) {
        Row row = rows.get(id);
        rows.put(id, new Row(row.entry(), false, modified));
    }

    public synchronized void touch(long id, Instant modified) {
        Row row = rows.get(id);
        rows.put(id, new Row(row.entry(), row.active(), modified));
    }

    public synchronized void clear() {
        rows.clear();
    }

    public void setUptimeSeconds(long uptimeSeconds) {
        this.uptimeSeconds = uptimeSeconds;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public int listCalls() {
        return listCalls.get();
    }

    @Override
    public synchronized List<KnowledgeEntry> listActiveEntries() {
        failIfUnavailable();
        listCalls.incrementAndGet();
        List<KnowledgeEntry> entries = new ArrayList<>();
        for (Row row : rows.values()) {
            if (row.active()) {
                entries.add(row.entry());
            }
        }
        return entries;
    }

    @Override
    public synchronized Optional<Instant> maxModificationOfActiveEntries() {
        failIfUnavailable();
        return rows.values().stream()
                .filter(Row::active)
                .map(Row::modified)
                .max(Instant::compareTo);
    }

    @Override
    public long sourceUptimeSeconds() {
        failIfUnavailable();
        return uptimeSeconds;
    }

    @Override
    public synchronized List<KnowledgeEntry> fetchEntriesByIds(Collection<Long> ids) {
        failIfUnavailable();
        List<KnowledgeEntry> entries = new ArrayList<>();
        for (Long id : ids) {
            Row row = rows.get(id);
            if (row != null && row.active()) {
                entries.add(row.entry());
            }
        }
        return entries;
    }

    private void failIfUnavailable() {
        if (unavailable) {
            throw new SourceUnavailableException("source is down", null);
        }
    }

    private record Row(KnowledgeEntry entry, boolean active, Instant modified) {
    }
}
