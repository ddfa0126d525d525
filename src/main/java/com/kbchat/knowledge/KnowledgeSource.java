package com.kbchat.knowledge;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The authoritative store of knowledge entries. Every method may fail with
 * {@link com.kbchat.error.SourceUnavailableException}.
 */
public interface KnowledgeSource {

    /**
     * Active entries, ascending by id.
     */
    List<KnowledgeEntry> listActiveEntries();

    Optional<Instant> maxModificationOfActiveEntries();

    long sourceUptimeSeconds();

    /**
     * Entries with the given ids, in no particular order. Unknown ids are skipped.
     */
    List<KnowledgeEntry> fetchEntriesByIds(Collection<Long> ids);
}
