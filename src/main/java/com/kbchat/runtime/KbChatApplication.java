package com.kbchat.runtime;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbchat.embedding.VectorEncoder;
import com.kbchat.index.IndexHolder;
import com.kbchat.index.IndexPaths;
import com.kbchat.index.VectorIndexStore;
import com.kbchat.inference.GeneratorHandle;
import com.kbchat.knowledge.KnowledgeSource;
import com.kbchat.retrieval.RetrievalOrchestrator;
import com.kbchat.sync.IndexRebuilder;
import com.kbchat.sync.IndexSynchronizer;

import okhttp3.OkHttpClient;

/**
 * Wires the process: one encoder, one published index, one synchronizer and one orchestrator.
 */
public class KbChatApplication implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KbChatApplication.class);

    private final IndexPaths indexPaths;
    private final IndexHolder indexHolder;
    private final IndexSynchronizer synchronizer;
    private final RetrievalOrchestrator orchestrator;
    private final GeneratorHandle generator;
    private final boolean syncEnabled;

    KbChatApplication(
            IndexPaths indexPaths,
            IndexHolder indexHolder,
            IndexSynchronizer synchronizer,
            RetrievalOrchestrator orchestrator,
            GeneratorHandle generator,
            boolean syncEnabled) {
        this.indexPaths = indexPaths;
        this.indexHolder = indexHolder;
        this.synchronizer = synchronizer;
        this.orchestrator = orchestrator;
        this.generator = generator;
        this.syncEnabled = syncEnabled;
    }

    public static KbChatApplication create(AppConfig config, Map<String, String> environment, Path indexOverride) {
        OkHttpClient httpClient = new OkHttpClient();
        VectorEncoder encoder = VectorEncoders.fromConfig(config.getEncoder(), httpClient, environment);
        KnowledgeSource source = KnowledgeSources.fromConfig(config.getKnowledge(), environment);

        Path structure = indexOverride != null ? indexOverride : Path.of(config.getIndex().getStructurePath());
        IndexPaths paths = IndexPaths.forStructure(structure);
        VectorIndexStore store = new VectorIndexStore();
        IndexHolder holder = new IndexHolder(store.loadOrEmpty(paths, encoder.dimension()));

        IndexRebuilder rebuilder = new IndexRebuilder(
                source, encoder, store, paths, holder, config.getSync().getRebuildBatchSize());
        IndexSynchronizer synchronizer = new IndexSynchronizer(
                source, rebuilder, paths, holder, config.getSync().toSettings(), Clock.systemUTC());

        GeneratorHandle generator = Generators.fromConfig(config.getGenerator(), httpClient, environment);
        RetrievalOrchestrator orchestrator = new RetrievalOrchestrator(
                encoder, holder, source, generator, config.getRetrieval().toSettings());

        log.info("app.initialized index={} entries={} generatorAvailable={}",
                paths.structure(), holder.current().size(), generator.isAvailable());
        return new KbChatApplication(paths, holder, synchronizer, orchestrator, generator, config.getSync().isEnabled());
    }

    public void startSync() {
        if (!syncEnabled) {
            log.info("sync.disabled");
            return;
        }
        synchronizer.start();
    }

    public IndexPaths indexPaths() {
        return indexPaths;
    }

    public IndexHolder indexHolder() {
        return indexHolder;
    }

    public IndexSynchronizer synchronizer() {
        return synchronizer;
    }

    public RetrievalOrchestrator orchestrator() {
        return orchestrator;
    }

    public GeneratorHandle generator() {
        return generator;
    }

    @Override
    public void close() {
        synchronizer.stop();
        orchestrator.close();
    }
}
