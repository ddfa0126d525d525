package com.kbchat.runtime;

import java.util.Map;

import com.kbchat.knowledge.JdbcKnowledgeSource;
import com.kbchat.knowledge.KnowledgeSource;

public final class KnowledgeSources {
    private KnowledgeSources() {
    }

    public static KnowledgeSource fromConfig(AppConfig.KnowledgeConfig config, Map<String, String> environment) {
        return new JdbcKnowledgeSource(
                config.getJdbcUrl(),
                config.getUsername(),
                Secrets.resolve(config.getPassword(), Secrets.DB_PASSWORD, environment),
                config.getTable(),
                config.getQueryTimeoutSeconds(),
                config.getUptimeQuery());
    }
}
