package com.kbchat.runtime;

import java.util.Map;

/**
 * Resolves credentials that may be left blank in YAML and supplied through the environment.
 */
public final class Secrets {
    public static final String DB_PASSWORD = "KBCHAT_DB_PASSWORD";
    public static final String ENCODER_API_KEY = "KBCHAT_ENCODER_API_KEY";
    public static final String GENERATOR_API_KEY = "KBCHAT_GENERATOR_API_KEY";

    private Secrets() {
    }

    public static String resolve(String configured, String variable, Map<String, String> environment) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String value = environment.get(variable);
        return value == null || value.isBlank() ? "" : value;
    }
}
