package com.kbchat.inference;

public final class PromptTemplate {
    private PromptTemplate() {
    }

    public static String build(String question, String context) {
        StringBuilder builder = new StringBuilder();
        builder.append("[INST] You are a helpful support assistant for this knowledge base.\n\n")
                .append("Rules:\n")
                .append("- Answer only from the context below; if it does not cover the question, say so.\n")
                .append("- Copy URLs exactly as they appear in the context and never invent one.\n")
                .append("- Keep the answer clear and professional, with at most one blank line in a row.\n\n")
                .append("=== CONTEXT ===\n")
                .append(context == null || context.isBlank() ? "(none)" : context)
                .append("\n\n=== QUESTION ===\n")
                .append(question)
                .append("\n\n=== ANSWER ===\n[/INST]");
        return builder.toString();
    }
}
