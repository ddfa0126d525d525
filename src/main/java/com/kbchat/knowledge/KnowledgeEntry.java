package com.kbchat.knowledge;

public record KnowledgeEntry(long id, String question, String answer) {

    public String indexText() {
        return question + " " + answer;
    }

    public String formatForContext() {
        return "Q: " + question + "\nA: " + answer;
    }
}
