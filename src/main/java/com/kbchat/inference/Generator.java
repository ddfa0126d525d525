package com.kbchat.inference;

public interface Generator {
    /**
     * @throws com.kbchat.error.GenerationException when the completion cannot be produced
     */
    String generate(String question, String context);

    String describe();
}
