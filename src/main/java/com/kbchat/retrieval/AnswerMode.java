package com.kbchat.retrieval;

/**
 * How the answer text of a {@link RetrievalResult} was produced.
 */
public enum AnswerMode {
    GENERATED,
    /** No generator is configured; the best entry's stored answer is returned verbatim. */
    STORED_ANSWER,
    STORED_ANSWER_AFTER_GENERATION_FAILURE
}
