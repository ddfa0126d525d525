package com.kbchat.inference;

/**
 * Whether answer generation is possible in this process. Decided once at startup.
 */
public sealed interface GeneratorHandle permits GeneratorHandle.Available, GeneratorHandle.Unavailable {

    static GeneratorHandle available(Generator generator) {
        return new Available(generator);
    }

    static GeneratorHandle unavailable(String reason) {
        return new Unavailable(reason);
    }

    default boolean isAvailable() {
        return this instanceof Available;
    }

    record Available(Generator generator) implements GeneratorHandle {
        public Available {
            if (generator == null) {
                throw new IllegalArgumentException("generator must not be null");
            }
        }
    }

    record Unavailable(String reason) implements GeneratorHandle {
    }
}
