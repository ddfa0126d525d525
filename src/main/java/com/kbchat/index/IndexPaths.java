package com.kbchat.index;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The two coupled artifacts of a persisted index: the vector structure and the id mapping.
 */
public record IndexPaths(Path structure, Path idMapping) {

    public static IndexPaths forStructure(Path structure) {
        Path fileName = structure.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("index path must name a file: " + structure);
        }
        return new IndexPaths(structure, structure.resolveSibling(fileName + ".ids.json"));
    }

    public boolean bothExist() {
        return Files.isRegularFile(structure) && Files.isRegularFile(idMapping);
    }
}
