package com.kbchat.index;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.zip.CRC32;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads and writes an index as a binary structure file plus a JSON id-mapping file.
 *
 * <p>The structure header carries the entry count and a CRC32 of the id sequence. A mapping file
 * that does not match its structure file is rejected on load.
 */
public class VectorIndexStore {
    private static final Logger log = LoggerFactory.getLogger(VectorIndexStore.class);
    private static final int MAGIC = 0x4B425649;
    private static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Writes both artifacts next to their targets and renames them into place as the last step.
     *
     * @return size of the structure file in bytes
     */
    public long save(VectorIndex index, IndexPaths paths) throws IOException {
        Path parent = paths.structure().toAbsolutePath().getParent();
        Files.createDirectories(parent);

        List<Long> ids = index.idMapping();
        float[] data = index.vectorData();

        Path structureTmp = Files.createTempFile(parent, ".structure-", ".tmp");
        Path mappingTmp = Files.createTempFile(parent, ".ids-", ".tmp");
        try {
            try (FileOutputStream file = new FileOutputStream(structureTmp.toFile());
                    DataOutputStream out = new DataOutputStream(new BufferedOutputStream(file))) {
                out.writeInt(MAGIC);
                out.writeInt(FORMAT_VERSION);
                out.writeInt(index.dimension());
                out.writeInt(ids.size());
                out.writeLong(checksum(ids));
                for (float value : data) {
                    out.writeFloat(value);
                }
                out.flush();
                file.getFD().sync();
            }
            try (FileOutputStream file = new FileOutputStream(mappingTmp.toFile())) {
                file.write(mapper.writeValueAsBytes(ids));
                file.getFD().sync();
            }

            move(mappingTmp, paths.idMapping());
            move(structureTmp, paths.structure());
        } finally {
            Files.deleteIfExists(structureTmp);
            Files.deleteIfExists(mappingTmp);
        }

        long size = Files.size(paths.structure());
        log.info("index.saved path={} entries={} dimension={} bytes={}",
                paths.structure(), ids.size(), index.dimension(), size);
        return size;
    }

    /**
     * Loads a persisted index. Missing, unreadable, inconsistent or dimensionally incompatible
     * artifacts are reported as an empty result rather than an error.
     */
    public Optional<VectorIndex> load(IndexPaths paths, int expectedDimension) {
        if (!paths.bothExist()) {
            log.info("index.absent structure={} mapping={}", paths.structure(), paths.idMapping());
            return Optional.empty();
        }
        try {
            List<Long> ids = mapper.readValue(paths.idMapping().toFile(), new TypeReference<List<Long>>() {
            });
            try (InputStream raw = Files.newInputStream(paths.structure());
                    DataInputStream in = new DataInputStream(new BufferedInputStream(raw))) {
                if (in.readInt() != MAGIC) {
                    log.warn("index.rejected reason=bad-magic path={}", paths.structure());
                    return Optional.empty();
                }
                int version = in.readInt();
                if (version != FORMAT_VERSION) {
                    log.warn("index.rejected reason=unsupported-format version={} path={}", version, paths.structure());
                    return Optional.empty();
                }
                int dimension = in.readInt();
                if (dimension != expectedDimension) {
                    log.warn("index.rejected reason=dimension-mismatch stored={} expected={}", dimension, expectedDimension);
                    return Optional.empty();
                }
                int count = in.readInt();
                long storedChecksum = in.readLong();
                if (count != ids.size() || storedChecksum != checksum(ids)) {
                    log.warn("index.rejected reason=mapping-mismatch structureCount={} mappingCount={}", count, ids.size());
                    return Optional.empty();
                }
                float[] data = new float[count * dimension];
                for (int i = 0; i < data.length; i++) {
                    data[i] = in.readFloat();
                }
                long[] mapping = new long[count];
                for (int i = 0; i < count; i++) {
                    mapping[i] = ids.get(i);
                }
                VectorIndex index = FlatVectorIndex.restore(dimension, data, mapping);
                log.info("index.loaded path={} entries={} dimension={}", paths.structure(), count, dimension);
                return Optional.of(index);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("index.rejected reason=unreadable path={} error={}", paths.structure(), e.getMessage());
            return Optional.empty();
        }
    }

    public VectorIndex loadOrEmpty(IndexPaths paths, int expectedDimension) {
        return load(paths, expectedDimension).orElseGet(() -> FlatVectorIndex.createEmpty(expectedDimension));
    }

    public long structureSize(IndexPaths paths) {
        try {
            return Files.isRegularFile(paths.structure()) ? Files.size(paths.structure()) : 0L;
        } catch (IOException e) {
            log.debug("index.size.unavailable path={}", paths.structure(), e);
            return 0L;
        }
    }

    static long checksum(List<Long> ids) {
        CRC32 crc = new CRC32();
        byte[] buffer = new byte[Long.BYTES];
        for (Long id : ids) {
            long value = id;
            for (int i = 0; i < Long.BYTES; i++) {
                buffer[i] = (byte) (value >>> (56 - 8 * i));
            }
            crc.update(buffer, 0, buffer.length);
        }
        return crc.getValue();
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
