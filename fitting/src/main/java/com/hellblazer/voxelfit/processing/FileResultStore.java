/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of VoxelFit.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.voxelfit.processing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hellblazer.voxelfit.balancing.WorkRange;
import com.hellblazer.voxelfit.protocol.ColumnTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result store on the file system: one directory per model path, one file per chunk.
 *
 * <p>Chunk files are named {@code chunk_<start>_<end>.bin} and written to a temporary file in the same directory
 * that is then moved into place, so a chunk file is either absent or complete. The protocol a fit used is written
 * as {@code used_protocol.json} once the fit completes.
 *
 * @author hal.hildebrand
 */
public class FileResultStore implements ResultStore {
    private static final Logger log = LoggerFactory.getLogger(FileResultStore.class);

    public static final String USED_PROTOCOL = "used_protocol.json";

    private static final int    MAGIC        = 0x56584631;
    private static final String CHUNK_PREFIX = "chunk_";
    private static final String CHUNK_SUFFIX = ".bin";

    private final Path         root;
    private final ObjectMapper objectMapper;

    public FileResultStore(Path root) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getRoot() {
        return root;
    }

    public Path modelDirectory(String modelPath) {
        return root.resolve(modelPath);
    }

    @Override
    public boolean exists(String modelPath, WorkRange chunk) {
        return Files.isRegularFile(chunkFile(modelPath, chunk));
    }

    @Override
    public void write(String modelPath, WorkRange chunk, Map<String, double[]> values) {
        var target = chunkFile(modelPath, chunk);
        try {
            Files.createDirectories(target.getParent());
            var temp = Files.createTempFile(target.getParent(), CHUNK_PREFIX, ".tmp");
            try {
                try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
                    out.writeInt(MAGIC);
                    out.writeInt(values.size());
                    for (var entry : values.entrySet()) {
                        out.writeUTF(entry.getKey());
                        out.writeInt(entry.getValue().length);
                        for (double v : entry.getValue()) {
                            out.writeDouble(v);
                        }
                    }
                }
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write chunk " + chunk + " of " + modelPath, e);
        }
        log.debug("Wrote {}", target);
    }

    @Override
    public List<WorkRange> chunks(String modelPath) {
        var directory = modelDirectory(modelPath);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        var found = new ArrayList<WorkRange>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, CHUNK_PREFIX + "*" + CHUNK_SUFFIX)) {
            for (var file : files) {
                var name = file.getFileName().toString();
                var bounds = name.substring(CHUNK_PREFIX.length(), name.length() - CHUNK_SUFFIX.length()).split("_");
                try {
                    found.add(new WorkRange(Integer.parseInt(bounds[0]), Integer.parseInt(bounds[1])));
                } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                    log.warn("Ignoring unrecognized chunk file {}", file);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list the chunks of " + modelPath, e);
        }
        Collections.sort(found);
        return found;
    }

    @Override
    public Map<String, double[]> read(String modelPath, WorkRange chunk) {
        var file = chunkFile(modelPath, chunk);
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("No chunk " + chunk + " stored for " + modelPath);
        }
        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            if (in.readInt() != MAGIC) {
                throw new IOException("Not a chunk file: " + file);
            }
            int count = in.readInt();
            var values = new LinkedHashMap<String, double[]>();
            for (int i = 0; i < count; i++) {
                var name = in.readUTF();
                var data = new double[in.readInt()];
                for (int j = 0; j < data.length; j++) {
                    data[j] = in.readDouble();
                }
                values.put(name, data);
            }
            return values;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read chunk " + chunk + " of " + modelPath, e);
        }
    }

    @Override
    public void invalidate(String modelPath) {
        var directory = modelDirectory(modelPath);
        if (!Files.isDirectory(directory)) {
            return;
        }
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, CHUNK_PREFIX + "*" + CHUNK_SUFFIX)) {
            for (var file : files) {
                Files.delete(file);
                removed++;
            }
            Files.deleteIfExists(directory.resolve(USED_PROTOCOL));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot invalidate " + modelPath, e);
        }
        log.info("Removed {} chunks of {}", removed, modelPath);
    }

    @Override
    public void writeColumnTable(String modelPath, ColumnTable table) {
        var target = modelDirectory(modelPath).resolve(USED_PROTOCOL);
        try {
            Files.createDirectories(target.getParent());
            var temp = Files.createTempFile(target.getParent(), "protocol", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), table.toMap());
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write the protocol of " + modelPath, e);
        }
    }

    @Override
    public boolean isComplete(String modelPath) {
        return Files.isRegularFile(modelDirectory(modelPath).resolve(USED_PROTOCOL));
    }

    /**
     * The protocol recorded for a completed fit.
     */
    public ColumnTable readColumnTable(String modelPath) {
        var file = modelDirectory(modelPath).resolve(USED_PROTOCOL);
        try {
            var columns = new LinkedHashMap<String, double[]>();
            var tree = objectMapper.readTree(file.toFile());
            var names = tree.fieldNames();
            while (names.hasNext()) {
                var name = names.next();
                columns.put(name, objectMapper.treeToValue(tree.get(name), double[].class));
            }
            return new ColumnTable(columns);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read the protocol of " + modelPath, e);
        }
    }

    private Path chunkFile(String modelPath, WorkRange chunk) {
        return modelDirectory(modelPath).resolve(CHUNK_PREFIX + chunk.start() + "_" + chunk.end() + CHUNK_SUFFIX);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
