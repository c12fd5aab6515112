package io.nosqlbench.fabric.persist;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonParseException;
import io.nosqlbench.fabric.EmbeddingFabric;
import io.nosqlbench.fabric.FabricConfig;
import io.nosqlbench.fabric.IntegrationRegistry;
import io.nosqlbench.fabric.SchemaException;
import io.nosqlbench.fabric.scale.ScaleRegistry;
import io.nosqlbench.fabric.transform.CrossScaleTransformer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/// Saves and loads whole fabrics as JSON snapshots.
///
/// ## Atomic Writes
///
/// ```text
///   1. Capture snapshot and compute SHA-256 over its compact JSON
///   2. Write pretty JSON to <file>.tmp
///   3. Rename <file>.tmp to <file> (atomic move)
///
///   If interrupted, the previous snapshot (if any) is untouched.
/// ```
///
/// ## Checksum
///
/// The checksum covers the compact JSON of the snapshot with its
/// `checksum` field set to null, so it is independent of formatting.
/// A snapshot without a checksum is accepted; a wrong checksum is not.
///
/// ## Validation
///
/// Loading never produces a partial fabric: the snapshot is validated in
/// full before any store is built.
///
/// @see FabricSnapshot
/// @see FabricGsonConfig
public final class PersistenceManager {

    private static final Logger logger = LogManager.getLogger(PersistenceManager.class);

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String CHECKSUM_PREFIX = "sha256:";

    private PersistenceManager() {
        // Utility class
    }

    /// Saves a fabric to a file atomically.
    ///
    /// @param fabric the fabric to save
    /// @param path target file, replaced if it exists
    /// @throws IOException if writing fails
    public static void save(EmbeddingFabric fabric, Path path) throws IOException {
        Objects.requireNonNull(fabric, "fabric cannot be null");
        write(fabric.snapshot(), path);
    }

    /// Writes a fabric's snapshot to a writer. The writer is not closed.
    public static void save(EmbeddingFabric fabric, Writer writer) throws IOException {
        Objects.requireNonNull(fabric, "fabric cannot be null");
        write(fabric.snapshot(), writer);
    }

    /// Writes a snapshot to a file through a temporary sibling and an atomic rename.
    ///
    /// @param snapshot the snapshot; its checksum is recomputed
    /// @param path target file
    /// @throws IOException if writing or renaming fails
    public static void write(FabricSnapshot snapshot, Path path) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        Objects.requireNonNull(path, "path cannot be null");

        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            write(snapshot, writer);
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Saved fabric snapshot to {} ({} scales, {} transforms, {} integrations, {} bytes)",
            path, snapshot.scaleNames().size(), snapshot.transformKeys().size(),
            snapshot.integrationNames().size(), Files.size(path));
    }

    /// Writes a snapshot with a fresh checksum to a writer. The writer is
    /// flushed but not closed.
    public static void write(FabricSnapshot snapshot, Writer writer) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        Objects.requireNonNull(writer, "writer cannot be null");
        FabricSnapshot unsigned = snapshot.withChecksum(null);
        FabricSnapshot signed = unsigned.withChecksum(computeChecksum(unsigned));
        FabricGsonConfig.gson().toJson(signed, writer);
        writer.flush();
    }

    /// Reads and checks a snapshot file.
    ///
    /// @param path the snapshot file
    /// @param verifyChecksum whether to verify the checksum
    /// @return the snapshot, version-checked and, if requested, checksum-verified
    /// @throws IOException if reading fails or the file does not exist
    /// @throws SchemaException if the content is malformed or corrupt
    public static FabricSnapshot read(Path path, boolean verifyChecksum) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "Fabric snapshot not found");
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, verifyChecksum);
        }
    }

    /// Reads and checks a snapshot from a reader. The reader is not closed.
    public static FabricSnapshot read(Reader reader, boolean verifyChecksum) throws IOException {
        Objects.requireNonNull(reader, "reader cannot be null");
        String json = readFully(reader);

        FabricSnapshot snapshot;
        try {
            snapshot = FabricGsonConfig.gson().fromJson(json, FabricSnapshot.class);
        } catch (JsonParseException e) {
            throw new SchemaException("Invalid fabric snapshot JSON: " + e.getMessage(), e);
        }
        if (snapshot == null) {
            throw new SchemaException("Fabric snapshot is empty");
        }
        if (snapshot.schemaVersion() == null || snapshot.schemaVersion() != FabricSnapshot.CURRENT_VERSION) {
            throw new SchemaException("Unsupported snapshot version: " + snapshot.schemaVersion()
                + " (expected: " + FabricSnapshot.CURRENT_VERSION + ")");
        }
        if (verifyChecksum && snapshot.checksum() != null) {
            String expected = computeChecksum(snapshot.withChecksum(null));
            if (!expected.equals(snapshot.checksum())) {
                throw new SchemaException("Snapshot checksum mismatch: expected " + expected
                    + " but found " + snapshot.checksum());
            }
        }
        return snapshot;
    }

    /// Loads a fabric whose layout is taken from the snapshot itself.
    public static EmbeddingFabric load(Path path) throws IOException {
        return load(path, null);
    }

    /// Loads a fabric whose layout is taken from the snapshot itself.
    public static EmbeddingFabric load(Reader reader) throws IOException {
        return load(reader, null);
    }

    /// Loads a fabric and requires its layout to match an expected configuration.
    ///
    /// @param path the snapshot file
    /// @param expected required dimension and scales, or null to accept the
    ///     snapshot's own layout
    /// @throws SchemaException on any mismatch or corruption
    public static EmbeddingFabric load(Path path, FabricConfig expected) throws IOException {
        EmbeddingFabric fabric = toFabric(read(path, true), expected);
        logger.info("Loaded fabric from {} ({} components, D={})",
            path, fabric.config().schema().totalComponents(), fabric.config().dimension());
        return fabric;
    }

    /// Loads a fabric from a reader and requires its layout to match an
    /// expected configuration.
    public static EmbeddingFabric load(Reader reader, FabricConfig expected) throws IOException {
        return toFabric(read(reader, true), expected);
    }

    /// Builds a new fabric from a snapshot.
    ///
    /// @param snapshot a snapshot read from storage
    /// @param expected required layout, or null
    /// @return a fabric holding exactly the snapshot's state
    /// @throws SchemaException if the snapshot is invalid or does not match
    public static EmbeddingFabric toFabric(FabricSnapshot snapshot, FabricConfig expected) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        if (expected != null) {
            snapshot.validateAgainst(expected);
        }
        FabricConfig config = snapshot.toConfig();
        ScaleRegistry registry = new ScaleRegistry(config.schema(), config.dimension());
        CrossScaleTransformer transformer = new CrossScaleTransformer(config.schema(), config.dimension());
        IntegrationRegistry integrations = new IntegrationRegistry();
        snapshot.applyTo(registry, transformer, integrations);
        return new EmbeddingFabric(config, registry, transformer, integrations);
    }

    static String computeChecksum(FabricSnapshot snapshot) {
        String content = FabricGsonConfig.compactGson().toJson(snapshot);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return CHECKSUM_PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String readFully(Reader reader) throws IOException {
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[8192];
        int read;
        while ((read = reader.read(buffer)) != -1) {
            sb.append(buffer, 0, read);
        }
        return sb.toString();
    }
}
