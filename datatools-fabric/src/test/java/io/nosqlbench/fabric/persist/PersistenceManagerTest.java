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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.nosqlbench.fabric.EmbeddingFabric;
import io.nosqlbench.fabric.FabricConfig;
import io.nosqlbench.fabric.FabricFactory;
import io.nosqlbench.fabric.SchemaException;
import io.nosqlbench.fabric.TransformInit;
import io.nosqlbench.fabric.scale.ComponentMetadata;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.scale.ScaleSchema;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class PersistenceManagerTest {

    private static final double TOLERANCE = 1e-6;

    private static final Scale A = Scale.of("a", 1, 3);
    private static final Scale B = Scale.of("b", 2, 2);

    private static FabricConfig smallConfig() {
        return FabricConfig.builder()
            .dimension(4)
            .initStd(0.05)
            .seed(1234L)
            .schema(ScaleSchema.of(A, B))
            .build();
    }

    @Test
    void saveAndLoadRoundTrip(@TempDir Path tempDir) throws Exception {
        EmbeddingFabric original = FabricFactory.createFabric(smallConfig());
        original.setMetadata(A, 1, ComponentMetadata.of(Map.of(
            "name", "marker",
            "count", 3,
            "weight", 0.25,
            "flag", true,
            "tags", List.of("x", "y"),
            "nested", Map.of("depth", 2))));

        Path path = tempDir.resolve("fabric.json");
        original.save(path);
        assertTrue(Files.exists(path));
        assertFalse(Files.exists(tempDir.resolve("fabric.json.tmp")));

        EmbeddingFabric restored = EmbeddingFabric.load(path);

        assertEquals(original.config(), restored.config());
        for (Scale scale : original.scales()) {
            for (int id = 0; id < scale.cardinality(); id++) {
                assertArrayEquals(original.getEmbedding(scale, id), restored.getEmbedding(scale, id), (float) TOLERANCE);
                assertEquals(original.getMetadata(scale, id), restored.getMetadata(scale, id));
            }
        }
        for (Scale from : original.scales()) {
            for (Scale to : original.scales()) {
                if (!from.equals(to)) {
                    float[][] m1 = original.transformMatrix(from, to);
                    float[][] m2 = restored.transformMatrix(from, to);
                    for (int r = 0; r < m1.length; r++) {
                        assertArrayEquals(m1[r], m2[r], (float) TOLERANCE);
                    }
                }
            }
        }
    }

    @Test
    void writerAndReaderRoundTrip() throws IOException {
        EmbeddingFabric original = FabricFactory.createFabric(smallConfig());
        StringWriter out = new StringWriter();
        original.save(out);

        EmbeddingFabric restored = EmbeddingFabric.load(new StringReader(out.toString()));
        assertArrayEquals(original.getEmbedding(B, 1), restored.getEmbedding(B, 1));
    }

    @Test
    void snapshotCarriesDocumentedKeys() throws IOException {
        StringWriter out = new StringWriter();
        FabricFactory.createFabric(smallConfig()).save(out);
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();

        assertEquals(FabricSnapshot.CURRENT_VERSION, json.get("schema_version").getAsInt());
        assertTrue(json.get("checksum").getAsString().startsWith("sha256:"));
        assertEquals(4, json.get("dimension").getAsInt());
        assertEquals(1234L, json.get("seed").getAsLong());
        assertEquals("GAUSSIAN", json.get("transform_init").getAsString());
        JsonObject scaleA = json.getAsJsonObject("scales").getAsJsonObject("a");
        assertEquals(3, scaleA.get("cardinality").getAsInt());
        assertEquals(3, scaleA.getAsJsonArray("embeddings").size());
        assertEquals(3, scaleA.getAsJsonArray("metadata").size());
        assertTrue(json.getAsJsonObject("transforms").has("a->b"));
        assertTrue(json.getAsJsonObject("transforms").has("b->a"));
    }

    @Test
    void unsupportedVersionIsRejected(@TempDir Path tempDir) throws IOException {
        JsonObject json = savedJson();
        json.addProperty("schema_version", 2);
        Path path = writeJson(tempDir, json);

        SchemaException e = assertThrows(SchemaException.class, () -> EmbeddingFabric.load(path));
        assertTrue(e.getMessage().contains("version"));
    }

    @Test
    void corruptedContentFailsChecksum(@TempDir Path tempDir) throws IOException {
        JsonObject json = savedJson();
        json.getAsJsonObject("scales").getAsJsonObject("a")
            .getAsJsonArray("embeddings").get(0).getAsJsonArray().set(0, new JsonPrimitive(42.0f));
        Path path = writeJson(tempDir, json);

        SchemaException e = assertThrows(SchemaException.class, () -> EmbeddingFabric.load(path));
        assertTrue(e.getMessage().contains("checksum"));

        FabricSnapshot unchecked = PersistenceManager.read(path, false);
        assertEquals(4, unchecked.dimension());
    }

    @Test
    void snapshotWithoutChecksumIsAccepted(@TempDir Path tempDir) throws IOException {
        JsonObject json = savedJson();
        json.remove("checksum");
        Path path = writeJson(tempDir, json);
        assertDoesNotThrow(() -> EmbeddingFabric.load(path));
    }

    @Test
    void wrongRowLengthIsSchemaError(@TempDir Path tempDir) throws IOException {
        JsonObject json = savedJson();
        json.remove("checksum");
        json.getAsJsonObject("scales").getAsJsonObject("b")
            .getAsJsonArray("embeddings").get(1).getAsJsonArray().remove(0);
        Path path = writeJson(tempDir, json);
        assertThrows(SchemaException.class, () -> EmbeddingFabric.load(path));
    }

    @Test
    void unknownScaleInTransformKeyIsSchemaError(@TempDir Path tempDir) throws IOException {
        JsonObject json = savedJson();
        json.remove("checksum");
        JsonObject transforms = json.getAsJsonObject("transforms");
        transforms.add("a->zzz", transforms.get("a->b"));
        Path path = writeJson(tempDir, json);
        assertThrows(SchemaException.class, () -> EmbeddingFabric.load(path));
    }

    @Test
    void malformedJsonIsSchemaError() {
        assertThrows(SchemaException.class, () -> EmbeddingFabric.load(new StringReader("{ not json ")));
        assertThrows(SchemaException.class, () -> EmbeddingFabric.load(new StringReader("")));
    }

    @Test
    void missingFileIsIoError(@TempDir Path tempDir) {
        assertThrows(NoSuchFileException.class, () -> EmbeddingFabric.load(tempDir.resolve("absent.json")));
    }

    @Test
    void loadAgainstDifferentSchemaFails(@TempDir Path tempDir) throws IOException {
        Path path = tempDir.resolve("fabric.json");
        FabricFactory.createFabric(smallConfig()).save(path);

        FabricConfig otherDimension = smallConfig().toBuilder().dimension(8).build();
        assertThrows(SchemaException.class, () -> PersistenceManager.load(path, otherDimension));

        FabricConfig otherCardinality = smallConfig().toBuilder()
            .schema(ScaleSchema.of(A, Scale.of("b", 2, 3))).build();
        assertThrows(SchemaException.class, () -> PersistenceManager.load(path, otherCardinality));

        assertDoesNotThrow(() -> PersistenceManager.load(path, smallConfig()));
    }

    @Test
    void restoreReplacesLiveState(@TempDir Path tempDir) throws IOException {
        EmbeddingFabric fabric = FabricFactory.createFabric(smallConfig());
        Path path = tempDir.resolve("fabric.json");
        float[] saved = fabric.getEmbedding(A, 0);
        fabric.save(path);

        fabric.setEmbedding(A, 0, new float[]{9f, 9f, 9f, 9f});
        fabric.restore(path);

        assertArrayEquals(saved, fabric.getEmbedding(A, 0));
    }

    @Test
    void restoreWithMismatchedSnapshotLeavesFabricUnchanged(@TempDir Path tempDir) throws IOException {
        Path path = tempDir.resolve("other.json");
        FabricFactory.createFabric(smallConfig().toBuilder().dimension(3).build()).save(path);

        EmbeddingFabric fabric = FabricFactory.createFabric(smallConfig());
        float[] before = fabric.getEmbedding(B, 0);
        assertThrows(SchemaException.class, () -> fabric.restore(path));
        assertArrayEquals(before, fabric.getEmbedding(B, 0));
    }

    @Test
    void identityPerturbedInitSurvivesRoundTrip() throws IOException {
        FabricConfig config = smallConfig().toBuilder().transformInit(TransformInit.IDENTITY_PERTURBED).build();
        StringWriter out = new StringWriter();
        FabricFactory.createFabric(config).save(out);

        EmbeddingFabric restored = EmbeddingFabric.load(new StringReader(out.toString()));
        assertEquals(TransformInit.IDENTITY_PERTURBED, restored.config().transformInit());
        assertTrue(restored.hasTransform(A, B));
        assertTrue(restored.hasTransform(B, A));
    }

    @Test
    void missingTransformIsSchemaError(@TempDir Path tempDir) throws IOException {
        JsonObject json = savedJson();
        json.remove("checksum");
        json.getAsJsonObject("transforms").remove("a->b");
        Path path = writeJson(tempDir, json);

        SchemaException e = assertThrows(SchemaException.class, () -> EmbeddingFabric.load(path));
        assertTrue(e.getMessage().contains("a->b"));
    }

    @Test
    void restoreWithMissingTransformKeepsLiveMatrices(@TempDir Path tempDir) throws IOException {
        JsonObject json = savedJson();
        json.remove("checksum");
        json.getAsJsonObject("transforms").remove("b->a");
        Path path = writeJson(tempDir, json);

        EmbeddingFabric fabric = FabricFactory.createFabric(smallConfig().toBuilder().seed(99L).build());
        float[][] before = fabric.transformMatrix(B, A);
        assertThrows(SchemaException.class, () -> fabric.restore(path));
        assertTrue(fabric.hasTransform(B, A));
        float[][] after = fabric.transformMatrix(B, A);
        for (int r = 0; r < before.length; r++) {
            assertArrayEquals(before[r], after[r]);
        }
    }

    private static JsonObject savedJson() throws IOException {
        StringWriter out = new StringWriter();
        FabricFactory.createFabric(smallConfig()).save(out);
        return JsonParser.parseString(out.toString()).getAsJsonObject();
    }

    private static Path writeJson(Path dir, JsonObject json) throws IOException {
        Path path = dir.resolve("edited.json");
        Files.writeString(path, FabricGsonConfig.gson().toJson(json));
        return path;
    }
}
