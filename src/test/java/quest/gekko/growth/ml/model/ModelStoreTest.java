package quest.gekko.growth.ml.model;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import quest.gekko.growth.ml.train.GradientBoostingTrainer;
import quest.gekko.growth.ml.train.TrainingDataset;
import quest.gekko.growth.ml.train.TrainingFixtures;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ModelStoreTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    private static TrainingDataset dataset;
    private static GrowthModel model;

    @TempDir
    Path dir;

    @BeforeAll
    static void train() {
        dataset = TrainingFixtures.dataset(30);
        model = new GradientBoostingTrainer(TrainingFixtures.fastSettings(), Clock.fixed(NOW, ZoneOffset.UTC))
                .fit(dataset, TrainingFixtures.TARGET).model();
    }

    @Test
    void load_shouldReturnEmptyWhenNoArtifact() throws IOException {
        assertEquals(Optional.empty(), new ModelStore(dir.resolve("missing.bin")).load());
    }

    @Test
    void save_shouldRoundTripModelAndMetadata() throws IOException {
        ModelStore store = new ModelStore(dir.resolve("nested/growth-model.bin"));
        store.save(model);

        GrowthModel loaded = store.load().orElseThrow();

        assertEquals(model.targetColumn(), loaded.targetColumn());
        assertEquals(model.rounds(), loaded.rounds());
        assertEquals(NOW, loaded.trainedAt());
        assertArrayEquals(model.predict(dataset.featureMatrix()), loaded.predict(dataset.featureMatrix()), 1e-12);
    }

    @Test
    void save_shouldReplaceArtifactWithoutLeavingTempFiles() throws IOException {
        ModelStore store = new ModelStore(dir.resolve("growth-model.bin"));
        store.save(model);
        store.save(model);

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void load_shouldRejectUnsupportedVersion() throws IOException {
        Path path = dir.resolve("future.bin");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(ModelStore.MAGIC);
            out.writeInt(ModelStore.FORMAT_VERSION + 1);
        }
        Files.write(path, bytes.toByteArray());

        ModelFormatException e = assertThrows(ModelFormatException.class, () -> new ModelStore(path).load());
        assertTrue(e.getMessage().contains("version"));
    }

    @Test
    void load_shouldRejectDifferentFeatureSchema() throws IOException {
        Path path = dir.resolve("old-schema.bin");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(ModelStore.MAGIC);
            out.writeInt(ModelStore.FORMAT_VERSION);
            out.writeUTF(GrowthModel.ALGORITHM);
            out.writeInt(2);
            out.writeUTF("subscriberCount");
            out.writeUTF("viewCount");
        }
        Files.write(path, bytes.toByteArray());

        assertThrows(ModelFormatException.class, () -> new ModelStore(path).load());
    }

    @Test
    void load_shouldRejectImplausibleFeatureCount() throws IOException {
        for (int count : new int[] {-1, Integer.MAX_VALUE}) {
            Path path = dir.resolve("count" + count + ".bin");
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            try (DataOutputStream out = new DataOutputStream(bytes)) {
                out.writeInt(ModelStore.MAGIC);
                out.writeInt(ModelStore.FORMAT_VERSION);
                out.writeUTF(GrowthModel.ALGORITHM);
                out.writeInt(count);
            }
            Files.write(path, bytes.toByteArray());

            ModelFormatException e = assertThrows(ModelFormatException.class, () -> new ModelStore(path).load());
            assertTrue(e.getMessage().contains("feature count"));
        }
    }

    @Test
    void load_shouldRejectForeignAndTruncatedFiles() throws IOException {
        Path foreign = Files.writeString(dir.resolve("notes.bin"), "definitely not a model");
        Path truncated = dir.resolve("truncated.bin");
        new ModelStore(truncated).save(model);
        byte[] full = Files.readAllBytes(truncated);
        Files.write(truncated, Arrays.copyOf(full, full.length / 2));

        assertThrows(ModelFormatException.class, () -> new ModelStore(foreign).load());
        assertThrows(ModelFormatException.class, () -> new ModelStore(truncated).load());
    }
}
