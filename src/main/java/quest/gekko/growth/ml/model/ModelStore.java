package quest.gekko.growth.ml.model;

import lombok.extern.slf4j.Slf4j;
import quest.gekko.growth.ml.feature.Feature;
import smile.regression.GradientTreeBoost;

import java.io.*;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the single current model artifact.
 * <p>
 * Layout: magic, format version, algorithm tag, feature names, target column, rounds, training time, then the
 * serialized ensemble. Any header mismatch is rejected with {@link ModelFormatException} instead of loading a model
 * that would read its inputs in the wrong order.
 */
@Slf4j
public class ModelStore {

    static final int MAGIC = 0x4347504D; // "CGPM"
    static final int FORMAT_VERSION = 1;

    private final Path path;

    public ModelStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    /**
     * @return empty when no artifact has been written yet
     * @throws ModelFormatException when the artifact is unreadable or incompatible
     */
    public Optional<GrowthModel> load() throws IOException {
        if (!Files.isRegularFile(path)) return Optional.empty();

        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return Optional.of(read(in));
        } catch (ModelFormatException e) {
            throw e;
        } catch (EOFException | UTFDataFormatException | ObjectStreamException e) {
            throw new ModelFormatException("Model artifact " + path + " is truncated or corrupt", e);
        }
    }

    /**
     * Writes to a sibling temp file and moves it over the artifact, so readers see either the old or the new model.
     */
    public void save(GrowthModel model) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
                write(model, out);
            }
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, replacing model artifact non-atomically", dir);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Saved model artifact to {} ({} rounds)", path, model.rounds());
    }

    static void write(GrowthModel model, OutputStream out) throws IOException {
        DataOutputStream data = new DataOutputStream(out);
        data.writeInt(MAGIC);
        data.writeInt(FORMAT_VERSION);
        data.writeUTF(GrowthModel.ALGORITHM);
        data.writeInt(Feature.count());
        for (String name : Feature.names()) {
            data.writeUTF(name);
        }
        data.writeUTF(model.targetColumn());
        data.writeInt(model.rounds());
        data.writeLong(model.trainedAt().toEpochMilli());

        ObjectOutputStream objects = new ObjectOutputStream(data);
        objects.writeObject(model.ensemble());
        objects.flush();
    }

    static GrowthModel read(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        if (data.readInt() != MAGIC) {
            throw new ModelFormatException("Not a growth model artifact");
        }
        int version = data.readInt();
        if (version != FORMAT_VERSION) {
            throw new ModelFormatException("Unsupported model format version " + version + ", expected " + FORMAT_VERSION);
        }
        String algorithm = data.readUTF();
        if (!GrowthModel.ALGORITHM.equals(algorithm)) {
            throw new ModelFormatException("Unsupported model algorithm '" + algorithm + "'");
        }
        int featureCount = data.readInt();
        if (featureCount < 0 || featureCount > Feature.count()) {
            throw new ModelFormatException("Invalid feature count " + featureCount + " in model header");
        }
        List<String> names = new ArrayList<>(featureCount);
        for (int i = 0; i < featureCount; i++) {
            names.add(data.readUTF());
        }
        if (!names.equals(Feature.names())) {
            throw new ModelFormatException("Model was trained on features " + names + ", current schema is " + Feature.names());
        }
        String targetColumn = data.readUTF();
        int rounds = data.readInt();
        Instant trainedAt = Instant.ofEpochMilli(data.readLong());

        try {
            Object ensemble = new ObjectInputStream(data).readObject();
            if (!(ensemble instanceof GradientTreeBoost booster)) {
                throw new ModelFormatException("Unexpected model payload " + (ensemble == null ? "null" : ensemble.getClass().getName()));
            }
            return new GrowthModel(booster, targetColumn, rounds, trainedAt);
        } catch (ClassNotFoundException e) {
            throw new ModelFormatException("Model payload references unknown class", e);
        }
    }
}
