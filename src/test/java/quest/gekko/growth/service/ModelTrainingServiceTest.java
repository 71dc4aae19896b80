package quest.gekko.growth.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import quest.gekko.growth.ml.model.ModelStore;
import quest.gekko.growth.ml.predict.GrowthPredictor;
import quest.gekko.growth.ml.train.GradientBoostingTrainer;
import quest.gekko.growth.ml.train.InsufficientTrainingDataException;
import quest.gekko.growth.ml.train.TrainingDataBuilder;
import quest.gekko.growth.ml.train.TrainingFixtures;
import quest.gekko.growth.ml.train.TrainingMetrics;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ModelTrainingServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    @TempDir
    Path dir;

    private TrainingDataBuilder builder;
    private ModelStore store;
    private GrowthPredictor predictor;
    private ModelTrainingService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        builder = mock(TrainingDataBuilder.class);
        store = new ModelStore(dir.resolve("growth-model.bin"));
        predictor = new GrowthPredictor(store, new GradientBoostingTrainer(TrainingFixtures.fastSettings(), clock));
        service = new ModelTrainingService(builder, predictor, TrainingFixtures.fastSettings(), clock);
    }

    @Test
    void trainFromHistory_shouldRejectTooFewRowsWithoutWritingArtifact() {
        when(builder.build(NOW)).thenReturn(TrainingFixtures.dataset(5));

        InsufficientTrainingDataException e =
                assertThrows(InsufficientTrainingDataException.class, () -> service.trainFromHistory());

        assertEquals(5, e.getRows());
        assertEquals(10, e.getRequired());
        assertFalse(Files.exists(store.path()));
        assertFalse(predictor.isLoaded());
    }

    @Test
    void trainFromHistory_shouldTrainOnBuiltRows() {
        when(builder.build(NOW)).thenReturn(TrainingFixtures.dataset(25));

        TrainingMetrics metrics = service.trainFromHistory();

        assertEquals(20, metrics.trainRows());
        assertEquals(5, metrics.validationRows());
        assertTrue(predictor.isLoaded());
        assertTrue(Files.exists(store.path()));
        verify(builder).build(NOW);
    }
}
