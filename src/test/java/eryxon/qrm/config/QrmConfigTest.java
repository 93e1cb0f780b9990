package eryxon.qrm.config;

import eryxon.qrm.live.ViewKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QrmConfigTest {

    @Test
    void defaults() {
        QrmConfig config = QrmConfig.defaults();

        assertEquals(4, config.fetchThreads());
        assertEquals("Unknown", config.unknownCellName());
        assertEquals(Duration.ofMillis(150), config.quietWindow(ViewKind.CELL_METRICS));
        assertEquals(Duration.ofMillis(300), config.quietWindow(ViewKind.ALL_CELL_METRICS));
        assertEquals(Duration.ofMillis(200), config.quietWindow(ViewKind.JOB_ROUTING));
    }

    @Test
    void fromEnvOverrides() {
        QrmConfig config = QrmConfig.fromEnv(Map.of(
                "QRM_DB_URL", "jdbc:h2:mem:env",
                "QRM_DB_POOL_SIZE", "3",
                "QRM_FETCH_THREADS", " 8 ",
                "QRM_UNKNOWN_CELL_NAME", "Unassigned",
                "QRM_DEBOUNCE_PART_ROUTING_MS", "50"));

        assertEquals("jdbc:h2:mem:env", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
        assertEquals(8, config.fetchThreads());
        assertEquals("Unassigned", config.unknownCellName());
        assertEquals(Duration.ofMillis(50), config.quietWindow(ViewKind.PART_ROUTING));
        assertEquals(Duration.ofMillis(150), config.quietWindow(ViewKind.CELL_METRICS));
    }

    @Test
    void blankEnvValuesKeepDefaults() {
        QrmConfig config = QrmConfig.fromEnv(Map.of("QRM_FETCH_THREADS", " ", "QRM_UNKNOWN_CELL_NAME", ""));

        assertEquals(4, config.fetchThreads());
        assertEquals("Unknown", config.unknownCellName());
    }

    @Test
    void fluentSetters() {
        QrmConfig config = QrmConfig.defaults()
                .withQuietWindow(Duration.ofMillis(20))
                .withQuietWindow(ViewKind.JOBS_ROUTING, Duration.ofMillis(70))
                .withStopTimeout(Duration.ofSeconds(1));

        assertEquals(Duration.ofMillis(20), config.quietWindow(ViewKind.CELL_METRICS));
        assertEquals(Duration.ofMillis(70), config.quietWindow(ViewKind.JOBS_ROUTING));
        assertEquals(Duration.ofSeconds(1), config.stopTimeout());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> QrmConfig.defaults().withFetchThreads(0));
        assertThrows(IllegalArgumentException.class,
                () -> QrmConfig.defaults().withQuietWindow(ViewKind.CELL_METRICS, Duration.ofMillis(-1)));
    }
}
