package ai.symgraph.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class ExtractionSettingsTest {

    @Test
    void propertiesOverrideDefaults() {
        var props = new Properties();
        props.setProperty(ExtractionSettings.KEY_WORKERS, "6");
        props.setProperty(ExtractionSettings.KEY_PROGRESS_INTERVAL, "25");
        props.setProperty(ExtractionSettings.KEY_BATCH_TIMEOUT_SECONDS, "30");
        props.setProperty(ExtractionSettings.KEY_MAX_FILE_BYTES, "1024");

        var settings = ExtractionSettings.fromProperties(props);

        assertEquals(6, settings.workers());
        assertEquals(6, settings.effectiveWorkers());
        assertEquals(25, settings.progressInterval());
        assertEquals(Duration.ofSeconds(30), settings.timeout().orElseThrow());
        assertEquals(1024, settings.maxFileBytes());
    }

    @Test
    void badValuesFallBack() {
        var props = new Properties();
        props.setProperty(ExtractionSettings.KEY_WORKERS, "many");
        props.setProperty(ExtractionSettings.KEY_PROGRESS_INTERVAL, "-5");
        props.setProperty(ExtractionSettings.KEY_BATCH_TIMEOUT_SECONDS, "0");
        props.setProperty(ExtractionSettings.KEY_MAX_FILE_BYTES, "-1");

        var settings = ExtractionSettings.fromProperties(props);

        assertEquals(0, settings.workers());
        assertEquals(0, settings.progressInterval());
        assertTrue(settings.timeout().isEmpty());
        assertEquals(ExtractionSettings.DEFAULT_MAX_FILE_BYTES, settings.maxFileBytes());
    }

    @Test
    void automaticWorkerCountIsCapped() {
        int expected = Math.min(Runtime.getRuntime().availableProcessors(), ExtractionSettings.MAX_DEFAULT_WORKERS);
        assertEquals(expected, ExtractionSettings.DEFAULTS.effectiveWorkers());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExtractionSettings(-1, 0, null, 1));
        assertThrows(IllegalArgumentException.class, () -> new ExtractionSettings(0, 0, Duration.ZERO, 1));
        assertThrows(IllegalArgumentException.class, () -> new ExtractionSettings(0, 0, null, 0));
    }

    @Test
    void classPathDefaultsLoad() {
        var settings = ExtractionSettings.load();
        assertEquals(100, settings.progressInterval());
        assertEquals(ExtractionSettings.DEFAULT_MAX_FILE_BYTES, settings.maxFileBytes());
    }
}
