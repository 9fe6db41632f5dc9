package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.ExtractorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ExtractionPoolTest {

    private static ExtractorRegistry registry() {
        return ExtractorRegistry.create(PROVIDER, SETTINGS);
    }

    @Test
    void unreadableFilesAreReportedNotThrown(@TempDir Path dir) {
        var files = List.of(
                SourceFile.of(dir, dir.resolve("missing_a.go")), SourceFile.of(dir, dir.resolve("missing_b.py")));

        BatchResult result;
        try (var pool = new ExtractionPool(registry(), 2)) {
            result = pool.process(files);
        }

        assertEquals(2, result.errors().size());
        assertTrue(result.errors().stream().allMatch(e -> e.kind() == DetailedParseError.ErrorKind.FILESYSTEM));
        assertEquals(2, result.parsedFiles().size());
        assertTrue(result.hasErrors());
    }

    @Test
    void unsupportedLanguageIsAMappingError(@TempDir Path dir) {
        var file = new SourceFile("notes.txt", dir.resolve("notes.txt"), Language.NONE, 0);

        BatchResult result;
        try (var pool = new ExtractionPool(registry(), 1)) {
            result = pool.process(List.of(file));
        }

        assertTrue(result.parsedFiles().isEmpty());
        assertEquals(1, result.errors().size());
        var error = result.errors().get(0);
        assertEquals(DetailedParseError.ErrorKind.MAPPING, error.kind());
        assertEquals("unsupported language: none", error.message());
    }

    @Test
    void mixedBatchParsesEveryFileOnce(@TempDir Path dir) throws Exception {
        var files = new ArrayList<SourceFile>();
        for (int i = 0; i < 12; i++) {
            var path = dir.resolve("f" + i + ".go");
            Files.writeString(path, "package p" + i + "\nfunc F" + i + "() {}\n");
            files.add(SourceFile.of(dir, path));
        }
        var py = dir.resolve("tool.py");
        Files.writeString(py, "def run():\n    return 1\n");
        files.add(SourceFile.of(dir, py));

        BatchResult result;
        try (var pool = new ExtractionPool(registry(), 4)) {
            result = pool.process(files);
        }

        assertFalse(result.hasErrors(), result.errors().toString());
        assertEquals(13, result.parsedFiles().size());
        var paths = result.parsedFiles().stream().map(ParsedFile::path).sorted().toList();
        assertEquals(13, paths.stream().distinct().count());
        assertTrue(paths.contains("tool.py"));
        for (var parsed : result.parsedFiles()) {
            assertFalse(parsed.symbols().isEmpty(), parsed.path());
        }
    }

    @Test
    void crashingExtractorOnlyFailsItsFile(@TempDir Path dir) throws Exception {
        var good = dir.resolve("ok.go");
        Files.writeString(good, "package ok\n");
        var crashing = new LanguageExtractor() {
            @Override
            public Language language() {
                return Language.PYTHON;
            }

            @Override
            public ExtractionResult extract(SourceFile file) {
                throw new IllegalStateException("boom");
            }
        };
        var registry = new ExtractorRegistry(
                Map.of(Language.GO, new GoExtractor(PROVIDER, SETTINGS), Language.PYTHON, crashing), SETTINGS);

        BatchResult result;
        try (var pool = new ExtractionPool(registry, 2)) {
            result = pool.process(List.of(
                    SourceFile.of(dir, good), new SourceFile("bad.py", dir.resolve("bad.py"), Language.PYTHON, 0)));
        }

        assertEquals(1, result.parsedFiles().size());
        assertEquals("ok.go", result.parsedFiles().get(0).path());
        assertEquals(1, result.errors().size());
        var error = result.errors().get(0);
        assertEquals("bad.py", error.file());
        assertEquals(DetailedParseError.ErrorKind.MAPPING, error.kind());
        assertTrue(error.message().startsWith("extraction failed"), error.message());
    }

    @Test
    void filesPastTheDeadlineTimeOut(@TempDir Path dir) {
        var release = new CountDownLatch(1);
        var started = new AtomicInteger();
        var stuck = new LanguageExtractor() {
            @Override
            public Language language() {
                return Language.GO;
            }

            @Override
            public ExtractionResult extract(SourceFile file) {
                started.incrementAndGet();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ExtractionResult.ok(ParsedFile.minimal(file.path(), Language.GO));
            }
        };
        var settings = SETTINGS.withBatchTimeout(Duration.ofMillis(200));
        var registry = new ExtractorRegistry(Map.of(Language.GO, stuck), settings);

        BatchResult result;
        int startedAtDeadline;
        try (var pool = new ExtractionPool(registry, 1)) {
            result = pool.process(List.of(
                    new SourceFile("slow.go", dir.resolve("slow.go"), Language.GO, 0),
                    new SourceFile("queued.go", dir.resolve("queued.go"), Language.GO, 0)));
            startedAtDeadline = started.get();
        } finally {
            release.countDown();
        }

        assertTrue(result.parsedFiles().isEmpty());
        assertEquals(2, result.errors().size());
        assertTrue(result.errors().stream().allMatch(e -> ExtractionPool.TIMED_OUT.equals(e.message())));
        assertEquals(
                List.of("queued.go", "slow.go"),
                result.errors().stream().map(DetailedParseError::file).sorted().toList());
        assertEquals(1, startedAtDeadline);
    }

    @Test
    void optimalWorkerCountScalesWithBatchSize() {
        int cpus = Runtime.getRuntime().availableProcessors();
        assertEquals(Math.min(2, cpus), ExtractionPool.optimalWorkerCount(3));
        assertEquals(Math.max(1, cpus / 2), ExtractionPool.optimalWorkerCount(20));
        assertEquals(Math.min(cpus, 16), ExtractionPool.optimalWorkerCount(500));
    }

    @Test
    void defaultWorkerCountComesFromSettings() {
        try (var pool = new ExtractionPool(ExtractorRegistry.create(PROVIDER, SETTINGS.withWorkers(3)))) {
            assertEquals(3, pool.workers());
        }
    }
}
