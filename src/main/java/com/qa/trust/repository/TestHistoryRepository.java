package com.qa.trust.repository;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.qa.trust.config.TrustConfig;
import com.qa.trust.model.FlakyTestSnapshot;
import com.qa.trust.model.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Per-project run history and flaky-test files under the data directory:
 * {@code history/<project>.json} and {@code flaky/<project>.json}.
 */
@Repository
public class TestHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(TestHistoryRepository.class);

    private static final String HISTORY_DIR = "history";
    private static final String FLAKY_DIR = "flaky";
    private static final String SUFFIX = ".json";

    private final JsonFileStore fileStore;
    private final TrustConfig config;
    private final JavaType historyType;
    private final JavaType flakyType;

    public TestHistoryRepository(JsonFileStore fileStore, TrustConfig config) {
        this.fileStore = fileStore;
        this.config = config;
        TypeFactory types = fileStore.getObjectMapper().getTypeFactory();
        this.historyType = types.constructCollectionType(List.class, RunRecord.class);
        this.flakyType = types.constructType(FlakyTestSnapshot.class);
    }

    public List<RunRecord> loadHistory(String project) throws IOException {
        List<RunRecord> runs = fileStore.read(historyFile(project), historyType);
        return runs == null ? new ArrayList<>() : new ArrayList<>(runs);
    }

    public void saveHistory(String project, List<RunRecord> runs) throws IOException {
        fileStore.writeAtomically(historyFile(project), runs);
        log.debug("Saved {} runs of history for project {}", runs.size(), project);
    }

    public FlakyTestSnapshot loadFlakyTests(String project) throws IOException {
        FlakyTestSnapshot snapshot = fileStore.read(flakyFile(project), flakyType);
        return snapshot == null ? new FlakyTestSnapshot() : snapshot;
    }

    public void saveFlakyTests(String project, FlakyTestSnapshot snapshot) throws IOException {
        fileStore.writeAtomically(flakyFile(project), snapshot);
    }

    /**
     * File-name form of every project that has a history file.
     */
    public List<String> listProjects() throws IOException {
        Path dir = root().resolve(HISTORY_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .toList();
        }
    }

    Path historyFile(String project) {
        return root().resolve(HISTORY_DIR).resolve(JsonFileStore.safeFileName(project) + SUFFIX);
    }

    Path flakyFile(String project) {
        return root().resolve(FLAKY_DIR).resolve(JsonFileStore.safeFileName(project) + SUFFIX);
    }

    private Path root() {
        return Paths.get(config.getStorage().getDataDir());
    }
}
