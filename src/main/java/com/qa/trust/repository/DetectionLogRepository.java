package com.qa.trust.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.qa.trust.config.TrustConfig;
import com.qa.trust.model.DetectionEvent;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only detection logs ({@code <project>_detections.jsonl}) and hourly summaries in the
 * log directory.
 */
@Repository
public class DetectionLogRepository {

    private final JsonFileStore fileStore;
    private final TrustConfig config;

    public DetectionLogRepository(JsonFileStore fileStore, TrustConfig config) {
        this.fileStore = fileStore;
        this.config = config;
    }

    public void append(String project, DetectionEvent event) throws IOException {
        fileStore.appendLine(detectionLog(project), event);
    }

    public List<DetectionEvent> readEvents(String project) throws IOException {
        Path file = detectionLog(project);
        List<DetectionEvent> events = new ArrayList<>();
        if (!Files.exists(file)) {
            return events;
        }
        ObjectMapper mapper = fileStore.getObjectMapper();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    events.add(mapper.readValue(line, DetectionEvent.class));
                }
            }
        }
        return events;
    }

    public Path writeSummary(String fileName, Object summary) throws IOException {
        Path file = logDir().resolve(fileName);
        fileStore.writeAtomically(file, summary);
        return file;
    }

    Path detectionLog(String project) {
        return logDir().resolve(JsonFileStore.safeFileName(project) + "_detections.jsonl");
    }

    private Path logDir() {
        return Paths.get(config.getStorage().getLogDir());
    }
}
