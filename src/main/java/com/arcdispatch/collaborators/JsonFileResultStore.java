package com.arcdispatch.collaborators;

import com.arcdispatch.AppLogger;
import com.arcdispatch.models.AnalysisResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Stores each result as {@code {dataDir}/results/{recordId}.json}.
 */
public class JsonFileResultStore implements AnalysisResultStore {

    private final Path resultsRoot;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public JsonFileResultStore(Path dataDir, ObjectMapper objectMapper) {
        this.resultsRoot = dataDir.resolve("results");
        this.objectMapper = objectMapper;
    }

    public String generateRecordId() {
        return "rec_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    @Override
    public String save(AnalysisResult result) throws IOException {
        Files.createDirectories(resultsRoot);
        String recordId = generateRecordId();
        ObjectNode record = objectMapper.valueToTree(result);
        record.put("recordId", recordId);
        record.put("savedAt", System.currentTimeMillis());
        writeJsonAtomic(resultsRoot.resolve(recordId + ".json"), record);
        logger.info("[JsonFileResultStore] Saved " + result.getSessionId() + " as " + recordId);
        return recordId;
    }

    /**
     * @return the stored record, or null when absent
     */
    public JsonNode read(String recordId) throws IOException {
        Path file = resultsRoot.resolve(recordId + ".json");
        if (!Files.exists(file)) {
            return null;
        }
        return objectMapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
    }

    public Path getResultsRoot() {
        return resultsRoot;
    }

    /**
     * Atomic write: write to .tmp file, then rename.
     */
    private void writeJsonAtomic(Path target, JsonNode node) throws IOException {
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        Files.writeString(tmpFile, json, StandardCharsets.UTF_8);
        Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
