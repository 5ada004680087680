package org.gambitpairing.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.gambitpairing.json.ObjectMapperFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes comparison reports to disk. Files are written to a temporary name and moved
 * into place, so a reader never sees a partial report.
 */
public class ReportWriter {

    public static final String JSON_REPORT = "comparison-report.json";
    public static final String TEXT_REPORT = "comparison-report.txt";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public ReportWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = ObjectMapperFactory.createPretty();
    }

    public Path writeJson(JsonNode report) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(JSON_REPORT);
        Path temp = outputDir.resolve(JSON_REPORT + ".tmp");
        objectMapper.writeValue(temp.toFile(), report);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    public Path writeText(String report) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(TEXT_REPORT);
        Path temp = outputDir.resolve(TEXT_REPORT + ".tmp");
        Files.writeString(temp, report, StandardCharsets.UTF_8);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }
}
