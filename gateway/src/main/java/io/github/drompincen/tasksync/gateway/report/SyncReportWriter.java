package io.github.drompincen.tasksync.gateway.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tasksync.protocol.api.SyncReportDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the run summary as pretty-printed JSON for CI consumers.
 */
@Component
public class SyncReportWriter {

    private static final Logger log = LoggerFactory.getLogger(SyncReportWriter.class);

    private final ObjectMapper objectMapper;

    public SyncReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Path target, SyncReportDto report) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report) + "\n");
        log.info("[Report] Wrote sync report to {}", target);
    }
}
