package com.xammer.anomaly.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.anomaly.dto.AnomalyReportDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes an anomaly report as an indented JSON array.
 */
@Service
public class AnomalyReportExporter {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyReportExporter.class);

    private final ObjectMapper objectMapper;

    public AnomalyReportExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path export(AnomalyReportDto report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
        logger.info("Saved {} entries to {}", report.size(), target);
        return target;
    }
}
