package com.xammer.anomaly.service;

import com.xammer.anomaly.dto.AnomalyReportDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Collects the default window once at startup and writes it to disk.
 */
@Component
@ConditionalOnProperty(name = "anomaly.report.export.enabled", havingValue = "true")
public class AnomalyReportRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyReportRunner.class);

    private final AnomalyAggregator anomalyAggregator;
    private final AnomalyReportExporter exporter;
    private final Path exportPath;

    public AnomalyReportRunner(AnomalyAggregator anomalyAggregator,
                               AnomalyReportExporter exporter,
                               @Value("${anomaly.report.export.path:aws_anomalies_detailed.json}") String exportPath) {
        this.anomalyAggregator = anomalyAggregator;
        this.exporter = exporter;
        this.exportPath = Paths.get(exportPath);
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        logger.info("--- RUNNING STARTUP ANOMALY EXPORT to {} ---", exportPath);
        AnomalyReportDto report = anomalyAggregator.collect();
        exporter.export(report, exportPath);
    }
}
