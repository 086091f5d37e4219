package com.xammer.anomaly.service;

import com.xammer.anomaly.dto.AnomalyDto;
import com.xammer.anomaly.dto.AnomalyReportDto;
import com.xammer.anomaly.dto.CostAmount;
import com.xammer.anomaly.dto.RootCauseDto;
import com.xammer.anomaly.exception.AnomalyRetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costexplorer.model.Anomaly;
import software.amazon.awssdk.services.costexplorer.model.AnomalyDateInterval;
import software.amazon.awssdk.services.costexplorer.model.GetAnomaliesRequest;
import software.amazon.awssdk.services.costexplorer.model.GetAnomaliesResponse;
import software.amazon.awssdk.services.costexplorer.model.RootCause;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Pages through Cost Anomaly Detection results and assembles the anomaly report.
 */
@Service
public class AnomalyAggregator {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyAggregator.class);

    private final CostExplorerClient costExplorerClient;
    private final RootCauseResolver rootCauseResolver;
    private final Executor fetchExecutor;
    private final Clock clock;
    private final int lookbackDays;
    private final int fetchParallelism;

    @Autowired
    public AnomalyAggregator(CostExplorerClient costExplorerClient,
                             RootCauseResolver rootCauseResolver,
                             @Qualifier("anomalyFetchExecutor") Executor fetchExecutor,
                             Clock clock,
                             @Value("${anomaly.report.lookback-days:90}") int lookbackDays,
                             @Value("${anomaly.report.fetch-parallelism:1}") int fetchParallelism) {
        this.costExplorerClient = costExplorerClient;
        this.rootCauseResolver = rootCauseResolver;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
        this.lookbackDays = lookbackDays;
        this.fetchParallelism = fetchParallelism;
    }

    public AnomalyDateWindow defaultWindow() {
        return AnomalyDateWindow.lastDays(clock, lookbackDays);
    }

    public AnomalyReportDto collect() {
        return collect(defaultWindow());
    }

    /**
     * Runs one aggregation over {@code window}.
     *
     * @throws AnomalyRetrievalException if any listing page fails or cannot be interpreted
     */
    public AnomalyReportDto collect(AnomalyDateWindow window) {
        logger.info("Fetching cost anomalies from {} to {}...", window.getStart(), window.getEnd());

        List<AnomalyDto> anomalies = new ArrayList<>();
        Set<String> seenTokens = new HashSet<>();
        String nextToken = null;
        int pages = 0;

        do {
            GetAnomaliesResponse page = fetchPage(window, nextToken);
            pages++;
            for (Anomaly anomaly : page.anomalies()) {
                anomalies.add(toAnomaly(anomaly));
            }
            logger.debug("Page {} returned {} anomalies", pages, page.anomalies().size());

            nextToken = page.nextPageToken();
            if (hasMorePages(nextToken) && !seenTokens.add(nextToken)) {
                throw new AnomalyRetrievalException("Anomaly listing returned a repeated page token after "
                        + pages + " pages");
            }
        } while (hasMorePages(nextToken));

        logger.info("✅ Collected {} anomalies across {} pages", anomalies.size(), pages);
        return new AnomalyReportDto(anomalies);
    }

    static boolean hasMorePages(String nextToken) {
        return nextToken != null && !nextToken.isEmpty();
    }

    private GetAnomaliesResponse fetchPage(AnomalyDateWindow window, String nextToken) {
        GetAnomaliesRequest.Builder request = GetAnomaliesRequest.builder()
                .dateInterval(AnomalyDateInterval.builder()
                        .startDate(window.getStart().toString())
                        .endDate(window.getEnd().toString())
                        .build());
        if (nextToken != null) {
            request.nextPageToken(nextToken);
        }
        logger.debug("Requesting anomaly page with token {}", nextToken);

        try {
            return costExplorerClient.getAnomalies(request.build());
        } catch (SdkException e) {
            logger.error("❌ Could not list cost anomalies from {} to {}: {}",
                    window.getStart(), window.getEnd(), e.getMessage(), e);
            throw new AnomalyRetrievalException("Failed to list cost anomalies: " + e.getMessage(), e);
        }
    }

    private AnomalyDto toAnomaly(Anomaly anomaly) {
        LocalDate start = parseDate(anomaly.anomalyId(), anomaly.anomalyStartDate());
        LocalDate end = anomaly.anomalyEndDate() != null
                ? parseDate(anomaly.anomalyId(), anomaly.anomalyEndDate())
                : LocalDate.now(clock);

        int duration = durationDays(start, end);
        Double rawImpact = anomaly.impact() != null ? anomaly.impact().totalImpact() : null;

        return AnomalyDto.builder()
                .id(anomaly.anomalyId())
                .startDate(start)
                .endDate(end)
                .durationDays(duration)
                .totalImpact(CostAmount.of(rawImpact))
                .averageDailyImpact(averageDailyImpact(rawImpact, duration))
                .rootCauses(resolveRootCauses(anomaly.rootCauses(), start, end))
                .build();
    }

    private List<RootCauseDto> resolveRootCauses(List<RootCause> rootCauses, LocalDate start, LocalDate end) {
        if (fetchParallelism <= 1 || rootCauses.size() <= 1) {
            List<RootCauseDto> resolved = new ArrayList<>(rootCauses.size());
            for (RootCause rootCause : rootCauses) {
                resolved.add(rootCauseResolver.resolve(rootCause, start, end));
            }
            return resolved;
        }

        // One task per root cause; joined by index so completion order never leaks into the report
        List<CompletableFuture<RootCauseDto>> tasks = new ArrayList<>(rootCauses.size());
        for (RootCause rootCause : rootCauses) {
            tasks.add(CompletableFuture.supplyAsync(
                    () -> rootCauseResolver.resolve(rootCause, start, end), fetchExecutor));
        }
        List<RootCauseDto> resolved = new ArrayList<>(tasks.size());
        for (CompletableFuture<RootCauseDto> task : tasks) {
            resolved.add(task.join());
        }
        return resolved;
    }

    /**
     * Divides the unrounded impact so the average is rounded once, not after the total is.
     */
    static CostAmount averageDailyImpact(Double rawImpact, int duration) {
        if (rawImpact == null || rawImpact.isNaN() || rawImpact.isInfinite()) {
            return CostAmount.ZERO;
        }
        return CostAmount.of(BigDecimal.valueOf(rawImpact)
                .divide(BigDecimal.valueOf(Math.max(1, duration)), 2, RoundingMode.HALF_UP));
    }

    /**
     * Inclusive day count, never below one.
     */
    static int durationDays(LocalDate start, LocalDate end) {
        long days = ChronoUnit.DAYS.between(start, end) + 1;
        return (int) Math.max(1, days);
    }

    /**
     * Anomaly timestamps look like {@code 2024-05-01T00:00:00Z}; only the date part is kept.
     */
    static LocalDate parseDate(String anomalyId, String timestamp) {
        if (timestamp == null) {
            throw new AnomalyRetrievalException("Anomaly " + anomalyId + " has no start date");
        }
        try {
            return LocalDate.parse(timestamp.split("T", 2)[0]);
        } catch (DateTimeParseException e) {
            throw new AnomalyRetrievalException("Anomaly " + anomalyId + " has an unparsable date '"
                    + timestamp + "'", e);
        }
    }
}
