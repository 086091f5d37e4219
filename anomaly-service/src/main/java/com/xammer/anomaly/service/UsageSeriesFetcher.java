package com.xammer.anomaly.service;

import com.xammer.anomaly.dto.AnomalyDto;
import com.xammer.anomaly.dto.UsagePointDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costexplorer.model.DateInterval;
import software.amazon.awssdk.services.costexplorer.model.DimensionValues;
import software.amazon.awssdk.services.costexplorer.model.Expression;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageRequest;
import software.amazon.awssdk.services.costexplorer.model.Granularity;
import software.amazon.awssdk.services.costexplorer.model.MetricValue;
import software.amazon.awssdk.services.costexplorer.model.ResultByTime;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Retrieves the daily unblended cost attributable to one set of dimension values.
 */
@Service
public class UsageSeriesFetcher {

    private static final Logger logger = LoggerFactory.getLogger(UsageSeriesFetcher.class);

    static final String METRIC = "UnblendedCost";

    private final CostExplorerClient costExplorerClient;

    public UsageSeriesFetcher(CostExplorerClient costExplorerClient) {
        this.costExplorerClient = costExplorerClient;
    }

    /**
     * Daily cost series for {@code [start, end]} inclusive. Never throws: any failure is logged
     * and yields an empty list so one lookup cannot abort the anomaly it belongs to.
     */
    public List<UsagePointDto> fetch(LocalDate start, LocalDate end, UsageDimensions dimensions) {
        try {
            GetCostAndUsageRequest request = buildRequest(start, end, dimensions);
            logger.debug("Querying daily cost {} to {} (exclusive) for {}",
                    request.timePeriod().start(), request.timePeriod().end(), dimensions);

            List<UsagePointDto> points = new ArrayList<>();
            for (ResultByTime result : costExplorerClient.getCostAndUsage(request).resultsByTime()) {
                points.add(toUsagePoint(result));
            }
            return points;
        } catch (Exception e) {
            logger.error("❌ Error fetching cost usage for root cause {}: {}", dimensions, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    static GetCostAndUsageRequest buildRequest(LocalDate start, LocalDate end, UsageDimensions dimensions) {
        GetCostAndUsageRequest.Builder requestBuilder = GetCostAndUsageRequest.builder()
                .timePeriod(DateInterval.builder()
                        .start(start.toString())
                        .end(end.plusDays(1).toString()) // Cost Explorer is exclusive of end date
                        .build())
                .granularity(Granularity.DAILY)
                .metrics(METRIC);

        Expression filter = buildFilter(dimensions);
        if (filter != null) {
            requestBuilder.filter(filter);
        }
        return requestBuilder.build();
    }

    /**
     * No filter for zero dimensions, a bare equality clause for one, an {@code And} of
     * equality clauses for two or more.
     */
    static Expression buildFilter(UsageDimensions dimensions) {
        List<Expression> clauses = new ArrayList<>();
        for (Map.Entry<CostDimension, String> entry : dimensions.asMap().entrySet()) {
            clauses.add(Expression.builder()
                    .dimensions(DimensionValues.builder()
                            .key(entry.getKey().getSdkDimension())
                            .values(entry.getValue())
                            .build())
                    .build());
        }

        if (clauses.isEmpty()) {
            return null;
        }
        return clauses.size() == 1
                ? clauses.get(0)
                : Expression.builder().and(clauses).build();
    }

    private static UsagePointDto toUsagePoint(ResultByTime result) {
        MetricValue metric = result.total().get(METRIC);
        String amount = metric != null && metric.amount() != null ? metric.amount() : "0";
        String unit = metric != null && metric.unit() != null ? metric.unit() : AnomalyDto.CURRENCY;
        return new UsagePointDto(LocalDate.parse(result.timePeriod().start()), new BigDecimal(amount), unit);
    }
}
