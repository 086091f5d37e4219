package com.xammer.anomaly.service;

import software.amazon.awssdk.services.costexplorer.model.Anomaly;
import software.amazon.awssdk.services.costexplorer.model.DateInterval;
import software.amazon.awssdk.services.costexplorer.model.GetAnomaliesResponse;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageResponse;
import software.amazon.awssdk.services.costexplorer.model.Impact;
import software.amazon.awssdk.services.costexplorer.model.MetricValue;
import software.amazon.awssdk.services.costexplorer.model.ResultByTime;
import software.amazon.awssdk.services.costexplorer.model.RootCause;
import software.amazon.awssdk.services.costexplorer.model.RootCauseImpact;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class CostExplorerFixtures {

    private CostExplorerFixtures() {
    }

    static Anomaly anomaly(String id, String start, String end, Double totalImpact, RootCause... rootCauses) {
        Anomaly.Builder builder = Anomaly.builder()
                .anomalyId(id)
                .anomalyStartDate(start)
                .anomalyEndDate(end)
                .rootCauses(rootCauses);
        if (totalImpact != null) {
            builder.impact(Impact.builder().maxImpact(totalImpact).totalImpact(totalImpact).build());
        }
        return builder.build();
    }

    static RootCause rootCause(String service, String region, Double contribution) {
        RootCause.Builder builder = RootCause.builder()
                .service(service)
                .region(region)
                .usageType("USE1-BoxUsage:m5.large")
                .linkedAccount("123456789012")
                .linkedAccountName("production");
        if (contribution != null) {
            builder.impact(RootCauseImpact.builder().contribution(contribution).build());
        }
        return builder.build();
    }

    static GetAnomaliesResponse page(String nextToken, Anomaly... anomalies) {
        return GetAnomaliesResponse.builder()
                .anomalies(anomalies)
                .nextPageToken(nextToken)
                .build();
    }

    static GetCostAndUsageResponse dailyCosts(LocalDate first, String... amounts) {
        List<ResultByTime> results = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            LocalDate day = first.plusDays(i);
            results.add(ResultByTime.builder()
                    .timePeriod(DateInterval.builder().start(day.toString()).end(day.plusDays(1).toString()).build())
                    .total(Map.of(UsageSeriesFetcher.METRIC,
                            MetricValue.builder().amount(amounts[i]).unit("USD").build()))
                    .build());
        }
        return GetCostAndUsageResponse.builder().resultsByTime(results).build();
    }
}
