package com.xammer.anomaly.service;

import com.xammer.anomaly.dto.CostAmount;
import com.xammer.anomaly.dto.RootCauseDto;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.costexplorer.model.RootCause;

import java.time.LocalDate;

/**
 * Normalizes a root cause reported by Cost Anomaly Detection and attaches its daily usage series.
 */
@Service
public class RootCauseResolver {

    private final UsageSeriesFetcher usageSeriesFetcher;
    private final RootCauseTagProvider tagProvider;

    public RootCauseResolver(UsageSeriesFetcher usageSeriesFetcher, RootCauseTagProvider tagProvider) {
        this.usageSeriesFetcher = usageSeriesFetcher;
        this.tagProvider = tagProvider;
    }

    public RootCauseDto resolve(RootCause rootCause, LocalDate anomalyStart, LocalDate anomalyEnd) {
        UsageDimensions dimensions = dimensionsOf(rootCause);

        return RootCauseDto.builder()
                .service(rootCause.service())
                .region(rootCause.region())
                .usageType(rootCause.usageType())
                .linkedAccountId(rootCause.linkedAccount())
                .linkedAccountName(rootCause.linkedAccountName())
                .costImpact(contributionOf(rootCause))
                .tags(tagProvider.tagsFor(rootCause))
                .usageSeries(usageSeriesFetcher.fetch(anomalyStart, anomalyEnd, dimensions))
                .build();
    }

    static UsageDimensions dimensionsOf(RootCause rootCause) {
        return UsageDimensions.builder()
                .with(CostDimension.SERVICE, rootCause.service())
                .with(CostDimension.REGION, rootCause.region())
                .with(CostDimension.USAGE_TYPE, rootCause.usageType())
                .with(CostDimension.LINKED_ACCOUNT, rootCause.linkedAccount())
                .build();
    }

    private static CostAmount contributionOf(RootCause rootCause) {
        if (rootCause.impact() == null) {
            return CostAmount.ZERO;
        }
        return CostAmount.of(rootCause.impact().contribution());
    }
}
