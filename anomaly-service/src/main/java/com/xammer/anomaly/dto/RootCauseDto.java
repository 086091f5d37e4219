package com.xammer.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A single attributed contributor to an anomaly. Dimension fields the billing
 * service did not report stay {@code null}.
 */
@Value
@Builder
@JsonPropertyOrder({"Service", "Region", "UsageType", "LinkedAccount", "LinkedAccountName",
        "Tags", "CostImpact", "CostUsageGraph"})
public class RootCauseDto implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("Service")
    String service;

    @JsonProperty("Region")
    String region;

    @JsonProperty("UsageType")
    String usageType;

    @JsonProperty("LinkedAccount")
    String linkedAccountId;

    @JsonProperty("LinkedAccountName")
    String linkedAccountName;

    @JsonProperty("CostImpact")
    @Builder.Default
    CostAmount costImpact = CostAmount.ZERO;

    @JsonProperty("Tags")
    @Singular
    Map<String, String> tags;

    @JsonProperty("CostUsageGraph")
    @Singular("usagePoint")
    List<UsagePointDto> usageSeries;
}
