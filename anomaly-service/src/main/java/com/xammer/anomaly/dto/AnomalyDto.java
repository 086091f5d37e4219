package com.xammer.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@JsonPropertyOrder({"AnomalyId", "StartDate", "EndDate", "LastDetectedDate", "DurationInDays",
        "TotalCostImpact", "AverageDailyCost", "Currency", "RootCauses"})
public class AnomalyDto implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CURRENCY = "USD";

    @JsonProperty("AnomalyId")
    String id;

    @JsonProperty("StartDate")
    LocalDate startDate;

    @JsonProperty("EndDate")
    LocalDate endDate;

    @JsonProperty("DurationInDays")
    int durationDays;

    @JsonProperty("TotalCostImpact")
    CostAmount totalImpact;

    @JsonProperty("AverageDailyCost")
    CostAmount averageDailyImpact;

    @JsonProperty("RootCauses")
    @Singular
    List<RootCauseDto> rootCauses;

    @JsonProperty("Currency")
    public String getCurrency() {
        return CURRENCY;
    }

    /**
     * The billing service reports the last detection on the anomaly's end date.
     */
    @JsonProperty("LastDetectedDate")
    public LocalDate getLastDetectedDate() {
        return endDate;
    }
}
