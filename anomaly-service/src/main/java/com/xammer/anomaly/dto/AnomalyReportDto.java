package com.xammer.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * Result of one aggregation run: anomalies in the order the billing service returned them
 * across all pages. Serializes as a bare JSON array.
 */
@Value
public class AnomalyReportDto implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonValue
    List<AnomalyDto> anomalies;

    public AnomalyReportDto(List<AnomalyDto> anomalies) {
        this.anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    public int size() {
        return anomalies.size();
    }

    public boolean isEmpty() {
        return anomalies.isEmpty();
    }
}
