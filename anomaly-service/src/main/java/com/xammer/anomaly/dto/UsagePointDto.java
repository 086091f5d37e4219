package com.xammer.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One daily bucket of unblended cost for a root cause.
 */
@Value
@JsonPropertyOrder({"Date", "Amount", "Unit"})
public class UsagePointDto implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("Date")
    LocalDate date;

    @JsonIgnore
    BigDecimal amount;

    @JsonProperty("Unit")
    String unit;

    @JsonProperty("Amount")
    public String getAmountText() {
        return amount.toPlainString();
    }
}
