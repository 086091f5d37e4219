package com.xammer.anomaly.service;

import lombok.Value;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Inclusive range of calendar days the anomaly listing covers.
 */
@Value
public class AnomalyDateWindow {

    LocalDate start;
    LocalDate end;

    public AnomalyDateWindow(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date window requires both a start and an end date");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Date window start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static AnomalyDateWindow lastDays(Clock clock, int days) {
        LocalDate today = LocalDate.now(clock);
        return new AnomalyDateWindow(today.minusDays(days), today);
    }
}
