package com.hwbscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Setup {
    public final String id;
    public final LocalDate date;
    public final SetupKind kind;
    public final double confidence;
    public final double zoneLower;
    public final double zoneUpper;
    public final SetupStatus status;

    public boolean isActive() {
        return status == SetupStatus.ACTIVE;
    }

    public Setup consume() {
        return toBuilder().status(status.consume()).build();
    }

    public double zoneMidpoint() {
        return (zoneLower + zoneUpper) / 2.0;
    }
}
