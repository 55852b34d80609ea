package com.tsl.search.model;

import java.util.Locale;

public enum PriceTier {
    BUDGET,
    MID_RANGE,
    LUXURY;

    public static PriceTier fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (normalized.isEmpty()) {
            return null;
        }
        switch (normalized) {
            case "budget":
            case "cheap":
            case "low":
                return BUDGET;
            case "mid_range":
            case "midrange":
            case "moderate":
            case "medium":
                return MID_RANGE;
            case "luxury":
            case "premium":
            case "high":
                return LUXURY;
            default:
                return null;
        }
    }
}
