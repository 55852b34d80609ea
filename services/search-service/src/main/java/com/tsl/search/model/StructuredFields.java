package com.tsl.search.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

public final class StructuredFields {
    private static final StructuredFields EMPTY = new StructuredFields(null, null, Set.of(), null, false);

    private final String city;
    private final String country;
    private final Set<String> activities;
    private final PriceTier priceTier;
    private final boolean partial;

    public StructuredFields(String city, String country, Set<String> activities, PriceTier priceTier, boolean partial) {
        this.city = blankToNull(city);
        this.country = blankToNull(country);
        this.activities = activities == null
            ? Set.of()
            : Collections.unmodifiableSet(new TreeSet<>(activities));
        this.priceTier = priceTier;
        this.partial = partial;
    }

    public static StructuredFields empty() {
        return EMPTY;
    }

    public StructuredFields withAdditionalActivities(Set<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Set<String> merged = new LinkedHashSet<>(activities);
        merged.addAll(extra);
        return new StructuredFields(city, country, merged, priceTier, partial);
    }

    public String getCity() {
        return city;
    }

    public String getCountry() {
        return country;
    }

    public Set<String> getActivities() {
        return activities;
    }

    public PriceTier getPriceTier() {
        return priceTier;
    }

    public boolean isPartial() {
        return partial;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StructuredFields other)) {
            return false;
        }
        return partial == other.partial
            && Objects.equals(city, other.city)
            && Objects.equals(country, other.country)
            && activities.equals(other.activities)
            && priceTier == other.priceTier;
    }

    @Override
    public int hashCode() {
        return Objects.hash(city, country, activities, priceTier, partial);
    }

    @Override
    public String toString() {
        return "StructuredFields{city=" + city + ", country=" + country + ", activities=" + activities
            + ", priceTier=" + priceTier + ", partial=" + partial + "}";
    }
}
