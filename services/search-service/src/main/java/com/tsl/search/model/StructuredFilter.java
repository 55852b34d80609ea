package com.tsl.search.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

public final class StructuredFilter {
    private static final StructuredFilter UNCONSTRAINED = new StructuredFilter(null, null, Set.of());

    private final String city;
    private final String country;
    private final Set<String> activities;

    public StructuredFilter(String city, String country, Set<String> activities) {
        this.city = blankToNull(city);
        this.country = blankToNull(country);
        this.activities = activities == null
            ? Set.of()
            : Collections.unmodifiableSet(new TreeSet<>(activities));
    }

    public static StructuredFilter unconstrained() {
        return UNCONSTRAINED;
    }

    public boolean isUnconstrained() {
        return city == null && country == null && activities.isEmpty();
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
        if (!(o instanceof StructuredFilter other)) {
            return false;
        }
        return Objects.equals(city, other.city)
            && Objects.equals(country, other.country)
            && activities.equals(other.activities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(city, country, activities);
    }

    @Override
    public String toString() {
        return "StructuredFilter{city=" + city + ", country=" + country + ", activities=" + activities + "}";
    }
}
