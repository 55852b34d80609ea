package com.tsl.search.index;

import com.tsl.search.model.StructuredFields;
import com.tsl.search.model.StructuredFilter;
import java.util.Locale;

public final class StructuredFilterPredicate {
    private StructuredFilterPredicate() {
    }

    public static boolean matches(StructuredFields fields, StructuredFilter filter) {
        if (filter == null || filter.isUnconstrained()) {
            return true;
        }
        if (fields == null) {
            return false;
        }
        if (filter.getCity() != null && !sameValue(filter.getCity(), fields.getCity())) {
            return false;
        }
        if (filter.getCountry() != null && !sameValue(filter.getCountry(), fields.getCountry())) {
            return false;
        }
        if (!filter.getActivities().isEmpty()) {
            for (String activity : filter.getActivities()) {
                if (fields.getActivities().contains(activity)) {
                    return true;
                }
            }
            return false;
        }
        return true;
    }

    private static boolean sameValue(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return expected.trim().toLowerCase(Locale.ROOT).equals(actual.trim().toLowerCase(Locale.ROOT));
    }
}
