package com.tsl.search.index;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tsl.search.model.StructuredFields;
import com.tsl.search.model.StructuredFilter;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StructuredFilterPredicateTest {
    private final StructuredFields florence = new StructuredFields(
        "Florence", "Italy", Set.of("museum", "wine_tasting"), null, false
    );

    @Test
    void unconstrainedFilterMatchesEverything() {
        assertTrue(StructuredFilterPredicate.matches(florence, null));
        assertTrue(StructuredFilterPredicate.matches(StructuredFields.empty(), StructuredFilter.unconstrained()));
    }

    @Test
    void cityAndCountryCompareIgnoringCase() {
        assertTrue(StructuredFilterPredicate.matches(florence, new StructuredFilter(" florence ", "ITALY", Set.of())));
        assertFalse(StructuredFilterPredicate.matches(florence, new StructuredFilter("Rome", null, Set.of())));
    }

    @Test
    void activitiesNeedOneInCommon() {
        assertTrue(StructuredFilterPredicate.matches(florence, new StructuredFilter(null, null, Set.of("hiking", "museum"))));
        assertFalse(StructuredFilterPredicate.matches(florence, new StructuredFilter(null, null, Set.of("hiking"))));
    }

    @Test
    void unknownFieldFailsConstraint() {
        assertFalse(StructuredFilterPredicate.matches(StructuredFields.empty(), new StructuredFilter(null, "Italy", Set.of())));
    }
}
