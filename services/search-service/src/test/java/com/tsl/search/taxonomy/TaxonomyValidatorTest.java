package com.tsl.search.taxonomy;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TaxonomyValidatorTest {

    @Test
    void acceptsConsistentTaxonomy() {
        TaxonomyDefinition definition = definition(
            Map.of("hikes", "hiking", "scuba", "diving"),
            Map.of("outdoor", List.of("hiking", "diving"))
        );

        assertThatCode(() -> TaxonomyValidator.validate(definition)).doesNotThrowAnyException();
    }

    @Test
    void rejectsKeyMappedToTwoActivities() {
        Map<Object, Object> synonyms = new LinkedHashMap<>();
        synonyms.put("dive", "diving");
        synonyms.put("Dives", "snorkeling");

        assertThatThrownBy(() -> TaxonomyValidator.validate(definition(synonyms, Map.of("water", List.of("diving")))))
            .isInstanceOf(TaxonomyConfigurationException.class)
            .hasMessageContaining("ambiguous key 'dive'");
    }

    @Test
    void rejectsEmptyCategory() {
        assertThatThrownBy(() -> TaxonomyValidator.validate(
            definition(Map.of("hikes", "hiking"), Map.of("outdoor", List.of()))
        ))
            .isInstanceOf(TaxonomyConfigurationException.class)
            .hasMessageContaining("outdoor");
    }

    @Test
    void rejectsCategoryNamedLikeActivity() {
        assertThatThrownBy(() -> TaxonomyValidator.validate(
            definition(Map.of("hikes", "hiking"), Map.of("hiking", List.of("hiking")))
        ))
            .isInstanceOf(TaxonomyConfigurationException.class)
            .hasMessageContaining("collides");
    }

    @Test
    void rejectsMalformedActivityId() {
        assertThatThrownBy(() -> TaxonomyValidator.validate(
            definition(Map.of("hikes", "Hiking Trips"), Map.of("outdoor", List.of("hiking")))
        ))
            .isInstanceOf(TaxonomyConfigurationException.class)
            .hasMessageContaining("invalid activity id");
    }

    @Test
    void rejectsEmptyTables() {
        assertThatThrownBy(() -> TaxonomyValidator.validate(definition(Map.of(), Map.of("a", List.of("b")))))
            .isInstanceOf(TaxonomyConfigurationException.class)
            .hasMessage("synonyms table empty");
        assertThatThrownBy(() -> TaxonomyValidator.validate(null))
            .isInstanceOf(TaxonomyConfigurationException.class);
    }

    private static TaxonomyDefinition definition(Map<?, ?> synonyms, Map<?, ?> categories) {
        return new TaxonomyDefinition("test", new LinkedHashMap<>(synonyms), new LinkedHashMap<>(categories));
    }
}
