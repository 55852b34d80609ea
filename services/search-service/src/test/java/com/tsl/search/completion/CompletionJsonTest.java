package com.tsl.search.completion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

class CompletionJsonTest {

    @Test
    void readsObjectWrappedInFencesAndProse() {
        JsonNode node = CompletionJson.parseObject(
            "Here you go:\n```json\n{\"city\": \"Florence\", \"activities\": [\"wine tasting\"]}\n```"
        );

        assertThat(CompletionJson.optionalText(node, "city")).isEqualTo("Florence");
        assertThat(CompletionJson.textList(node, "activities")).containsExactly("wine tasting");
    }

    @Test
    void nullLikeWordsReadAsAbsent() {
        JsonNode node = CompletionJson.parseObject("{\"city\": \"N/A\", \"country\": null, \"activities\": [\"none\", \"hiking\"]}");

        assertThat(CompletionJson.optionalText(node, "city")).isNull();
        assertThat(CompletionJson.optionalText(node, "country")).isNull();
        assertThat(CompletionJson.optionalText(node, "missing")).isNull();
        assertThat(CompletionJson.textList(node, "activities")).containsExactly("hiking");
    }

    @Test
    void bareStringCountsAsSingleItemList() {
        JsonNode node = CompletionJson.parseObject("{\"activities\": \"diving\"}");

        assertThat(CompletionJson.textList(node, "activities")).containsExactly("diving");
        assertThat(CompletionJson.textList(node, "other")).isEmpty();
    }

    @Test
    void rejectsNonObjectOutput() {
        assertThatThrownBy(() -> CompletionJson.parseObject("  "))
            .isInstanceOf(MalformedCompletionException.class)
            .hasMessage("completion_blank");
        assertThatThrownBy(() -> CompletionJson.parseObject("[1, 2]"))
            .isInstanceOf(MalformedCompletionException.class)
            .hasMessage("completion_not_object");
        assertThatThrownBy(() -> CompletionJson.parseObject("{\"city\": }"))
            .isInstanceOf(MalformedCompletionException.class)
            .hasMessage("completion_invalid_json");
    }

    @Test
    void rejectsWrongFieldShapes() {
        JsonNode node = CompletionJson.parseObject("{\"city\": {\"name\": \"Rome\"}, \"activities\": 3}");

        assertThatThrownBy(() -> CompletionJson.optionalText(node, "city"))
            .isInstanceOf(MalformedCompletionException.class)
            .hasMessage("completion_field_not_scalar:city");
        assertThatThrownBy(() -> CompletionJson.textList(node, "activities"))
            .isInstanceOf(MalformedCompletionException.class)
            .hasMessage("completion_field_not_list:activities");
    }
}
