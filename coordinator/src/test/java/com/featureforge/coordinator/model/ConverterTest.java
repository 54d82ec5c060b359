package com.featureforge.coordinator.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConverterTest {

    private final PayloadConverter    payloads = new PayloadConverter();
    private final StringListConverter lists    = new StringListConverter();

    @Test
    void payload_nestedValues_surviveStorage() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chunk_id", "t1_a");
        payload.put("files", List.of("a.py", "b.py"));
        payload.put("retryable", true);

        Map<String, Object> back = payloads.convertToEntityAttribute(payloads.convertToDatabaseColumn(payload));

        assertThat(back).containsEntry("chunk_id", "t1_a")
                .containsEntry("files", List.of("a.py", "b.py"))
                .containsEntry("retryable", true);
    }

    @Test
    void payload_nullOrBlankColumn_isEmptyMap() {
        assertThat(payloads.convertToDatabaseColumn(null)).isEqualTo("{}");
        assertThat(payloads.convertToEntityAttribute(null)).isEmpty();
        assertThat(payloads.convertToEntityAttribute("  ")).isEmpty();
    }

    @Test
    void payload_corruptColumn_throws() {
        assertThatThrownBy(() -> payloads.convertToEntityAttribute("{not json"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stringList_keepsOrder() {
        String column = lists.convertToDatabaseColumn(List.of("b.py", "a.py"));

        assertThat(lists.convertToEntityAttribute(column)).containsExactly("b.py", "a.py");
    }
}
