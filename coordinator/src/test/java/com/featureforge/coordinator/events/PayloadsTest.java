package com.featureforge.coordinator.events;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadsTest {

    @Test
    void of_keepsOrderAndAllowsNull() {
        Map<String, Object> payload = Payloads.of("task_id", "t1", "handle", null, "attempt", 2);

        assertThat(payload.keySet()).containsExactly("task_id", "handle", "attempt");
        assertThat(payload).containsEntry("handle", null).containsEntry("attempt", 2);
    }

    @Test
    void of_oddArgumentCount_throws() {
        assertThatThrownBy(() -> Payloads.of("task_id"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
