package com.example.cronscheduler.service.callback;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CallbackRegistry Tests")
class CallbackRegistryTest {

    private CallbackRegistry registry;

    private final JobCallbackHandler reportHandler = new JobCallbackHandler() {
        @Override
        public String getKind() {
            return "report";
        }

        @Override
        public Map<String, Object> run(Map<String, Object> callbackConfig) {
            return Map.of("rows", 10);
        }
    };

    @BeforeEach
    void setUp() {
        registry = new CallbackRegistry(List.of(reportHandler));
        registry.initialize();
    }

    @Test
    @DisplayName("Should register handler beans by kind")
    void shouldRegisterHandlerBeans() {
        assertThat(registry.getCallback("report")).containsSame(reportHandler);
        assertThat(registry.getRegisteredKinds()).containsExactly("report");
    }

    @Test
    @DisplayName("Should return empty for an unregistered kind")
    void shouldReturnEmptyForUnknownKind() {
        assertThat(registry.getCallback("cleanup")).isEmpty();
        assertThat(registry.getCallback(null)).isEmpty();
    }

    @Test
    @DisplayName("Should register and replace callbacks at runtime")
    void shouldRegisterAtRuntime() {
        JobCallback first = config -> Map.of();
        JobCallback second = config -> Map.of("v", 2);

        registry.register("cleanup", first);
        registry.register("cleanup", second);

        assertThat(registry.getCallback("cleanup")).containsSame(second);
        assertThat(registry.getRegisteredKinds()).containsExactly("cleanup", "report");
    }

    @Test
    @DisplayName("Should reject a blank kind")
    void shouldRejectBlankKind() {
        assertThatThrownBy(() -> registry.register(" ", config -> Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
