package com.example.cronscheduler.service.callback;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookCallback Tests")
class WebhookCallbackTest {

    @Mock
    private WebhookClient webhookClient;

    @InjectMocks
    private WebhookCallback webhookCallback;

    @Test
    @DisplayName("Should have the webhook kind")
    void shouldHaveWebhookKind() {
        assertThat(webhookCallback.getKind()).isEqualTo("webhook");
    }

    @Test
    @DisplayName("Should build a request from the callback config")
    void shouldBuildRequest() {
        var config = new HashMap<String, Object>();
        config.put("kind", "webhook");
        config.put("url", "https://hooks.example.com/ping");
        config.put("method", "put");
        config.put("headers", Map.of("X-Token", 123));
        config.put("body", Map.of("event", "tick"));
        config.put("timeoutSeconds", 5);

        var request = WebhookCallback.toRequest(config);

        assertThat(request.getUrl()).isEqualTo("https://hooks.example.com/ping");
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getHeaders()).containsEntry("X-Token", "123");
        assertThat(request.getBody()).isEqualTo(Map.of("event", "tick"));
        assertThat(request.getTimeoutSeconds()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should default to POST with a 30 second timeout")
    void shouldApplyDefaults() {
        var request = WebhookCallback.toRequest(Map.of("url", "http://localhost/hook"));

        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getTimeoutSeconds()).isEqualTo(30);
        assertThat(request.getHeaders()).isEmpty();
        assertThat(request.getBody()).isNull();
    }

    @Test
    @DisplayName("Should fail without a url")
    void shouldFailWithoutUrl() {
        assertThatThrownBy(() -> webhookCallback.run(Map.of("kind", "webhook")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("url");

        verify(webhookClient, never()).call(any());
    }

    @Test
    @DisplayName("Should return the client output")
    void shouldReturnClientOutput() {
        when(webhookClient.call(any())).thenReturn(Map.of("statusCode", 204));

        var output = webhookCallback.run(Map.of("url", "http://localhost/hook"));

        assertThat(output).containsEntry("statusCode", 204);
    }
}
