package com.example.cronscheduler.service.callback;

import com.example.cronscheduler.exception.ExternalServiceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WebhookClient Tests")
class WebhookClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WebhookClient clientAnswering(HttpStatus status, String body) {
        var webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "text/plain")
                            .body(body)
                            .build());
                })
                .build();
        return new WebhookClient(webClient);
    }

    @Test
    @DisplayName("Should send method, url and headers and return status and body")
    void shouldCallEndpoint() {
        // Given
        var client = clientAnswering(HttpStatus.OK, "pong");
        var request = WebhookRequest.builder()
                .url("http://localhost/hook")
                .method("PUT")
                .headers(Map.of("X-Token", "secret"))
                .body(Map.of("event", "tick"))
                .build();

        // When
        var output = client.call(request);

        // Then
        assertThat(output)
                .containsEntry("url", "http://localhost/hook")
                .containsEntry("statusCode", 200)
                .containsEntry("body", "pong");
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.PUT);
        assertThat(lastRequest.get().headers().getFirst("X-Token")).isEqualTo("secret");
    }

    @Test
    @DisplayName("Should raise an external service error on a 5xx response")
    void shouldRaiseOnServerError() {
        var client = clientAnswering(HttpStatus.INTERNAL_SERVER_ERROR, "oops");

        assertThatThrownBy(() -> client.call(WebhookRequest.builder().url("http://localhost/hook").build()))
                .isInstanceOfSatisfying(ExternalServiceException.class, e -> {
                    assertThat(e.getHttpStatusCode()).isEqualTo(500);
                    assertThat(e.getResponseBody()).isEqualTo("oops");
                });
    }
}
