package com.example.cronscheduler.service.callback;

import com.example.cronscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Client for arbitrary HTTP endpoints called by webhook jobs.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff
 * - WebClient, blocking on the executor worker thread
 */
@Slf4j
@Component
public class WebhookClient {

    private static final String TARGET = "Webhook";

    private final WebClient webClient;

    public WebhookClient(@Qualifier("webhookWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Call an endpoint and return its status and body
     *
     * @throws ExternalServiceException on non-2xx responses and transport failures
     */
    @CircuitBreaker(name = "webhook", fallbackMethod = "callFallback")
    @Retry(name = "webhook")
    public Map<String, Object> call(WebhookRequest request) {
        log.info("Calling webhook {} {}", request.getMethod(), request.getUrl());

        try {
            var spec = webClient.method(HttpMethod.valueOf(request.getMethod()))
                    .uri(request.getUrl())
                    .headers(headers -> request.getHeaders().forEach(headers::set));
            WebClient.RequestHeadersSpec<?> call = request.getBody() == null ? spec : spec.bodyValue(request.getBody());

            var response = call.retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(TARGET, clientResponse.statusCode().value(), body))))
                    .toEntity(String.class)
                    .timeout(Duration.ofSeconds(request.getTimeoutSeconds()))
                    .block();

            var output = new HashMap<String, Object>();
            output.put("url", request.getUrl());
            output.put("statusCode", response != null ? response.getStatusCode().value() : null);
            output.put("body", response != null && response.getBody() != null ? response.getBody() : "");
            return output;
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Webhook call to {} failed: {}", request.getUrl(), e.getMessage());
            throw new ExternalServiceException(TARGET, e);
        }
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private Map<String, Object> callFallback(WebhookRequest request, Exception e) {
        log.warn("Circuit breaker open for webhooks, url: {}, error: {}", request.getUrl(), e.getMessage());
        if (e instanceof ExternalServiceException external) {
            throw external;
        }
        throw new ExternalServiceException(TARGET, "Webhook temporarily unavailable (circuit breaker open)", e);
    }
}
