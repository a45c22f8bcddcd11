package com.example.cronscheduler.service.callback;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in callback for kind {@code webhook}.
 * <p>
 * Expected callback config:
 * - url: Endpoint to call (required)
 * - method: HTTP method, default POST
 * - headers: Map of header values
 * - body: Request body, sent as JSON
 * - timeoutSeconds: Per-call timeout, default 30
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookCallback implements JobCallbackHandler {

    public static final String KIND = "webhook";

    private final WebhookClient webhookClient;

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public Map<String, Object> run(Map<String, Object> callbackConfig) {
        var request = toRequest(callbackConfig);
        var output = webhookClient.call(request);
        log.debug("Webhook {} answered {}", request.getUrl(), output.get("statusCode"));
        return output;
    }

    static WebhookRequest toRequest(Map<String, Object> config) {
        var url = config.get("url");
        if (!(url instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException("Webhook callback requires a 'url'");
        }

        var builder = WebhookRequest.builder()
                .url(s)
                .body(config.get("body"));

        if (config.get("method") instanceof String method && !method.isBlank()) {
            builder.method(method.toUpperCase(Locale.ROOT));
        }
        if (config.get("timeoutSeconds") instanceof Number timeout) {
            builder.timeoutSeconds(timeout.intValue());
        }
        if (config.get("headers") instanceof Map<?, ?> raw) {
            var headers = new LinkedHashMap<String, String>();
            raw.forEach((key, value) -> headers.put(String.valueOf(key), String.valueOf(value)));
            builder.headers(headers);
        }
        return builder.build();
    }
}
