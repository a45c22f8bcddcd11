package com.example.cronscheduler.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Callback that calls an HTTP endpoint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookCallbackSpec implements CallbackSpec {

    public static final String KIND = "webhook";

    @Builder.Default
    private String kind = KIND;

    @NotBlank(message = "Webhook URL is required")
    @Pattern(regexp = "https?://.+", message = "Webhook URL must be http or https")
    private String url;

    @Builder.Default
    @Pattern(regexp = "GET|POST|PUT|PATCH|DELETE", message = "Unsupported HTTP method")
    private String method = "POST";

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    /**
     * JSON body to send
     */
    private Object body;

    @Min(1)
    private Integer timeoutSeconds;

    @Override
    public Map<String, Object> toCallbackConfig() {
        var config = new LinkedHashMap<String, Object>();
        config.put("kind", KIND);
        config.put("url", url);
        config.put("method", method);
        if (headers != null && !headers.isEmpty()) {
            config.put("headers", new LinkedHashMap<>(headers));
        }
        if (body != null) {
            config.put("body", body);
        }
        if (timeoutSeconds != null) {
            config.put("timeoutSeconds", timeoutSeconds);
        }
        return config;
    }
}
