package com.example.cronscheduler.service.callback;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outgoing webhook call, built from a job's callback config
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookRequest {

    private String url;

    @Builder.Default
    private String method = "POST";

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    private Object body;

    @Builder.Default
    private int timeoutSeconds = 30;
}
