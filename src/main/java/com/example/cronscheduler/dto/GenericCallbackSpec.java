package com.example.cronscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Callback of any registered kind, with free-form parameters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenericCallbackSpec implements CallbackSpec {

    /**
     * Registered callback kind; when empty the job name is used
     */
    private String kind;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    @Override
    public Map<String, Object> toCallbackConfig() {
        var config = new LinkedHashMap<String, Object>();
        if (params != null) {
            config.putAll(params);
        }
        if (kind != null && !kind.isBlank()) {
            config.put("kind", kind);
        }
        return config;
    }
}
