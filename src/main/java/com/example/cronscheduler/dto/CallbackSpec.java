package com.example.cronscheduler.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Typed callback configuration accepted by the API, discriminated by {@code kind}.
 * <p>
 * {@code webhook} maps to {@link WebhookCallbackSpec}; any other kind is a
 * {@link GenericCallbackSpec}. Either way it is flattened into the job's opaque
 * callback config before it reaches the scheduler.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "kind",
        visible = true,
        defaultImpl = GenericCallbackSpec.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = WebhookCallbackSpec.class, name = WebhookCallbackSpec.KIND)
})
public interface CallbackSpec {

    String getKind();

    Map<String, Object> toCallbackConfig();
}
