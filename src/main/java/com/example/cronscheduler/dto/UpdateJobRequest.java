package com.example.cronscheduler.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a job; null fields are left unchanged
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateJobRequest {

    @Size(min = 1, max = 200)
    private String name;

    @Size(max = 500)
    private String description;

    private String cronExpression;

    @Valid
    private CallbackSpec callback;

    private Boolean enabled;
}
