package com.example.cronscheduler.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a new job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    @NotBlank(message = "Job name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 500)
    private String description;

    /**
     * Five-field cron expression, evaluated in the scheduler time zone
     */
    @NotBlank(message = "Cron expression is required")
    private String cronExpression;

    /**
     * What the job runs (optional: the job name is then used as the callback kind)
     */
    @Valid
    private CallbackSpec callback;

    @Builder.Default
    private boolean enabled = true;

    /**
     * Who created this job
     */
    private String createdBy;
}
