package com.example.cronscheduler.mapper;

import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.ScheduledJob;
import com.example.cronscheduler.dto.JobResponse;
import com.example.cronscheduler.dto.JobRunResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    /**
     * Convert ScheduledJob entity to JobResponse DTO
     */
    JobResponse toResponse(ScheduledJob job);

    List<JobResponse> toResponseList(List<ScheduledJob> jobs);

    /**
     * Convert JobRun entity to JobRunResponse DTO
     */
    JobRunResponse toRunResponse(JobRun run);

    List<JobRunResponse> toRunResponses(List<JobRun> runs);
}
