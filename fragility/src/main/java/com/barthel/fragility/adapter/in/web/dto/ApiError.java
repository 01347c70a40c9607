package com.barthel.fragility.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Error body of every failed request.
 *
 * @see com.barthel.fragility.adapter.in.web.GlobalExceptionHandler
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    /** Stable machine readable code, e.g. {@code CLIMATE_DATA_UNAVAILABLE}. */
    String code;
    int status;
    String message;
    String details;
    /** Request path that failed. */
    String path;
    /** Sector and hazard of the request, when its route names them. */
    String sector;
    String hazard;
    String traceId;
    Instant timestamp;
}
