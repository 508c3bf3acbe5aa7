package com.fitjourney.backend.journey.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JourneyErrorResponse(
        String code,
        String message,
        String requestId
) {}
