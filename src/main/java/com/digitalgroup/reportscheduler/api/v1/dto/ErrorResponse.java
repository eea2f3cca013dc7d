package com.digitalgroup.reportscheduler.api.v1.dto;

import com.digitalgroup.reportscheduler.domain.schedule.service.ValidationError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, List<ValidationError> fieldErrors) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null);
    }
}
