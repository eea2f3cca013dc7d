package com.digitalgroup.reportscheduler.exception;

import com.digitalgroup.reportscheduler.domain.schedule.service.ValidationError;
import lombok.Getter;

import java.util.List;

/**
 * Schedule rejected before persistence; carries every field-level violation.
 */
@Getter
public class ScheduleValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public ScheduleValidationException(List<ValidationError> errors) {
        super("Invalid schedule configuration: " + errors.size() + " error(s)");
        this.errors = List.copyOf(errors);
    }
}
