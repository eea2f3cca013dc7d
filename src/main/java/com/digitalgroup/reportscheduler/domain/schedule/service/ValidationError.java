package com.digitalgroup.reportscheduler.domain.schedule.service;

/**
 * One field-level schedule violation
 */
public record ValidationError(String field, String message) {
}
