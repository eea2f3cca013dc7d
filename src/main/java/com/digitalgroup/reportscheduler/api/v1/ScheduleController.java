package com.digitalgroup.reportscheduler.api.v1;

import com.digitalgroup.reportscheduler.api.v1.dto.PagedResponse;
import com.digitalgroup.reportscheduler.api.v1.dto.schedule.RunResponse;
import com.digitalgroup.reportscheduler.api.v1.dto.schedule.ScheduleRequest;
import com.digitalgroup.reportscheduler.api.v1.dto.schedule.ScheduleResponse;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import com.digitalgroup.reportscheduler.domain.schedule.service.ScheduleService;
import com.digitalgroup.reportscheduler.domain.schedule.service.ValidationError;
import com.digitalgroup.reportscheduler.job.ScheduleExecutionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Schedule Controller
 * CRUD, pause/resume, manual trigger and run history of report schedules
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ScheduleController {

    private static final int MAX_PAGE_SIZE = 100;

    private final ScheduleService scheduleService;
    private final ScheduleExecutionService executionService;
    private final Clock clock;

    /**
     * List schedules, optionally by report and enabled flag
     */
    @GetMapping("/schedules")
    public ResponseEntity<PagedResponse<ScheduleResponse>> index(
            @RequestParam(required = false) Long reportId,
            @RequestParam(required = false) Boolean enabled,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "20") int size) {

        Pageable pageable = pageOf(page, size, Sort.by("id").ascending());
        return ResponseEntity.ok(PagedResponse.fromPage(
                scheduleService.list(reportId, enabled, pageable), this::toResponse));
    }

    @GetMapping("/schedules/{id}")
    public ResponseEntity<ScheduleResponse> show(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(scheduleService.findById(id)));
    }

    @PostMapping("/schedules")
    public ResponseEntity<ScheduleResponse> create(@Valid @RequestBody ScheduleRequest request) {
        ReportSchedule created = scheduleService.create(request.toEntity());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
    }

    @PutMapping("/schedules/{id}")
    public ResponseEntity<ScheduleResponse> update(@PathVariable Long id, @Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.ok(toResponse(scheduleService.update(id, request.toEntity())));
    }

    @DeleteMapping("/schedules/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        scheduleService.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Remove every schedule of a deleted report, with their history
     */
    @DeleteMapping("/reports/{reportId}/schedules")
    public ResponseEntity<Map<String, Object>> deleteByReport(@PathVariable Long reportId) {
        int deleted = scheduleService.deleteByReport(reportId);
        return ResponseEntity.ok(Map.of("reportId", reportId, "deleted", deleted));
    }

    @PostMapping("/schedules/{id}/pause")
    public ResponseEntity<ScheduleResponse> pause(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(scheduleService.pause(id)));
    }

    @PostMapping("/schedules/{id}/resume")
    public ResponseEntity<ScheduleResponse> resume(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(scheduleService.resume(id)));
    }

    /**
     * Run now. force=true delivers even when the record-count conditions are not met.
     */
    @PostMapping("/schedules/{id}/trigger")
    public ResponseEntity<RunResponse> trigger(@PathVariable Long id,
                                               @RequestParam(required = false, defaultValue = "false") boolean force) {
        ScheduledReportRun run = executionService.triggerManualRun(id, force);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunResponse.fromEntity(run));
    }

    /**
     * Run history, newest first
     */
    @GetMapping("/schedules/{id}/runs")
    public ResponseEntity<PagedResponse<RunResponse>> runs(
            @PathVariable Long id,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "20") int size) {

        return ResponseEntity.ok(PagedResponse.fromPage(
                scheduleService.listRuns(id, pageOf(page, size, Sort.unsorted())), RunResponse::fromEntity));
    }

    /**
     * Validate without saving
     */
    @PostMapping("/schedules/validate")
    public ResponseEntity<Map<String, Object>> validate(@RequestBody ScheduleRequest request) {
        List<ValidationError> errors = scheduleService.validate(request.toEntity());
        return ResponseEntity.ok(Map.of(
                "valid", errors.isEmpty(),
                "errors", errors
        ));
    }

    // ==================== HELPER METHODS ====================

    private ScheduleResponse toResponse(ReportSchedule schedule) {
        return ScheduleResponse.fromEntity(schedule, clock.instant());
    }

    private static Pageable pageOf(int page, int size, Sort sort) {
        return PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE), sort);
    }
}
