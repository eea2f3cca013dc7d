package com.digitalgroup.reportscheduler.domain.schedule.repository;

import com.digitalgroup.reportscheduler.domain.common.enums.RunStatus;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ScheduledReportRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface ScheduledReportRunRepository extends JpaRepository<ScheduledReportRun, Long> {

    Page<ScheduledReportRun> findByScheduleIdOrderByTriggeredAtDesc(Long scheduleId, Pageable pageable);

    List<ScheduledReportRun> findByStatusIn(Collection<RunStatus> statuses);

    // derived deletes load each run so the channel result rows go with it
    @Transactional
    long deleteByScheduleIdIn(Collection<Long> scheduleIds);

    @Transactional
    long deleteByStatusInAndCompletedAtBefore(Collection<RunStatus> statuses, Instant threshold);
}
