package com.digitalgroup.reportscheduler.integration.database;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ChannelAdapter;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryContext;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryReceipt;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import com.digitalgroup.reportscheduler.domain.schedule.service.ScheduleValidator;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.PermissionDeniedDataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import jakarta.annotation.PreDestroy;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes one row per run into the configured table of a named target database.
 * The table needs the columns: schedule_id, run_id, report_id, attempt, artifact_ref,
 * file_name, format, record_count, content, delivered_at.
 * A retry replaces the row written by an earlier attempt of the same run.
 */
@Slf4j
@Component
public class DatabaseChannelAdapter implements ChannelAdapter {

    private final DeliveryDatabaseProperties properties;
    private final Map<String, Target> targets = new ConcurrentHashMap<>();

    public DatabaseChannelAdapter(DeliveryDatabaseProperties properties) {
        this.properties = properties;
    }

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.DATABASE;
    }

    @Override
    public DeliveryReceipt deliver(ReportArtifact artifact, DeliveryContext context) throws DeliveryException {
        DeliveryConfiguration settings = context.getSettings();
        String table = settings.getDatabaseTable();
        if (table == null || !ScheduleValidator.TABLE_IDENTIFIER.matcher(table).matches()) {
            throw DeliveryException.permanentError("Invalid target table: " + table);
        }
        Target target = resolveTarget(settings.getDatabaseConnection());

        int timeoutSeconds = (int) Math.max(context.remainingTimeout().toSeconds(), 1);
        try {
            target.transactions().executeWithoutResult(status -> {
                JdbcTemplate jdbc = new JdbcTemplate(target.dataSource());
                jdbc.setQueryTimeout(timeoutSeconds);
                jdbc.update("DELETE FROM " + table + " WHERE run_id = ?", context.getRunId());
                jdbc.update("INSERT INTO " + table
                                + " (schedule_id, run_id, report_id, attempt, artifact_ref, file_name, format,"
                                + " record_count, content, delivered_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                        context.getScheduleId(),
                        context.getRunId(),
                        context.getReportId(),
                        context.getAttempt(),
                        artifact.artifactRef(),
                        artifact.fileName(),
                        artifact.format() != null ? artifact.format().name() : null,
                        artifact.recordCount(),
                        artifact.content(),
                        Timestamp.from(Instant.now(context.getClock())));
            });
        } catch (DataAccessException e) {
            throw classify(e);
        }

        log.info("Run {} stored in {}.{}", context.getRunId(), settings.getDatabaseConnection(), table);
        return new DeliveryReceipt(method(), settings.getDatabaseConnection() + "/" + table + "/run_id=" + context.getRunId());
    }

    @PreDestroy
    public void shutdown() {
        targets.values().forEach(t -> t.dataSource().close());
        targets.clear();
    }

    // ==================== HELPER METHODS ====================

    private Target resolveTarget(String name) throws DeliveryException {
        if (name == null || name.isBlank()) {
            throw DeliveryException.permanentError("Database connection is not configured");
        }
        DeliveryDatabaseProperties.Connection connection = properties.getConnections().get(name);
        if (connection == null || connection.getUrl() == null) {
            throw DeliveryException.permanentError("Unknown database connection: " + name);
        }
        return targets.computeIfAbsent(name, key -> createTarget(key, connection));
    }

    Target createTarget(String name, DeliveryDatabaseProperties.Connection connection) {
        DataSourceBuilder<HikariDataSource> builder = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(connection.getUrl())
                .username(connection.getUsername())
                .password(connection.getPassword());
        if (connection.getDriverClassName() != null) {
            builder.driverClassName(connection.getDriverClassName());
        }
        HikariDataSource dataSource = builder.build();
        dataSource.setPoolName("delivery-" + name);
        dataSource.setMaximumPoolSize(connection.getMaximumPoolSize());

        log.info("Created delivery data source '{}'", name);
        return new Target(dataSource, new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    static DeliveryException classify(DataAccessException e) {
        String message = "Database delivery failed: " + e.getMostSpecificCause().getMessage();
        if (e instanceof CannotGetJdbcConnectionException) {
            return DeliveryException.transientError(message, e);
        }
        if (e instanceof BadSqlGrammarException
                || e instanceof DataIntegrityViolationException
                || e instanceof PermissionDeniedDataAccessException
                || e instanceof NonTransientDataAccessException) {
            return DeliveryException.permanentError(message, e);
        }
        return DeliveryException.transientError(message, e);
    }

    record Target(HikariDataSource dataSource, TransactionTemplate transactions) {
    }
}
