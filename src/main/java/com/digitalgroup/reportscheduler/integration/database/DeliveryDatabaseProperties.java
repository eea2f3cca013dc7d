package com.digitalgroup.reportscheduler.integration.database;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Named target databases for the DATABASE delivery method. Schedules refer to
 * them by name so credentials never live in schedule rows.
 */
@Configuration
@ConfigurationProperties(prefix = "app.delivery.database")
@Data
public class DeliveryDatabaseProperties {

    private Map<String, Connection> connections = new HashMap<>();

    @Data
    public static class Connection {
        private String url;
        private String username;
        private String password;
        private String driverClassName;
        private int maximumPoolSize = 2;
    }
}
