package com.buildflow.agencyapi;

import com.buildflow.database.config.TenantDatabaseConfiguration;
import com.buildflow.security.config.SecurityConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Agency API: routes each request to its agency database and enforces session and role checks.
 *
 * <p>There is no single application {@code DataSource}. Connections come from the pools of the
 * {@code TenantPoolManager}, so Spring Boot's datasource and Flyway auto-configuration are
 * switched off.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@ConfigurationPropertiesScan
@EnableScheduling
@Import({TenantDatabaseConfiguration.class, SecurityConfiguration.class})
public class AgencyApiApplication {

    private static final Logger log = LoggerFactory.getLogger(AgencyApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AgencyApiApplication.class, args);
        log.info("BuildFlow agency API started");
    }
}
