package org.tesseracthub.currency.config;

import javax.sql.DataSource;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;

/**
 * ShedLock configuration for coordinating scheduled work across instances.
 *
 * <p>Two locks are taken against the {@code shedlock} table:
 *
 * <ul>
 *   <li>{@code exchangeRateRefresh}: acquired programmatically by the rate updater around every
 *       scheduled refresh attempt, so horizontally scaled instances do not issue overlapping bulk
 *       upserts. An instance that cannot get the lock skips that attempt.
 *   <li>{@code exchangeRatePrune}: acquired through {@code @SchedulerLock} on the retention job.
 * </ul>
 *
 * <p>The table is created by the {@code V2__create_shedlock.sql} Flyway migration:
 *
 * <pre>
 * CREATE TABLE shedlock (
 *   name VARCHAR(64) PRIMARY KEY,
 *   lock_until TIMESTAMP NOT NULL,
 *   locked_at TIMESTAMP NOT NULL,
 *   locked_by VARCHAR(255) NOT NULL
 * );
 * </pre>
 *
 * @see net.javacrumbs.shedlock.spring.annotation.SchedulerLock
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
public class ShedLockConfig {

  /**
   * JDBC lock provider backed by the service's own PostgreSQL database.
   *
   * @param dataSource The application's data source (auto-configured by Spring)
   * @return LockProvider instance for ShedLock
   */
  @Bean
  public LockProvider lockProvider(DataSource dataSource) {
    return new JdbcTemplateLockProvider(
        JdbcTemplateLockProvider.Configuration.builder()
            .withJdbcTemplate(new JdbcTemplate(dataSource))
            .usingDbTime()
            .build());
  }
}
