package org.tesseracthub.currency.config;

import org.springframework.boot.autoconfigure.task.TaskSchedulingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Configuration for scheduled tasks.
 *
 * <p>One {@code taskScheduler} pool runs everything time driven in the service:
 *
 * <ul>
 *   <li>the rate updater's fixed-rate refresh ticks and its delayed retries
 *   <li>the tier 1 cache sweep ({@code @Scheduled} on {@code RateCache})
 *   <li>the retention job ({@code @Scheduled} cron on {@code ExchangeRatePruneScheduler})
 * </ul>
 *
 * <p>A retry waiting on its delay does not hold a thread, so a small pool is enough. Pool size,
 * thread name prefix and shutdown behavior come from {@code spring.task.scheduling} in
 * application.yml.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {

  private final TaskSchedulingProperties taskSchedulingProperties;

  public SchedulingConfig(TaskSchedulingProperties taskSchedulingProperties) {
    this.taskSchedulingProperties = taskSchedulingProperties;
  }

  /**
   * Task scheduler shared by {@code @Scheduled} methods and the rate updater.
   *
   * @return The configured task scheduler
   */
  @Bean
  @NonNull
  public TaskScheduler taskScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();

    var pool = taskSchedulingProperties.getPool();
    scheduler.setPoolSize(pool.getSize());

    var shutdown = taskSchedulingProperties.getShutdown();
    scheduler.setWaitForTasksToCompleteOnShutdown(shutdown.isAwaitTermination());
    if (shutdown.getAwaitTerminationPeriod() != null) {
      scheduler.setAwaitTerminationSeconds((int) shutdown.getAwaitTerminationPeriod().getSeconds());
    }

    scheduler.setThreadNamePrefix(taskSchedulingProperties.getThreadNamePrefix());
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();

    return scheduler;
  }

  @Override
  public void configureTasks(@NonNull ScheduledTaskRegistrar taskRegistrar) {
    taskRegistrar.setTaskScheduler(taskScheduler());
  }
}
