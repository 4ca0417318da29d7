package org.neuralchilli.datahub.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

/**
 * Scheduling settings, under {@code datahub.scheduler}.
 */
@ConfigMapping(prefix = "datahub.scheduler")
public interface SchedulerConfig {

    /**
     * Zone in which period boundaries (midnight, Monday, first of month) are computed
     */
    @WithDefault("UTC")
    String zone();

    @WithName("tick-interval")
    @WithDefault("PT30S")
    Duration tickInterval();

    /**
     * How long a kill signal may go unacknowledged before the instance is marked Killed anyway
     */
    @WithName("kill-grace-period")
    @WithDefault("PT1M")
    Duration killGracePeriod();

    @WithName("default-queue-capacity")
    @WithDefault("4")
    int defaultQueueCapacity();

    /**
     * Concurrency limit per queue name
     */
    Map<String, Integer> queues();

    default ZoneId zoneId() {
        return ZoneId.of(zone());
    }

    default int capacityOf(String queue) {
        return queues().getOrDefault(queue, defaultQueueCapacity());
    }
}
