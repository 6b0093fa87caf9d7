package com.stockinsight.orchestrator.task;

import com.stockinsight.common.exception.ConfigurationException;

import java.time.Duration;

/**
 * Limits of the task and stream layer.
 *
 * @param workerPoolSize    tasks executed concurrently
 * @param batchMaxSymbols   largest accepted batch
 * @param taskRetention     how long a finished task stays queryable without acknowledgement
 * @param queueCapacity     buffered events per client before old ones are dropped
 * @param heartbeatInterval idle keep-alive period of the event stream
 */
public record OrchestratorSettings(
    int workerPoolSize,
    int batchMaxSymbols,
    Duration taskRetention,
    int queueCapacity,
    Duration heartbeatInterval
) {
    public OrchestratorSettings {
        if (workerPoolSize < 1) throw new ConfigurationException("worker-pool-size must be at least 1: " + workerPoolSize);
        if (batchMaxSymbols < 1) throw new ConfigurationException("batch-max-symbols must be at least 1: " + batchMaxSymbols);
        if (queueCapacity < 1) throw new ConfigurationException("queue-capacity must be at least 1: " + queueCapacity);
        if (taskRetention == null || taskRetention.isNegative()) {
            throw new ConfigurationException("task-retention must not be negative: " + taskRetention);
        }
        if (heartbeatInterval == null || heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new ConfigurationException("heartbeat-interval must be positive: " + heartbeatInterval);
        }
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(3, 10, Duration.ofMinutes(10), 256, Duration.ofSeconds(20));
    }
}
