package io.petitions.mover;

import java.util.UUID;

/**
 * Correlation data appended to every log line of a workflow run.
 */
public record LogContext(String jobId, String serverName, String workerName) {

    public static LogContext newJob(String serverName, String workerName) {
        return new LogContext(UUID.randomUUID().toString(), serverName, workerName);
    }

    public String suffix() {
        return " (job_id=" + jobId + ", server=" + serverName + ", worker=" + workerName + ")";
    }
}
