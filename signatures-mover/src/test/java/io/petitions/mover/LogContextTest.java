package io.petitions.mover;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogContextTest {

    @Test
    void suffixCarriesJobServerAndWorker() {
        LogContext ctx = new LogContext("job-1", "web-3", "cron");

        assertThat(ctx.suffix()).isEqualTo(" (job_id=job-1, server=web-3, worker=cron)");
    }

    @Test
    void newJobGetsUniqueIds() {
        LogContext a = LogContext.newJob("web-3", "cron");
        LogContext b = LogContext.newJob("web-3", "cron");

        assertThat(a.jobId()).isNotBlank().isNotEqualTo(b.jobId());
        assertThat(a.serverName()).isEqualTo("web-3");
    }
}
