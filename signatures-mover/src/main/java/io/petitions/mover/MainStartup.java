package io.petitions.mover;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class MainStartup {

    private static final Logger LOG = Logger.getLogger(MainStartup.class);

    final SchemaInitializer schema;
    final WorkflowScheduler scheduler;

    public MainStartup(SchemaInitializer schema, WorkflowScheduler scheduler) {
        this.schema = schema;
        this.scheduler = scheduler;
    }

    @ConfigProperty(name = "app.schedule.enabled", defaultValue = "true")
    boolean scheduleEnabled;

    void onStart(@Observes StartupEvent ev) {
        schema.init().subscribe().with(
                v -> {
                    if (scheduleEnabled) {
                        LOG.info("Starting signatures mover schedule on boot...");
                        scheduler.start();
                    } else {
                        LOG.info("Schedule disabled; runs only through the admin endpoint.");
                    }
                },
                e -> LOG.error("Schema initialization failed; schedule not started", e)
        );
    }

    void onStop(@Observes ShutdownEvent ev) {
        LOG.info("Stopping signatures mover schedule...");
        scheduler.stop();
    }
}
