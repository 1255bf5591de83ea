package com.connectpro.gateway;

import com.connectpro.channels.InboundDispatcher;
import com.connectpro.channels.TelegramTransport;
import com.connectpro.maintenance.RetentionSweep;
import com.connectpro.maintenance.SweepScheduler;
import com.connectpro.observability.DoctorCommand;
import com.connectpro.observability.RelayMetrics;
import com.connectpro.policy.Footer;
import com.connectpro.policy.PolicyEngine;
import com.connectpro.routing.MessageRouter;
import com.connectpro.shared.config.ConfigLoader;
import com.connectpro.shared.config.RelayConfig;
import com.connectpro.store.InMemoryRecordStore;
import com.connectpro.store.PostgresRecordStore;
import com.connectpro.store.RecordStore;
import com.connectpro.store.TimeLimitedRecordStore;
import com.connectpro.tenants.TenantOrchestrator;
import com.connectpro.tenants.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@SpringBootApplication(scanBasePackages = "com.connectpro")
public class ConnectProApp {

    private static final Logger log = LoggerFactory.getLogger(ConnectProApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        var app = new SpringApplication(ConnectProApp.class);
        app.setDefaultProperties(springDefaults(config));
        var ctx = app.run(args);

        if (config.frontDoorToken() == null || config.frontDoorToken().isBlank()) {
            log.error("Front-door bot token not configured. Set front-door.bot-token in ~/.connectpro/config.yaml "
                    + "or CONNECTPRO_BOT_TOKEN");
            ctx.close();
            return;
        }

        var clock = Clock.systemUTC();
        ExecutorService io = Executors.newCachedThreadPool(new CustomizableThreadFactory("relay-io-"));
        var timeouts = config.timeouts();

        // Store
        RecordStore backing = config.inMemoryStore()
                ? new InMemoryRecordStore(clock)
                : new PostgresRecordStore(ctx.getBean(DataSource.class), timeouts.store(), clock);
        var store = new TimeLimitedRecordStore(backing, io, timeouts.store());
        log.info("Record store: {}", config.inMemoryStore() ? "in-memory" : "postgres");

        // Policy
        var policy = new PolicyEngine(config.policy());
        var footer = new Footer(config.footerText());
        var metrics = new RelayMetrics();

        // Channels
        var registry = new TenantRegistry(timeouts.drain());
        var frontDoor = TelegramTransport.frontDoor(config.frontDoorToken());
        var dispatcher = new InboundDispatcher(config.dispatchLanes());
        var router = new MessageRouter(store, policy, registry, frontDoor, footer, io,
                timeouts.transport(), clock, metrics);
        var orchestrator = new TenantOrchestrator(store, registry, TelegramTransport::dedicated, dispatcher,
                policy, frontDoor, io, timeouts.transport(), clock, metrics);

        // Maintenance
        var schedule = config.schedule();
        var retention = new RetentionSweep(store, schedule.retentionDays(), schedule.retentionCron(), clock);
        var doctor = new DoctorCommand(store, registry, frontDoor);
        var handler = new InboundHandler(store, router, orchestrator, retention, doctor,
                new Replies(config.policy(), footer, frontDoor::botUsername), frontDoor, config::isAdmin,
                io, timeouts.transport());

        dispatcher.start(handler);
        try {
            frontDoor.open();
            frontDoor.subscribe(dispatcher);
        } catch (RuntimeException e) {
            log.error("Front-door bot failed to start: {}", e.getMessage());
            dispatcher.close();
            io.shutdownNow();
            ctx.close();
            return;
        }
        log.info("Front door @{} listening", frontDoor.botUsername());

        var report = orchestrator.startAll();
        var scheduler = new SweepScheduler();
        scheduler.start(retention, schedule.retentionCron(), orchestrator, schedule.trialSweepCron(),
                config.policy().zone());
        log.info("ConnectPro relay ready: {} dedicated bots running", report.started());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(ctx, scheduler, frontDoor,
                orchestrator, dispatcher, io), "relay-shutdown"));
    }

    private static void shutdown(ConfigurableApplicationContext ctx, SweepScheduler scheduler,
                                 TelegramTransport frontDoor, TenantOrchestrator orchestrator,
                                 InboundDispatcher dispatcher, ExecutorService io) {
        log.info("Shutting down relay");
        scheduler.close();
        frontDoor.close();
        orchestrator.shutdown();
        dispatcher.close();
        io.shutdown();
        ctx.close();
    }

    static Map<String, Object> springDefaults(RelayConfig config) {
        var props = new HashMap<String, Object>();
        if (config.inMemoryStore()) {
            props.put("spring.autoconfigure.exclude",
                    "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration");
            props.put("spring.sql.init.mode", "never");
        } else {
            props.put("spring.datasource.url", config.database().get("url"));
            props.put("spring.datasource.username", config.database().get("username"));
            props.put("spring.datasource.password", config.database().get("password"));
        }
        return props;
    }
}
