package com.openclaw.scheduler.gateway.runtime;

import com.openclaw.scheduler.common.config.ConfigPaths;
import com.openclaw.scheduler.common.config.ConfigService;
import com.openclaw.scheduler.common.config.SchedulerConfig;
import com.openclaw.scheduler.common.infra.HeartbeatRunner;
import com.openclaw.scheduler.common.infra.SystemEvents;
import com.openclaw.scheduler.cron.CronEventBus;
import com.openclaw.scheduler.cron.CronRunLog;
import com.openclaw.scheduler.cron.CronService;
import com.openclaw.scheduler.cron.CronState;
import com.openclaw.scheduler.cron.CronStore;
import com.openclaw.scheduler.cron.WakeScheduler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Builds the gateway-level cron service from configuration and wires it to
 * the gateway runtime: system events land in {@link SystemEvents}, heartbeats
 * go through {@link HeartbeatRunner}, lifecycle events fan out over a
 * {@link CronEventBus} and finished runs are appended to the per-job run log.
 */
@Slf4j
public class GatewayCronRunner {

    static final String SKIP_CRON_ENV = "OPENCLAW_SKIP_CRON";

    private final ConfigService configService;
    private final SystemEvents systemEvents;
    private final Map<String, String> env;
    private final LongSupplier clock;
    private final CronEventBus eventBus = new CronEventBus();
    private final Path storePath;
    private final boolean cronEnabled;
    private final CronService cronService;

    public GatewayCronRunner(ConfigService configService,
            SystemEvents systemEvents,
            HeartbeatRunner heartbeatRunner,
            CronState.IsolatedJobRunner isolatedJobRunner,
            CronState.FailureAlertSender failureAlertSender,
            Map<String, String> env) {
        this(configService, systemEvents, heartbeatRunner, isolatedJobRunner, failureAlertSender, env,
                System::currentTimeMillis, null);
    }

    GatewayCronRunner(ConfigService configService,
            SystemEvents systemEvents,
            HeartbeatRunner heartbeatRunner,
            CronState.IsolatedJobRunner isolatedJobRunner,
            CronState.FailureAlertSender failureAlertSender,
            Map<String, String> env,
            LongSupplier clock,
            WakeScheduler wakeScheduler) {
        this.configService = configService;
        this.systemEvents = systemEvents;
        this.env = env;
        this.clock = clock;

        SchedulerConfig cfg = configService.loadConfig();
        SchedulerConfig.CronConfig cronConfig = cfg.getCron() != null ? cfg.getCron()
                : new SchedulerConfig.CronConfig();
        this.storePath = CronStore.resolveCronStorePath(cronConfig.getStore(), env);
        this.cronEnabled = !"1".equals(env.get(SKIP_CRON_ENV))
                && (cronConfig.getEnabled() == null || cronConfig.getEnabled());

        eventBus.subscribe(this::appendRunLog);

        CronState.CronServiceDeps deps = CronState.CronServiceDeps.builder()
                .storePath(storePath)
                .cronEnabled(cronEnabled)
                .cronConfig(cronConfig)
                .nowMs(clock)
                .wakeScheduler(wakeScheduler)
                .enqueueSystemEvent(this::enqueueSystemEvent)
                .requestHeartbeatNow(heartbeatRunner::requestNow)
                .runHeartbeatOnce(heartbeatRunner::runOnce)
                .runIsolatedAgentJob(isolatedJobRunner)
                .sendCronFailureAlert(failureAlertSender)
                .resolveSessionStorePath(this::resolveSessionStorePath)
                .onEvent(eventBus)
                .build();
        this.cronService = new CronService(deps);
    }

    /**
     * Start the cron service if enabled.
     */
    public void start() throws IOException {
        if (!cronEnabled) {
            log.info("cron: disabled by config or {}", SKIP_CRON_ENV);
            return;
        }
        cronService.start();
    }

    /**
     * Stop the cron service.
     */
    public void stop() {
        cronService.stop();
    }

    /**
     * Recent finished runs of one job, newest first.
     */
    public List<CronRunLog.Entry> runs(String jobId, int limit) throws IOException {
        return CronRunLog.readEntries(CronRunLog.resolveRunLogPath(storePath, jobId), limit);
    }

    /**
     * Main session key for an agent: {@code agent:<agentId>:<mainKey>}.
     */
    public String resolveMainSessionKey(String agentId) {
        SchedulerConfig.SessionConfig session = configService.loadConfig().getSession();
        String mainKey = session != null && session.getMainKey() != null && !session.getMainKey().isBlank()
                ? session.getMainKey().trim()
                : "main";
        return "agent:" + ConfigPaths.normalizeAgentId(agentId) + ":" + mainKey;
    }

    Path resolveSessionStorePath(String agentId) {
        SchedulerConfig.SessionConfig session = configService.loadConfig().getSession();
        return ConfigPaths.resolveSessionStorePath(session != null ? session.getStore() : null, agentId, env);
    }

    private void enqueueSystemEvent(String text, CronState.SystemEventTarget target) {
        String sessionKey = target.sessionKey() != null && !target.sessionKey().isBlank()
                ? target.sessionKey()
                : resolveMainSessionKey(target.agentId());
        systemEvents.enqueue(text, sessionKey, target.contextKey());
    }

    private void appendRunLog(CronState.CronEvent event) {
        if (event.getAction() != CronState.CronEventAction.FINISHED || event.getJobId() == null) {
            return;
        }
        SchedulerConfig.CronConfig cronConfig = configService.loadConfig().getCron();
        try {
            CronRunLog.appendEntry(CronRunLog.resolveRunLogPath(storePath, event.getJobId()),
                    CronRunLog.Entry.fromEvent(event, clock.getAsLong()),
                    CronRunLog.resolveMaxBytes(cronConfig),
                    CronRunLog.resolveKeepLines(cronConfig));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("cron: failed to append run log for {}: {}", event.getJobId(), e.getMessage());
        }
    }

    public boolean isCronEnabled() {
        return cronEnabled;
    }

    public Path getStorePath() {
        return storePath;
    }

    public CronEventBus getEventBus() {
        return eventBus;
    }

    public CronService getCronService() {
        return cronService;
    }
}
