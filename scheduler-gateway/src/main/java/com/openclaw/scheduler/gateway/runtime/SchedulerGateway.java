package com.openclaw.scheduler.gateway.runtime;

import com.openclaw.scheduler.common.config.ConfigService;
import com.openclaw.scheduler.common.infra.HeartbeatRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Boot and shutdown sequence: heartbeat first, then cron; stopped in
 * reverse order.
 */
@Slf4j
public class SchedulerGateway {

    private final ConfigService configService;
    private final HeartbeatRunner heartbeatRunner;
    private final GatewayCronRunner cronRunner;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public SchedulerGateway(ConfigService configService, HeartbeatRunner heartbeatRunner,
            GatewayCronRunner cronRunner) {
        this.configService = configService;
        this.heartbeatRunner = heartbeatRunner;
        this.cronRunner = cronRunner;
    }

    public void start() throws IOException {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        LogLevels.apply(configService.loadConfig().getLogging());
        log.info("scheduler gateway starting (cron store: {})", cronRunner.getStorePath());
        heartbeatRunner.start();
        cronRunner.start();
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        cronRunner.stop();
        heartbeatRunner.stop();
        log.info("scheduler gateway stopped");
    }

    public boolean isStarted() {
        return started.get();
    }
}
