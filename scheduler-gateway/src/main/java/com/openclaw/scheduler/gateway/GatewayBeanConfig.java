package com.openclaw.scheduler.gateway;

import com.openclaw.scheduler.common.config.ConfigService;
import com.openclaw.scheduler.common.infra.HeartbeatRunner;
import com.openclaw.scheduler.common.infra.SystemEvents;
import com.openclaw.scheduler.cron.CronState;
import com.openclaw.scheduler.cron.CronTypes;
import com.openclaw.scheduler.gateway.runtime.GatewayCronRunner;
import com.openclaw.scheduler.gateway.runtime.SchedulerGateway;
import com.openclaw.scheduler.gateway.runtime.SystemEventHeartbeat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Spring configuration for the scheduler gateway. Hosts that run agents
 * contribute {@link CronState.IsolatedJobRunner} and
 * {@link CronState.FailureAlertSender} beans; without them isolated jobs
 * fail with an error and failure alerts fall back to the main timeline.
 */
@Slf4j
@Configuration
public class GatewayBeanConfig {

    @Value("${openclaw.config.path:}")
    private String configPath;
    @Value("${openclaw.state.dir:}")
    private String stateDir;
    @Value("${openclaw.heartbeat.interval-ms:1800000}")
    private long heartbeatIntervalMs;

    Map<String, String> schedulerEnv() {
        Map<String, String> env = new HashMap<>(System.getenv());
        if (!stateDir.isBlank()) {
            env.put("OPENCLAW_STATE_DIR", stateDir);
        }
        if (!configPath.isBlank()) {
            env.put("OPENCLAW_CONFIG_PATH", configPath);
        }
        return env;
    }

    @Bean
    public ConfigService configService() {
        return ConfigService.fromEnv(schedulerEnv());
    }

    @Bean
    public SystemEvents systemEvents() {
        return new SystemEvents();
    }

    @Bean(destroyMethod = "close")
    public HeartbeatRunner heartbeatRunner() {
        // action is attached once the cron runner exists
        return new HeartbeatRunner(heartbeatIntervalMs, null);
    }

    @Bean
    public GatewayCronRunner gatewayCronRunner(ConfigService configService,
            SystemEvents systemEvents,
            HeartbeatRunner heartbeatRunner,
            ObjectProvider<CronState.IsolatedJobRunner> isolatedJobRunner,
            ObjectProvider<CronState.FailureAlertSender> failureAlertSender) {
        GatewayCronRunner runner = new GatewayCronRunner(configService, systemEvents, heartbeatRunner,
                isolatedJobRunner.getIfAvailable(() -> GatewayBeanConfig::unconfiguredIsolatedRunner),
                failureAlertSender.getIfAvailable(),
                schedulerEnv());
        heartbeatRunner.updateAction(new SystemEventHeartbeat(systemEvents, runner));
        return runner;
    }

    @Bean(destroyMethod = "stop")
    public SchedulerGateway schedulerGateway(ConfigService configService, HeartbeatRunner heartbeatRunner,
            GatewayCronRunner gatewayCronRunner) {
        return new SchedulerGateway(configService, heartbeatRunner, gatewayCronRunner);
    }

    static CronState.IsolatedRunResult unconfiguredIsolatedRunner(CronState.IsolatedRunRequest request) {
        log.warn("cron: no isolated agent runner configured, failing job {}", request.job().getId());
        return CronState.IsolatedRunResult.builder()
                .status(CronTypes.RunStatus.ERROR)
                .error("isolated agent runner not configured")
                .build();
    }
}
