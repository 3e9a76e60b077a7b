package com.openclaw.scheduler.gateway.runtime;

import com.openclaw.scheduler.common.infra.HeartbeatRunner;
import com.openclaw.scheduler.common.infra.SystemEvents;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Function;

/**
 * Default heartbeat action for a gateway without an agent attached: drains
 * the queued system events of the target session and logs them.
 */
@Slf4j
public class SystemEventHeartbeat implements Function<HeartbeatRunner.Request, HeartbeatRunner.RunResult> {

    private final SystemEvents systemEvents;
    private final GatewayCronRunner cronRunner;

    public SystemEventHeartbeat(SystemEvents systemEvents, GatewayCronRunner cronRunner) {
        this.systemEvents = systemEvents;
        this.cronRunner = cronRunner;
    }

    @Override
    public HeartbeatRunner.RunResult apply(HeartbeatRunner.Request request) {
        long startedAt = System.currentTimeMillis();
        String sessionKey = request.sessionKey() != null && !request.sessionKey().isBlank()
                ? request.sessionKey()
                : cronRunner.resolveMainSessionKey(request.agentId());
        List<SystemEvents.Event> events = systemEvents.drainEntries(sessionKey);
        if (events.isEmpty()) {
            return HeartbeatRunner.RunResult.skipped("no-events");
        }
        for (SystemEvents.Event event : events) {
            log.info("heartbeat[{}] {} ({}): {}", request.reason(), sessionKey,
                    request.target() != null ? request.target() : "default", event.text());
        }
        return HeartbeatRunner.RunResult.ran(System.currentTimeMillis() - startedAt);
    }
}
