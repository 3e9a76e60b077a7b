package com.openclaw.scheduler.gateway;

import com.openclaw.scheduler.gateway.runtime.SchedulerGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

/**
 * Standalone entry point: boots the Spring context, starts heartbeat and
 * cron, and closes everything on JVM shutdown.
 */
@Slf4j
public final class SchedulerGatewayMain {

    private SchedulerGatewayMain() {
    }

    public static void main(String[] args) throws Exception {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(GatewayBeanConfig.class);
        context.registerShutdownHook();
        try {
            context.getBean(SchedulerGateway.class).start();
        } catch (Exception e) {
            log.error("scheduler gateway failed to start", e);
            context.close();
            throw e;
        }
        Thread.currentThread().join();
    }
}
