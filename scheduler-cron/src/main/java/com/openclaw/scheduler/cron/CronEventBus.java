package com.openclaw.scheduler.cron;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans cron lifecycle events out to subscribers. A failing subscriber is
 * logged and skipped.
 */
@Slf4j
public class CronEventBus implements Consumer<CronState.CronEvent> {

    private final List<Consumer<CronState.CronEvent>> subscribers = new CopyOnWriteArrayList<>();

    /**
     * @return handle that removes the subscription
     */
    public Runnable subscribe(Consumer<CronState.CronEvent> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @Override
    public void accept(CronState.CronEvent event) {
        for (Consumer<CronState.CronEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                log.warn("cron: event subscriber failed for {} {}: {}",
                        event.getAction(), event.getJobId(), e.getMessage());
            }
        }
    }
}
