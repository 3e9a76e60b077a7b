package com.openclaw.scheduler.cron;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Durable job scheduler: CRUD over the job store, the wake timer, on-demand
 * runs and wake requests. Every store access happens under the state lock.
 */
@Slf4j
public class CronService {

    static final int DEFAULT_PAGE_LIMIT = 50;
    static final int MAX_PAGE_LIMIT = 200;

    private final CronServiceState state;

    public CronService(CronState.CronServiceDeps deps) {
        this.state = new CronServiceState(deps);
    }

    public CronServiceState getState() {
        return state;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public void start() throws IOException {
        if (!state.deps().isCronEnabled()) {
            log.info("cron: disabled");
            return;
        }
        state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            for (CronTypes.CronJob job : state.store().getJobs()) {
                Long runningAt = job.getState().getRunningAtMs();
                if (runningAt != null) {
                    log.warn("cron: clearing stale running marker on startup (job={}, runningAtMs={})",
                            job.getId(), runningAt);
                    job.getState().setRunningAtMs(null);
                }
            }
            CronStore.persist(state);
            return null;
        });

        CronTimer.runMissedJobs(state);

        state.locked(() -> {
            // Jobs that came due while missed jobs ran keep their slot for the first tick.
            CronStore.ensureLoaded(state, true, true);
            if (CronJobs.recomputeNextRunsForMaintenance(state)) {
                CronStore.persist(state);
            }
            CronTimer.armTimer(state);
            log.info("cron: started (jobs={}, nextWakeAtMs={})", state.store().getJobs().size(),
                    CronJobs.nextWakeAtMs(state));
            return null;
        });
    }

    public void stop() {
        CronTimer.stopTimer(state);
        state.shutdown();
        log.info("cron: stopped");
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public CronState.CronStatusSummary status() throws IOException {
        return state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            return CronState.CronStatusSummary.builder()
                    .enabled(state.deps().isCronEnabled())
                    .storePath(String.valueOf(state.deps().getStorePath()))
                    .jobs(state.store().getJobs().size())
                    .nextWakeAtMs(state.deps().isCronEnabled() ? CronJobs.nextWakeAtMs(state) : null)
                    .build();
        });
    }

    public List<CronTypes.CronJob> list(boolean includeDisabled) throws IOException {
        return state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            CronJobs.recomputeNextRunsForMaintenance(state);
            List<CronTypes.CronJob> jobs = new ArrayList<>();
            for (CronTypes.CronJob job : state.store().getJobs()) {
                if (includeDisabled || job.isEnabled()) {
                    jobs.add(CronJobs.copyJob(job));
                }
            }
            jobs.sort(Comparator.comparing(CronService::nextRunOf, Comparator.nullsLast(Comparator.naturalOrder())));
            return jobs;
        });
    }

    public CronState.CronListPage listPage(CronState.CronListPageOptions options) throws IOException {
        CronState.CronListPageOptions opts = options != null ? options : CronState.CronListPageOptions.builder().build();
        return state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            CronJobs.recomputeNextRunsForMaintenance(state);

            String query = opts.getQuery() != null ? opts.getQuery().trim().toLowerCase(Locale.ROOT) : "";
            CronState.EnabledFilter enabledFilter = opts.getEnabled() != null
                    ? opts.getEnabled()
                    : CronState.EnabledFilter.ALL;
            List<CronTypes.CronJob> filtered = new ArrayList<>();
            for (CronTypes.CronJob job : state.store().getJobs()) {
                if (enabledFilter == CronState.EnabledFilter.ENABLED && !job.isEnabled())
                    continue;
                if (enabledFilter == CronState.EnabledFilter.DISABLED && job.isEnabled())
                    continue;
                if (!query.isEmpty() && !matchesQuery(job, query))
                    continue;
                filtered.add(job);
            }

            filtered.sort(pageComparator(opts.getSortBy(), opts.getSortDir()));

            int total = filtered.size();
            int offset = Math.max(0, opts.getOffset() != null ? opts.getOffset() : 0);
            int limit = opts.getLimit() != null
                    ? Math.max(1, Math.min(MAX_PAGE_LIMIT, opts.getLimit()))
                    : DEFAULT_PAGE_LIMIT;
            int from = Math.min(offset, total);
            int to = Math.min(total, from + limit);
            boolean hasMore = to < total;
            List<CronTypes.CronJob> page = new ArrayList<>(to - from);
            for (CronTypes.CronJob job : filtered.subList(from, to)) {
                page.add(CronJobs.copyJob(job));
            }
            return new CronState.CronListPage(page, total, offset, limit,
                    hasMore, hasMore ? to : null);
        });
    }

    private static boolean matchesQuery(CronTypes.CronJob job, String query) {
        for (String field : new String[] { job.getId(), job.getName(), job.getDescription(), job.getAgentId() }) {
            if (field != null && field.toLowerCase(Locale.ROOT).contains(query)) {
                return true;
            }
        }
        return false;
    }

    static Comparator<CronTypes.CronJob> pageComparator(CronState.SortBy sortBy, CronState.SortDir sortDir) {
        CronState.SortBy by = sortBy != null ? sortBy : CronState.SortBy.NEXT_RUN_AT_MS;
        boolean desc = sortDir == CronState.SortDir.DESC;
        Comparator<String> text = Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER);
        Comparator<CronTypes.CronJob> byId = Comparator.comparing(CronTypes.CronJob::getId, text);

        Comparator<CronTypes.CronJob> primary = switch (by) {
            case NAME -> {
                Comparator<CronTypes.CronJob> c = Comparator.comparing(CronTypes.CronJob::getName, text);
                yield desc ? c.reversed() : c;
            }
            case UPDATED_AT_MS -> {
                Comparator<CronTypes.CronJob> c = Comparator.comparingLong(CronTypes.CronJob::getUpdatedAtMs);
                yield desc ? c.reversed() : c;
            }
            case NEXT_RUN_AT_MS -> {
                // Jobs without a next run sort last in either direction.
                Comparator<Long> order = desc ? Comparator.<Long>reverseOrder() : Comparator.<Long>naturalOrder();
                yield Comparator.comparing(CronService::nextRunOf, Comparator.nullsLast(order));
            }
        };
        return primary.thenComparing(byId);
    }

    private static Long nextRunOf(CronTypes.CronJob job) {
        return job.getState() != null ? job.getState().getNextRunAtMs() : null;
    }

    // =========================================================================
    // Mutations
    // =========================================================================

    public CronTypes.CronJob add(CronTypes.CronJobCreate input) throws IOException {
        CronTypes.CronJob job = state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            CronTypes.CronJob created = CronJobs.createJob(state, input);
            state.store().getJobs().add(created);
            CronStore.persist(state);
            CronTimer.armTimer(state);
            log.info("cron: job added (id={}, name={}, nextRunAtMs={})", created.getId(), created.getName(),
                    created.getState().getNextRunAtMs());
            return created;
        });
        CronTimer.emit(state, CronState.CronEvent.builder()
                .jobId(job.getId())
                .action(CronState.CronEventAction.ADDED)
                .nextRunAtMs(job.getState().getNextRunAtMs())
                .build());
        return job;
    }

    /**
     * Add a job from a loosely shaped request map (legacy delivery hints,
     * {@code atMs}, bare {@code everyMs} and the like are accepted).
     */
    public CronTypes.CronJob add(Map<String, Object> raw) throws IOException {
        return add(CronNormalize.toJobCreate(raw));
    }

    public CronTypes.CronJob update(String id, CronTypes.CronJobPatch patch) throws IOException {
        CronTypes.CronJob job = state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            CronTypes.CronJob existing = requireJob(id);
            CronJobs.applyJobPatch(existing, patch, state.nowMs());
            CronStore.persist(state);
            CronTimer.armTimer(state);
            return existing;
        });
        CronTimer.emit(state, CronState.CronEvent.builder()
                .jobId(job.getId())
                .action(CronState.CronEventAction.UPDATED)
                .nextRunAtMs(job.getState().getNextRunAtMs())
                .build());
        return job;
    }

    public CronTypes.CronJob update(String id, Map<String, Object> rawPatch) throws IOException {
        return update(id, CronNormalize.toJobPatch(rawPatch));
    }

    public CronState.CronRemoveResult remove(String id) throws IOException {
        boolean removed = state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            boolean didRemove = state.store().getJobs().removeIf(job -> id != null && id.equals(job.getId()));
            CronStore.persist(state);
            CronTimer.armTimer(state);
            return didRemove;
        });
        if (removed) {
            CronTimer.emit(state, CronState.CronEvent.builder()
                    .jobId(id)
                    .action(CronState.CronEventAction.REMOVED)
                    .build());
        }
        return new CronState.CronRemoveResult(true, removed);
    }

    // =========================================================================
    // Run / wake
    // =========================================================================

    /**
     * Run one job inline. {@code DUE} runs only when the job is due;
     * {@code FORCE} runs it regardless of its schedule.
     */
    public CronState.CronRunResult run(String id, CronState.CronRunMode mode) throws IOException {
        CronState.CronRunResult blocked = state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            CronTypes.CronJob job = requireJob(id);
            if (job.getState().getRunningAtMs() != null) {
                return new CronState.CronNotRun("already-running");
            }
            long now = state.nowMs();
            if (!CronJobs.isJobDue(job, now, mode == CronState.CronRunMode.FORCE)) {
                return new CronState.CronNotRun("not-due");
            }
            job.getState().setRunningAtMs(now);
            job.getState().setLastError(null);
            CronStore.persist(state);
            return null;
        });
        if (blocked != null) {
            return blocked;
        }

        CronTypes.CronJob snapshot = state.locked(() -> CronJobs.findJob(state, id));
        long startedAt = state.nowMs();
        CronTimer.emit(state, CronState.CronEvent.builder()
                .jobId(id)
                .action(CronState.CronEventAction.STARTED)
                .runAtMs(startedAt)
                .build());
        CronRunOutcome outcome = CronExecutor.executeSafely(state, snapshot);
        long endedAt = state.nowMs();

        state.locked(() -> {
            CronStore.ensureLoaded(state, true, true);
            CronTimer.applyOutcomeToStoredJob(state, new CronTimer.TimedOutcome(id, outcome, startedAt, endedAt));
            CronJobs.recomputeNextRunsForMaintenance(state);
            CronStore.persist(state);
            CronTimer.armTimer(state);
            return null;
        });
        return new CronState.CronRanOk();
    }

    public boolean wake(CronTypes.WakeMode mode, String text) {
        return CronTimer.wake(state, mode, text);
    }

    private CronTypes.CronJob requireJob(String id) {
        CronTypes.CronJob job = CronJobs.findJob(state, id);
        if (job == null) {
            throw new IllegalArgumentException("unknown cron job id: " + id);
        }
        return job;
    }
}
