package com.polychaeta.bot.scheduler;

import com.polychaeta.bot.db.JobDao;
import com.polychaeta.bot.db.JobStoreException;
import com.polychaeta.bot.model.JobAction;
import com.polychaeta.bot.model.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process timer service over {@link JobDao}.
 *
 * <p>The store is the source of truth; the armed timers are a cache of it that
 * is rebuilt by {@link #start()} and updated under one lock by every
 * {@link #schedule}/{@link #cancel}. A matured job is handed to the
 * {@link Handler} on a separate worker thread, outside the lock, and its record
 * is deleted afterwards whether the handler succeeded or not. Failed jobs are
 * not retried.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    public interface Handler {
        void handle(ScheduledJob job) throws Exception;
    }

    private final JobDao jobDao;
    private final Handler handler;
    private final Clock clock;

    private final ScheduledExecutorService timer;
    private final ExecutorService worker;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Object lock = new Object();
    // guarded by lock
    private final Map<String, Armed> armed = new HashMap<>();

    public JobScheduler(JobDao jobDao, Handler handler) {
        this(jobDao, handler, Clock.systemUTC());
    }

    public JobScheduler(JobDao jobDao, Handler handler, Clock clock) {
        this.jobDao = jobDao;
        this.handler = handler;
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor(daemon("job-timer"));
        this.worker = Executors.newSingleThreadExecutor(daemon("job-worker"));
    }

    /**
     * Loads every persisted job and arms it. Overdue jobs fire right away, oldest first.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) return;

        List<ScheduledJob> jobs;
        synchronized (lock) {
            try {
                jobs = jobDao.list();
            } catch (JobStoreException e) {
                running.set(false);
                throw e;
            }
            for (ScheduledJob job : jobs) {
                arm(job);
            }
        }

        Instant now = clock.instant();
        for (ScheduledJob job : jobs) {
            log.info("Restored job {} due {}{}", job.id, job.runAt, job.runAt.isAfter(now) ? "" : " (overdue)");
        }
        log.info("JobScheduler started ({} pending job(s))", jobs.size());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) return;

        synchronized (lock) {
            for (Armed entry : armed.values()) {
                entry.disarm();
            }
            armed.clear();
        }
        timer.shutdownNow();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Job worker did not finish within 10s, interrupting");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("JobScheduler stopped.");
    }

    /**
     * Inserts or replaces the job with this id and (re)arms its timer.
     *
     * @throws JobStoreException if the job could not be persisted; nothing changes in that case
     */
    public void schedule(ScheduledJob job) {
        boolean replaced;
        synchronized (lock) {
            ensureRunning();
            jobDao.put(job);
            Armed previous = armed.remove(job.id);
            replaced = previous != null;
            if (previous != null) {
                previous.disarm();
            }
            arm(job);
        }
        log.info("{} job {} due {}", replaced ? "Rescheduled" : "Scheduled", job.id, job.runAt);
    }

    public void schedule(String id, Instant runAt, JobAction action, List<String> args) {
        schedule(new ScheduledJob(id, runAt, action, args));
    }

    /**
     * Removes the job and disarms its timer. Unknown ids are a no-op.
     *
     * @return true if a pending job was removed
     * @throws JobStoreException if the store could not be updated; the job stays armed in that case
     */
    public boolean cancel(String id) {
        boolean deleted;
        synchronized (lock) {
            ensureRunning();
            deleted = jobDao.delete(id);
            Armed entry = armed.remove(id);
            if (entry != null) {
                entry.disarm();
            }
        }
        if (deleted) {
            log.info("Cancelled job {}", id);
        } else {
            log.debug("Cancel of {} ignored, no such job", id);
        }
        return deleted;
    }

    public Optional<ScheduledJob> get(String id) {
        return jobDao.get(id);
    }

    boolean isArmed(String id) {
        synchronized (lock) {
            return armed.containsKey(id);
        }
    }

    /* ---------------------------
       Timers
       --------------------------- */

    // caller holds lock
    private void arm(ScheduledJob job) {
        long delayMillis = Math.max(0L, Duration.between(clock.instant(), job.runAt).toMillis());
        Armed entry = new Armed(job);
        armed.put(job.id, entry);
        entry.future = timer.schedule(() -> enqueue(entry), delayMillis, TimeUnit.MILLISECONDS);
    }

    private void enqueue(Armed entry) {
        synchronized (lock) {
            if (armed.get(entry.job.id) != entry) return;
        }
        try {
            worker.execute(() -> dispatch(entry));
        } catch (RuntimeException e) {
            log.warn("Job {} not dispatched, scheduler is shutting down", entry.job.id);
        }
    }

    private void dispatch(Armed entry) {
        ScheduledJob job = entry.job;
        synchronized (lock) {
            // replaced or cancelled while waiting for the worker
            if (armed.get(job.id) != entry) return;
            armed.remove(job.id);
        }

        log.info("Firing job {} ({})", job.id, job.action);
        try {
            handler.handle(job);
        } catch (Exception e) {
            log.warn("Job {} failed, dropping it: {}", job.id, e.getMessage(), e);
        }

        synchronized (lock) {
            // a schedule() during the handler call owns the record now
            if (armed.containsKey(job.id)) return;
            try {
                jobDao.delete(job.id);
            } catch (JobStoreException e) {
                log.error("Could not remove fired job {}; it will fire again after restart", job.id, e);
            }
        }
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("JobScheduler is not running");
        }
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Armed {
        final ScheduledJob job;
        ScheduledFuture<?> future;

        Armed(ScheduledJob job) {
            this.job = job;
        }

        void disarm() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
