package com.cellarexport.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-export mailboxes and alarms.
 * <p>
 * Every task submitted for an export id runs after the previous task for the same id has
 * finished, so the state of one export is only ever mutated by one thread at a time. Tasks of
 * different exports run in parallel on the shared executor. Each export has at most one armed
 * alarm; arming again replaces it.
 */
@Component
@Slf4j
public class ExportJobQueue {

    private final ConcurrentMap<String, CompletableFuture<Void>> mailboxTails = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Alarm> alarms = new ConcurrentHashMap<>();

    private final Executor executor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    public ExportJobQueue(@Qualifier("exportJobExecutor") Executor executor,
                          @Qualifier("exportAlarmScheduler") TaskScheduler scheduler,
                          Clock clock) {
        this.executor = executor;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Queue a task on the mailbox of an export. The returned future completes with the task's
     * outcome; a failed task does not block the ones queued after it.
     */
    public CompletableFuture<Void> submit(String exportId, Runnable task) {
        CompletableFuture<Void> next = mailboxTails.compute(exportId, (id, tail) -> {
            CompletableFuture<Void> previous = tail == null
                    ? CompletableFuture.completedFuture(null)
                    : tail.exceptionally(ex -> null);
            return previous.thenRunAsync(task, executor);
        });
        next.whenComplete((ignored, ex) -> mailboxTails.remove(exportId, next));
        return next;
    }

    /**
     * Arm the alarm of an export. When it fires, {@code handler} is posted to the export's
     * mailbox.
     */
    public void setAlarm(String exportId, Duration delay, Runnable handler) {
        Alarm alarm = new Alarm(exportId, handler);
        alarm.future = scheduler.schedule(alarm, clock.instant().plus(delay));
        Alarm previous = alarms.put(exportId, alarm);
        if (previous != null) {
            previous.cancel();
        }
        if (alarm.fired) {
            alarms.remove(exportId, alarm);
        }
        log.debug("Alarm for export {} set in {} ms", exportId, delay.toMillis());
    }

    public void cancelAlarm(String exportId) {
        Alarm alarm = alarms.remove(exportId);
        if (alarm != null) {
            alarm.cancel();
        }
    }

    public boolean hasAlarm(String exportId) {
        return alarms.containsKey(exportId);
    }

    /**
     * Whether the export has queued or running mailbox work.
     */
    public boolean isBusy(String exportId) {
        return mailboxTails.containsKey(exportId);
    }

    /**
     * Number of exports with queued or running mailbox work.
     */
    public int activeMailboxes() {
        return mailboxTails.size();
    }

    private final class Alarm implements Runnable {
        private final String exportId;
        private final Runnable handler;
        private volatile ScheduledFuture<?> future;
        private volatile boolean fired;

        private Alarm(String exportId, Runnable handler) {
            this.exportId = exportId;
            this.handler = handler;
        }

        @Override
        public void run() {
            fired = true;
            alarms.remove(exportId, this);
            submit(exportId, handler).whenComplete((ignored, ex) -> {
                if (ex != null) {
                    log.error("Alarm handler failed for export {}", exportId, ex);
                }
            });
        }

        private void cancel() {
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
