package com.ciro.ncl.standalone;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Agrupa ráfagas de trabajo: solo se ejecuta la última tarea enviada tras
 * {@code delayMs} sin envíos nuevos.
 */
public final class Debouncer {

    private final ScheduledExecutorService scheduler;
    private final long delayMs;

    private ScheduledFuture<?> pending;

    public Debouncer(ScheduledExecutorService scheduler, long delayMs) {
        this.scheduler = scheduler;
        this.delayMs = Math.max(0, delayMs);
    }

    public synchronized void submit(Runnable task) {
        if (pending != null) pending.cancel(false);
        pending = scheduler.schedule(task, delayMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }
}
