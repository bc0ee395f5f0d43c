package com.pagereader.core.correction.engine;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Вызов внешнего движка с таймаутом. Любой сбой (исключение, таймаут, прерывание) → {@link CapabilityCallException}.
 */
public final class CapabilityGuard implements AutoCloseable {
    private final long timeoutMs;
    private final ExecutorService exec;

    /** @param timeoutMs 0 = без таймаута, вызов в текущем потоке */
    public CapabilityGuard(long timeoutMs) {
        this.timeoutMs = Math.max(0, timeoutMs);
        this.exec = this.timeoutMs > 0
                // cached: зависший вызов не блокирует следующие
                ? Executors.newCachedThreadPool(r -> {
                    Thread t = new Thread(r, "pr-correction-call");
                    t.setDaemon(true);
                    return t;
                })
                : null;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public <T> T call(String what, Callable<T> call) {
        if (exec == null) {
            try {
                return call.call();
            } catch (Exception e) {
                throw new CapabilityCallException(what + " failed: " + e, e);
            }
        }
        Future<T> f = exec.submit(call);
        try {
            return f.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new CapabilityCallException(what + " timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CapabilityCallException(what + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            throw new CapabilityCallException(what + " interrupted", e);
        }
    }

    @Override
    public void close() {
        if (exec != null) exec.shutdownNow();
    }
}
