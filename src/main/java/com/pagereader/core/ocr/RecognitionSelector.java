package com.pagereader.core.ocr;

import com.pagereader.core.image.ImageVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Прогоняет OCR по всем вариантам и оставляет самый длинный trimmed-текст.
 * При равной длине побеждает более ранний вариант, независимо от порядка завершения задач.
 */
public final class RecognitionSelector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecognitionSelector.class);

    private final TextExtractor extractor;
    private final ExecutorService exec;
    private final long timeoutMs;
    private final int threads;

    /** Последовательно, без таймаута. */
    public RecognitionSelector(TextExtractor extractor) {
        this(extractor, 1, 0);
    }

    /**
     * @param parallelism сколько вариантов распознаётся одновременно (не больше числа ядер), 1 = последовательно
     * @param timeoutMs   ожидание одного варианта, 0 = без ограничения
     */
    public RecognitionSelector(TextExtractor extractor, int parallelism, long timeoutMs) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.threads = Math.max(1, Math.min(parallelism, Runtime.getRuntime().availableProcessors()));
        this.timeoutMs = Math.max(0, timeoutMs);
        AtomicInteger seq = new AtomicInteger(1);
        // cached: воркер, застрявший в нативном вызове после таймаута, просто заменяется новым;
        // число одновременных задач ограничивает окно в select()
        this.exec = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pr-ocr-worker-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    public int threads() {
        return threads;
    }

    public RecognitionResult select(List<ImageVariant> variants, String languageHint) {
        if (variants == null || variants.isEmpty()) {
            return RecognitionResult.EMPTY;
        }
        int n = variants.size();
        List<Future<String>> futures = new ArrayList<>(n);
        long[] startedAt = new long[n];
        int next = 0;

        RecognitionResult best = null;
        for (int i = 0; i < n; i++) {
            // окно: в работе не больше threads задач; таймаут считается от старта задачи
            while (next < n && next < i + threads) {
                ImageVariant v = variants.get(next);
                startedAt[next] = System.nanoTime();
                futures.add(exec.submit(() -> extractor.extract(v, languageHint)));
                next++;
            }
            String tag = variants.get(i).tag();
            String raw;
            try {
                raw = await(futures.get(i), startedAt[i]);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("OCR: interrupted at variant {}, remaining variants dropped", tag);
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                break;
            } catch (TimeoutException te) {
                futures.get(i).cancel(true);
                log.warn("OCR: variant {} timed out after {} ms", tag, timeoutMs);
                raw = "";
            } catch (ExecutionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("OCR: variant {} failed: {}", tag, cause.toString());
                raw = "";
            }
            RecognitionResult r = new RecognitionResult(tag, raw == null ? "" : raw.strip());
            log.debug("OCR: variant {} → {} chars", tag, r.length());
            // строго больше: при равенстве остаётся более ранний
            if (best == null || r.length() > best.length()) {
                best = r;
            }
        }
        if (best == null || best.isEmpty()) {
            log.info("OCR: no text in {} variants", variants.size());
            return RecognitionResult.EMPTY;
        }
        log.info("OCR: best variant={} chars={}", best.variantTag(), best.length());
        return best;
    }

    private String await(Future<String> f, long startedAt)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (timeoutMs == 0) return f.get();
        long left = timeoutMs - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        return f.get(Math.max(0, left), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        exec.shutdownNow();
    }
}
