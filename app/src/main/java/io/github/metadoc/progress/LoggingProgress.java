package io.github.metadoc.progress;

import io.github.metadoc.index.IndexProgress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reports progress as log lines, one per 10% step. Used when no terminal is attached. */
public final class LoggingProgress implements IndexProgress {
    private static final Logger logger = LogManager.getLogger(LoggingProgress.class);

    private final Map<String, Integer> totals = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> lastStep = new ConcurrentHashMap<>();

    @Override
    public void start(String task, int total) {
        totals.put(task, total);
        lastStep.put(task, new AtomicInteger());
    }

    @Override
    public void tick(String task, int done) {
        int total = totals.getOrDefault(task, 0);
        var last = lastStep.get(task);
        if (total <= 0 || last == null) {
            return;
        }
        int step = (int) (Math.min(done, total) * 10L / total);
        int previous = last.getAndAccumulate(step, Math::max);
        if (step > previous) {
            logger.info("{}: {}% ({}/{})", task, step * 10, done, total);
        }
    }

    @Override
    public void complete(String task, boolean success) {
        totals.remove(task);
        lastStep.remove(task);
        if (!success) {
            logger.warn("{}: failed", task);
        }
    }
}
