package io.github.metadoc.progress;

import io.github.metadoc.index.IndexProgress;
import java.io.PrintStream;

/**
 * A single-line progress bar, redrawn in place with carriage returns. Only redraws when the percentage changes.
 */
public final class ConsoleProgress implements IndexProgress {
    private static final int WIDTH = 30;

    private final PrintStream out;
    private int total;
    private int lastPercent = -1;

    public ConsoleProgress(PrintStream out) {
        this.out = out;
    }

    @Override
    public synchronized void start(String task, int total) {
        this.total = total;
        this.lastPercent = -1;
        draw(task, 0);
    }

    @Override
    public synchronized void tick(String task, int done) {
        draw(task, done);
    }

    @Override
    public synchronized void complete(String task, boolean success) {
        if (success) {
            draw(task, total);
        }
        out.println(success ? "" : " failed");
        out.flush();
    }

    private void draw(String task, int done) {
        int percent = total <= 0 ? 100 : (int) (Math.min(done, total) * 100L / total);
        if (percent <= lastPercent) {
            return;
        }
        lastPercent = percent;
        int filled = percent * WIDTH / 100;
        out.print("\r%s [%s%s] %3d%%".formatted(task, "#".repeat(filled), " ".repeat(WIDTH - filled), percent));
        out.flush();
    }

    /** The console bar when a terminal is attached and not disabled, log lines otherwise. */
    public static IndexProgress forTerminal(boolean nonInteractive) {
        if (nonInteractive || System.console() == null) {
            return new LoggingProgress();
        }
        return new ConsoleProgress(System.err);
    }
}
