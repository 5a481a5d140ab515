package io.github.metadoc.index;

/**
 * Observer for the phases of an index run. Callbacks may arrive from several worker threads at once; implementations
 * must tolerate that and must not block. Nothing in the pipeline depends on what an implementation does.
 */
public interface IndexProgress {

    IndexProgress NO_OP = new IndexProgress() {};

    /** A phase with {@code total} units of work begins. */
    default void start(String task, int total) {}

    /** {@code done} units of {@code task} have finished. Values may be reported out of order. */
    default void tick(String task, int done) {}

    default void complete(String task, boolean success) {}
}
