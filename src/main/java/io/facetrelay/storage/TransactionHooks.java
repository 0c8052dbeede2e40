package io.facetrelay.storage;

/**
 * Defers side effects that live outside SQLite until the surrounding unit of work settles.
 * Without an active unit of work {@code onCommit} runs immediately.
 */
public interface TransactionHooks {
    void afterCompletion(Runnable onCommit, Runnable onRollback);
}
