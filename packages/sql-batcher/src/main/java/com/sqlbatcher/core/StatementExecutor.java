package com.sqlbatcher.core;

/**
 * Callback that runs one flushed batch of SQL.
 *
 * <p>Whatever the callback throws is propagated to the caller of
 * {@link SQLBatcher#flush} or {@link SQLBatcher#processStatements} unchanged.
 *
 * @param <E> the exception type the callback may throw
 */
@FunctionalInterface
public interface StatementExecutor<E extends Exception> {

    void execute(String sql) throws E;
}
