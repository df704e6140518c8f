package com.project.items.persistence;

import com.project.items.exceptions.PersistenceException;
import com.project.items.exceptions.PoolExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLTransientConnectionException;

/**
 * Issues scoped {@link Session}s over the pooled data source.
 *
 * <p>{@link #inSession} runs the work in one transaction: it commits when the work returns,
 * rolls back when anything is thrown, and hands the connection back to the pool before it
 * returns or throws. Store failures leave as {@link PersistenceException}; exceptions raised
 * by the work itself are rethrown unchanged after the rollback.
 *
 * <p>Sessions do not nest: a call made from inside a callback on the same thread joins the
 * outer transaction.
 */
@Component
public class SessionFactory {
    private static final Logger log = LoggerFactory.getLogger(SessionFactory.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public SessionFactory(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    public <T> T inSession(SessionWork<T> work) {
        try {
            return transactionTemplate.execute(status -> {
                Session session = new Session(jdbcTemplate);
                try {
                    return work.apply(session);
                } finally {
                    session.close();
                }
            });
        } catch (DataAccessException | TransactionException e) {
            if (isPoolTimeout(e)) {
                log.warn("Connection pool exhausted: {}", e.getMessage());
                throw new PoolExhaustedException("Timed out waiting for a pooled connection", e);
            }
            throw new PersistenceException("Database operation failed", e);
        }
    }

    // Hikari attaches the last connection failure as the cause when the store is unreachable;
    // a bare timeout means every connection was checked out
    private static boolean isPoolTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLTransientConnectionException) {
                return t.getCause() == null;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
