package com.factql.store;

import com.factql.query.BuiltQuery;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Handle to the analytical store. Wraps the shared connection pool; safe to use from any
 * number of request threads.
 *
 * <p>No retries: a store failure surfaces to the caller as {@link StorageException} with the
 * store's own message.
 */
@Slf4j
@Service
public class FactStore {
    private static final int PING_TIMEOUT_SEC = 5;

    private final DataSource dataSource;
    private final ScheduledExecutorService deadlines = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "factql-query-deadline");
        t.setDaemon(true);
        return t;
    });

    /**
     * Create a store handle.
     *
     * @param dataSource pooled data source for the fact store
     */
    public FactStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Executes a built query and hands the result set to {@code reader}.
     *
     * <p>The statement is cancelled when {@code context} is cancelled or reaches its deadline;
     * in both cases {@link QueryCancelledException} is thrown and whatever the reader had
     * decoded is dropped.
     *
     * @param query query text and bound arguments
     * @param context deadline and cancellation signal
     * @param reader consumes the result set
     * @param <T> result type
     * @return value produced by {@code reader}
     */
    public <T> T query(BuiltQuery query, QueryContext context, ResultReader<T> reader) {
        context.throwIfCancelled();
        ScheduledFuture<?> deadline = deadlines.schedule(
                () -> context.cancel(QueryContext.REASON_DEADLINE),
                context.remainingMillis(),
                TimeUnit.MILLISECONDS);
        long startTime = System.currentTimeMillis();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(query.getSql())) {
            List<Object> args = query.getArgs();
            for (int i = 0; i < args.size(); i++) {
                stmt.setObject(i + 1, args.get(i));
            }
            stmt.setQueryTimeout(timeoutSeconds(context.remainingMillis()));
            context.onCancel(() -> cancelStatement(stmt));

            try (ResultSet rs = stmt.executeQuery()) {
                T result = reader.read(rs, context);
                context.throwIfCancelled();
                log.debug("Query finished: shape={}, duration_ms={}", query.getShape(), System.currentTimeMillis() - startTime);
                return result;
            }
        } catch (SQLException e) {
            if (context.isCancelled()) {
                throw new QueryCancelledException(context.getReason(), e);
            }
            log.error("Store query failed: shape={}, sql={} (SQLState: {}, Error Code: {})",
                    query.getShape(), query.getSql(), e.getSQLState(), e.getErrorCode(), e);
            throw new StorageException(e.getMessage(), e);
        } finally {
            deadline.cancel(false);
            context.clearCancelHook();
        }
    }

    /**
     * Single reachability probe.
     *
     * @throws StorageException when no valid connection can be obtained
     */
    public void ping() {
        try (Connection conn = dataSource.getConnection()) {
            if (!conn.isValid(PING_TIMEOUT_SEC)) {
                throw new SQLException("Connection is not valid");
            }
        } catch (SQLException e) {
            log.warn("Store ping failed: {} (SQLState: {})", e.getMessage(), e.getSQLState());
            throw new StorageException(e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        deadlines.shutdownNow();
    }

    static int timeoutSeconds(long remainingMillis) {
        return (int) Math.max(1, (remainingMillis + 999) / 1000);
    }

    private static void cancelStatement(Statement stmt) {
        try {
            stmt.cancel();
        } catch (SQLException e) {
            log.warn("Failed to cancel running statement: {}", e.getMessage());
        }
    }
}
