package berth.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Transaction helpers shared by the JDBC repositories.
 *
 * UPDATE-then-INSERT writes race when two writers create the same key: both
 * update nothing and the second INSERT fails on the primary key. Such a
 * transaction is rolled back and run again, and the retry finds the row.
 */
final class Transactions {

    private static final Logger log = LoggerFactory.getLogger(Transactions.class);

    static final int MAX_ATTEMPTS = 5;

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String H2_CONCURRENT_UPDATE = "90131";

    @FunctionalInterface
    interface Work<T> {
        T run(Connection conn) throws SQLException;
    }

    private Transactions() {
    }

    /**
     * Run the work in one transaction: commit on success, roll back on failure.
     */
    static <T> T inTransaction(Database db, Work<T> work) throws SQLException {
        try (Connection conn = db.getConnection()) {
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    /**
     * Like {@link #inTransaction}, but runs the whole transaction again when it
     * lost an insert race on a unique key.
     */
    static <T> T retryingOnConflict(Database db, String what, Work<T> work) throws SQLException {
        for (int attempt = 1;; attempt++) {
            try {
                return inTransaction(db, work);
            } catch (SQLException e) {
                if (!isConflict(e) || attempt >= MAX_ATTEMPTS) {
                    throw e;
                }
                log.debug("Concurrent write on {}, retrying (attempt {})", what, attempt + 1);
            }
        }
    }

    static boolean isConflict(SQLException e) {
        String state = e.getSQLState();
        return UNIQUE_VIOLATION.equals(state) || H2_CONCURRENT_UPDATE.equals(state);
    }
}
