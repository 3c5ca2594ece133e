package org.surveygrid.sinks;

import org.surveygrid.models.SimplifiedRecord;
import org.surveygrid.models.SurveyYear;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * JDBC sink writing aggregates to the {@code records} table.
 *
 * <p>Each {@link #persist} call is one transaction. The table is append-only:
 * re-running a survey-year adds a second copy of its rows, which is logged as a
 * warning rather than merged.
 */
public class JdbcAggregateSink implements AggregateSink, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcAggregateSink.class);
    private static final int BATCH_SIZE = 500;

    private final Connection connection;

    public JdbcAggregateSink(Connection connection) {
        this.connection = connection;
    }

    /**
     * Run the idempotent table DDL.
     */
    public void createTable() {
        boolean autoCommit = true;
        try {
            autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                for (String sql : SqlScripts.statements(SqlScripts.CREATE_TABLE)) {
                    statement.execute(sql);
                }
            }
            connection.commit();
            LOG.info("Aggregate table ready");
        } catch (SQLException e) {
            rollback(e);
            throw new PersistenceException("Failed to create aggregate table", e);
        } finally {
            restoreAutoCommit(autoCommit);
        }
    }

    @Override
    public int persist(SurveyYear unit, Iterable<SimplifiedRecord> records) {
        boolean autoCommit = true;
        int rows = 0;
        try {
            autoCommit = connection.getAutoCommit();
            warnIfAlreadyPresent(unit);
            connection.setAutoCommit(false);

            try (PreparedStatement statement = connection.prepareStatement(SqlScripts.load(SqlScripts.INSERT_RECORD))) {
                for (SimplifiedRecord record : records) {
                    bind(statement, record);
                    statement.addBatch();
                    rows++;
                    if (rows % BATCH_SIZE == 0) {
                        statement.executeBatch();
                    }
                }
                statement.executeBatch();
            }

            connection.commit();
            LOG.debug("Committed {} rows for {}", rows, unit);
            return rows;
        } catch (SQLException | RuntimeException e) {
            rollback(e);
            LOG.error("Rolled back {} after {} rows: {}", unit, rows, e.getMessage());
            throw new PersistenceException("Failed to persist aggregates for " + unit, e);
        } finally {
            restoreAutoCommit(autoCommit);
        }
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    private void warnIfAlreadyPresent(SurveyYear unit) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SqlScripts.load(SqlScripts.COUNT_EXISTING))) {
            statement.setString(1, unit.getSurvey());
            statement.setInt(2, unit.getYear());
            try (ResultSet rs = statement.executeQuery()) {
                if (rs.next() && rs.getLong(1) > 0) {
                    LOG.warn("{} already has {} rows in the store; new rows are appended, not merged",
                            unit, rs.getLong(1));
                }
            }
        }
    }

    private static void bind(PreparedStatement statement, SimplifiedRecord record) throws SQLException {
        statement.setInt(1, record.getYear());
        statement.setString(2, record.getSurvey());
        statement.setString(3, record.getSpecies());
        statement.setString(4, record.getCommonName());
        statement.setString(5, record.getGeohash());
        statement.setDouble(6, record.getSurfaceTemperature());
        statement.setDouble(7, record.getBottomTemperature());
        statement.setDouble(8, record.getWeight());
        statement.setLong(9, record.getCount());
        statement.setDouble(10, record.getAreaSwept());
        statement.setInt(11, record.getNumAggregated());
    }

    private void rollback(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void restoreAutoCommit(boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            LOG.warn("Could not restore auto-commit: {}", e.getMessage());
        }
    }
}
