package io.hookcron.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import io.hookcron.core.repository.ResourceNotFoundException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.transaction.TransactionException;

/**
 * Runs DAO calls on the handle of the current {@link TransactionManager} transaction.
 *
 * @param <D> SqlObject interface attached to the handle
 */
public abstract class BasicDatabaseStoreManager <D>
{
    private final Class<? extends D> daoIface;
    private final TransactionManager transactionManager;

    protected BasicDatabaseStoreManager(
            Class<? extends D> daoIface,
            TransactionManager transactionManager)
    {
        this.daoIface = daoIface;
        this.transactionManager = transactionManager;
    }

    public interface DaoAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    public interface CheckedDaoAction <T, D, E1 extends Exception, E2 extends Exception, E3 extends Exception>
    {
        T call(Handle handle, D dao) throws E1, E2, E3;
    }

    /**
     * Runs the action in the transaction started by {@code TransactionManager.begin}.
     */
    public <T> T transaction(DaoAction<T, D> action)
    {
        return call(action);
    }

    public <T, E1 extends Exception, E2 extends Exception, E3 extends Exception> T transaction(
            CheckedDaoAction<T, D, E1, E2, E3> action,
            Class<E1> exClass1,
            Class<E2> exClass2,
            Class<E3> exClass3)
        throws E1, E2, E3
    {
        Handle handle = transactionManager.getHandle();
        try {
            return action.call(handle, handle.attach(daoIface));
        }
        catch (Exception ex) {
            Throwables.throwIfInstanceOf(ex, exClass1);
            Throwables.throwIfInstanceOf(ex, exClass2);
            Throwables.throwIfInstanceOf(ex, exClass3);
            Throwables.throwIfUnchecked(ex);
            throw new TransactionException("Unexpected exception in a database transaction", ex);
        }
    }

    /**
     * Runs the action in the current transaction, or in its own auto-commit transaction
     * when called inside {@code TransactionManager.autoCommit}.
     */
    public <T> T autoCommit(DaoAction<T, D> action)
    {
        return call(action);
    }

    private <T> T call(DaoAction<T, D> action)
    {
        Handle handle = transactionManager.getHandle();
        return action.call(handle, handle.attach(daoIface));
    }

    protected static <T> T requiredSchedule(T resource, String scheduleId)
            throws ResourceNotFoundException
    {
        if (resource == null) {
            throw ResourceNotFoundException.ofSchedule(scheduleId);
        }
        return resource;
    }

    public static Optional<Integer> getOptionalInt(ResultSet r, String column)
            throws SQLException
    {
        int v = r.getInt(column);
        return r.wasNull() ? Optional.absent() : Optional.of(v);
    }

    public static Optional<String> getOptionalString(ResultSet r, String column)
            throws SQLException
    {
        return Optional.fromNullable(r.getString(column));
    }

    public static Instant getTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        return r.getTimestamp(column).toInstant();
    }

    // times of schedules are stored as epoch seconds in bigint columns
    public static Optional<Instant> getOptionalEpochSecond(ResultSet r, String column)
            throws SQLException
    {
        long v = r.getLong(column);
        return r.wasNull() ? Optional.absent() : Optional.of(Instant.ofEpochSecond(v));
    }

    public static Long epochSecondOrNull(Optional<Instant> instant)
    {
        return instant.isPresent() ? instant.get().getEpochSecond() : null;
    }
}
