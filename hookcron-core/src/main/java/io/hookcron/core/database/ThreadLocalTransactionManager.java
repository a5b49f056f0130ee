package io.hookcron.core.database;

import com.google.common.base.Throwables;
import com.google.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.transaction.TransactionException;

import java.sql.SQLException;

import javax.sql.DataSource;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Locale.ENGLISH;

public class ThreadLocalTransactionManager
        implements TransactionManager
{
    private final ThreadLocal<LazyTransaction> threadLocalTransaction = new ThreadLocal<>();
    private final ThreadLocal<LazyTransaction> threadLocalAutoCommitTransaction = new ThreadLocal<>();
    private final Jdbi jdbi;

    // opens a connection on the first getHandle call only
    private static class LazyTransaction
    {
        private enum State
        {
            ACTIVE,
            ABORTED,
            COMMITTED;
        }

        private final Jdbi jdbi;
        private final boolean autoAutoCommit;
        private Handle handle;
        private State state = State.ACTIVE;

        LazyTransaction(Jdbi jdbi, boolean autoAutoCommit)
        {
            this.jdbi = checkNotNull(jdbi);
            this.autoAutoCommit = autoAutoCommit;
        }

        Handle getHandle()
        {
            if (state != State.ACTIVE) {
                throw new IllegalStateException("Transaction is already " + state.name().toLowerCase(ENGLISH));
            }

            if (handle == null) {
                handle = jdbi.open();

                // Handle.begin turns auto-commit off and restores it on commit or rollback
                if (autoAutoCommit) {
                    try {
                        handle.getConnection().setAutoCommit(true);
                    }
                    catch (SQLException ex) {
                        throw new TransactionException("Failed to set auto commit", ex);
                    }
                }
                else {
                    handle.begin();
                }
            }
            return handle;
        }

        void commit()
        {
            if (handle == null) {
                return;
            }
            if (state != State.ACTIVE) {
                throw new IllegalStateException("Committing " + state.name().toLowerCase(ENGLISH) + " is not allowed");
            }

            // PostgreSQL silently rolls back on COMMIT if a statement failed in the transaction.
            // Connection.isValid returns false in that case.
            boolean isValid;
            try {
                isValid = handle.getConnection().isValid(30);
            }
            catch (SQLException ex) {
                throw new TransactionException(
                        "Can't validate a transaction before commit", ex);
            }
            if (!isValid) {
                throw new TransactionException(
                        "Trying to commit a transaction that is already aborted. " +
                                "Because current transaction is aborted, commands including " +
                                "commit are ignored until end of transaction block.");
            }
            else {
                handle.commit();
            }

            state = State.COMMITTED;
        }

        void abort()
        {
            if (handle == null) {
                return;
            }
            if (state == State.COMMITTED) {
                throw new IllegalStateException("Aborting committed transaction is not allowed");
            }
            if (!autoAutoCommit) {
                handle.rollback();
            }
            state = State.ABORTED;
        }

        void close()
        {
            if (handle != null) {
                handle.close();
            }
        }

        @Override
        public String toString()
        {
            return "LazyTransaction{" +
                    "autoAutoCommit=" + autoAutoCommit +
                    ", handle=" + handle +
                    ", state=" + state +
                    "}";
        }
    }

    @Inject
    public ThreadLocalTransactionManager(DataSource ds, ConfigMapper configMapper)
    {
        this.jdbi = DatabaseHelper.createJdbi(checkNotNull(ds), configMapper);
    }

    @Override
    public Handle getHandle()
    {
        LazyTransaction transaction = threadLocalTransaction.get();
        if (transaction == null) {
            transaction = threadLocalAutoCommitTransaction.get();
            if (transaction == null) {
                throw new IllegalStateException("Not in transaction");
            }
        }
        return transaction.getHandle();
    }

    @Override
    public <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func)
    {
        return begin(func, RuntimeException.class, RuntimeException.class, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T begin(SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        return begin(func, e1, RuntimeException.class, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception, E2 extends Exception>
    T begin(SupplierInTransaction<T, E1, E2, RuntimeException> func, Class<E1> e1, Class<E2> e2)
            throws E1, E2
    {
        return begin(func, e1, e2, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception, E2 extends Exception, E3 extends Exception>
    T begin(SupplierInTransaction<T, E1, E2, E3> func, Class<E1> e1, Class<E2> e2, Class<E3> e3)
            throws E1, E2, E3
    {
        if (threadLocalTransaction.get() != null) {
            throw new IllegalStateException("Nested transaction is not allowed: " + threadLocalTransaction.get());
        }

        boolean committed = false;
        LazyTransaction transaction = new LazyTransaction(jdbi, false);
        try {
            threadLocalTransaction.set(transaction);
            T result = func.get();
            transaction.commit();
            committed = true;
            return result;
        }
        catch (Exception e) {
            Throwables.throwIfInstanceOf(e, e1);
            Throwables.throwIfInstanceOf(e, e2);
            Throwables.throwIfInstanceOf(e, e3);
            Throwables.throwIfUnchecked(e);
            throw new TransactionException("Transaction failed", e);
        }
        finally {
            threadLocalTransaction.set(null);
            try {
                if (!committed) {
                    transaction.abort();
                }
            }
            finally {
                transaction.close();
            }
        }
    }

    @Override
    public <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func)
    {
        return autoCommit(func, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T autoCommit(SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        try {
            if (threadLocalTransaction.get() != null || threadLocalAutoCommitTransaction.get() != null) {
                return func.get();
            }
            else {
                LazyTransaction transaction = new LazyTransaction(jdbi, true);
                threadLocalAutoCommitTransaction.set(transaction);
                try {
                    return func.get();
                }
                finally {
                    threadLocalAutoCommitTransaction.set(null);
                    transaction.close();
                }
            }
        }
        catch (Exception e) {
            Throwables.throwIfInstanceOf(e, e1);
            Throwables.throwIfUnchecked(e);
            throw new TransactionException("Auto-commit statement failed", e);
        }
    }
}
