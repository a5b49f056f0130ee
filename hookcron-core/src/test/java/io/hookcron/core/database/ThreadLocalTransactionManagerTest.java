package io.hookcron.core.database;

import org.jdbi.v3.core.Handle;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.hookcron.core.database.DatabaseTestingUtils.createConfigMapper;
import static io.hookcron.core.database.DatabaseTestingUtils.getEnvironmentDatabaseConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ThreadLocalTransactionManagerTest
{
    private DataSourceProvider dsp;
    private TransactionManager tm;

    @Before
    public void setUp()
    {
        dsp = new DataSourceProvider(getEnvironmentDatabaseConfig());
        tm = new ThreadLocalTransactionManager(dsp.get(), createConfigMapper());
        tm.autoCommit(() -> tm.getHandle().execute("create table tx_rows (id int not null)"));
    }

    @After
    public void destroy()
    {
        tm.autoCommit(() -> tm.getHandle().execute("drop table tx_rows"));
        dsp.close();
    }

    private int count()
    {
        return tm.autoCommit(() -> tm.getHandle()
                .createQuery("select count(*) from tx_rows")
                .mapTo(Integer.class)
                .one());
    }

    @Test
    public void beginCommitsAndClosesHandle()
    {
        Handle used = tm.begin(() -> {
            Handle handle = tm.getHandle();
            handle.execute("insert into tx_rows (id) values (1)");
            handle.execute("insert into tx_rows (id) values (2)");
            return handle;
        });

        assertThat(count(), is(2));
        assertThat(used.isClosed(), is(true));

        // a second transaction on the same thread starts cleanly
        tm.begin(() -> tm.getHandle().execute("insert into tx_rows (id) values (3)"));
        assertThat(count(), is(3));
    }

    @Test
    public void exceptionRollsBack()
    {
        try {
            tm.begin(() -> {
                tm.getHandle().execute("insert into tx_rows (id) values (1)");
                throw new IllegalStateException("boom");
            });
            fail();
        }
        catch (IllegalStateException ex) {
            assertThat(ex.getMessage(), is("boom"));
        }

        assertThat(count(), is(0));
    }

    @Test
    public void transactionWithoutStatementsCommits()
    {
        assertThat(tm.begin(() -> "done"), is("done"));
    }

    @Test(expected = IllegalStateException.class)
    public void nestedTransactionIsRejected()
    {
        tm.begin(() -> tm.begin(() -> null));
    }

    @Test(expected = IllegalStateException.class)
    public void handleOutsideTransactionIsRejected()
    {
        tm.getHandle();
    }
}
