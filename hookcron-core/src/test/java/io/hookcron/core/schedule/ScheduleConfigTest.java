package io.hookcron.core.schedule;

import io.hookcron.client.config.ConfigException;
import org.junit.Test;

import static io.hookcron.core.database.DatabaseTestingUtils.createConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ScheduleConfigTest
{
    @Test
    public void defaults()
    {
        ScheduleConfig config = ScheduleConfig.convertFrom(createConfig());
        assertThat(config.getEnabled(), is(true));
        assertThat(config.getPollInterval(), is(60));
        assertThat(config.getMaxConcurrency(), is(8));
        assertThat(config.getClaimLease(), is(300));
        assertThat(config.getMaxPerOwner(), is(100));
    }

    @Test
    public void claimLeaseShorterThanDeliveryTimeoutIsRejected()
    {
        try {
            ScheduleConfig.convertFrom(createConfig().set("schedule.claim_lease", 5));
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("schedule.claim_lease"));
            assertThat(ex.getMessage(), containsString("delivery.timeout (10) but got 5"));
        }
    }

    @Test
    public void claimLeaseIsComparedWithConfiguredDeliveryTimeout()
    {
        ScheduleConfig config = ScheduleConfig.convertFrom(createConfig()
                .set("schedule.claim_lease", 30)
                .set("delivery.timeout", 20));
        assertThat(config.getClaimLease(), is(30));

        try {
            ScheduleConfig.convertFrom(createConfig()
                    .set("schedule.claim_lease", 30)
                    .set("delivery.timeout", 30));
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("delivery.timeout (30) but got 30"));
        }
    }

    @Test(expected = ConfigException.class)
    public void nonPositiveValueIsRejected()
    {
        ScheduleConfig.convertFrom(createConfig().set("schedule.max_concurrency", 0));
    }
}
