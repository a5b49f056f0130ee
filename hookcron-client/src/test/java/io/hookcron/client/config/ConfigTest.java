package io.hookcron.client.config;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Properties;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import static io.hookcron.client.ObjectMappers.objectMapper;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ConfigTest
{
    private ConfigFactory factory;
    private Config config;

    @Before
    public void setUp()
    {
        factory = new ConfigFactory(objectMapper());
        config = factory.create();
    }

    @Test
    public void setGetPrimitives()
    {
        config.set("int", 1);
        config.set("str", "s");
        config.set("bool", true);

        assertThat(config.get("int", int.class), is(1));
        assertThat(config.get("int", long.class), is(1L));
        assertThat(config.get("int", Integer.class), is(1));
        assertThat(config.get("str", String.class), is("s"));
        assertThat(config.get("bool", boolean.class), is(true));
        assertThat(config.get("int", String.class), is("1"));
    }

    @Test
    public void timeValues()
    {
        Instant at = Instant.parse("2024-01-02T09:00:00Z");
        config.set("at", at);
        config.set("timezone", ZoneId.of("Asia/Tokyo"));

        assertThat(config.get("at", String.class), is("2024-01-02T09:00:00Z"));
        assertThat(config.get("at", Instant.class), is(at));
        assertThat(config.get("timezone", String.class), is("Asia/Tokyo"));
        assertThat(config.get("timezone", ZoneId.class), is(ZoneId.of("Asia/Tokyo")));
    }

    @Test
    public void propertiesAreStrings()
    {
        Properties props = new Properties();
        props.setProperty("schedule.poll_interval", "30");
        props.setProperty("schedule.enabled", "false");
        Config fromProps = factory.fromProperties(props);

        assertThat(fromProps.get("schedule.poll_interval", int.class), is(30));
        assertThat(fromProps.get("schedule.enabled", boolean.class), is(false));
        assertThat(ConfigElement.fromProperties(props).toConfig(factory), is(fromProps));
    }

    @Test
    public void defaultsAndOptionals()
    {
        config.set("nullValue", null);
        config.set("present", "v");

        assertThat(config.has("nullValue"), is(false));
        assertThat(config.get("missing", String.class, "d"), is("d"));
        assertThat(config.get("present", String.class, "d"), is("v"));
        assertThat(config.getOptional("missing", String.class), is(Optional.absent()));
        assertThat(config.getOptional("present", String.class), is(Optional.of("v")));
        assertThat(config.setOptional("opt", Optional.absent()).has("opt"), is(false));
    }

    @Test
    public void missingRequiredKey()
    {
        try {
            config.get("missing", String.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), is("Parameter 'missing' is required but not set"));
        }
    }

    @Test
    public void typeMismatchNamesTheKey()
    {
        config.set("port", "eighty");
        try {
            config.get("port", int.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("Expected integer (int) type for key 'port' but got \"eighty\" (string)"));
        }
    }

    @Test
    public void lists()
    {
        config.set("hosts", Arrays.asList("a", "b"));
        assertThat(config.getListOrEmpty("hosts", String.class), is(ImmutableList.of("a", "b")));
        assertThat(config.getListOrEmpty("missing", String.class), is(ImmutableList.of()));
    }

    @Test
    public void mergeIsDeep()
    {
        config.set("a", 1).setNested("nested", factory.create().set("x", 1).set("y", 1));
        Config other = factory.create().set("b", 2).setNested("nested", factory.create().set("y", 2));

        config.merge(other);

        assertThat(config.get("a", int.class), is(1));
        assertThat(config.get("b", int.class), is(2));
        assertThat(config.getNested("nested").get("x", int.class), is(1));
        assertThat(config.getNested("nested").get("y", int.class), is(2));
    }

    @Test
    public void extractPrefixed()
    {
        config.set("attachment.type", "local");
        config.set("attachment.local.root", "/var/lib/hookcron");
        config.set("database.type", "memory");

        Config local = config.extractPrefixed("attachment.local.");
        assertThat(local.getKeys(), is(ImmutableList.of("root")));
        assertThat(local.get("root", String.class), is("/var/lib/hookcron"));

        local.set("root", "changed");
        assertThat(config.get("attachment.local.root", String.class), is("/var/lib/hookcron"));
    }

    @Test
    public void fromJsonString()
    {
        Config parsed = factory.fromJsonString("{\"cron_expression\":\"0 9 * * *\",\"timezone\":\"UTC\"}");
        assertThat(parsed.get("cron_expression", String.class), is("0 9 * * *"));

        try {
            factory.fromJsonString("[1]");
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("Expected a JSON object"));
        }
    }

    @Test
    public void elementIsImmutableCopy()
    {
        config.set("k", "v");
        ConfigElement element = ConfigElement.copyOf(config);
        config.set("k", "changed");

        Config copy = element.toConfig(factory);
        assertThat(copy.get("k", String.class), is("v"));
        copy.set("k", "other");
        assertThat(element.toConfig(factory).get("k", String.class), is("v"));
    }
}
