package io.hookcron.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import io.hookcron.client.api.MessageSnapshot;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigException;
import io.hookcron.core.payload.PayloadSerializer;
import io.hookcron.core.payload.PayloadValidator;
import io.hookcron.core.payload.SnapshotHydrator;
import io.hookcron.standards.scheduler.CronSchedulerFactory;
import io.hookcron.standards.scheduler.OnceSchedulerFactory;
import org.junit.Test;

import static io.hookcron.client.ObjectMappers.objectMapper;
import static io.hookcron.core.database.DatabaseTestingUtils.createConfig;
import static io.hookcron.core.database.DatabaseTestingUtils.createConfigFactory;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ScheduleValidatorTest
{
    // Friday
    private static final Instant AT = Instant.parse("2024-03-15T23:45:00Z");

    private static ScheduleValidator validator(Config systemConfig)
    {
        return new ScheduleValidator(
                createConfigFactory(),
                new SchedulerManager(ImmutableSet.of(new OnceSchedulerFactory(), new CronSchedulerFactory())),
                new PayloadValidator(new PayloadSerializer()),
                new SnapshotHydrator(objectMapper()),
                ScheduleConfig.defaultBuilder().build(),
                WebhookConfig.convertFrom(systemConfig));
    }

    private final ScheduleValidator validator = validator(createConfig());

    private static String cron(Config config)
    {
        return config.get(ScheduleValidator.CRON_EXPRESSION_KEY, String.class);
    }

    @Test
    public void namedPatternsBecomeCron()
    {
        assertThat(cron(validator.toCronConfig(RecurrenceRequest.of(RecurrencePattern.DAILY, Optional.absent()), AT)), is("45 23 * * *"));
        assertThat(cron(validator.toCronConfig(RecurrenceRequest.of(RecurrencePattern.WEEKLY, Optional.absent()), AT)), is("45 23 * * 5"));
        assertThat(cron(validator.toCronConfig(RecurrenceRequest.of(RecurrencePattern.MONTHLY, Optional.absent()), AT)), is("45 23 15 * *"));
        assertThat(cron(validator.toCronConfig(RecurrenceRequest.cron(" 0-59/5 * * * * ", Optional.absent()), AT)), is("0-59/5 * * * *"));
    }

    @Test
    public void timeZoneMovesTheFields()
    {
        // Saturday 08:45 in Tokyo
        Config config = validator.toCronConfig(RecurrenceRequest.of(RecurrencePattern.WEEKLY, Optional.of(" Asia/Tokyo ")), AT);
        assertThat(cron(config), is("45 8 * * 6"));
        assertThat(config.get(ScheduleValidator.TIMEZONE_KEY, String.class), is("Asia/Tokyo"));

        Config sunday = validator.toCronConfig(RecurrenceRequest.of(RecurrencePattern.WEEKLY, Optional.absent()),
                Instant.parse("2024-03-17T10:00:00Z"));
        assertThat(cron(sunday), is("0 10 * * 0"));
        assertThat(sunday.has(ScheduleValidator.TIMEZONE_KEY), is(false));

        Config blank = validator.toCronConfig(RecurrenceRequest.of(RecurrencePattern.DAILY, Optional.of(" ")), AT);
        assertThat(blank.has(ScheduleValidator.TIMEZONE_KEY), is(false));
    }

    @Test
    public void validateRecurringRequest()
    {
        ScheduleDefinition def = validator.validate(ScheduleRequest.builder()
                .name("standup")
                .targetUrl(" https://discordapp.com/api/webhooks/1/t ")
                .payload(MessageSnapshot.builder().content("standup").build())
                .scheduledAt(AT)
                .recurrence(RecurrenceRequest.cron("0 9 * * 1-5", Optional.of("Europe/Berlin")))
                .maxExecutions(10)
                .build(), AT.plusSeconds(86400 * 30));

        assertThat(def.getTargetUrl(), is("https://discordapp.com/api/webhooks/1/t"));
        assertThat(def.getRecurring(), is(true));
        assertThat(def.getRecurrencePattern(), is(ScheduleValidator.CRON_PATTERN));
        assertThat(cron(def.getRecurrenceConfig()), is("0 9 * * 1-5"));
        assertThat(def.getMaxExecutions(), is(Optional.of(10)));
        assertThat(def.getPayload().get(), containsString("\"content\":\"standup\""));
    }

    @Test
    public void onceMayBeSlightlyInThePast()
    {
        ScheduleRequest request = ScheduleRequest.builder()
            .name("now")
            .targetUrl("https://discord.com/api/webhooks/1/t")
            .payload(MessageSnapshot.builder().content("x").build())
            .scheduledAt(AT)
            .build();

        ScheduleDefinition def = validator.validate(request, AT.plusSeconds(60));
        assertThat(def.getRecurring(), is(false));
        assertThat(def.getRecurrencePattern(), is(ScheduleValidator.ONCE_PATTERN));
        assertThat(def.getRecurrenceConfig().isEmpty(), is(true));

        assertInvalid(() -> validator.validate(request, AT.plusSeconds(61)), "in the past");
    }

    @Test
    public void targetUrl()
    {
        validator.validateTargetUrl("https://discord.com/api/webhooks/123/token");
        validator.validateTargetUrl("https://DISCORD.com/api/webhooks/123/token?wait=true");

        assertInvalid(() -> validator.validateTargetUrl("https://discord.com/api/webhooks/"), "path must start with");
        assertInvalid(() -> validator.validateTargetUrl("https://discord.com/channels/1"), "path must start with");
        assertInvalid(() -> validator.validateTargetUrl("https://discord.com.evil.example/api/webhooks/1/t"), "is not allowed");
        assertInvalid(() -> validator.validateTargetUrl("ftp://discord.com/api/webhooks/1/t"), "must use https");
        assertInvalid(() -> validator.validateTargetUrl("not a url"), "Invalid webhook URL");
        assertInvalid(() -> validator.validateTargetUrl("http://discord.com/api/webhooks/1/t"), "must use https");
    }

    @Test
    public void configuredHostsAndInsecure()
    {
        ScheduleValidator local = validator(createConfig()
                .set("webhook.allowed_hosts", "localhost, hooks.example.com")
                .set("webhook.allow_insecure", true));

        local.validateTargetUrl("http://localhost:8080/api/webhooks/1/t");
        local.validateTargetUrl("https://hooks.example.com/api/webhooks/1/t");
        assertInvalid(() -> local.validateTargetUrl("https://discord.com/api/webhooks/1/t"), "is not allowed");
    }

    private static void assertInvalid(Runnable r, String messagePart)
    {
        try {
            r.run();
            fail("Expected ConfigException containing " + messagePart);
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString(messagePart));
        }
    }
}
