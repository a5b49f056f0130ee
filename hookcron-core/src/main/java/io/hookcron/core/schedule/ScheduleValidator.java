package io.hookcron.core.schedule;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigException;
import io.hookcron.client.config.ConfigFactory;
import io.hookcron.core.payload.PayloadValidator;
import io.hookcron.core.payload.SnapshotHydrator;

import static java.util.Locale.ENGLISH;

/**
 * Checks a {@link ScheduleRequest} and turns it into the {@link ScheduleDefinition} that is stored.
 * Named recurrences are rewritten to cron expressions here so that only {@code once} and
 * {@code cron} reach the dispatcher.
 */
public class ScheduleValidator
{
    public static final String ONCE_PATTERN = "once";
    public static final String CRON_PATTERN = "cron";
    public static final String CRON_EXPRESSION_KEY = "cron_expression";
    public static final String TIMEZONE_KEY = "timezone";

    private static final String WEBHOOK_PATH_PREFIX = "/api/webhooks/";

    private final ConfigFactory cf;
    private final SchedulerManager srm;
    private final PayloadValidator payloadValidator;
    private final SnapshotHydrator hydrator;
    private final ScheduleConfig scheduleConfig;
    private final WebhookConfig webhookConfig;

    @Inject
    public ScheduleValidator(
            ConfigFactory cf,
            SchedulerManager srm,
            PayloadValidator payloadValidator,
            SnapshotHydrator hydrator,
            ScheduleConfig scheduleConfig,
            WebhookConfig webhookConfig)
    {
        this.cf = cf;
        this.srm = srm;
        this.payloadValidator = payloadValidator;
        this.hydrator = hydrator;
        this.scheduleConfig = scheduleConfig;
        this.webhookConfig = webhookConfig;
    }

    public ScheduleDefinition validate(ScheduleRequest request, Instant now)
    {
        String name = request.getName().trim();
        if (name.isEmpty()) {
            throw new ConfigException("Schedule name must not be empty");
        }

        validateTargetUrl(request.getTargetUrl());
        payloadValidator.validate(request.getPayload());

        if (request.getMaxExecutions().isPresent() && request.getMaxExecutions().get() < 1) {
            throw new ConfigException("max_executions must be at least 1: " + request.getMaxExecutions().get());
        }

        RecurrenceRequest recurrence = request.getRecurrence();
        ImmutableScheduleDefinition.Builder builder = ScheduleDefinition.builder()
            .name(name)
            .targetUrl(request.getTargetUrl().trim())
            .payload(hydrator.toJson(request.getPayload()))
            .scheduledAt(request.getScheduledAt())
            .maxExecutions(request.getMaxExecutions());

        if (recurrence.getPattern().isRecurring()) {
            Config recurrenceConfig = toCronConfig(recurrence, request.getScheduledAt());
            // fails with ConfigException on a bad expression or time zone
            srm.getScheduler(CRON_PATTERN, recurrenceConfig);
            builder.recurring(true)
                .recurrencePattern(CRON_PATTERN)
                .recurrenceConfig(recurrenceConfig);
        }
        else {
            Instant earliest = now.minusSeconds(scheduleConfig.getPastGrace());
            if (request.getScheduledAt().isBefore(earliest)) {
                throw new ConfigException("Scheduled time of a one-time schedule is in the past: " + request.getScheduledAt());
            }
            builder.recurring(false)
                .recurrencePattern(ONCE_PATTERN)
                .recurrenceConfig(cf.create());
        }

        return builder.build();
    }

    Config toCronConfig(RecurrenceRequest recurrence, Instant scheduledAt)
    {
        Optional<String> timezone = recurrence.getTimezone().transform(String::trim);
        if (timezone.isPresent() && timezone.get().isEmpty()) {
            timezone = Optional.absent();
        }
        ZoneId zone = timezone.isPresent() ? parseZone(timezone.get()) : SchedulerManager.DEFAULT_TIME_ZONE;
        ZonedDateTime at = scheduledAt.atZone(zone);

        String expression;
        switch (recurrence.getPattern()) {
        case DAILY:
            expression = String.format(ENGLISH, "%d %d * * *", at.getMinute(), at.getHour());
            break;
        case WEEKLY:
            expression = String.format(ENGLISH, "%d %d * * %d", at.getMinute(), at.getHour(), at.getDayOfWeek().getValue() % 7);
            break;
        case MONTHLY:
            expression = String.format(ENGLISH, "%d %d %d * *", at.getMinute(), at.getHour(), at.getDayOfMonth());
            break;
        case CUSTOM:
        case CRON:
            if (!recurrence.getCronExpression().isPresent() || recurrence.getCronExpression().get().trim().isEmpty()) {
                throw new ConfigException("A cron expression is required for recurrence pattern " + recurrence.getPattern());
            }
            expression = recurrence.getCronExpression().get().trim();
            break;
        default:
            throw new ConfigException("Recurrence pattern " + recurrence.getPattern() + " has no cron form");
        }

        Config config = cf.create().set(CRON_EXPRESSION_KEY, expression);
        if (timezone.isPresent()) {
            config.set(TIMEZONE_KEY, zone.getId());
        }
        return config;
    }

    void validateTargetUrl(String url)
    {
        URI uri;
        try {
            uri = new URI(url.trim());
        }
        catch (URISyntaxException ex) {
            throw new ConfigException("Invalid webhook URL: " + url, ex);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(ENGLISH);
        boolean allowedScheme = scheme.equals("https") || (scheme.equals("http") && webhookConfig.getAllowInsecure());
        if (!allowedScheme) {
            throw new ConfigException("Webhook URL must use https: " + url);
        }

        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(ENGLISH);
        if (!webhookConfig.getAllowedHosts().contains(host)) {
            throw new ConfigException("Webhook host '" + host + "' is not allowed. Allowed hosts: " + webhookConfig.getAllowedHosts());
        }

        String path = uri.getPath() == null ? "" : uri.getPath();
        if (!path.startsWith(WEBHOOK_PATH_PREFIX) || path.length() == WEBHOOK_PATH_PREFIX.length()) {
            throw new ConfigException("Webhook URL path must start with " + WEBHOOK_PATH_PREFIX + ": " + url);
        }
    }

    private static ZoneId parseZone(String name)
    {
        try {
            return ZoneId.of(name);
        }
        catch (DateTimeException ex) {
            throw new ConfigException("Unknown time zone '" + name + "'", ex);
        }
    }
}
