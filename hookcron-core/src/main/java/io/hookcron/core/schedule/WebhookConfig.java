package io.hookcron.core.schedule;

import java.util.List;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.hookcron.client.config.Config;
import org.immutables.value.Value;

import static java.util.Locale.ENGLISH;

@Value.Immutable
public interface WebhookConfig
{
    List<String> DEFAULT_ALLOWED_HOSTS = ImmutableList.of("discord.com", "discordapp.com");

    List<String> getAllowedHosts();

    // permits http targets for local testing
    boolean getAllowInsecure();

    static WebhookConfig convertFrom(Config config)
    {
        List<String> hosts = config.getOptional("webhook.allowed_hosts", String.class)
            .transform(value -> (List<String>) ImmutableList.copyOf(
                        Splitter.on(',').trimResults().omitEmptyStrings().split(value.toLowerCase(ENGLISH))))
            .or(DEFAULT_ALLOWED_HOSTS);
        return ImmutableWebhookConfig.builder()
            .allowedHosts(hosts)
            .allowInsecure(config.get("webhook.allow_insecure", boolean.class, false))
            .build();
    }
}
