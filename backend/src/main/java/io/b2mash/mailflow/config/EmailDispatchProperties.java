package io.b2mash.mailflow.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Operational settings for the email pipeline.
 *
 * @param senderAddress default From address when a dispatch does not override it
 * @param siteName value of {@code site_name} in every render context
 * @param siteUrl value of {@code site_url} in every render context
 * @param transportTimeout upper bound for a single transport call when the caller supplies none
 * @param templateCacheTtl how long a resolved template stays cached on this node
 * @param worker sizing of the queued-dispatch worker pool
 * @param watchdog detection of deliveries stuck in PENDING
 */
@ConfigurationProperties(prefix = "mailflow.email")
public record EmailDispatchProperties(
    @DefaultValue("noreply@mailflow.local") String senderAddress,
    @DefaultValue("Mailflow") String siteName,
    @DefaultValue("http://localhost:8080") String siteUrl,
    @DefaultValue("30s") Duration transportTimeout,
    @DefaultValue("5m") Duration templateCacheTtl,
    @DefaultValue Worker worker,
    @DefaultValue Watchdog watchdog) {

  public record Worker(
      @DefaultValue("2") int coreSize,
      @DefaultValue("8") int maxSize,
      @DefaultValue("500") int queueCapacity) {}

  public record Watchdog(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("15m") Duration staleAfter,
      @DefaultValue("1m") Duration interval) {}
}
