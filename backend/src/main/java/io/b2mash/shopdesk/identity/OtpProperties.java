package io.b2mash.shopdesk.identity;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * One-time code policy.
 *
 * @param defaultCountryPrefix prefix added to phone numbers entered without one
 * @param codeTtl lifetime of a code
 * @param maxAttempts wrong guesses after which a challenge is closed
 * @param maxChallengesPerWindow codes that may be issued per subject and channel within {@code
 *     rateWindow}
 * @param rateWindow sliding window for {@code maxChallengesPerWindow}
 * @param flowTtl how long a client keeps its pending challenge state between requests
 */
@ConfigurationProperties(prefix = "shopdesk.otp")
public record OtpProperties(
    String defaultCountryPrefix,
    Duration codeTtl,
    int maxAttempts,
    int maxChallengesPerWindow,
    Duration rateWindow,
    Duration flowTtl) {

  public OtpProperties {
    defaultCountryPrefix = defaultCountryPrefix != null ? defaultCountryPrefix : "+91";
    codeTtl = codeTtl != null ? codeTtl : Duration.ofMinutes(10);
    maxAttempts = maxAttempts > 0 ? maxAttempts : 5;
    maxChallengesPerWindow = maxChallengesPerWindow > 0 ? maxChallengesPerWindow : 3;
    rateWindow = rateWindow != null ? rateWindow : Duration.ofMinutes(5);
    flowTtl = flowTtl != null ? flowTtl : Duration.ofMinutes(30);
  }
}
