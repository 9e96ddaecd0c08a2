package io.b2mash.shopdesk.business;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tenant context settings.
 *
 * @param defaultBusinessName name of the business provisioned for a subject that has none
 * @param keepLastBusiness refuse to delete a subject's only remaining business
 * @param pointerCookieName cookie holding the current-business pointer
 * @param pointerTtl lifetime of the pointer cookie
 * @param ownershipCacheSize maximum cached business-to-owner entries
 * @param ownershipCacheTtl how long a cached ownership entry is trusted
 */
@ConfigurationProperties(prefix = "shopdesk.tenancy")
public record TenancyProperties(
    String defaultBusinessName,
    boolean keepLastBusiness,
    String pointerCookieName,
    Duration pointerTtl,
    long ownershipCacheSize,
    Duration ownershipCacheTtl) {

  public TenancyProperties {
    defaultBusinessName = defaultBusinessName != null ? defaultBusinessName : "My Business";
    pointerCookieName = pointerCookieName != null ? pointerCookieName : "sd_business";
    pointerTtl = pointerTtl != null ? pointerTtl : Duration.ofDays(30);
    ownershipCacheSize = ownershipCacheSize > 0 ? ownershipCacheSize : 10_000;
    ownershipCacheTtl = ownershipCacheTtl != null ? ownershipCacheTtl : Duration.ofMinutes(5);
  }
}
