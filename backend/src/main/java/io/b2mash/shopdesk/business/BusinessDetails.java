package io.b2mash.shopdesk.business;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Descriptive fields of a business. On create every null field takes its default; on update a
 * null field is left untouched.
 */
public record BusinessDetails(
    @Size(max = 120, message = "name must be at most 120 characters") String name,
    @Size(max = 2000, message = "description must be at most 2000 characters")
        String description,
    @Email(message = "email must be a valid address")
        @Size(max = 255, message = "email must be at most 255 characters")
        String email,
    @Size(max = 50, message = "phone must be at most 50 characters") String phone,
    @Size(max = 255, message = "website must be at most 255 characters") String website,
    @Size(max = 20, message = "gstNumber must be at most 20 characters") String gstNumber,
    @Size(max = 20, message = "panNumber must be at most 20 characters") String panNumber,
    @Size(max = 50, message = "registrationNumber must be at most 50 characters")
        String registrationNumber,
    @Size(min = 3, max = 3, message = "currency must be a 3-letter code") String currency,
    @Size(max = 20, message = "fiscalYear must be at most 20 characters") String fiscalYear,
    @Size(max = 2048, message = "logoUrl must be at most 2048 characters") String logoUrl) {

  public static BusinessDetails named(String name) {
    return new BusinessDetails(name, null, null, null, null, null, null, null, null, null, null);
  }
}
