package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.exception.ValidationException;
import io.b2mash.shopdesk.session.Channel;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Classifies a raw login identifier as an email address or a phone number. Anything matching the
 * email pattern is an email; everything else is treated as a phone number, prefixed with the
 * default country code when it lacks a leading {@code +}, and must then be valid E.164.
 */
@Component
public class IdentifierParser {

  private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
  private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");
  private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-().]");

  private final String defaultCountryPrefix;

  public IdentifierParser(OtpProperties properties) {
    this.defaultCountryPrefix = properties.defaultCountryPrefix();
  }

  public Identifier parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ValidationException("Invalid identifier", "Phone or email is required");
    }
    String trimmed = raw.trim();
    if (EMAIL.matcher(trimmed).matches()) {
      return new Identifier(Channel.EMAIL, trimmed.toLowerCase(Locale.ROOT));
    }
    if (trimmed.contains("@")) {
      throw new ValidationException("Invalid identifier", "Invalid email format");
    }
    return new Identifier(Channel.PHONE, normalizePhone(trimmed));
  }

  /** Parses an identifier that must be an email address. */
  public Identifier parseEmail(String raw) {
    Identifier identifier = parse(raw);
    if (identifier.channel() != Channel.EMAIL) {
      throw new ValidationException("Invalid identifier", "Invalid email format");
    }
    return identifier;
  }

  private String normalizePhone(String raw) {
    String digits = PHONE_SEPARATORS.matcher(raw).replaceAll("");
    String normalized = digits.startsWith("+") ? digits : defaultCountryPrefix + digits;
    if (!E164.matcher(normalized).matches()) {
      throw new ValidationException("Invalid identifier", "Invalid phone number format");
    }
    return normalized;
  }
}
