package io.b2mash.shopdesk.business;

import java.util.Optional;
import java.util.UUID;

/**
 * The client's current-business pointer. Values read back are untrusted: they may be malformed
 * or refer to a business the subject no longer owns.
 */
public interface TenantPointer {

  Optional<String> get();

  /** Overwrites the pointer in a single write. */
  void set(UUID businessId);

  void clear();
}
