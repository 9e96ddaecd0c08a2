package io.b2mash.shopdesk.routing;

import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Content served in place of a gated path. Reached by internal forward from {@link
 * EdgeAuthorizationFilter}, or directly.
 */
@RestController
public class GateLandingController {

  @RequestMapping("${shopdesk.routes.unauthorized-target:/unauthorized}")
  public ResponseEntity<Map<String, Object>> unauthorized() {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(Map.of("authenticated", false, "next", "/login"));
  }

  @RequestMapping("${shopdesk.routes.authorized-target:/authorized}")
  public ResponseEntity<Map<String, Object>> authorized() {
    return ResponseEntity.ok(Map.of("authenticated", true, "next", "/dashboard"));
  }
}
