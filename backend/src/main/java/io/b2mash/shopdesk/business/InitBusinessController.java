package io.b2mash.shopdesk.business;

import io.b2mash.shopdesk.routing.RedirectTargets;
import io.b2mash.shopdesk.session.CurrentSession;
import io.b2mash.shopdesk.session.Session;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bootstraps the tenant context for a signed-in user, provisioning a default business when needed,
 * then redirects back to the page that asked for it.
 */
@RestController
public class InitBusinessController {

  private final TenantContextManager tenantContextManager;
  private final TenantPointers tenantPointers;

  public InitBusinessController(
      TenantContextManager tenantContextManager, TenantPointers tenantPointers) {
    this.tenantContextManager = tenantContextManager;
    this.tenantPointers = tenantPointers;
  }

  @GetMapping("/api/init-business")
  public ResponseEntity<Void> initBusiness(
      @CurrentSession Session session,
      @RequestParam(name = "path", required = false) String path,
      HttpServletRequest request,
      HttpServletResponse response) {
    tenantContextManager.resolveCurrentBusiness(
        session, tenantPointers.forRequest(request, response));
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(URI.create(RedirectTargets.safe(path)))
        .build();
  }
}
