package io.b2mash.shopdesk.business;

import io.b2mash.shopdesk.session.CurrentSession;
import io.b2mash.shopdesk.session.Session;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/businesses")
public class BusinessController {

  private final TenantContextManager tenantContextManager;
  private final TenantPointers tenantPointers;

  public BusinessController(
      TenantContextManager tenantContextManager, TenantPointers tenantPointers) {
    this.tenantContextManager = tenantContextManager;
    this.tenantPointers = tenantPointers;
  }

  @GetMapping
  public ResponseEntity<TenantContextResponse> listBusinesses(
      @CurrentSession Session session, HttpServletRequest request, HttpServletResponse response) {
    UUID current =
        tenantContextManager.resolveCurrentBusiness(
            session, tenantPointers.forRequest(request, response));
    var businesses =
        tenantContextManager.listBusinesses(session).stream().map(BusinessResponse::from).toList();
    return ResponseEntity.ok(new TenantContextResponse(current, businesses));
  }

  @GetMapping("/current")
  public ResponseEntity<BusinessResponse> getCurrentBusiness(
      @CurrentSession Session session, HttpServletRequest request, HttpServletResponse response) {
    UUID current =
        tenantContextManager.resolveCurrentBusiness(
            session, tenantPointers.forRequest(request, response));
    return ResponseEntity.ok(
        BusinessResponse.from(tenantContextManager.getBusiness(session, current)));
  }

  @PostMapping
  public ResponseEntity<BusinessResponse> createBusiness(
      @CurrentSession Session session,
      @Valid @RequestBody BusinessDetails body,
      @RequestParam(name = "switchTo", defaultValue = "false") boolean switchTo,
      HttpServletRequest request,
      HttpServletResponse response) {
    var business =
        tenantContextManager.createBusiness(
            session, tenantPointers.forRequest(request, response), body, switchTo);
    return ResponseEntity.created(URI.create("/api/businesses/" + business.getId()))
        .body(BusinessResponse.from(business));
  }

  @PutMapping("/{id}")
  public ResponseEntity<BusinessResponse> updateBusiness(
      @CurrentSession Session session,
      @PathVariable UUID id,
      @Valid @RequestBody BusinessDetails body) {
    return ResponseEntity.ok(
        BusinessResponse.from(tenantContextManager.updateBusiness(session, id, body)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteBusiness(
      @CurrentSession Session session,
      @PathVariable UUID id,
      HttpServletRequest request,
      HttpServletResponse response) {
    tenantContextManager.deleteBusiness(session, tenantPointers.forRequest(request, response), id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/select")
  public ResponseEntity<BusinessResponse> selectBusiness(
      @CurrentSession Session session,
      @PathVariable UUID id,
      HttpServletRequest request,
      HttpServletResponse response) {
    var business =
        tenantContextManager.switchCurrentBusiness(
            session, tenantPointers.forRequest(request, response), id);
    return ResponseEntity.ok(BusinessResponse.from(business));
  }

  public record TenantContextResponse(
      UUID currentBusinessId, List<BusinessResponse> businesses) {}

  public record BusinessResponse(
      UUID id,
      String name,
      String description,
      String email,
      String phone,
      String website,
      String gstNumber,
      String panNumber,
      String registrationNumber,
      String currency,
      String fiscalYear,
      String logoUrl,
      Instant createdAt,
      Instant updatedAt) {

    public static BusinessResponse from(Business business) {
      return new BusinessResponse(
          business.getId(),
          business.getName(),
          business.getDescription(),
          business.getEmail(),
          business.getPhone(),
          business.getWebsite(),
          business.getGstNumber(),
          business.getPanNumber(),
          business.getRegistrationNumber(),
          business.getCurrency(),
          business.getFiscalYear(),
          business.getLogoUrl(),
          business.getCreatedAt(),
          business.getUpdatedAt());
    }
  }
}
