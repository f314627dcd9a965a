package io.invoicedesk.backend.multitenancy;

import jakarta.persistence.PrePersist;

/**
 * JPA entity listener that stamps {@code company_id} on new entities from the bound {@link
 * TenantContext}. Entities that already carry a company id are left alone.
 *
 * @see TenantAware
 */
public class TenantAwareEntityListener {

  @PrePersist
  public void setCompanyId(Object entity) {
    if (entity instanceof TenantAware tenantAware && tenantAware.getCompanyId() == null) {
      tenantAware.setCompanyId(TenantContext.requireCompanyId());
    }
  }
}
