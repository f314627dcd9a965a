package io.invoicedesk.backend.multitenancy;

import java.util.UUID;

/**
 * Marker interface for entities owned by a company. Entities implementing this interface have a
 * {@code company_id} column that is populated by {@link TenantAwareEntityListener} on persist and
 * filtered by the {@code tenantFilter} Hibernate filter on read.
 */
public interface TenantAware {

  UUID getCompanyId();

  void setCompanyId(UUID companyId);
}
