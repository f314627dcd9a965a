package io.invoicedesk.backend.multitenancy;

import jakarta.persistence.EntityManagerFactory;
import java.util.UUID;
import org.hibernate.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.jpa.EntityManagerHolder;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Transaction manager that activates Hibernate's {@code @Filter("tenantFilter")} for the bound
 * company. Overrides {@link #doBegin} to enable the filter on the <em>same</em> Session that will
 * execute the transaction's queries.
 *
 * <p>With no company bound (company maintenance, seeding) the filter stays off.
 */
public class TenantFilterTransactionManager extends JpaTransactionManager {

  private static final Logger log = LoggerFactory.getLogger(TenantFilterTransactionManager.class);

  public static final String FILTER_NAME = "tenantFilter";
  public static final String FILTER_PARAM = "companyId";

  public TenantFilterTransactionManager(EntityManagerFactory emf) {
    super(emf);
  }

  @Override
  protected void doBegin(Object transaction, TransactionDefinition definition) {
    super.doBegin(transaction, definition);

    UUID companyId = TenantContext.getCompanyId();
    if (companyId == null) {
      return;
    }
    var emHolder =
        (EntityManagerHolder)
            TransactionSynchronizationManager.getResource(getEntityManagerFactory());
    if (emHolder != null) {
      Session session = emHolder.getEntityManager().unwrap(Session.class);
      session.enableFilter(FILTER_NAME).setParameter(FILTER_PARAM, companyId);
      log.debug("Enabled tenantFilter for company {} on session {}", companyId, session.hashCode());
    }
  }
}
