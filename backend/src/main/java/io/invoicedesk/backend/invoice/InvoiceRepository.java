package io.invoicedesk.backend.invoice;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  /** JPQL lookup so the tenant filter applies, unlike findById which goes to EntityManager.find. */
  @Query("SELECT i FROM Invoice i WHERE i.id = :id")
  Optional<Invoice> findOneById(@Param("id") UUID id);

  @Query("SELECT i FROM Invoice i ORDER BY i.createdAt DESC")
  List<Invoice> findAllOrdered();

  @Query("SELECT i FROM Invoice i WHERE i.status = :status ORDER BY i.createdAt DESC")
  List<Invoice> findByStatus(@Param("status") InvoiceStatus status);

  /** Counts invoices for a customer. Used by the customer delete guard. */
  @Query("SELECT COUNT(i) FROM Invoice i WHERE i.customerId = :customerId")
  long countByCustomerId(@Param("customerId") UUID customerId);
}
