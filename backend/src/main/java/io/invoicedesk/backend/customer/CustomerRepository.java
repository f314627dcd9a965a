package io.invoicedesk.backend.customer;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CustomerRepository extends JpaRepository<Customer, UUID> {

  /** JPQL lookup so the tenant filter applies, unlike findById which goes to EntityManager.find. */
  @Query("SELECT c FROM Customer c WHERE c.id = :id")
  Optional<Customer> findOneById(@Param("id") UUID id);

  @Query("SELECT c FROM Customer c ORDER BY c.name")
  List<Customer> findAllOrdered();
}
