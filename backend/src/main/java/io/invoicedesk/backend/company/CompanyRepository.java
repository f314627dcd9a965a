package io.invoicedesk.backend.company;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface CompanyRepository extends JpaRepository<Company, UUID> {

  @Query("SELECT c FROM Company c ORDER BY c.name")
  List<Company> findAllOrdered();

  /**
   * Loads the company with a row-level write lock held until the surrounding transaction ends.
   * Concurrent issuances for the same company serialize here; a waiter that times out surfaces as
   * a pessimistic locking failure.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
  @Query("SELECT c FROM Company c WHERE c.id = :id")
  Optional<Company> findByIdForUpdate(@Param("id") UUID id);
}
