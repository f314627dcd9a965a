package io.invoicedesk.backend.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.invoicedesk.backend.company.CompanyRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the company named by the {@code X-Company-Id} header as the tenant for the rest of the
 * request. Company maintenance runs unbound; every other API call must name a known company.
 */
@Component
@Order(1)
public class TenantFilter extends OncePerRequestFilter {

  public static final String COMPANY_HEADER = "X-Company-Id";

  private static final String UNSCOPED_PREFIX = "/api/companies";

  private final CompanyRepository companyRepository;
  private final Cache<UUID, Boolean> knownCompanies =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofHours(1)).build();

  public TenantFilter(CompanyRepository companyRepository) {
    this.companyRepository = companyRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String header = request.getHeader(COMPANY_HEADER);
    if (header == null || header.isBlank()) {
      if (request.getRequestURI().startsWith(UNSCOPED_PREFIX)) {
        filterChain.doFilter(request, response);
      } else {
        response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Missing " + COMPANY_HEADER);
      }
      return;
    }

    UUID companyId;
    try {
      companyId = UUID.fromString(header.trim());
    } catch (IllegalArgumentException e) {
      response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Malformed company id");
      return;
    }

    if (!isKnownCompany(companyId)) {
      response.sendError(HttpServletResponse.SC_NOT_FOUND, "Company not found");
      return;
    }

    TenantContext.setCompanyId(companyId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      TenantContext.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }

  private boolean isKnownCompany(UUID companyId) {
    // Only positive lookups are cached so a company created after a miss is found next time.
    if (knownCompanies.getIfPresent(companyId) != null) {
      return true;
    }
    boolean exists = companyRepository.existsById(companyId);
    if (exists) {
      knownCompanies.put(companyId, Boolean.TRUE);
    }
    return exists;
  }
}
