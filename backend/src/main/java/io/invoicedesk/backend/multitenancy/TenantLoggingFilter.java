package io.invoicedesk.backend.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(2)
public class TenantLoggingFilter extends OncePerRequestFilter {

  static final String MDC_COMPANY_ID = "companyId";
  static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      UUID companyId = TenantContext.getCompanyId();
      if (companyId != null) {
        MDC.put(MDC_COMPANY_ID, companyId.toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_COMPANY_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
