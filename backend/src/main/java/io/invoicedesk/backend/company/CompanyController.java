package io.invoicedesk.backend.company;

import io.invoicedesk.backend.company.dto.CompanyRequest;
import io.invoicedesk.backend.company.dto.CompanyResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Company (tenant) maintenance. Not tenant scoped: these endpoints do not need X-Company-Id. */
@RestController
@RequestMapping("/api/companies")
public class CompanyController {

  private final CompanyService companyService;

  public CompanyController(CompanyService companyService) {
    this.companyService = companyService;
  }

  @PostMapping
  public ResponseEntity<CompanyResponse> createCompany(@Valid @RequestBody CompanyRequest request) {
    var company = companyService.create(request);
    return ResponseEntity.created(URI.create("/api/companies/" + company.getId()))
        .body(CompanyResponse.from(company));
  }

  @PutMapping("/{id}")
  public ResponseEntity<CompanyResponse> updateCompany(
      @PathVariable UUID id, @Valid @RequestBody CompanyRequest request) {
    return ResponseEntity.ok(CompanyResponse.from(companyService.update(id, request)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<CompanyResponse> getCompany(@PathVariable UUID id) {
    return ResponseEntity.ok(CompanyResponse.from(companyService.getCompany(id)));
  }

  @GetMapping
  public ResponseEntity<List<CompanyResponse>> listCompanies() {
    return ResponseEntity.ok(companyService.findAll().stream().map(CompanyResponse::from).toList());
  }
}
