package io.invoicedesk.backend.customer;

import io.invoicedesk.backend.customer.dto.CustomerRequest;
import io.invoicedesk.backend.exception.InvalidStateException;
import io.invoicedesk.backend.exception.ResourceNotFoundException;
import io.invoicedesk.backend.invoice.InvoiceRepository;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CustomerService {

  private static final Logger log = LoggerFactory.getLogger(CustomerService.class);

  private final CustomerRepository customerRepository;
  private final InvoiceRepository invoiceRepository;

  public CustomerService(
      CustomerRepository customerRepository, InvoiceRepository invoiceRepository) {
    this.customerRepository = customerRepository;
    this.invoiceRepository = invoiceRepository;
  }

  @Transactional
  public Customer create(CustomerRequest request) {
    var customer = new Customer(request.name(), request.address(), request.vatNumber());
    applyDetails(customer, request);
    customer = customerRepository.save(customer);
    log.info("Created customer {} ({})", customer.getId(), customer.getName());
    return customer;
  }

  @Transactional
  public Customer update(UUID customerId, CustomerRequest request) {
    var customer = getCustomer(customerId);
    applyDetails(customer, request);
    return customerRepository.save(customer);
  }

  @Transactional(readOnly = true)
  public Customer getCustomer(UUID customerId) {
    return customerRepository
        .findOneById(customerId)
        .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
  }

  @Transactional(readOnly = true)
  public List<Customer> findAll() {
    return customerRepository.findAllOrdered();
  }

  /** Deletes a customer that no invoice refers to. */
  @Transactional
  public void delete(UUID customerId) {
    var customer = getCustomer(customerId);
    long invoiceCount = invoiceRepository.countByCustomerId(customerId);
    if (invoiceCount > 0) {
      throw new InvalidStateException(
          "customer.has_invoices",
          "Customer in use",
          "Customer " + customerId + " is referenced by " + invoiceCount + " invoice(s)");
    }
    customerRepository.delete(customer);
    log.info("Deleted customer {}", customerId);
  }

  private static void applyDetails(Customer customer, CustomerRequest request) {
    customer.update(
        request.name(),
        request.address(),
        request.vatNumber(),
        request.eik(),
        request.countryCode() == null ? null : request.countryCode().trim().toUpperCase(),
        request.vatRegistered(),
        request.email(),
        request.phone());
  }
}
