package io.b2mash.b2b.banklink.invoice;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  Optional<Invoice> findByIdAndTenantId(UUID id, String tenantId);
}
