package io.b2mash.b2b.banklink.invoice;

/**
 * Invoice lifecycle status. Only the transitions a payment can drive are modelled here.
 *
 * <ul>
 *   <li>DRAFT → APPROVED
 *   <li>APPROVED → SENT, VOID
 *   <li>SENT → PAID, VOID
 *   <li>PAID and VOID are terminal
 * </ul>
 */
public enum InvoiceStatus {
  DRAFT,
  APPROVED,
  SENT,
  PAID,
  VOID;

  public boolean canTransitionTo(InvoiceStatus target) {
    return switch (this) {
      case DRAFT -> target == APPROVED;
      case APPROVED -> target == SENT || target == VOID;
      case SENT -> target == PAID || target == VOID;
      case PAID, VOID -> false;
    };
  }
}
