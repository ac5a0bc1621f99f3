package io.b2mash.b2b.banklink.integration.banking.payment;

/** Result of applying a provider-reported state to a payment. */
public enum StateTransition {
  /** The new state was stored. */
  APPLIED,
  /** Re-delivery of the terminal state the payment already has. */
  UNCHANGED,
  /** A non-terminal state reported after the payment became terminal. */
  IGNORED,
  /** A different terminal state reported for an already-terminal payment; not stored. */
  ANOMALY
}
