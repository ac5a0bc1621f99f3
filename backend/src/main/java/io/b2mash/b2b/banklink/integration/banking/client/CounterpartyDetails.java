package io.b2mash.b2b.banklink.integration.banking.client;

/** An external recipient for an outbound transfer. */
public record CounterpartyDetails(String name, String iban, String bic, String currency) {

  /** ISO country code taken from the IBAN prefix. */
  public String bankCountry() {
    return iban.substring(0, 2).toUpperCase();
  }
}
