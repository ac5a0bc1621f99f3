package io.b2mash.b2b.banklink.integration.banking.connection;

/**
 * Parameters of the bank's redirect back to us.
 *
 * @param browserState the state value stored in the initiating browser, null if absent
 */
public record CallbackRequest(
    String code, String state, String error, String errorDescription, String browserState) {}
