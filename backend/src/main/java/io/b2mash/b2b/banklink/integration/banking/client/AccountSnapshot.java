package io.b2mash.b2b.banklink.integration.banking.client;

import java.math.BigDecimal;

/** Provider account normalized into the local account shape. */
public record AccountSnapshot(
    String externalAccountId, String name, BigDecimal balance, String currency, String state) {}
