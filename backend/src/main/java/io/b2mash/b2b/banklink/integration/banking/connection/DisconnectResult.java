package io.b2mash.b2b.banklink.integration.banking.connection;

public record DisconnectResult(boolean success, boolean dataDeleted) {}
