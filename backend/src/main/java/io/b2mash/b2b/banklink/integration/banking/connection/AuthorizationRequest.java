package io.b2mash.b2b.banklink.integration.banking.connection;

import java.time.Duration;

/** Where to send the browser, and the state value the callback must echo back. */
public record AuthorizationRequest(String authorizationUrl, String state, Duration stateTtl) {}
