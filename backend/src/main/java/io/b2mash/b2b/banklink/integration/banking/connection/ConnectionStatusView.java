package io.b2mash.b2b.banklink.integration.banking.connection;

import io.b2mash.b2b.banklink.integration.banking.sync.SyncRunStatus;
import java.time.Instant;

/** Connection state without token material. */
public record ConnectionStatusView(
    boolean connected,
    BankConnectionStatus status,
    Instant connectedAt,
    Instant lastSyncAt,
    SyncRunStatus lastSyncStatus,
    String lastSyncError,
    Instant accessTokenExpiresAt) {

  static ConnectionStatusView notConnected() {
    return new ConnectionStatusView(false, null, null, null, null, null, null);
  }

  static ConnectionStatusView from(BankConnection connection) {
    return new ConnectionStatusView(
        connection.isActive(),
        connection.getStatus(),
        connection.getConnectedAt(),
        connection.getLastSyncAt(),
        connection.getLastSyncStatus(),
        connection.getLastSyncError(),
        connection.getAccessTokenExpiresAt());
  }
}
