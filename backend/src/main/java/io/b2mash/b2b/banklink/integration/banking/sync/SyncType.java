package io.b2mash.b2b.banklink.integration.banking.sync;

public enum SyncType {
  MANUAL,
  SCHEDULED
}
