package io.b2mash.mailflow.dispatch;

public enum DispatchMode {
  /** Caller blocks until the log reaches SENT or FAILED. */
  IMMEDIATE,
  /** Caller returns once the PENDING log is persisted; a worker sends it. */
  QUEUED
}
