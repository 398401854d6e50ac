package io.b2mash.mailflow.delivery;

/** What applying one delivery event did to the log. */
public enum EventOutcome {
  /** Status moved forward and the event's timestamp was recorded. */
  ADVANCED,
  /** Status kept; a late event's timestamp was recorded. */
  TIMESTAMP_RECORDED,
  /** The event had already been applied. */
  DUPLICATE,
  /** The log is terminal or the event cannot follow its status. */
  REJECTED,
  /** No log carries the correlation id. */
  UNKNOWN_CORRELATION
}
