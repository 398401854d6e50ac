package io.b2mash.mailflow.dispatch;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One dispatch call.
 *
 * @param templateKey key of an active template
 * @param toAddress primary recipient
 * @param context caller variables, overlaid on the base render context
 * @param mode immediate or queued execution
 * @param initiator identity of the caller, stored on the log for audit
 * @param cc extra recipients, may be empty
 * @param bcc blind recipients, may be empty
 * @param fromAddress sender override, or null for the configured sender
 * @param timeout transport timeout override, or null for the configured timeout
 */
public record DispatchRequest(
    String templateKey,
    String toAddress,
    Map<String, Object> context,
    DispatchMode mode,
    String initiator,
    List<String> cc,
    List<String> bcc,
    String fromAddress,
    Duration timeout) {

  public DispatchRequest {
    Objects.requireNonNull(mode, "mode");
    context = context != null ? context : Map.of();
    cc = cc != null ? List.copyOf(cc) : List.of();
    bcc = bcc != null ? List.copyOf(bcc) : List.of();
  }

  public static DispatchRequest of(
      String templateKey,
      String toAddress,
      Map<String, Object> context,
      DispatchMode mode,
      String initiator) {
    return new DispatchRequest(
        templateKey, toAddress, context, mode, initiator, null, null, null, null);
  }
}
