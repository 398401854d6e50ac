package io.b2mash.mailflow.transport;

/**
 * Outcome of a single transport call.
 *
 * @param success whether the transport accepted the message
 * @param providerMessageId the transport's own message identifier, used as the correlation id
 * @param errorMessage failure reason when {@code success} is false
 */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {

  public static SendResult accepted(String providerMessageId) {
    return new SendResult(true, providerMessageId, null);
  }

  public static SendResult failed(String errorMessage) {
    return new SendResult(false, null, errorMessage);
  }
}
