package io.b2mash.mailflow.delivery;

import java.util.Locale;
import java.util.Optional;

/** Provider delivery events the pipeline understands, keyed by their wire name. */
public enum DeliveryEventType {
  DELIVERED("delivered", EmailDeliveryStatus.DELIVERED),
  OPENED("opened", EmailDeliveryStatus.OPENED),
  CLICKED("clicked", EmailDeliveryStatus.CLICKED),
  BOUNCED("bounced", EmailDeliveryStatus.BOUNCED);

  private final String wireName;
  private final EmailDeliveryStatus targetStatus;

  DeliveryEventType(String wireName, EmailDeliveryStatus targetStatus) {
    this.wireName = wireName;
    this.targetStatus = targetStatus;
  }

  public String wireName() {
    return wireName;
  }

  public EmailDeliveryStatus targetStatus() {
    return targetStatus;
  }

  /** Returns empty for event names this pipeline does not track. */
  public static Optional<DeliveryEventType> fromWireName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    var normalized = name.trim().toLowerCase(Locale.ROOT);
    for (var type : values()) {
      if (type.wireName.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
