package io.b2mash.b2b.bidsubmission.notification;

import java.util.Map;

/**
 * Announces submission events to operators. Delivery is best effort and asynchronous: callers are
 * never blocked on, or failed by, a notification.
 */
public interface NotificationSink {

  void notify(String eventType, Map<String, Object> payload);
}
