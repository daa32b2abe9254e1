package io.b2mash.b2b.bidsubmission.notification;

public enum NotificationPriority {
  LOW,
  NORMAL,
  HIGH,
  CRITICAL
}
