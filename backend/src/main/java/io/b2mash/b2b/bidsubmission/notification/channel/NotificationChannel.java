package io.b2mash.b2b.bidsubmission.notification.channel;

import io.b2mash.b2b.bidsubmission.notification.SubmissionNotification;

/**
 * Abstraction for notification delivery channels. Each channel handles one delivery mechanism
 * (log, email, Slack).
 */
public interface NotificationChannel {

  /** Unique identifier for this channel (e.g., "log", "email"). */
  String channelId();

  /**
   * Delivers a notification via this channel. May throw; the dispatcher logs and moves on.
   *
   * @param notification the formatted notification
   */
  void deliver(SubmissionNotification notification);

  /** Whether this channel is currently enabled/available. */
  boolean isEnabled();
}
