package com.elssolution.unlockwatch.notify;

/** Where rendered notifications go. Implementations report failure in the result instead of throwing. */
public interface NotificationChannel {

    DeliveryResult send(String subscriberId, String markdownText);
}
