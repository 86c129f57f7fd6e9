package com.pulsenms.services;

import io.vertx.core.Future;

/**
 * Notifier - Outbound notification channel (push service, log, ...)
 */
public interface Notifier
{

    /**
     * Send one notification.
     *
     * @param priority Priority from -2 (lowest) to 2 (emergency)
     * @param title Short title
     * @param message Message body
     * @return Future that completes when the channel accepted the notification
     */
    Future<Void> notificationSend(int priority, String title, String message);

}
