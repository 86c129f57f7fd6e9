package com.pulsenms.services.impl;

import com.pulsenms.services.Notifier;

import io.vertx.core.Future;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * LoggingNotifier - Writes notifications to the log when no push channel is configured
 */
public class LoggingNotifier implements Notifier
{

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public Future<Void> notificationSend(int priority, String title, String message)
    {
        if (priority >= 1)
        {
            logger.warn("[ALERT p{}] {} - {}", priority, title, message);
        }
        else
        {
            logger.info("[ALERT p{}] {} - {}", priority, title, message);
        }

        return Future.succeededFuture();
    }
}
