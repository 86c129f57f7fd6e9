package com.pulsenms.services.impl;

import com.pulsenms.models.AlertSettings;

import com.pulsenms.services.Notifier;

import io.vertx.core.Future;

import io.vertx.core.MultiMap;

import io.vertx.core.Vertx;

import io.vertx.ext.web.client.WebClient;

import io.vertx.ext.web.client.WebClientOptions;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * PushoverNotifier - Push notifications through the Pushover messages API

 * Priority mapping:
 * - -2..1 are passed through
 * - 2 (emergency) also sends retry / expire so the user is re-alerted until acknowledged
 */
public class PushoverNotifier implements Notifier
{

    private static final Logger logger = LoggerFactory.getLogger(PushoverNotifier.class);

    static final int EMERGENCY_RETRY_SECONDS = 60;

    static final int EMERGENCY_EXPIRE_SECONDS = 3600;

    private final WebClient webClient;

    private final AlertSettings settings;

    public PushoverNotifier(Vertx vertx, AlertSettings settings)
    {
        this.webClient = WebClient.create(vertx, new WebClientOptions()
            .setConnectTimeout(10_000)
            .setIdleTimeout(30));

        this.settings = settings;
    }

    @Override
    public Future<Void> notificationSend(int priority, String title, String message)
    {
        var form = formFor(settings, priority, title, message);

        return webClient.postAbs(settings.getPushoverUrl())
            .timeout(15_000)
            .sendForm(form)
            .compose(response ->
            {
                if (response.statusCode() / 100 != 2)
                {
                    return Future.failedFuture(new IllegalStateException(
                        "Pushover rejected notification: HTTP " + response.statusCode() + " " + response.bodyAsString()));
                }

                logger.debug("Pushover notification sent: {} (priority {})", title, priority);

                return Future.<Void>succeededFuture();
            });
    }

    static MultiMap formFor(AlertSettings settings, int priority, String title, String message)
    {
        var form = MultiMap.caseInsensitiveMultiMap()
            .add("token", settings.getPushoverToken())
            .add("user", settings.getPushoverUser())
            .add("title", title)
            .add("message", message)
            .add("priority", String.valueOf(priority));

        if (priority >= 2)
        {
            form.add("retry", String.valueOf(EMERGENCY_RETRY_SECONDS));

            form.add("expire", String.valueOf(EMERGENCY_EXPIRE_SECONDS));
        }

        return form;
    }

    public void close()
    {
        webClient.close();
    }
}
