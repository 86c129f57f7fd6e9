package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

/**
 * Trace bus sizing from the "trace" block of application.conf.
 */
public class TraceSettings
{

    private final int capacity;

    private final int subscriberBacklog;

    public TraceSettings(int capacity, int subscriberBacklog)
    {
        this.capacity = Math.max(1, capacity);

        this.subscriberBacklog = Math.max(1, subscriberBacklog);
    }

    public static TraceSettings fromConfig(JsonObject config)
    {
        var trace = config.getJsonObject("trace", new JsonObject());

        return new TraceSettings(
            trace.getInteger("capacity", 500),
            trace.getJsonObject("subscriber", new JsonObject()).getInteger("backlog", 100));
    }

    public int getCapacity()
    {
        return capacity;
    }

    public int getSubscriberBacklog()
    {
        return subscriberBacklog;
    }
}
