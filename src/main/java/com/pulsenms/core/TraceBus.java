package com.pulsenms.core;

import com.pulsenms.models.TraceEvent;

import io.vertx.core.Context;

import io.vertx.core.Handler;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;

import java.util.ArrayList;

import java.util.List;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * TraceBus - Append-only in-memory log of status changes with non-blocking fan-out

 * Features:
 * - Ring buffer of the most recent events (default 500)
 * - One serialized append point: every subscriber sees events in append order
 * - Bounded per-subscriber backlog (default 100); a full backlog disconnects that subscriber
 * - Optional replay of the buffered history before live events
 */
public class TraceBus
{

    private static final Logger logger = LoggerFactory.getLogger(TraceBus.class);

    private final int capacity;

    private final int subscriberBacklog;

    private final ArrayDeque<TraceEvent> buffer;

    private final CopyOnWriteArrayList<TraceSubscription> subscribers = new CopyOnWriteArrayList<>();

    private final Object appendLock = new Object();

    /**
     * @param capacity Ring buffer size
     * @param subscriberBacklog Live events a subscriber may fall behind before it is dropped
     */
    public TraceBus(int capacity, int subscriberBacklog)
    {
        this.capacity = Math.max(1, capacity);

        this.subscriberBacklog = Math.max(1, subscriberBacklog);

        this.buffer = new ArrayDeque<>(this.capacity);
    }

    /**
     * Append an event and hand it to every subscriber. Never blocks on a subscriber.
     *
     * @param event Event to append
     */
    public void publish(TraceEvent event)
    {
        synchronized (appendLock)
        {
            if (buffer.size() == capacity)
            {
                buffer.pollFirst();
            }

            buffer.addLast(event);

            for (var subscription : subscribers)
            {
                if (!subscription.offer(event))
                {
                    subscribers.remove(subscription);

                    if (!subscription.isClosed())
                    {
                        subscription.drop();

                        logger.warn("Trace subscriber dropped: backlog of {} events full", subscriberBacklog);
                    }
                }
            }
        }
    }

    /**
     * Pull-style subscription.
     *
     * @param replay true to receive the buffered history first
     * @return Subscription to poll
     */
    public TraceSubscription subscribe(boolean replay)
    {
        return register(null, null, replay);
    }

    /**
     * Push-style subscription. The handler always runs on the given context.
     *
     * @param context Context to deliver on
     * @param handler Event handler
     * @param replay true to receive the buffered history first
     * @return Subscription handle
     */
    public TraceSubscription subscribe(Context context, Handler<TraceEvent> handler, boolean replay)
    {
        return register(context, handler, replay);
    }

    /**
     * Push-style subscription that is never dropped, whatever its backlog. Only for
     * in-process consumers that keep up on average and must not lose an event.
     *
     * @param context Context to deliver on
     * @param handler Event handler
     * @return Subscription handle
     */
    public TraceSubscription subscribeUnbounded(Context context, Handler<TraceEvent> handler)
    {
        synchronized (appendLock)
        {
            var subscription = new TraceSubscription(this, TraceSubscription.UNBOUNDED, context, handler);

            subscribers.add(subscription);

            logger.debug("Unbounded trace subscriber added, {} active", subscribers.size());

            return subscription;
        }
    }

    private TraceSubscription register(Context context, Handler<TraceEvent> handler, boolean replay)
    {
        synchronized (appendLock)
        {
            var history = replay ? new ArrayList<>(buffer) : List.<TraceEvent>of();

            var subscription = new TraceSubscription(this, subscriberBacklog + history.size(), context, handler);

            history.forEach(subscription::offer);

            subscribers.add(subscription);

            logger.debug("Trace subscriber added (replay: {} events), {} active", history.size(), subscribers.size());

            return subscription;
        }
    }

    void unsubscribe(TraceSubscription subscription)
    {
        subscribers.remove(subscription);
    }

    /**
     * Snapshot of the most recent events, oldest first.
     *
     * @param limit Maximum number of events
     * @return Events
     */
    public List<TraceEvent> recent(int limit)
    {
        synchronized (appendLock)
        {
            var events = new ArrayList<>(buffer);

            var from = Math.max(0, events.size() - Math.max(0, limit));

            return new ArrayList<>(events.subList(from, events.size()));
        }
    }

    public int size()
    {
        synchronized (appendLock)
        {
            return buffer.size();
        }
    }

    public int subscriberCount()
    {
        return subscribers.size();
    }

    public int getCapacity()
    {
        return capacity;
    }
}
