package com.pulsenms.core;

import com.pulsenms.models.TraceEvent;

import io.vertx.core.Context;

import io.vertx.core.Handler;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.List;

import java.util.concurrent.LinkedBlockingQueue;

import java.util.concurrent.TimeUnit;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A consumer's bounded view of the trace bus.

 * Pull style: poll() / drain() from any thread.
 * Push style: events are handed to a handler on the subscriber's Vert.x context.

 * The bus never waits on a subscription: when the backlog is full the subscription is
 * dropped and its close handler runs. An unbounded subscription has no backlog limit and
 * is never dropped; it is meant for in-process consumers that must see every event.
 */
public class TraceSubscription
{

    private static final Logger logger = LoggerFactory.getLogger(TraceSubscription.class);

    static final int UNBOUNDED = -1;

    private final TraceBus bus;

    private final LinkedBlockingQueue<TraceEvent> backlog;

    private final Context context;

    private final Handler<TraceEvent> handler;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final AtomicBoolean dropped = new AtomicBoolean(false);

    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);

    private volatile Handler<Void> closeHandler;

    TraceSubscription(TraceBus bus, int capacity, Context context, Handler<TraceEvent> handler)
    {
        this.bus = bus;

        this.backlog = capacity == UNBOUNDED ? new LinkedBlockingQueue<>() : new LinkedBlockingQueue<>(Math.max(1, capacity));

        this.context = context;

        this.handler = handler;
    }

    /**
     * Enqueue without blocking. Called by the bus under its append lock.
     *
     * @param event Event to deliver
     * @return false when the backlog is full or the subscription is closed
     */
    boolean offer(TraceEvent event)
    {
        if (closed.get() || !backlog.offer(event))
        {
            return false;
        }

        if (handler != null && drainScheduled.compareAndSet(false, true))
        {
            context.runOnContext(v -> deliver());
        }

        return true;
    }

    private void deliver()
    {
        drainScheduled.set(false);

        TraceEvent event;

        while (!closed.get() && (event = backlog.poll()) != null)
        {
            try
            {
                handler.handle(event);
            }
            catch (Exception exception)
            {
                logger.error("Error in trace subscriber handler: {}", exception.getMessage());
            }
        }

        // Events offered while the flag was still set
        if (!closed.get() && !backlog.isEmpty() && drainScheduled.compareAndSet(false, true))
        {
            context.runOnContext(v -> deliver());
        }
    }

    public TraceEvent poll()
    {
        return backlog.poll();
    }

    public TraceEvent poll(long timeout, TimeUnit unit) throws InterruptedException
    {
        return backlog.poll(timeout, unit);
    }

    /**
     * Remove and return everything currently buffered.
     *
     * @return Buffered events in delivery order
     */
    public List<TraceEvent> drain()
    {
        var events = new ArrayList<TraceEvent>();

        backlog.drainTo(events);

        return events;
    }

    public int pending()
    {
        return backlog.size();
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    /**
     * @return true when the bus disconnected this subscription because its backlog overflowed
     */
    public boolean isDropped()
    {
        return dropped.get();
    }

    public TraceSubscription closeHandler(Handler<Void> closeHandler)
    {
        this.closeHandler = closeHandler;

        return this;
    }

    /**
     * Unsubscribe. Buffered events stay readable through poll().
     */
    public void close()
    {
        if (markClosed())
        {
            bus.unsubscribe(this);
        }
    }

    void drop()
    {
        dropped.set(true);

        markClosed();
    }

    private boolean markClosed()
    {
        if (!closed.compareAndSet(false, true))
        {
            return false;
        }

        var handlerOnClose = closeHandler;

        if (handlerOnClose != null)
        {
            if (context != null)
            {
                context.runOnContext(v -> handlerOnClose.handle(null));
            }
            else
            {
                handlerOnClose.handle(null);
            }
        }

        return true;
    }

}
