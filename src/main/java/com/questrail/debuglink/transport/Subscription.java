package com.questrail.debuglink.transport;

/**
 * Handle returned by every handler registration.
 *
 * <p>{@link #unsubscribe()} removes exactly the handler it was returned for and
 * may be called any number of times.</p>
 */
@FunctionalInterface
public interface Subscription
{
    void unsubscribe();
}
