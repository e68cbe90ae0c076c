package com.questrail.debuglink.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a scheduled heartbeat, pong timeout or discovery sweep.
 *
 * <p>
 * Every component that arms a timer keeps the returned handle and cancels it
 * on the path that leaves the state the timer belongs to. Implemented by:
 * <ul>
 *   <li>the deterministic test scheduler</li>
 *   <li>the {@code ScheduledExecutorService}-backed scheduler</li>
 *   <li>{@link PeriodicTask} for repeating timers</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
