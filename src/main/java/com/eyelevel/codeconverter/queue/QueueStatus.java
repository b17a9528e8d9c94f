package com.eyelevel.codeconverter.queue;

/**
 * Point-in-time view of a {@link RateLimitedWorkQueue}. For observability only.
 *
 * @param queued     Tasks waiting for their first dispatch.
 * @param running    Tasks holding a slot, including those sleeping between retries.
 * @param capacity   The maximum number of slots.
 * @param intervalMs Minimum gap between dispatches.
 */
public record QueueStatus(int queued, int running, int capacity, long intervalMs) {

    public boolean idle() {
        return queued == 0 && running == 0;
    }
}
