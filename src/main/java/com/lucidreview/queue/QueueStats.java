package com.lucidreview.queue;

public record QueueStats(
        long waiting,
        long active,
        long completed,
        long failed,
        long delayed
) {

    public static final QueueStats EMPTY = new QueueStats(0, 0, 0, 0, 0);
}
