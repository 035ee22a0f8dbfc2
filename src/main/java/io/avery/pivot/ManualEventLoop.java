/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import java.util.Objects;
import java.util.PriorityQueue;

/**
 * An {@link EventLoop} with a virtual clock, driven explicitly by its caller. Time only passes when
 * {@link #advance(long) advanced}, and tasks only run from within {@link #advance(long)} or {@link #runUntilIdle()}.
 *
 * <p>This loop makes deferred engine work deterministic, which is useful for tests and for hosts that process
 * pivot updates at points of their own choosing.
 */
public final class ManualEventLoop implements EventLoop {
    private final PriorityQueue<ScheduledTask> queue = new PriorityQueue<>();
    private long now;
    private long sequence;
    
    public ManualEventLoop() {
        this(0);
    }
    
    /**
     * @param startMillis the initial reading of the virtual clock
     */
    public ManualEventLoop(long startMillis) {
        this.now = startMillis;
    }
    
    @Override
    public long currentTimeMillis() {
        return now;
    }
    
    @Override
    public Task schedule(Runnable action, long delayMillis) {
        Objects.requireNonNull(action);
        if (delayMillis < 0)
            throw new IllegalArgumentException("delayMillis must be non-negative");
        ScheduledTask task = new ScheduledTask(action, now + delayMillis, sequence++);
        queue.add(task);
        return task;
    }
    
    /**
     * Advances the virtual clock by the given amount, running every task that comes due on the way (including tasks
     * scheduled by those tasks), in due-time order. The clock reads each task's due time while the task runs.
     *
     * @param millis the amount of time to advance by
     * @throws IllegalArgumentException if {@code millis} is negative
     */
    public void advance(long millis) {
        if (millis < 0)
            throw new IllegalArgumentException("millis must be non-negative");
        long target = now + millis;
        for (ScheduledTask task; (task = queue.peek()) != null && task.due <= target; ) {
            queue.poll();
            now = Math.max(now, task.due);
            task.action.run();
        }
        now = target;
    }
    
    /**
     * Runs tasks until none are pending, advancing the virtual clock to each task's due time.
     */
    public void runUntilIdle() {
        for (ScheduledTask task; (task = queue.poll()) != null; ) {
            now = Math.max(now, task.due);
            task.action.run();
        }
    }
    
    /**
     * Returns the number of tasks that are scheduled and not cancelled.
     *
     * @return the number of pending tasks
     */
    public int pendingCount() {
        return queue.size();
    }
    
    private final class ScheduledTask implements Task, Comparable<ScheduledTask> {
        final Runnable action;
        final long due;
        final long seq;
        
        ScheduledTask(Runnable action, long due, long seq) {
            this.action = action;
            this.due = due;
            this.seq = seq;
        }
        
        @Override
        public void cancel() {
            queue.remove(this);
        }
        
        @Override
        public int compareTo(ScheduledTask o) {
            int c = Long.compare(due, o.due);
            return c != 0 ? c : Long.compare(seq, o.seq);
        }
    }
}
