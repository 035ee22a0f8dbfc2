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

/**
 * The single-threaded host an {@link PivotEngine engine} runs on. The engine schedules its deferred work (debounced
 * invalidation and the continuation of a batched scan) on the loop, and reads the loop's clock to decide when a scan
 * slice has run long enough to yield.
 *
 * <p>All calls into an engine must happen on its loop's thread, including the tasks the loop runs.
 *
 * @see ManualEventLoop
 * @see ExecutorEventLoop
 */
public interface EventLoop {
    /**
     * A scheduled task that has not necessarily run yet.
     */
    interface Task {
        /**
         * Prevents the task from running, if it has not run yet. Has no effect otherwise.
         */
        void cancel();
    }
    
    /**
     * Returns the current time of this loop's clock, in milliseconds.
     *
     * @return the current time of this loop's clock, in milliseconds
     */
    long currentTimeMillis();
    
    /**
     * Schedules the given action to run on this loop after the given delay. Actions due at the same time run in the
     * order they were scheduled.
     *
     * @param action the action to run
     * @param delayMillis the delay in milliseconds, may be zero
     * @return a handle that can cancel the action
     */
    Task schedule(Runnable action, long delayMillis);
}
