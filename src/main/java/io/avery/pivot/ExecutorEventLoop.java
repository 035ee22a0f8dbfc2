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
import java.util.concurrent.*;

/**
 * An {@link EventLoop} backed by a single-threaded {@link ScheduledExecutorService} and the system clock.
 *
 * <p>The loop thread is the engine's thread: callers on other threads marshal their engine calls onto it with
 * {@link #execute(Runnable)}. Listeners registered with an engine on this loop are notified on the loop thread.
 */
public final class ExecutorEventLoop implements EventLoop, AutoCloseable {
    private final ScheduledExecutorService executor;
    
    public ExecutorEventLoop() {
        this(Executors.defaultThreadFactory());
    }
    
    /**
     * @param threadFactory the factory for the loop thread
     */
    public ExecutorEventLoop(ThreadFactory threadFactory) {
        this.executor = Executors.newSingleThreadScheduledExecutor(Objects.requireNonNull(threadFactory));
    }
    
    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }
    
    @Override
    public Task schedule(Runnable action, long delayMillis) {
        Objects.requireNonNull(action);
        ScheduledFuture<?> future = executor.schedule(action, delayMillis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }
    
    /**
     * Runs the given action on the loop thread, as soon as possible.
     *
     * @param action the action to run
     * @return a future that completes when the action has run
     */
    public Future<?> execute(Runnable action) {
        return executor.submit(Objects.requireNonNull(action));
    }
    
    /**
     * Shuts the loop down. Tasks that are already scheduled do not run.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
