/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.enhancer.util;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dempsy.util.QuietCloseable;
import net.dempsy.util.executor.AutoDisposeSingleThreadScheduler;
import net.dempsy.util.executor.AutoDisposeSingleThreadScheduler.Cancelable;

/**
 * Coalesces rapidly repeated triggers into a single action that runs once the triggers
 * have stopped arriving for the quiescence window. There is at most one pending action at
 * any time. Each call to {@link #trigger(Runnable)} cancels the pending action (if it hasn't
 * started yet) and replaces it.
 *
 * <p>
 * Actions run on a single background thread so they never overlap each other. An action that
 * has already started is never interrupted.
 * </p>
 */
public class Debouncer implements QuietCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Debouncer.class);

    private final AutoDisposeSingleThreadScheduler scheduler;
    private final long quiescenceMillis;

    private Cancelable pending = null;
    private long generation = 0;
    private boolean closed = false;

    public Debouncer(final String name, final long quiescenceMillis) {
        if(quiescenceMillis < 0)
            throw new IllegalArgumentException("The debounce window for \"" + name + "\" cannot be negative. It was " + quiescenceMillis);
        this.scheduler = new AutoDisposeSingleThreadScheduler(name);
        this.quiescenceMillis = quiescenceMillis;
    }

    public long getQuiescenceMillis() {
        return quiescenceMillis;
    }

    /**
     * Schedule {@code action} to run after the quiescence window, replacing anything pending.
     */
    public void trigger(final Runnable action) {
        trigger(action, quiescenceMillis);
    }

    /**
     * Run {@code action} as soon as possible on the background thread, replacing anything pending.
     */
    public void triggerNow(final Runnable action) {
        trigger(action, 0);
    }

    /**
     * @return true if there's an action scheduled that hasn't started yet.
     */
    public synchronized boolean isPending() {
        return pending != null;
    }

    /**
     * Drop the pending action, if any. An action that has already started still finishes.
     */
    public synchronized void cancel() {
        cancelPending();
    }

    private synchronized void trigger(final Runnable action, final long delayMillis) {
        if(closed)
            throw new IllegalStateException("Cannot trigger a closed " + Debouncer.class.getSimpleName());

        cancelPending();

        final long myGeneration = ++generation;
        pending = scheduler.schedule(() -> {
            synchronized(Debouncer.this) {
                // superseded between firing and acquiring the lock
                if(myGeneration != generation || closed)
                    return;
                pending = null;
            }
            try {
                action.run();
            } catch(final RuntimeException rte) {
                LOGGER.warn("Debounced action {} failed", action, rte);
            }
        }, delayMillis, TimeUnit.MILLISECONDS);
    }

    private void cancelPending() {
        if(pending != null) {
            LOGGER.trace("Replacing pending debounced action");
            pending.cancel();
            pending = null;
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        cancelPending();
    }
}
