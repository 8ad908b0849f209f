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

package ai.kognition.enhancer.image;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes lookup tables by technique and fixed point parameter.
 *
 * <p>
 * Concurrent requests for the same key share a single build: the first caller runs the builder
 * and every other caller for that key blocks until it completes. If the builder fails, every
 * waiting caller sees the failure and the key is left empty so a later request builds again.
 * </p>
 */
public class LutCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(LutCache.class);

    private final Map<Key, FutureTask<LookupTable>> entries = new ConcurrentHashMap<>();
    private final AtomicLong builds = new AtomicLong(0);

    public static final class Key {
        public final Technique technique;
        public final int parameter;

        public Key(final Technique technique, final int parameter) {
            if(technique == null)
                throw new NullPointerException("A " + Key.class.getName() + " needs a technique.");
            this.technique = technique;
            this.parameter = parameter;
        }

        public static Key gamma(final GammaParameter gamma) {
            return new Key(Technique.GAMMA_CORRECTION, gamma.hundredths);
        }

        @Override
        public boolean equals(final Object o) {
            if(this == o)
                return true;
            if(!(o instanceof Key))
                return false;
            final Key other = (Key)o;
            return technique == other.technique && parameter == other.parameter;
        }

        @Override
        public int hashCode() {
            return 31 * technique.hashCode() + parameter;
        }

        @Override
        public String toString() {
            return technique.tag + "_" + parameter;
        }
    }

    public LookupTable getOrBuild(final Key key, final Supplier<LookupTable> builder) {
        FutureTask<LookupTable> task = entries.get(key);
        if(task == null) {
            final FutureTask<LookupTable> newTask = new FutureTask<>(() -> builder.get());
            task = entries.putIfAbsent(key, newTask);
            if(task == null) {
                LOGGER.trace("LUT cache miss for {}", key);
                task = newTask;
                builds.incrementAndGet();
                newTask.run();
            } else
                LOGGER.trace("LUT cache joined in-flight build for {}", key);
        } else
            LOGGER.trace("LUT cache hit for {}", key);

        try {
            return task.get();
        } catch(final ExecutionException ee) {
            entries.remove(key, task);
            final Throwable cause = ee.getCause();
            if(cause instanceof RuntimeException)
                throw (RuntimeException)cause;
            if(cause instanceof Error)
                throw (Error)cause;
            throw new EnhancementException("Failed to build lookup table for " + key, cause);
        } catch(final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new EnhancementException("Interrupted while waiting on the lookup table for " + key, ie);
        }
    }

    public boolean contains(final Key key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Number of times a builder has been invoked since this cache was created.
     */
    public long buildCount() {
        return builds.get();
    }

    /**
     * Drop every entry. Builds already in flight complete for the callers waiting on them.
     */
    public void clear() {
        LOGGER.debug("Clearing {} cached lookup tables", entries.size());
        entries.clear();
    }
}
