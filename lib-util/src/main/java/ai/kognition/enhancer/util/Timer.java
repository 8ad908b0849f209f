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

import java.util.Locale;

/**
 * Stopwatch for debug logging of elapsed times.
 */
public final class Timer {
    private final long startNanos = System.nanoTime();

    private Timer() {}

    public static Timer started() {
        return new Timer();
    }

    /**
     * @return the seconds elapsed since {@link #started()}, to the millisecond.
     */
    public String stop() {
        return String.format(Locale.ROOT, "%.3f", (System.nanoTime() - startNanos) / 1.0e9);
    }
}
