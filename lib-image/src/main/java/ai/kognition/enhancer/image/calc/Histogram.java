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

package ai.kognition.enhancer.image.calc;

import java.util.Arrays;

import ai.kognition.enhancer.image.IntensityArray;

/**
 * Frequency of each of the 256 intensities. When {@link #sampled} is set the counts
 * come from a uniform sub-sample of the image rather than every pixel, and callers
 * presenting it should label it as approximate.
 */
public final class Histogram {
    public static final String SAMPLED_SUFFIX = " (Sampled)";

    private final int[] counts;
    public final boolean sampled;
    private final long total;

    Histogram(final int[] counts, final boolean sampled) {
        this.counts = counts;
        this.sampled = sampled;
        long sum = 0;
        for(final int c: counts)
            sum += c;
        this.total = sum;
    }

    public int count(final int intensity) {
        return counts[intensity];
    }

    /**
     * @return a copy of the 256 bin counts.
     */
    public int[] counts() {
        return counts.clone();
    }

    /**
     * @return the sum of all of the bins.
     */
    public long total() {
        return total;
    }

    public int numBins() {
        return IntensityArray.NUM_INTENSITIES;
    }

    /**
     * The title a chart of this histogram should carry.
     */
    public String title(final String baseTitle) {
        return sampled ? baseTitle + SAMPLED_SUFFIX : baseTitle;
    }

    @Override
    public boolean equals(final Object o) {
        if(this == o)
            return true;
        if(!(o instanceof Histogram))
            return false;
        final Histogram other = (Histogram)o;
        return sampled == other.sampled && Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(counts) + (sampled ? 1 : 0);
    }

    @Override
    public String toString() {
        return Histogram.class.getSimpleName() + "[total=" + total + (sampled ? ", sampled" : "") + "]";
    }
}
