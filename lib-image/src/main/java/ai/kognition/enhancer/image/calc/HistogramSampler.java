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

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.enhancer.image.IntensityArray;
import ai.kognition.enhancer.image.InvalidParameterException;
import ai.kognition.enhancer.util.Timer;

/**
 * Computes intensity histograms with a bounded cost. Images with more pixels than the
 * pixel limit are histogrammed from a uniform random sample, drawn without replacement,
 * of exactly pixel limit pixels. The result is then flagged as {@link Histogram#sampled}.
 */
public class HistogramSampler {
    private static final Logger LOGGER = LoggerFactory.getLogger(HistogramSampler.class);

    public static final int DEFAULT_PIXEL_LIMIT = 250000;

    private final int pixelLimit;

    public HistogramSampler() {
        this(DEFAULT_PIXEL_LIMIT);
    }

    public HistogramSampler(final int pixelLimit) {
        checkLimit(pixelLimit);
        this.pixelLimit = pixelLimit;
    }

    public int getPixelLimit() {
        return pixelLimit;
    }

    public Histogram compute(final IntensityArray image) {
        return compute(image, pixelLimit);
    }

    public static Histogram compute(final IntensityArray image, final int pixelLimit) {
        return compute(image, pixelLimit, ThreadLocalRandom.current());
    }

    public static Histogram compute(final IntensityArray image, final int pixelLimit, final Random random) {
        IntensityArray.requireNonEmpty(image);
        checkLimit(pixelLimit);

        final Timer timer = Timer.started();
        final Histogram ret;
        if(image.pixelCount() <= pixelLimit)
            ret = new Histogram(exactCounts(image), false);
        else
            ret = new Histogram(sampledCounts(image, pixelLimit, random), true);

        if(LOGGER.isDebugEnabled())
            LOGGER.debug("Histogram of {} ({} of {} pixels) computed in {}s", image, ret.total(), image.pixelCount(), timer.stop());
        return ret;
    }

    /**
     * Count every pixel.
     */
    public static int[] exactCounts(final IntensityArray image) {
        final int[] counts = new int[IntensityArray.NUM_INTENSITIES];
        final int n = image.pixelCount();
        for(int i = 0; i < n; i++)
            counts[image.getFlat(i)]++;
        return counts;
    }

    /*
     * Floyd's sampling: for j from n-k to n-1 pick t in [0, j]; if t was already
     * picked take j instead. Every k-subset is equally likely and only k random
     * draws are made.
     */
    static int[] sampledCounts(final IntensityArray image, final int k, final Random random) {
        final int n = image.pixelCount();
        final int[] counts = new int[IntensityArray.NUM_INTENSITIES];
        // sized to the sample, not the image
        final Set<Integer> chosen = new HashSet<>(Math.max(16, (int)(k / 0.75f) + 1));
        for(int j = n - k; j < n; j++) {
            int t = random.nextInt(j + 1);
            if(!chosen.add(t)) {
                t = j;
                chosen.add(t);
            }
            counts[image.getFlat(t)]++;
        }
        return counts;
    }

    private static void checkLimit(final int pixelLimit) {
        if(pixelLimit < 1)
            throw new InvalidParameterException("The histogram pixel limit must be at least 1 but was " + pixelLimit);
    }
}
