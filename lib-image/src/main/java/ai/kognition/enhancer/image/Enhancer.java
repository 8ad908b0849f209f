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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.enhancer.image.calc.HistogramSampler;
import ai.kognition.enhancer.util.Timer;

/**
 * Produces a new {@link IntensityArray} from an existing one using one of the
 * {@link Technique}s. The input is never modified and the output never shares
 * storage with it. Gamma tables are memoized in the {@link LutCache} this engine
 * was constructed with.
 */
public class Enhancer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Enhancer.class);

    private final LutCache cache;

    public Enhancer() {
        this(new LutCache());
    }

    public Enhancer(final LutCache cache) {
        if(cache == null)
            throw new NullPointerException("Cannot create an " + Enhancer.class.getSimpleName() + " with a null " + LutCache.class.getSimpleName());
        this.cache = cache;
    }

    public LutCache getCache() {
        return cache;
    }

    /**
     * @param gamma only used, and then required, for {@link Technique#GAMMA_CORRECTION}.
     *
     * @throws EmptyImageException if {@code image} is null.
     * @throws InvalidParameterException if the technique is missing or the gamma is missing or out of range.
     */
    public IntensityArray enhance(final IntensityArray image, final Technique technique, final Double gamma) {
        IntensityArray.requireNonEmpty(image);
        if(technique == null)
            throw new InvalidParameterException("No enhancement technique was selected.");

        final Timer timer = Timer.started();
        final IntensityArray ret;
        switch(technique) {
            case IDENTITY:
                ret = image.copy();
                break;
            case HISTOGRAM_EQUALIZATION:
                ret = image.map(equalizationTable(image));
                break;
            case GAMMA_CORRECTION:
                ret = image.map(gammaTable(GammaParameter.of(gamma)));
                break;
            default:
                throw new InvalidParameterException("Unsupported enhancement technique " + technique);
        }

        if(LOGGER.isDebugEnabled())
            LOGGER.debug("Applied {}{} to {} in {}s", technique.tag, technique.requiresGamma() ? "(" + gamma + ")" : "", image, timer.stop());
        return ret;
    }

    public IntensityArray enhance(final IntensityArray image, final Technique technique) {
        return enhance(image, technique, null);
    }

    public IntensityArray equalize(final IntensityArray image) {
        return enhance(image, Technique.HISTOGRAM_EQUALIZATION, null);
    }

    public IntensityArray gamma(final IntensityArray image, final double gamma) {
        return enhance(image, Technique.GAMMA_CORRECTION, gamma);
    }

    /**
     * The gamma table for the given parameter, built at most once per distinct parameter.
     */
    public LookupTable gammaTable(final GammaParameter gamma) {
        return cache.getOrBuild(LutCache.Key.gamma(gamma), () -> LookupTable.gamma(gamma));
    }

    /**
     * The global histogram equalization mapping for this image's intensity distribution:
     * {@code round((cdf(i) - cdfMin) / (N - cdfMin) * 255)} where {@code cdfMin} is the
     * cumulative count at the lowest intensity present. Intensities below that map to 0.
     * A single valued image maps to itself.
     */
    public static LookupTable equalizationTable(final IntensityArray image) {
        return equalizationTable(HistogramSampler.exactCounts(IntensityArray.requireNonEmpty(image)));
    }

    public static LookupTable equalizationTable(final int[] counts) {
        if(counts == null || counts.length != IntensityArray.NUM_INTENSITIES)
            throw new InvalidParameterException("Equalization needs " + IntensityArray.NUM_INTENSITIES + " histogram bins.");

        int first = 0;
        while(first < counts.length && counts[first] == 0)
            first++;
        if(first == counts.length)
            throw new EmptyImageException("Cannot equalize an empty histogram.");

        final long[] cdf = new long[counts.length];
        long running = 0;
        for(int i = 0; i < counts.length; i++) {
            running += counts[i];
            cdf[i] = running;
        }
        final long total = running;
        final long cdfMin = cdf[first];

        if(total == cdfMin)
            return LookupTable.fromFunction(i -> i);

        final double scale = 255.0 / (total - cdfMin);
        final int lowest = first;
        return LookupTable.fromFunction(i -> i < lowest ? 0 : (int)Math.round((cdf[i] - cdfMin) * scale));
    }
}
