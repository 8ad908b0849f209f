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

package ai.kognition.enhancer.image.session;

import java.io.File;
import java.io.IOException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.enhancer.image.Enhancer;
import ai.kognition.enhancer.image.EnhancerConfig;
import ai.kognition.enhancer.image.GammaParameter;
import ai.kognition.enhancer.image.ImageDecodeException;
import ai.kognition.enhancer.image.ImageSource;
import ai.kognition.enhancer.image.IntensityArray;
import ai.kognition.enhancer.image.InvalidParameterException;
import ai.kognition.enhancer.image.LutCache;
import ai.kognition.enhancer.image.Technique;
import ai.kognition.enhancer.image.calc.Histogram;
import ai.kognition.enhancer.image.calc.HistogramSampler;

/**
 * The images for one loaded file. The original is fixed from the time it's loaded until the
 * next load. The processed image is replaced, never modified, every time an enhancement is
 * applied. Lookup tables built while enhancing are kept for as long as the original is loaded.
 */
public class EnhancementSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnhancementSession.class);

    private final EnhancerConfig config;
    private final LutCache cache = new LutCache();
    private final Enhancer enhancer = new Enhancer(cache);
    private final HistogramSampler sampler;

    private volatile EnhancementResult current = null;

    public EnhancementSession() {
        this(EnhancerConfig.defaults());
    }

    public EnhancementSession(final EnhancerConfig config) {
        this.config = config;
        this.sampler = new HistogramSampler(config.histogramPixelLimit);
    }

    public EnhancerConfig getConfig() {
        return config;
    }

    public LutCache getCache() {
        return cache;
    }

    /**
     * Load a new original from the source. On failure the previously loaded image, if any, is kept.
     *
     * @throws ImageDecodeException when the source can't provide the image.
     */
    public EnhancementResult load(final ImageSource source, final String path) throws ImageDecodeException {
        final IntensityArray image = source.load(path);
        if(image == null)
            throw new ImageDecodeException(path, "File is not a valid image.");
        return load(image, path);
    }

    /**
     * Replace the original image. This clears the lookup table cache and resets the
     * enhancement to {@link Technique#IDENTITY}.
     */
    public synchronized EnhancementResult load(final IntensityArray original, final String sourceName) {
        IntensityArray.requireNonEmpty(original);
        cache.clear();
        final Histogram originalHistogram = sampler.compute(original);
        final IntensityArray processed = enhancer.enhance(original, Technique.IDENTITY);
        current = new EnhancementResult(sourceName, original, originalHistogram, processed, sampler.compute(processed), Technique.IDENTITY, null);
        LOGGER.info("Loaded {} from {}", original, sourceName);
        return current;
    }

    /**
     * Replace the processed image with the original enhanced by {@code technique}.
     *
     * @param gamma required for, and only used by, {@link Technique#GAMMA_CORRECTION}.
     * @return the new result or empty if no image has been loaded yet.
     * @throws InvalidParameterException if the parameters are invalid. This is checked even when nothing is loaded.
     */
    public synchronized Optional<EnhancementResult> apply(final Technique technique, final Double gamma) {
        if(technique == null)
            throw new InvalidParameterException("No enhancement technique was selected.");
        final GammaParameter gammaParam = technique.requiresGamma() ? GammaParameter.of(gamma) : null;

        final EnhancementResult prev = current;
        if(prev == null) {
            LOGGER.debug("Ignoring {} since no image is loaded", technique.tag);
            return Optional.empty();
        }

        final IntensityArray processed = enhancer.enhance(prev.original, technique, gammaParam == null ? null : gammaParam.value());
        current = new EnhancementResult(prev.sourceName, prev.original, prev.originalHistogram, processed, sampler.compute(processed), technique,
            gammaParam);
        return Optional.of(current);
    }

    /**
     * Go back to showing the original.
     */
    public Optional<EnhancementResult> reset() {
        return apply(Technique.IDENTITY, null);
    }

    public Optional<EnhancementResult> current() {
        return Optional.ofNullable(current);
    }

    public Optional<IntensityArray> original() {
        return current().map(r -> r.original);
    }

    public Optional<IntensityArray> processed() {
        return current().map(r -> r.processed);
    }

    public Technique technique() {
        return current().map(r -> r.technique).orElse(Technique.IDENTITY);
    }

    /**
     * Where the current result would be exported. The output directory is created if needed.
     *
     * @throws InvalidParameterException if nothing is loaded or no enhancement is applied.
     */
    public File prepareExportDirectory() throws IOException {
        exportNames();
        return OutputNames.prepareDirectory(config.outputDirectory);
    }

    public OutputNames exportNames() {
        final EnhancementResult res = current;
        if(res == null)
            throw new InvalidParameterException("No enhanced image to save.");
        return res.outputNames();
    }
}
