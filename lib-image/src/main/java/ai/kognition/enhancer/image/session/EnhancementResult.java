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

import java.util.Optional;

import ai.kognition.enhancer.image.GammaParameter;
import ai.kognition.enhancer.image.IntensityArray;
import ai.kognition.enhancer.image.Technique;
import ai.kognition.enhancer.image.calc.Histogram;

/**
 * Everything a display or export adapter needs after an enhancement: both images and
 * both histograms along with the parameters that produced them.
 */
public final class EnhancementResult {
    public final String sourceName;
    public final IntensityArray original;
    public final Histogram originalHistogram;
    public final IntensityArray processed;
    public final Histogram processedHistogram;
    public final Technique technique;
    private final GammaParameter gamma;

    EnhancementResult(final String sourceName, final IntensityArray original, final Histogram originalHistogram, final IntensityArray processed,
        final Histogram processedHistogram, final Technique technique, final GammaParameter gamma) {
        this.sourceName = sourceName;
        this.original = original;
        this.originalHistogram = originalHistogram;
        this.processed = processed;
        this.processedHistogram = processedHistogram;
        this.technique = technique;
        this.gamma = gamma;
    }

    /**
     * @return the gamma used. Only present for {@link Technique#GAMMA_CORRECTION}.
     */
    public Optional<GammaParameter> gamma() {
        return Optional.ofNullable(gamma);
    }

    /**
     * The file names this result would be exported under.
     *
     * @throws ai.kognition.enhancer.image.InvalidParameterException if no enhancement was applied.
     */
    public OutputNames outputNames() {
        return OutputNames.of(sourceName, technique, gamma);
    }

    @Override
    public String toString() {
        return "EnhancementResult [" + sourceName + ", " + technique.tag + (gamma == null ? "" : ", " + gamma) + ", " + processed + "]";
    }
}
