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

import java.util.Locale;

/**
 * A validated gamma value. Gamma is held as fixed point hundredths so values that
 * round to the same two decimal places are the same parameter.
 */
public final class GammaParameter {
    public static final double MIN = 0.1;
    public static final double MAX = 5.0;

    private static final int MIN_HUNDREDTHS = 10;
    private static final int MAX_HUNDREDTHS = 500;

    public final int hundredths;

    private GammaParameter(final int hundredths) {
        this.hundredths = hundredths;
    }

    /**
     * @throws InvalidParameterException if {@code gamma} is missing, not a number, or outside [{@link #MIN}, {@link #MAX}].
     */
    public static GammaParameter of(final Double gamma) {
        if(gamma == null)
            throw new InvalidParameterException("A gamma value is required for gamma correction.");
        final double g = gamma.doubleValue();
        if(Double.isNaN(g) || Double.isInfinite(g))
            throw new InvalidParameterException("Gamma must be a number but was " + gamma);
        if(g <= 0.0)
            throw new InvalidParameterException("Gamma value must be greater than zero but was " + gamma);
        if(g < MIN || g > MAX)
            throw new InvalidParameterException("Gamma must be in [" + MIN + ", " + MAX + "] but was " + gamma);

        // MIN and MAX themselves must survive the rounding
        final int hundredths = (int)Math.max(MIN_HUNDREDTHS, Math.min(MAX_HUNDREDTHS, Math.round(g * 100.0)));
        return new GammaParameter(hundredths);
    }

    /**
     * Parse a user supplied value.
     */
    public static GammaParameter parse(final String gamma) {
        if(gamma == null || gamma.trim().length() == 0)
            throw new InvalidParameterException("A gamma value is required for gamma correction.");
        final double g;
        try {
            g = Double.parseDouble(gamma.trim());
        } catch(final NumberFormatException nfe) {
            throw new InvalidParameterException("Gamma must be a number but was \"" + gamma + "\"", nfe);
        }
        return of(g);
    }

    public double value() {
        return hundredths / 100.0;
    }

    /**
     * Two decimal place rendering, always with a '.' separator.
     */
    public String format() {
        return String.format(Locale.ROOT, "%.2f", value());
    }

    @Override
    public boolean equals(final Object o) {
        return (o instanceof GammaParameter) && ((GammaParameter)o).hundredths == hundredths;
    }

    @Override
    public int hashCode() {
        return hundredths;
    }

    @Override
    public String toString() {
        return "gamma=" + format();
    }
}
