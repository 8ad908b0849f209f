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

import java.util.function.IntUnaryOperator;

/**
 * An immutable mapping from every input intensity to an output intensity.
 */
public final class LookupTable {
    private final byte[] table;

    private LookupTable(final byte[] table) {
        this.table = table;
    }

    /**
     * Build a table by evaluating {@code mapping} at every intensity. Results are clamped to [0, 255].
     */
    public static LookupTable fromFunction(final IntUnaryOperator mapping) {
        final byte[] table = new byte[IntensityArray.NUM_INTENSITIES];
        for(int i = 0; i < table.length; i++)
            table[i] = (byte)clamp(mapping.applyAsInt(i));
        return new LookupTable(table);
    }

    /**
     * The power law table {@code round((i/255)^(1/gamma) * 255)}.
     */
    public static LookupTable gamma(final GammaParameter gamma) {
        final double invGamma = 1.0 / gamma.value();
        return fromFunction(i -> (int)Math.round(Math.pow(i / 255.0, invGamma) * 255.0));
    }

    public int lookup(final int intensity) {
        return table[intensity] & 0xff;
    }

    /**
     * @return a copy of the table as ints.
     */
    public int[] toIntArray() {
        final int[] ret = new int[table.length];
        for(int i = 0; i < table.length; i++)
            ret[i] = table[i] & 0xff;
        return ret;
    }

    byte[] table() {
        return table;
    }

    static int clamp(final int v) {
        return v < 0 ? 0 : (v > 255 ? 255 : v);
    }
}
