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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Random;

import org.junit.Test;

public class EnhancerTest {

    static IntensityArray randomImage(final long seed, final int width, final int height) {
        final Random random = new Random(seed);
        final byte[] samples = new byte[width * height];
        random.nextBytes(samples);
        return IntensityArray.of(width, height, samples);
    }

    @Test
    public void testIdentityIsADistinctCopy() {
        final Enhancer enhancer = new Enhancer();
        final IntensityArray img = randomImage(1234L, 37, 21);
        final IntensityArray out = enhancer.enhance(img, Technique.IDENTITY);

        assertEquals(img, out);
        assertNotSame(img, out);
        assertNotSame(img.data(), out.data());

        // changing the copy's storage must not be visible through the original
        out.data()[0] = (byte)(out.data()[0] + 1);
        assertTrue(img.getFlat(0) != out.getFlat(0));
    }

    @Test
    public void testIdentityOnConstantImage() {
        final IntensityArray img = IntensityArray.filled(8, 8, 100);
        final IntensityArray out = new Enhancer().enhance(img, Technique.IDENTITY, null);
        assertEquals(8, out.width());
        assertEquals(8, out.height());
        for(int r = 0; r < 8; r++)
            for(int c = 0; c < 8; c++)
                assertEquals(100, out.get(r, c));
    }

    @Test
    public void testEqualizationFormula() {
        final IntensityArray img = IntensityArray.fromRows(new int[][] {
            {0,1,2,3},
            {3,2,1,0}
        });

        final IntensityArray out = new Enhancer().equalize(img);
        assertEquals(IntensityArray.fromRows(new int[][] {
            {0,85,170,255},
            {255,170,85,0}
        }), out);
    }

    @Test
    public void testEqualizationSkipsEmptyBins() {
        final IntensityArray img = IntensityArray.fromRows(new int[][] {{10,10,10,200}});
        final LookupTable lut = Enhancer.equalizationTable(img);

        assertEquals(0, lut.lookup(0));
        assertEquals(0, lut.lookup(10));
        assertEquals(0, lut.lookup(199));
        assertEquals(255, lut.lookup(200));
        assertEquals(255, lut.lookup(255));

        assertEquals(IntensityArray.fromRows(new int[][] {{0,0,0,255}}), new Enhancer().equalize(img));
    }

    @Test
    public void testEqualizationOfConstantImageIsUnchanged() {
        final IntensityArray img = IntensityArray.filled(5, 3, 77);
        final IntensityArray out = new Enhancer().equalize(img);
        assertEquals(img, out);
        assertNotSame(img.data(), out.data());
    }

    @Test
    public void testEqualizationIsMonotonic() {
        for(long seed = 0; seed < 20; seed++) {
            // skew the distribution so the mapping isn't close to the identity
            final IntensityArray base = randomImage(seed, 64, 48);
            final IntensityArray skewed = base.map(LookupTable.fromFunction(i -> (i * i) / 255));
            final int[] table = Enhancer.equalizationTable(skewed).toIntArray();
            for(int i = 1; i < table.length; i++)
                assertTrue("seed " + seed + " at " + i, table[i - 1] <= table[i]);

            final IntensityArray out = new Enhancer().equalize(skewed);
            for(int p = 0; p < out.pixelCount(); p++)
                assertEquals(table[skewed.getFlat(p)], out.getFlat(p));
        }
    }

    @Test
    public void testGammaSamplePoints() {
        final Enhancer enhancer = new Enhancer();
        final LookupTable brighten = enhancer.gammaTable(GammaParameter.of(2.0));
        final LookupTable darken = enhancer.gammaTable(GammaParameter.of(0.5));

        assertEquals(181, brighten.lookup(128));
        assertEquals(64, darken.lookup(128));

        for(final LookupTable lut: new LookupTable[] {brighten,darken}) {
            assertEquals(0, lut.lookup(0));
            assertEquals(255, lut.lookup(255));
        }
    }

    @Test
    public void testGammaTableIsMonotonic() {
        final Enhancer enhancer = new Enhancer();
        for(int h = 10; h <= 500; h += 7) {
            final int[] table = enhancer.gammaTable(GammaParameter.of(h / 100.0)).toIntArray();
            for(int i = 1; i < table.length; i++)
                assertTrue("gamma " + h + " at " + i, table[i - 1] <= table[i]);
        }

        // larger gamma lifts mid tones with the 1/gamma exponent
        final int[] low = enhancer.gammaTable(GammaParameter.of(0.8)).toIntArray();
        final int[] high = enhancer.gammaTable(GammaParameter.of(1.6)).toIntArray();
        for(int i = 0; i < 256; i++)
            assertTrue(low[i] <= high[i]);
    }

    @Test
    public void testGammaOfOneIsIdentity() {
        final IntensityArray img = randomImage(42L, 31, 17);
        final Enhancer enhancer = new Enhancer();
        assertEquals(img, enhancer.gamma(img, 1.0));
        // rounds to 1.00
        assertEquals(img, enhancer.gamma(img, 1.004));
    }

    @Test
    public void testGammaWarmCacheMatchesColdCache() {
        final IntensityArray img = randomImage(7L, 50, 40);
        final Enhancer warm = new Enhancer();

        for(final double g: new double[] {0.1,0.37,1.0,2.2,5.0}) {
            final IntensityArray first = warm.gamma(img, g);
            final IntensityArray second = warm.gamma(img, g);
            final IntensityArray cold = new Enhancer().gamma(img, g);
            assertEquals(first, second);
            assertArrayEquals(cold.toByteArray(), second.toByteArray());
        }
        assertEquals(5, warm.getCache().size());
        assertEquals(5, warm.getCache().buildCount());
    }

    @Test
    public void testNearbyGammasShareATable() {
        final Enhancer enhancer = new Enhancer();
        final LookupTable a = enhancer.gammaTable(GammaParameter.of(1.501));
        final LookupTable b = enhancer.gammaTable(GammaParameter.of(1.499));
        assertSame(a, b);
        assertEquals(1, enhancer.getCache().size());
    }

    @Test
    public void testInvalidGammaIsRejectedBeforeBuilding() {
        final Enhancer enhancer = new Enhancer();
        final IntensityArray img = IntensityArray.filled(2, 2, 50);
        for(final Double g: new Double[] {null,0.0,-1.0,0.09,5.01,Double.NaN,Double.POSITIVE_INFINITY}) {
            try {
                enhancer.enhance(img, Technique.GAMMA_CORRECTION, g);
                fail("Gamma " + g + " should have been rejected");
            } catch(final InvalidParameterException expected) {}
        }
        assertEquals(0, enhancer.getCache().size());
        assertEquals(0, enhancer.getCache().buildCount());
    }

    @Test
    public void testGammaIgnoredForOtherTechniques() {
        final IntensityArray img = IntensityArray.filled(2, 2, 50);
        assertEquals(img, new Enhancer().enhance(img, Technique.IDENTITY, -3.0));
    }

    @Test(expected = EmptyImageException.class)
    public void testNullImage() {
        new Enhancer().enhance(null, Technique.IDENTITY);
    }

    @Test(expected = InvalidParameterException.class)
    public void testNullTechnique() {
        new Enhancer().enhance(IntensityArray.filled(1, 1, 0), null);
    }

    @Test
    public void testOutputIsDeterministic() {
        final IntensityArray img = randomImage(99L, 20, 20);
        final Enhancer enhancer = new Enhancer();
        for(final Technique t: Technique.values())
            assertEquals(enhancer.enhance(img, t, 1.7), enhancer.enhance(img, t, 1.7));
    }
}
