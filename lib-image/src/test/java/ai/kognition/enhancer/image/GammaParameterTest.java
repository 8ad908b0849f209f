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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

public class GammaParameterTest {

    @Test
    public void testRoundsToHundredths() {
        assertEquals(150, GammaParameter.of(1.5).hundredths);
        assertEquals(150, GammaParameter.of(1.504).hundredths);
        assertEquals(151, GammaParameter.of(1.506).hundredths);
        assertEquals(GammaParameter.of(2.0), GammaParameter.of(2.001));
        assertEquals(2.0, GammaParameter.of(2.001).value(), 0.0);
    }

    @Test
    public void testBounds() {
        assertEquals(10, GammaParameter.of(GammaParameter.MIN).hundredths);
        assertEquals(500, GammaParameter.of(GammaParameter.MAX).hundredths);
        assertEquals("0.10", GammaParameter.of(0.1).format());
        assertEquals("5.00", GammaParameter.of(5.0).format());
    }

    @Test
    public void testParse() {
        assertEquals(GammaParameter.of(0.75), GammaParameter.parse(" 0.75 "));
        for(final String bad: new String[] {null,"","   ","abc","1.2.3","0","-2","7"}) {
            try {
                GammaParameter.parse(bad);
                fail("\"" + bad + "\" should have been rejected");
            } catch(final InvalidParameterException expected) {}
        }
    }

    @Test
    public void testFormatIgnoresDefaultLocale() {
        assertEquals("1.25", GammaParameter.of(1.25).format());
        assertEquals("gamma=1.25", GammaParameter.of(1.25).toString());
    }

    @Test(expected = InvalidParameterException.class)
    public void testMissing() {
        GammaParameter.of(null);
    }

    @Test(expected = InvalidParameterException.class)
    public void testZero() {
        GammaParameter.of(0.0);
    }
}
