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

package ai.kognition.enhancer.image.display;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Test;

import ai.kognition.enhancer.image.IntensityArray;

public class DisplayFitTest {

    @Test
    public void testWideImageFillsWidth() {
        final DisplayFit fit = DisplayFit.fit(400, 200, 800, 600).get();
        assertEquals(800, fit.width);
        assertEquals(400, fit.height);
        assertEquals(0, fit.offsetX);
        assertEquals(100, fit.offsetY);
    }

    @Test
    public void testTallImageFillsHeight() {
        final DisplayFit fit = DisplayFit.fit(200, 400, 800, 600).get();
        assertEquals(300, fit.width);
        assertEquals(600, fit.height);
        assertEquals(250, fit.offsetX);
        assertEquals(0, fit.offsetY);
    }

    @Test
    public void testRounding() {
        // 3:2 into 100 wide gives 66.67 high
        final DisplayFit fit = DisplayFit.fit(IntensityArray.filled(3, 2, 0), 100, 100).get();
        assertEquals(100, fit.width);
        assertEquals(67, fit.height);
    }

    @Test
    public void testExactFit() {
        assertEquals(DisplayFit.fit(640, 480, 640, 480).get(), DisplayFit.fit(64, 48, 640, 480).get());
    }

    @Test
    public void testDegenerateViewports() {
        assertFalse(DisplayFit.fit(100, 100, 1, 500).isPresent());
        assertFalse(DisplayFit.fit(100, 100, 500, 1).isPresent());
        assertFalse(DisplayFit.fit(100, 100, 0, 0).isPresent());
        // a sliver that would round to zero pixels high
        assertFalse(DisplayFit.fit(10000, 1, 2, 2).isPresent());
    }
}
