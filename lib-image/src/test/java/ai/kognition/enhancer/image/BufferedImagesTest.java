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

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import org.junit.Test;

public class BufferedImagesTest {

    @Test
    public void testGrayRoundTrip() {
        final IntensityArray img = EnhancerTest.randomImage(5L, 13, 7);
        final BufferedImage bi = BufferedImages.toBufferedImage(img);
        assertEquals(BufferedImage.TYPE_BYTE_GRAY, bi.getType());
        assertEquals(13, bi.getWidth());
        assertEquals(7, bi.getHeight());
        assertEquals(img.get(3, 4), bi.getRaster().getSample(4, 3, 0));
        assertEquals(img, BufferedImages.toIntensityArray(bi));
    }

    @Test
    public void testColorIsReducedToGray() {
        final BufferedImage rgb = new BufferedImage(4, 2, BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, 2, 2);
            g.setColor(Color.BLACK);
            g.fillRect(2, 0, 2, 2);
        } finally {
            g.dispose();
        }

        final IntensityArray img = BufferedImages.toIntensityArray(rgb);
        assertEquals(IntensityArray.fromRows(new int[][] {{255,255,0,0},{255,255,0,0}}), img);
    }

    @Test(expected = EmptyImageException.class)
    public void testNullBufferedImage() {
        BufferedImages.toIntensityArray(null);
    }
}
