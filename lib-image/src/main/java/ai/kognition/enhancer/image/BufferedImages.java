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

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.awt.image.Raster;

/**
 * Moves pixels between {@link BufferedImage}s and {@link IntensityArray}s so AWT based
 * readers, writers and displays can sit on either side of the engine.
 */
public class BufferedImages {

    /**
     * Convert to an intensity array. Images that aren't already 8-bit gray are
     * redrawn into a {@link BufferedImage#TYPE_BYTE_GRAY} image first, which reduces
     * color to luminance.
     */
    public static IntensityArray toIntensityArray(final BufferedImage image) {
        if(image == null)
            throw new EmptyImageException("No image was supplied.");
        final int width = image.getWidth();
        final int height = image.getHeight();
        if(width < 1 || height < 1)
            throw new EmptyImageException("Image dimensions must be at least 1x1 but were " + width + "x" + height);

        final BufferedImage gray;
        if(image.getType() == BufferedImage.TYPE_BYTE_GRAY)
            gray = image;
        else {
            gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            final Graphics2D g = gray.createGraphics();
            try {
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
        }

        final Raster raster = gray.getRaster();
        final byte[] samples = new byte[IntensityArray.checkedPixelCount(width, height)];
        for(int r = 0; r < height; r++) {
            for(int c = 0; c < width; c++)
                samples[r * width + c] = (byte)raster.getSample(c, r, 0);
        }
        return IntensityArray.of(width, height, samples);
    }

    public static BufferedImage toBufferedImage(final IntensityArray image) {
        IntensityArray.requireNonEmpty(image);
        final BufferedImage ret = new BufferedImage(image.width(), image.height(), BufferedImage.TYPE_BYTE_GRAY);
        final byte[] dest = ((DataBufferByte)ret.getRaster().getDataBuffer()).getData();
        final byte[] src = image.data();
        // a fresh TYPE_BYTE_GRAY raster is tightly packed so the layouts match
        System.arraycopy(src, 0, dest, 0, src.length);
        return ret;
    }
}
