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

import java.util.Optional;

import ai.kognition.enhancer.image.IntensityArray;

/**
 * Where and how large to draw an image so it fits entirely inside a viewport while
 * keeping its aspect ratio. The image is centered along the axis it doesn't fill.
 */
public final class DisplayFit {
    public static final int MIN_VIEWPORT_DIMENSION = 2;

    public final int width;
    public final int height;
    public final int offsetX;
    public final int offsetY;

    private DisplayFit(final int width, final int height, final int offsetX, final int offsetY) {
        this.width = width;
        this.height = height;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
    }

    public static Optional<DisplayFit> fit(final IntensityArray image, final int viewportWidth, final int viewportHeight) {
        IntensityArray.requireNonEmpty(image);
        return fit(image.width(), image.height(), viewportWidth, viewportHeight);
    }

    /**
     * @return empty when there's nothing sensible to draw: the viewport is smaller than
     *         {@value #MIN_VIEWPORT_DIMENSION} pixels in either direction or the fitted image
     *         would collapse to less than a pixel.
     */
    public static Optional<DisplayFit> fit(final int imageWidth, final int imageHeight, final int viewportWidth, final int viewportHeight) {
        if(viewportWidth < MIN_VIEWPORT_DIMENSION || viewportHeight < MIN_VIEWPORT_DIMENSION || imageWidth < 1 || imageHeight < 1)
            return Optional.empty();

        final double aspect = (double)imageWidth / (double)imageHeight;
        final long w;
        final long h;
        if(viewportWidth / aspect <= viewportHeight) {
            w = viewportWidth;
            h = Math.round(viewportWidth / aspect);
        } else {
            w = Math.round(viewportHeight * aspect);
            h = viewportHeight;
        }

        if(w < 1 || h < 1)
            return Optional.empty();

        return Optional.of(new DisplayFit((int)w, (int)h, (int)((viewportWidth - w) / 2), (int)((viewportHeight - h) / 2)));
    }

    @Override
    public boolean equals(final Object o) {
        if(this == o)
            return true;
        if(!(o instanceof DisplayFit))
            return false;
        final DisplayFit other = (DisplayFit)o;
        return width == other.width && height == other.height && offsetX == other.offsetX && offsetY == other.offsetY;
    }

    @Override
    public int hashCode() {
        return ((31 * width + height) * 31 + offsetX) * 31 + offsetY;
    }

    @Override
    public String toString() {
        return "DisplayFit [" + width + "x" + height + " at (" + offsetX + ", " + offsetY + ")]";
    }
}
