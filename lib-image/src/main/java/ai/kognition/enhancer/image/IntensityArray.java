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

import java.util.Arrays;

/**
 * An immutable grid of unsigned 8-bit grayscale samples stored row major. Every
 * operation that changes intensities produces a new instance with its own storage.
 */
public final class IntensityArray {
    public static final int NUM_INTENSITIES = 256;

    private final int width;
    private final int height;
    private final byte[] data;

    // takes ownership of data
    private IntensityArray(final int width, final int height, final byte[] data) {
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * Create an array from row major samples. The samples are copied.
     *
     * @throws EmptyImageException if either dimension is less than 1 or {@code samples} is null.
     * @throws InvalidParameterException if the number of samples doesn't match the dimensions.
     */
    public static IntensityArray of(final int width, final int height, final byte[] samples) {
        final int count = checkedPixelCount(width, height);
        if(samples == null)
            throw new EmptyImageException("Cannot create an image from null samples.");
        if(samples.length != count)
            throw new InvalidParameterException(
                "An image of " + width + "x" + height + " needs " + count + " samples but " + samples.length + " were supplied.");
        return new IntensityArray(width, height, samples.clone());
    }

    /**
     * Create an array from rows of intensities in the range [0, 255]. All rows must be the same length.
     */
    public static IntensityArray fromRows(final int[][] rows) {
        if(rows == null || rows.length == 0 || rows[0] == null || rows[0].length == 0)
            throw new EmptyImageException("Cannot create an image from empty rows.");
        final int height = rows.length;
        final int width = rows[0].length;
        final byte[] data = new byte[checkedPixelCount(width, height)];
        for(int r = 0; r < height; r++) {
            if(rows[r] == null || rows[r].length != width)
                throw new InvalidParameterException("Row " + r + " doesn't have " + width + " columns.");
            for(int c = 0; c < width; c++) {
                final int v = rows[r][c];
                if(v < 0 || v > 255)
                    throw new InvalidParameterException("Intensity at (" + r + ", " + c + ") is " + v + " which is outside of [0, 255]");
                data[r * width + c] = (byte)v;
            }
        }
        return new IntensityArray(width, height, data);
    }

    /**
     * An image where every sample has the same intensity.
     */
    public static IntensityArray filled(final int width, final int height, final int intensity) {
        final int count = checkedPixelCount(width, height);
        if(intensity < 0 || intensity > 255)
            throw new InvalidParameterException("Intensity " + intensity + " is outside of [0, 255]");
        final byte[] data = new byte[count];
        Arrays.fill(data, (byte)intensity);
        return new IntensityArray(width, height, data);
    }

    /**
     * Fail fast when handed a missing image.
     */
    public static IntensityArray requireNonEmpty(final IntensityArray image) {
        if(image == null)
            throw new EmptyImageException("No image was supplied.");
        return image;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return data.length;
    }

    /**
     * @return the intensity, in [0, 255], at the given position.
     */
    public int get(final int row, final int col) {
        if(row < 0 || row >= height || col < 0 || col >= width)
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") is outside of a " + width + "x" + height + " image");
        return data[row * width + col] & 0xff;
    }

    /**
     * @return the intensity, in [0, 255], at the given row major index.
     */
    public int getFlat(final int index) {
        return data[index] & 0xff;
    }

    /**
     * A new array with the same dimensions and samples and separate storage.
     */
    public IntensityArray copy() {
        return new IntensityArray(width, height, data.clone());
    }

    /**
     * Apply the lookup table to every sample producing a new array.
     */
    public IntensityArray map(final LookupTable lut) {
        final byte[] table = lut.table();
        final byte[] out = new byte[data.length];
        for(int i = 0; i < data.length; i++)
            out[i] = table[data[i] & 0xff];
        return new IntensityArray(width, height, out);
    }

    /**
     * @return a copy of the samples in row major order.
     */
    public byte[] toByteArray() {
        return data.clone();
    }

    // storage identity is only visible within the package
    byte[] data() {
        return data;
    }

    /**
     * The number of samples in a {@code width x height} image.
     *
     * @throws EmptyImageException if either dimension is less than 1.
     * @throws InvalidParameterException if there would be more samples than fit in a single array.
     */
    public static int checkedPixelCount(final int width, final int height) {
        if(width < 1 || height < 1)
            throw new EmptyImageException("Image dimensions must be at least 1x1 but were " + width + "x" + height);
        final long count = (long)width * height;
        if(count > Integer.MAX_VALUE)
            throw new InvalidParameterException("An image of " + width + "x" + height + " has " + count + " samples which is more than "
                + Integer.MAX_VALUE);
        return (int)count;
    }

    @Override
    public boolean equals(final Object o) {
        if(this == o)
            return true;
        if(!(o instanceof IntensityArray))
            return false;
        final IntensityArray other = (IntensityArray)o;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return IntensityArray.class.getSimpleName() + "[" + width + "x" + height + "]";
    }
}
