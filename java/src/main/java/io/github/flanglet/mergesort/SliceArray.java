/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.mergesort;

import java.util.ArrayList;
import java.util.List;


/**
 * An immutable window over an array shared by several sort tasks. Splitting
 * a slice creates new views on the same backing array, the elements are never
 * copied until {@link #toList()} is called and never written.
 *
 * @param <T> the type of the elements
 */
public final class SliceArray<T> {
    private final T[] array;
    private final Range range;


    /**
     * Constructs a {@code SliceArray} covering the whole array.
     *
     * @param array the backing array
     * @throws NullPointerException if the provided array is null
     */
    public SliceArray(T[] array) {
        this(array, (array == null) ? null : Range.full(array.length));
    }

    /**
     * Constructs a {@code SliceArray} with the specified array and range.
     *
     * @param array the backing array
     * @param range the window into the array
     * @throws NullPointerException if the provided array or range is null
     * @throws IndexOutOfBoundsException if the range does not fit in the array
     */
    public SliceArray(T[] array, Range range) {
        if (array == null)
            throw new NullPointerException("The array cannot be null");
        if (range == null)
            throw new NullPointerException("The range cannot be null");

        this.array = array;
        this.range = range.checkBounds(array.length);
    }

    public Range getRange() {
        return this.range;
    }

    public int length() {
        return this.range.length();
    }

    /**
     * Returns the element at the given position, relative to the slice start.
     *
     * @param idx the position in the slice
     * @return the element
     * @throws IndexOutOfBoundsException if the position is outside the slice
     */
    public T get(int idx) {
        if ((idx < 0) || (idx >= this.range.length()))
            throw new IndexOutOfBoundsException("Index " + idx + " out of bounds for slice length " + this.range.length());

        return this.array[this.range.getStart() + idx];
    }

    /**
     * Splits the slice in two views on the same array (see {@link Range#split()}).
     *
     * @return the lower and upper halves
     */
    @SuppressWarnings("unchecked")
    public SliceArray<T>[] split() {
        Range[] halves = this.range.split();
        return new SliceArray[] { new SliceArray<>(this.array, halves[0]), new SliceArray<>(this.array, halves[1]) };
    }

    /**
     * Copies the elements of the slice into a new list.
     *
     * @return a list owned by the caller
     */
    public List<T> toList() {
        final int start = this.range.getStart();
        final int end = this.range.getEnd();
        List<T> res = new ArrayList<>(end - start);

        for (int i = start; i < end; i++)
            res.add(this.array[i]);

        return res;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(100);
        builder.append("[ len=");
        builder.append(this.array.length);
        builder.append(", range=");
        builder.append(this.range);
        builder.append("]");
        return builder.toString();
    }
}
