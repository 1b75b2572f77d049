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


/**
 * A half-open interval of indexes {@code [start, end)} into an array.
 */
public final class Range {
    private final int start;
    private final int end;


    private Range(int start, int end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Creates the range {@code [start, end)}.
     *
     * @param start the first index (inclusive)
     * @param end the last index (exclusive)
     * @return the new range
     * @throws IllegalArgumentException if start is negative or greater than end
     */
    public static Range of(int start, int end) {
        if (start < 0)
            throw new IllegalArgumentException("The range start cannot be negative: " + start);
        if (start > end)
            throw new IllegalArgumentException("The range start (" + start + ") cannot be greater than the range end (" + end + ")");

        return new Range(start, end);
    }

    /**
     * Creates the range {@code [0, length)}.
     *
     * @param length the array length
     * @return the new range
     */
    public static Range full(int length) {
        return of(0, length);
    }

    public int getStart() {
        return this.start;
    }

    public int getEnd() {
        return this.end;
    }

    public int length() {
        return this.end - this.start;
    }

    public boolean isEmpty() {
        return this.end == this.start;
    }

    /**
     * Returns the first index of the upper half: {@code start + ceil(length/2)}.
     *
     * @return the split index
     */
    public int middle() {
        return this.start + ((this.length() + 1) >>> 1);
    }

    /**
     * Splits this range at {@link #middle()}. The lower half is the larger
     * one when the length is odd.
     *
     * @return the lower and upper halves
     */
    public Range[] split() {
        final int mid = this.middle();
        return new Range[] { new Range(this.start, mid), new Range(mid, this.end) };
    }

    /**
     * Checks that the range fits in an array of the given length.
     *
     * @param length the array length
     * @return this range
     * @throws IndexOutOfBoundsException if the range end exceeds the length
     */
    public Range checkBounds(int length) {
        if (this.end > length)
            throw new IndexOutOfBoundsException("Range " + this + " out of bounds for length " + length);

        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;

        if ((o instanceof Range) == false)
            return false;

        Range r = (Range) o;
        return (this.start == r.start) && (this.end == r.end);
    }

    @Override
    public int hashCode() {
        return 31 * this.start + this.end;
    }

    @Override
    public String toString() {
        return "[" + this.start + ", " + this.end + ")";
    }
}
