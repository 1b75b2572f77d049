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

import java.util.List;


/**
 * This interface defines methods for sorting a range of an array of objects
 * into a newly allocated list.
 *
 * @param <T> the type of the elements to sort
 */
public interface Sorter<T> {

    /**
     * Sorts a range of the array. The array is not modified.
     *
     * @param array the array containing the range to be sorted
     * @param range the half-open interval of indexes to sort
     * @return a new list containing the elements of the range in sorted order
     * @throws IndexOutOfBoundsException if the range does not fit in the array
     */
    public List<T> sort(T[] array, Range range);

    /**
     * Sorts the whole array. The array is not modified.
     *
     * @param array the array to be sorted
     * @return a new list containing the elements of the array in sorted order
     */
    public default List<T> sort(T[] array) {
        if (array == null)
            throw new NullPointerException("Invalid null array parameter");

        return this.sort(array, Range.full(array.length));
    }
}
