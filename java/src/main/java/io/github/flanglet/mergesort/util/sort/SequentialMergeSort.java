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

package io.github.flanglet.mergesort.util.sort;

import java.util.Comparator;
import java.util.List;
import io.github.flanglet.mergesort.Range;
import io.github.flanglet.mergesort.SliceArray;
import io.github.flanglet.mergesort.Sorter;


/**
 * The {@code SequentialMergeSort} class implements a single threaded, top-down
 * merge sort. Each range is halved, both halves are sorted recursively then
 * combined with {@link PivotMerge}. Ranges of length 0 or 1 are copied as is.
 *
 * <p>The input array is never modified, the result is a new list. The sort is
 * stable and the recursion depth is the base 2 logarithm of the range length.</p>
 *
 * @param <T> the type of the elements
 */
public class SequentialMergeSort<T> implements Sorter<T> {

   private final Comparator<? super T> cmp;


   /**
    * Constructs a {@code SequentialMergeSort} using the given comparator.
    *
    * @param cmp the comparator used for element comparisons
    * @throws NullPointerException if the comparator is null
    */
   public SequentialMergeSort(Comparator<? super T> cmp) {
      if (cmp == null)
         throw new NullPointerException("Invalid null comparator parameter");

      this.cmp = cmp;
   }


   @Override
   public List<T> sort(T[] array, Range range) {
      return split(new SliceArray<>(array, range), this.cmp);
   }


   /**
    * Performs the split step of the merge sort on the slice, then merges the
    * sorted halves.
    *
    * @param slice the range to sort
    * @param cmp the comparator
    * @return a new sorted list
    */
   static <T> List<T> split(SliceArray<T> slice, Comparator<? super T> cmp) {
      if (slice.length() <= 1)
         return slice.toList();

      SliceArray<T>[] halves = slice.split();
      List<T> lower = split(halves[0], cmp);
      List<T> upper = split(halves[1], cmp);
      return PivotMerge.merge(lower, upper, cmp);
   }
}
