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


/**
 * Shortcuts for the common sorts. The parallel ones use one thread per
 * logical CPU. All of them return a new list and leave the input array
 * untouched. See {@link SortOptions} for more control.
 */
public final class MergeSorts {

   private MergeSorts() {
   }


   /**
    * Sorts the whole array in natural order.
    *
    * @param <T> the type of the elements
    * @param array the array to sort
    * @return a new sorted list
    */
   public static <T extends Comparable<? super T>> List<T> sort(T[] array) {
      return SortOptions.<T>defaultOrder().sort(array);
   }


   /**
    * Sorts the whole array with the given comparator.
    *
    * @param <T> the type of the elements
    * @param array the array to sort
    * @param cmp the comparator
    * @return a new sorted list
    */
   public static <T> List<T> sortBy(T[] array, Comparator<? super T> cmp) {
      return SortOptions.<T>customOrder(cmp).sort(array);
   }


   /**
    * Sorts a range of the array in natural order.
    *
    * @param <T> the type of the elements
    * @param array the array to sort
    * @param range the range to sort
    * @return a new sorted list with the elements of the range
    */
   public static <T extends Comparable<? super T>> List<T> sortRange(T[] array, Range range) {
      return SortOptions.<T>defaultOrder().range(range).sort(array);
   }


   /**
    * Sorts a range of the array with the given comparator.
    *
    * @param <T> the type of the elements
    * @param array the array to sort
    * @param range the range to sort
    * @param cmp the comparator
    * @return a new sorted list with the elements of the range
    */
   public static <T> List<T> sortRangeBy(T[] array, Range range, Comparator<? super T> cmp) {
      return SortOptions.<T>customOrder(cmp).range(range).sort(array);
   }


   /**
    * Sorts the whole array in natural order on the calling thread.
    *
    * @param <T> the type of the elements
    * @param array the array to sort
    * @return a new sorted list
    */
   public static <T extends Comparable<? super T>> List<T> sequentialSort(T[] array) {
      return new SequentialMergeSort<T>(Comparator.naturalOrder()).sort(array);
   }


   /**
    * Sorts the whole array with the given comparator on the calling thread.
    *
    * @param <T> the type of the elements
    * @param array the array to sort
    * @param cmp the comparator
    * @return a new sorted list
    */
   public static <T> List<T> sequentialSortBy(T[] array, Comparator<? super T> cmp) {
      return new SequentialMergeSort<T>(cmp).sort(array);
   }


   public static <T extends Comparable<? super T>> SortOptions<T> defaultOrder() {
      return SortOptions.defaultOrder();
   }


   public static <T extends Comparable<? super T>> SortOptions<T> reverseOrder() {
      return SortOptions.reverseOrder();
   }


   public static <T> SortOptions<T> customOrder(Comparator<? super T> cmp) {
      return SortOptions.customOrder(cmp);
   }
}
