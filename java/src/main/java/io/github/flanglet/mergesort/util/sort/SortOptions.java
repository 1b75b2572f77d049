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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import io.github.flanglet.mergesort.Global;
import io.github.flanglet.mergesort.Listener;
import io.github.flanglet.mergesort.Range;
import io.github.flanglet.mergesort.Sorter;


/**
 * Options to configure a parallel merge sort. Options are set by chaining
 * calls, then {@link #sort(Object[])} runs a {@link ParallelMergeSort} with a
 * snapshot of the current options. The same instance can be reused for
 * several sorts but must not be modified while a sort is running.
 *
 * <p>By default the whole array is sorted with one thread per logical CPU.</p>
 *
 * <pre>
 * Integer[] array = { -1, 5, 91293, 12, -95, 20000, 20001, -12, 7 };
 * List&lt;Integer&gt; sorted = SortOptions.&lt;Integer&gt;defaultOrder()
 *     .range(3, 7)
 *     .threads(8)
 *     .sort(array); // [-95, 12, 20000, 20001]
 * </pre>
 *
 * @param <T> the type of the elements
 */
public class SortOptions<T> implements Sorter<T> {

   private final Comparator<? super T> cmp;
   private final List<Listener> listeners;
   private int threads;
   private int minChunkSize;
   private Range range;


   /**
    * Constructs options for the given comparator, with default values.
    *
    * @param cmp the comparator used for element comparisons
    * @throws NullPointerException if the comparator is null
    */
   public SortOptions(Comparator<? super T> cmp) {
      if (cmp == null)
         throw new NullPointerException("Invalid null comparator parameter");

      this.cmp = cmp;
      this.listeners = new ArrayList<>();
      this.threads = Global.logicalCpus();
      this.minChunkSize = ParallelMergeSort.DEFAULT_MIN_CHUNK_SIZE;
      this.range = null;
   }


   /**
    * Returns options sorting in natural (ascending) order.
    *
    * @param <T> the type of the elements
    * @return new options
    */
   public static <T extends Comparable<? super T>> SortOptions<T> defaultOrder() {
      return new SortOptions<T>(Comparator.naturalOrder());
   }


   /**
    * Returns options sorting in reverse natural (descending) order.
    *
    * @param <T> the type of the elements
    * @return new options
    */
   public static <T extends Comparable<? super T>> SortOptions<T> reverseOrder() {
      return new SortOptions<T>(Comparator.reverseOrder());
   }


   /**
    * Returns options sorting with the given comparator.
    *
    * @param <T> the type of the elements
    * @param cmp the comparator
    * @return new options
    */
   public static <T> SortOptions<T> customOrder(Comparator<? super T> cmp) {
      return new SortOptions<T>(cmp);
   }


   /**
    * Sets the number of threads used. 0 means no parallelism, like 1.
    *
    * @param threads the thread budget
    * @return these options
    */
   public SortOptions<T> threads(int threads) {
      this.threads = threads;
      return this;
   }


   /**
    * Sets the number of threads to the number of logical CPUs (default).
    *
    * @return these options
    */
   public SortOptions<T> threadPerCpu() {
      return this.threads(Global.logicalCpus());
   }


   /**
    * Sets the number of threads to the number of physical CPUs.
    *
    * @return these options
    */
   public SortOptions<T> threadPerPhysicalCpu() {
      return this.threads(Global.physicalCpus());
   }


   /**
    * Sets the range of the array to sort.
    *
    * @param start the first index (inclusive)
    * @param end the last index (exclusive)
    * @return these options
    * @throws IllegalArgumentException if start is negative or greater than end
    */
   public SortOptions<T> range(int start, int end) {
      return this.range(Range.of(start, end));
   }


   /**
    * Sets the range of the array to sort.
    *
    * @param range the range, or null for the full array
    * @return these options
    */
   public SortOptions<T> range(Range range) {
      this.range = range;
      return this;
   }


   /**
    * Sets the array to be fully sorted (default).
    *
    * @return these options
    */
   public SortOptions<T> fullRange() {
      this.range = null;
      return this;
   }


   /**
    * Sets the minimum length of a range for its halves to be sorted on
    * different threads.
    *
    * @param minChunkSize the minimum range length
    * @return these options
    */
   public SortOptions<T> minChunkSize(int minChunkSize) {
      this.minChunkSize = minChunkSize;
      return this;
   }


   public SortOptions<T> addListener(Listener bl) {
      if (bl == null)
         throw new NullPointerException("Invalid null listener parameter");

      this.listeners.add(bl);
      return this;
   }


   public SortOptions<T> removeListener(Listener bl) {
      this.listeners.remove(bl);
      return this;
   }


   public Comparator<? super T> getComparator() {
      return this.cmp;
   }


   public int getThreads() {
      return this.threads;
   }


   public int getMinChunkSize() {
      return this.minChunkSize;
   }


   /**
    * Returns the configured range.
    *
    * @return the range, or null if the full array is sorted
    */
   public Range getRange() {
      return this.range;
   }


   /**
    * Sorts the configured range of the array (the whole array if no range is
    * set).
    *
    * @param array the array to sort, not modified
    * @return a new sorted list
    * @throws IndexOutOfBoundsException if the configured range does not fit
    *         in the array
    * @throws io.github.flanglet.mergesort.SortException if a worker fails
    */
   @Override
   public List<T> sort(T[] array) {
      if (array == null)
         throw new NullPointerException("Invalid null array parameter");

      return this.sort(array, (this.range != null) ? this.range : Range.full(array.length));
   }


   /**
    * Sorts the given range of the array, ignoring the configured range.
    *
    * @param array the array to sort, not modified
    * @param range the range to sort
    * @return a new sorted list
    */
   @Override
   public List<T> sort(T[] array, Range range) {
      Listener[] bls = this.listeners.toArray(new Listener[0]);
      return new ParallelMergeSort<T>(this.cmp, this.threads, this.minChunkSize, bls).sort(array, range);
   }
}
