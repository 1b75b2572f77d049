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
import java.util.Iterator;
import java.util.List;


/**
 * The {@code PivotMerge} class merges two sorted lists into a new sorted list.
 *
 * <p>Instead of comparing the heads of both lists at every step, the merge
 * carries a single pivot: the smallest element not yet emitted from the half
 * that was drained last. The two halves are drained alternately against the
 * pivot. When a drained element does not go before the pivot, the pivot is
 * emitted and the element becomes the new pivot. When a half is exhausted,
 * the pivot is emitted and the other half is appended as is.</p>
 *
 * <p>The merge is stable: elements of the lower half precede equal elements
 * of the upper half. For that reason the upper half is drained while its
 * elements are strictly less than the pivot, and the lower half while its
 * elements are less than or equal to the pivot.</p>
 */
public final class PivotMerge {

   private PivotMerge() {
   }


   /**
    * Merges two lists sorted with the same comparator.
    *
    * @param <T> the type of the elements
    * @param lower the lower half, sorted
    * @param upper the upper half, sorted
    * @param cmp the comparator used to sort both halves
    * @return a new list with all the elements of both halves, sorted
    */
   public static <T> List<T> merge(List<T> lower, List<T> upper, Comparator<? super T> cmp) {
      List<T> merged = new ArrayList<>(lower.size() + upper.size());
      Iterator<T> lowerIt = lower.iterator();
      Iterator<T> upperIt = upper.iterator();
      Pivot<T> pivot = new Pivot<>();

      if (lowerIt.hasNext())
         pivot.set(lowerIt.next());

      while ((mergeWhileLess(upperIt, pivot, merged, cmp, true) == true)
         && (mergeWhileLess(lowerIt, pivot, merged, cmp, false) == true)) {
      }

      return merged;
   }


   /**
    * Drains one half into the merged list while its elements go before the
    * pivot. The first element that does not becomes the new pivot, after the
    * old pivot has been emitted.
    *
    * @param half the remaining elements of the half to drain
    * @param pivot the current pivot, taken from the other half
    * @param merged the output list
    * @param cmp the comparator
    * @param strict if true, only elements strictly less than the pivot go
    *        before it, otherwise equal elements go before it too
    * @return false if there was no pivot, in which case the whole half has
    *         been appended and the merge is done
    */
   static <T> boolean mergeWhileLess(Iterator<T> half, Pivot<T> pivot, List<T> merged,
           Comparator<? super T> cmp, boolean strict) {
      if (pivot.isEmpty() == true) {
         while (half.hasNext())
            merged.add(half.next());

         return false;
      }

      final T pivotElem = pivot.take();

      while (half.hasNext()) {
         final T elem = half.next();
         final int res = cmp.compare(elem, pivotElem);

         if ((res > 0) || ((res == 0) && (strict == true))) {
            merged.add(pivotElem);
            pivot.set(elem);
            return true;
         }

         merged.add(elem);
      }

      // Half exhausted, the pivot is the last pending element of the other half
      merged.add(pivotElem);
      return true;
   }


   // Holder for the pivot, null is a valid element value
   static final class Pivot<T> {
      private T elem;
      private boolean present;

      void set(T elem) {
         this.elem = elem;
         this.present = true;
      }

      T take() {
         final T res = this.elem;
         this.elem = null;
         this.present = false;
         return res;
      }

      boolean isEmpty() {
         return this.present == false;
      }
   }
}
