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
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import io.github.flanglet.mergesort.Error;
import io.github.flanglet.mergesort.Event;
import io.github.flanglet.mergesort.Global;
import io.github.flanglet.mergesort.Listener;
import io.github.flanglet.mergesort.Range;
import io.github.flanglet.mergesort.SliceArray;
import io.github.flanglet.mergesort.SortException;
import io.github.flanglet.mergesort.Sorter;


/**
 * The {@code ParallelMergeSort} class implements a fork-join merge sort driven
 * by a thread budget.
 *
 * <p>Each call splits its range in two halves. While the budget is greater than
 * 1 (and the range is at least {@code minChunkSize} long), the upper half is
 * sorted by a forked worker and the lower half by the calling thread, both with
 * half the budget. The calling thread then joins the worker and merges both
 * results with {@link PivotMerge}. Once the budget reaches 1 the recursion
 * continues sequentially. A sort starting with a budget of {@code B} forks at
 * most {@code B - 1} workers.</p>
 *
 * <p>The input array and the comparator are shared by all the workers and only
 * read. Each worker builds its own result list, so no locking is needed. The
 * comparator must therefore be safe to call concurrently.</p>
 *
 * <p>Workers run on a fixed thread pool created for each call, large enough
 * for every fork to get its own thread, and shut down before returning.</p>
 *
 * <p>If a worker fails, the whole sort fails with a {@link SortException}
 * (code {@link Error#ERR_WORKER_FAILURE}) whose cause is the worker failure.
 * There is no retry and no partial result.</p>
 *
 * @param <T> the type of the elements
 */
public class ParallelMergeSort<T> implements Sorter<T> {

   /**
    * Default minimum length of a range for its upper half to be forked.
    */
   public static final int DEFAULT_MIN_CHUNK_SIZE = 8192;

   private static final Listener[] NO_LISTENER = new Listener[0];

   private final Comparator<? super T> cmp;
   private final int threads;
   private final int minChunkSize;
   private final Listener[] listeners;


   /**
    * Constructs a {@code ParallelMergeSort} with the default minimum chunk size
    * and no listener.
    *
    * @param cmp the comparator used for element comparisons
    * @param threads the thread budget, values below 1 mean no parallelism
    */
   public ParallelMergeSort(Comparator<? super T> cmp, int threads) {
      this(cmp, threads, DEFAULT_MIN_CHUNK_SIZE, NO_LISTENER);
   }


   /**
    * Constructs a {@code ParallelMergeSort}.
    *
    * @param cmp the comparator used for element comparisons
    * @param threads the thread budget, values below 1 mean no parallelism
    * @param minChunkSize the minimum range length that may be split across
    *        threads, values below 2 are treated as 2
    * @param listeners the listeners notified of the sort events
    * @throws NullPointerException if the comparator or the listeners are null
    */
   public ParallelMergeSort(Comparator<? super T> cmp, int threads, int minChunkSize, Listener[] listeners) {
      if (cmp == null)
         throw new NullPointerException("Invalid null comparator parameter");

      if (listeners == null)
         throw new NullPointerException("Invalid null listeners parameter");

      this.cmp = cmp;
      this.threads = Global.positiveThreads(threads);
      this.minChunkSize = Math.max(minChunkSize, 2);
      this.listeners = listeners.clone();
   }


   public int getThreads() {
      return this.threads;
   }


   public int getMinChunkSize() {
      return this.minChunkSize;
   }


   @Override
   public List<T> sort(T[] array, Range range) {
      SliceArray<T> slice = new SliceArray<>(array, range);
      final int length = slice.length();
      notifyListeners(this.listeners, new Event(Event.Type.SORT_START, 0, length));
      final int forks = (length < this.minChunkSize) ? 0 : Math.min(Global.maxForks(this.threads), length - 1);
      List<T> res;

      if (forks == 0) {
         res = SequentialMergeSort.split(slice, this.cmp);
      }
      else {
         ExecutorService pool = Executors.newFixedThreadPool(forks, new WorkerThreadFactory());

         try {
            res = new ForkContext(pool).split(slice, this.threads);
         }
         finally {
            pool.shutdownNow();
         }
      }

      notifyListeners(this.listeners, new Event(Event.Type.SORT_END, 0, length));
      return res;
   }


   static void notifyListeners(Listener[] listeners, Event evt) {
      for (Listener bl : listeners)
         bl.processEvent(evt);
   }



   // State shared by all the recursive calls of one sort
   private class ForkContext {
      private final ExecutorService pool;
      private final AtomicInteger forkIds;


      ForkContext(ExecutorService pool) {
         this.pool = pool;
         this.forkIds = new AtomicInteger(0);
      }


      List<T> split(SliceArray<T> slice, int budget) {
         if (slice.length() <= 1)
            return slice.toList();

         if ((budget <= 1) || (slice.length() < ParallelMergeSort.this.minChunkSize))
            return SequentialMergeSort.split(slice, ParallelMergeSort.this.cmp);

         SliceArray<T>[] halves = slice.split();
         final int half = budget >>> 1;
         final int id = this.forkIds.incrementAndGet();
         final int upperLength = halves[1].length();
         notifyListeners(ParallelMergeSort.this.listeners, new Event(Event.Type.BEFORE_FORK, id, upperLength));
         Future<List<T>> upperResult = this.pool.submit(new SortTask(this, halves[1], half));
         List<T> lower = this.split(halves[0], half);
         List<T> upper = this.join(upperResult, id);
         notifyListeners(ParallelMergeSort.this.listeners, new Event(Event.Type.AFTER_JOIN, id, upperLength));
         return PivotMerge.merge(lower, upper, ParallelMergeSort.this.cmp);
      }


      private List<T> join(Future<List<T>> result, int id) {
         try {
            return result.get();
         }
         catch (ExecutionException e) {
            final Throwable cause = e.getCause();

            // Failure of a nested worker, already reported
            if (cause instanceof SortException)
               throw (SortException) cause;

            throw new SortException("Worker " + id + " failed: " + cause, Error.ERR_WORKER_FAILURE, cause);
         }
         catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SortException("Interrupted while joining worker " + id, Error.ERR_INTERRUPTED, e);
         }
      }
   }



   // Sorts the upper half of a range on a worker thread
   private class SortTask implements Callable<List<T>> {
      private final ForkContext ctx;
      private final SliceArray<T> slice;
      private final int budget;


      SortTask(ForkContext ctx, SliceArray<T> slice, int budget) {
         this.ctx = ctx;
         this.slice = slice;
         this.budget = budget;
      }


      @Override
      public List<T> call() {
         return this.ctx.split(this.slice, this.budget);
      }
   }



   static class WorkerThreadFactory implements ThreadFactory {
      private static final AtomicInteger THREAD_IDS = new AtomicInteger(0);


      @Override
      public Thread newThread(Runnable r) {
         Thread t = new Thread(r, "mergesort-worker-" + THREAD_IDS.incrementAndGet());
         t.setDaemon(true);
         return t;
      }
   }
}
