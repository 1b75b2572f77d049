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

package io.github.flanglet.mergesort.test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import io.github.flanglet.mergesort.Error;
import io.github.flanglet.mergesort.Event;
import io.github.flanglet.mergesort.Global;
import io.github.flanglet.mergesort.Listener;
import io.github.flanglet.mergesort.Range;
import io.github.flanglet.mergesort.SortException;
import io.github.flanglet.mergesort.util.sort.MergeSorts;
import io.github.flanglet.mergesort.util.sort.ParallelMergeSort;
import io.github.flanglet.mergesort.util.sort.SequentialMergeSort;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;


public class TestParallelMergeSort {
    private final static Random RANDOM = new Random(Long.MAX_VALUE);

    @Test
    public void testForkCount() {
        Integer[] array = randomArray(1000);
        int[] threads = { 0, 1, 2, 3, 4, 5, 8, 16 };

        for (int t : threads) {
            EventCounter counter = new EventCounter();
            ParallelMergeSort<Integer> sorter = new ParallelMergeSort<>(Comparator.<Integer>naturalOrder(), t, 2,
                    new Listener[] { counter });
            sorter.sort(array);
            Assertions.assertEquals(Global.maxForks(t), counter.get(Event.Type.BEFORE_FORK), "Thread count " + t);
            Assertions.assertEquals(counter.get(Event.Type.BEFORE_FORK), counter.get(Event.Type.AFTER_JOIN));
            Assertions.assertTrue(counter.get(Event.Type.BEFORE_FORK) <= Math.max(t - 1, 0));
            Assertions.assertEquals(1, counter.get(Event.Type.SORT_START));
            Assertions.assertEquals(1, counter.get(Event.Type.SORT_END));
        }
    }

    @Test
    public void testForksBoundedByRangeLength() {
        // Budget much larger than the array
        Integer[] array = randomArray(3);
        EventCounter counter = new EventCounter();
        List<Integer> sorted = new ParallelMergeSort<Integer>(Comparator.<Integer>naturalOrder(), 64, 1,
                new Listener[] { counter }).sort(array);
        Assertions.assertEquals(MergeSorts.sequentialSort(array), sorted);
        Assertions.assertEquals(2, counter.get(Event.Type.BEFORE_FORK));
    }

    @Test
    public void testMinChunkSize() {
        Integer[] array = randomArray(1000);
        EventCounter counter = new EventCounter();
        new ParallelMergeSort<Integer>(Comparator.<Integer>naturalOrder(), 8, 2000,
                new Listener[] { counter }).sort(array);
        Assertions.assertEquals(0, counter.get(Event.Type.BEFORE_FORK));

        // Only the root range (1000) and its halves (500) are long enough
        counter = new EventCounter();
        new ParallelMergeSort<Integer>(Comparator.<Integer>naturalOrder(), 8, 500,
                new Listener[] { counter }).sort(array);
        Assertions.assertEquals(3, counter.get(Event.Type.BEFORE_FORK));

        ParallelMergeSort<Integer> sorter = new ParallelMergeSort<>(Comparator.<Integer>naturalOrder(), 4);
        Assertions.assertEquals(ParallelMergeSort.DEFAULT_MIN_CHUNK_SIZE, sorter.getMinChunkSize());
        Assertions.assertEquals(4, sorter.getThreads());
        Assertions.assertEquals(1, new ParallelMergeSort<Integer>(Comparator.<Integer>naturalOrder(), 0).getThreads());
    }

    @Test
    public void testWorkerThreads() {
        final List<String> names = Collections.synchronizedList(new ArrayList<String>());
        Comparator<Integer> cmp = new Comparator<Integer>() {
            @Override
            public int compare(Integer a, Integer b) {
                names.add(Thread.currentThread().getName());
                return a.compareTo(b);
            }
        };

        new ParallelMergeSort<Integer>(cmp, 2, 2, new Listener[0]).sort(randomArray(100));
        boolean worker = false;

        for (String name : new ArrayList<>(names))
            worker |= name.startsWith("mergesort-worker-");

        Assertions.assertTrue(worker);
    }

    @Test
    public void testWorkerFailure() {
        final Integer[] array = randomArray(200);
        final int[] threads = { 2, 4, 8 };

        for (final int t : threads) {
            SortException e = Assertions.assertThrows(SortException.class, new Executable() {
                @Override
                public void execute() throws Throwable {
                    new ParallelMergeSort<Integer>(new FailingComparator(true), t, 2, new Listener[0]).sort(array);
                }
            });

            Assertions.assertEquals(Error.ERR_WORKER_FAILURE, e.getErrorCode());
            Assertions.assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void testCallerFailure() {
        final Integer[] array = randomArray(200);

        Assertions.assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                new ParallelMergeSort<Integer>(new FailingComparator(false), 4, 2, new Listener[0]).sort(array);
            }
        });
    }

    @Test
    public void testSubRange() {
        Integer[] array = randomArray(5000);
        Range range = Range.of(1234, 4321);
        List<Integer> expected = new SequentialMergeSort<Integer>(Comparator.<Integer>naturalOrder()).sort(array, range);
        List<Integer> sorted = new ParallelMergeSort<Integer>(Comparator.<Integer>naturalOrder(), 6, 100,
                new Listener[0]).sort(array, range);
        Assertions.assertEquals(range.length(), sorted.size());
        Assertions.assertEquals(expected, sorted);
    }

    @Test
    public void testEventSizes() {
        final List<Event> events = Collections.synchronizedList(new ArrayList<Event>());
        Listener bl = new Listener() {
            @Override
            public void processEvent(Event evt) {
                events.add(evt);
            }
        };

        new ParallelMergeSort<Integer>(Comparator.<Integer>naturalOrder(), 2, 2, new Listener[] { bl })
                .sort(randomArray(11));
        Assertions.assertEquals(4, events.size());
        Assertions.assertEquals(Event.Type.SORT_START, events.get(0).getType());
        Assertions.assertEquals(11, events.get(0).getSize());
        Assertions.assertEquals(Event.Type.BEFORE_FORK, events.get(1).getType());
        Assertions.assertEquals(5, events.get(1).getSize());
        Assertions.assertEquals(1, events.get(1).getId());
        Assertions.assertEquals(Event.Type.AFTER_JOIN, events.get(2).getType());
        Assertions.assertEquals(Event.Type.SORT_END, events.get(3).getType());
    }

    private static Integer[] randomArray(int size) {
        Integer[] res = new Integer[size];

        for (int i = 0; i < size; i++)
            res[i] = RANDOM.nextInt(1000);

        return res;
    }


    static class EventCounter implements Listener {
        private final AtomicInteger[] counts;

        EventCounter() {
            this.counts = new AtomicInteger[Event.Type.values().length];

            for (int i = 0; i < this.counts.length; i++)
                this.counts[i] = new AtomicInteger();
        }

        @Override
        public void processEvent(Event evt) {
            this.counts[evt.getType().ordinal()].incrementAndGet();
        }

        int get(Event.Type type) {
            return this.counts[type.ordinal()].get();
        }
    }


    // Fails either on worker threads or on the calling thread only
    static class FailingComparator implements Comparator<Integer> {
        private final boolean onWorker;

        FailingComparator(boolean onWorker) {
            this.onWorker = onWorker;
        }

        @Override
        public int compare(Integer a, Integer b) {
            final boolean worker = Thread.currentThread().getName().startsWith("mergesort-worker-");

            if (worker == this.onWorker)
                throw new IllegalStateException("Comparison failure in " + Thread.currentThread().getName());

            return a.compareTo(b);
        }
    }
}
