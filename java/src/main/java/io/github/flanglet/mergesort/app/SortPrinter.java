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

package io.github.flanglet.mergesort.app;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import io.github.flanglet.mergesort.Event;
import io.github.flanglet.mergesort.Listener;

/**
 * The {@code SortPrinter} class implements the {@code Listener} interface and
 * prints information about the forks and joins of parallel sorts.
 */
public class SortPrinter implements Listener {
    private final PrintStream ps;
    private final Map<Integer, Long> forkTimes;
    private final int level;
    private volatile long startTime;

    /**
     * Constructs a {@code SortPrinter} with the specified information level and
     * output stream.
     *
     * @param infoLevel
     *            the level of information to be printed: 2 prints each sort,
     *            3 each joined worker, 5 every event
     * @param ps
     *            the {@code PrintStream} to which information will be printed
     */
    public SortPrinter(int infoLevel, PrintStream ps) {
        if (ps == null)
            throw new NullPointerException("Invalid null print stream parameter");

        this.ps = ps;
        this.level = infoLevel;
        this.forkTimes = new ConcurrentHashMap<>();
    }

    @Override
    public void processEvent(Event evt) {
        if (this.level >= 5)
            this.ps.println(evt);

        switch (evt.getType()) {
            case SORT_START:
                this.startTime = evt.getTime();
                break;

            case BEFORE_FORK:
                this.forkTimes.put(evt.getId(), evt.getTime());
                break;

            case AFTER_JOIN: {
                Long time0 = this.forkTimes.remove(evt.getId());

                if ((time0 == null) || (this.level < 3))
                    return;

                long duration_ms = (evt.getTime() - time0) / 1000000L;
                this.ps.println(String.format("Worker %d: %d elements [%d ms]", evt.getId(), evt.getSize(), duration_ms));
                break;
            }

            case SORT_END: {
                if (this.level < 2)
                    return;

                long duration_ms = (evt.getTime() - this.startTime) / 1000000L;
                this.ps.println(String.format("Sorted %d elements [%d ms]", evt.getSize(), duration_ms));
                break;
            }

            default:
                break;
        }
    }
}
