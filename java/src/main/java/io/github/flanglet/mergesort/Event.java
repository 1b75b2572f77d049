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
 * This class represents events that occur during a parallel sort. Each event
 * includes a type, the id of the fork it belongs to, the length of the range
 * being sorted and a timestamp.
 */
public class Event {

    /**
     * Enum representing the types of events that can occur.
     */
    public enum Type {
        /**
         * Beginning of a sort
         */
        SORT_START,

        /**
         * A worker is about to be forked
         */
        BEFORE_FORK,

        /**
         * A forked worker has been joined
         */
        AFTER_JOIN,

        /**
         * End of a sort
         */
        SORT_END
    }

    private final int id;
    private final long size;
    private final Type type;
    private final long time;

    /**
     * Constructs an Event with the specified type, id, and size.
     *
     * @param type
     *            the type of event
     * @param id
     *            the fork id (0 for the calling thread)
     * @param size
     *            the length of the sorted range
     */
    public Event(Type type, int id, long size) {
        this(type, id, size, 0);
    }

    /**
     * Constructs an Event with the specified type, id, size and time.
     *
     * @param type
     *            the type of event
     * @param id
     *            the fork id (0 for the calling thread)
     * @param size
     *            the length of the sorted range
     * @param time
     *            the event timestamp in nanoseconds, or 0 to use the current time
     */
    public Event(Type type, int id, long size, long time) {
        this.id = id;
        this.size = size;
        this.type = type;
        this.time = (time > 0) ? time : System.nanoTime();
    }

    public int getId() {
        return this.id;
    }

    public long getSize() {
        return this.size;
    }

    public long getTime() {
        return this.time;
    }

    public Type getType() {
        return this.type;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(200);
        sb.append("{ \"type\":\"").append(this.getType()).append("\"");

        if (this.id >= 0)
            sb.append(", \"id\":").append(this.getId());

        sb.append(", \"size\":").append(this.getSize());
        sb.append(", \"time\":").append(this.getTime());
        sb.append(" }");
        return sb.toString();
    }
}
