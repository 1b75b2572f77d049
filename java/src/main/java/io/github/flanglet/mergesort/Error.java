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

public final class Error {

    /**
     *  Missing parameter
     */
    public static final int ERR_MISSING_PARAM = 1;

    /**
     * Invalid parameter
     */
    public static final int ERR_INVALID_PARAM = 2;

    /**
     * Range out of the array bounds
     */
    public static final int ERR_INVALID_RANGE = 3;

    /**
     * A forked worker failed
     */
    public static final int ERR_WORKER_FAILURE = 4;

    /**
     * Interrupted while waiting for a worker
     */
    public static final int ERR_INTERRUPTED = 5;

    /**
     * Sorted output failed validation
     */
    public static final int ERR_SORT_CHECK = 6;

    /**
     *  Unknown error
     */
    public static final int ERR_UNKNOWN = 127;

    /**
     * Private constructor to prevent instantiation.
     */
    private Error() {
    }
}
