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
 * Unchecked exception raised when a sort cannot complete. It carries one of
 * the {@link Error} codes. No partial result is ever available when it is
 * thrown.
 */
public class SortException extends RuntimeException {
    private static final long serialVersionUID = 4618257004926841397L;

    private final int code;

    /**
     * Constructs a new {@code SortException} with the specified detail message
     * and error code.
     *
     * @param msg the detail message
     * @param code the error code
     */
    public SortException(String msg, int code) {
        super(msg);
        this.code = code;
    }

    /**
     * Constructs a new {@code SortException} with the specified detail message,
     * error code and cause.
     *
     * @param msg the detail message
     * @param code the error code
     * @param cause the failure that aborted the sort
     */
    public SortException(String msg, int code, Throwable cause) {
        super(msg, cause);
        this.code = code;
    }

    /**
     * Returns the error code associated with this exception.
     *
     * @return the error code
     */
    public int getErrorCode() {
        return this.code;
    }
}
