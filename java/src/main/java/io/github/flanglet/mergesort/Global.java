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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;


/**
 * The {@code Global} class provides CPU count queries used to pick default
 * thread counts and helpers to reason about thread budgets.
 */
public class Global {

  private static final Path CPU_INFO = Paths.get("/proc/cpuinfo");

  /**
   * Private constructor to prevent instantiation.
   */
  private Global() {
  }


  /**
   * Returns the number of logical CPUs available to the JVM.
   *
   * @return the number of logical CPUs, at least 1
   */
  public static int logicalCpus() {
    return Math.max(Runtime.getRuntime().availableProcessors(), 1);
  }


  /**
   * Returns the number of physical cores. The value is read from
   * {@code /proc/cpuinfo} when available, otherwise it is estimated as half the
   * number of logical CPUs.
   *
   * @return the number of physical cores, at least 1
   */
  public static int physicalCpus() {
    int cores = 0;

    if (Files.isReadable(CPU_INFO)) {
       try {
          cores = countPhysicalCpus(Files.readAllLines(CPU_INFO, StandardCharsets.UTF_8));
       }
       catch (IOException e) {
          cores = 0;
       }
    }

    if (cores <= 0)
       cores = logicalCpus() / 2;

    return Math.min(Math.max(cores, 1), logicalCpus());
  }


  /**
   * Counts the distinct (physical id, core id) pairs in the content of a
   * Linux {@code /proc/cpuinfo} file.
   *
   * @param lines the lines of the file
   * @return the number of physical cores, or 0 if none is described
   */
  public static int countPhysicalCpus(List<String> lines) {
     Set<String> cores = new HashSet<>();
     String physicalId = "0";
     String coreId = null;

     for (String line : lines) {
        final int sep = line.indexOf(':');

        if (sep < 0) {
           // Blank line between processor entries
           if (coreId != null)
              cores.add(physicalId + ":" + coreId);

           physicalId = "0";
           coreId = null;
           continue;
        }

        final String key = line.substring(0, sep).trim();
        final String value = line.substring(sep + 1).trim();

        if (key.equals("physical id"))
           physicalId = value;
        else if (key.equals("core id"))
           coreId = value;
     }

     if (coreId != null)
        cores.add(physicalId + ":" + coreId);

     return cores.size();
  }


  /**
   * Computes the number of workers forked by a sort that starts with the given
   * thread budget and splits large enough ranges: one fork per call whose
   * budget is greater than 1, the budget being halved for both halves.
   *
   * @param threads the initial thread budget
   * @return the maximum number of forked workers, at most {@code threads - 1}
   */
  public static int maxForks(int threads) {
     if (threads <= 1)
        return 0;

     return 1 + 2 * maxForks(threads >>> 1);
  }


  /**
   * Normalizes a thread count: values below 1 mean no parallelism.
   *
   * @param threads the requested number of threads
   * @return the thread budget, at least 1
   */
  public static int positiveThreads(int threads) {
     return (threads < 1) ? 1 : threads;
  }
}
