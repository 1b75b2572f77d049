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

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import io.github.flanglet.mergesort.Error;
import io.github.flanglet.mergesort.Global;
import io.github.flanglet.mergesort.SortException;
import io.github.flanglet.mergesort.Sorter;
import io.github.flanglet.mergesort.util.sort.SequentialMergeSort;
import io.github.flanglet.mergesort.util.sort.SortOptions;

/**
 * Merge Sort Benchmark
 *
 * Compares the sequential and the parallel merge sorts on groups of random
 * arrays of {@code Long}. The random generator is seeded, the seed is printed
 * so that a run can be reproduced.
 *
 * Usage: java -jar mergesort.jar [--seed=n] [--jobs=n] [--verbose=n] [--groups=small,medium,...]
 */
public class Benchmark {

    private static final String APP_HEADER = "Merge Sort Benchmark 1.0.0";
    private static final String APP_USAGE = "Usage: java -jar mergesort.jar [--seed=<seed>] [--jobs=<jobs>] "
            + "[--verbose=<level>] [--groups=<names>]";

    private static final DecimalFormat TIME_FORMAT = new DecimalFormat("0.000000");

    // Case groups: number of arrays, min size, max size
    static final Map<String, int[]> GROUPS = new LinkedHashMap<>();

    static {
        GROUPS.put("small", new int[]{400, 10, 200});
        GROUPS.put("medium", new int[]{200, 500, 10000});
        GROUPS.put("large", new int[]{50, 20000, 400000});
        GROUPS.put("huge", new int[]{10, 800000, 2000000});
    }

    private final long seed;
    private final int jobs;
    private final int verbosity;
    private final List<String> groups;

    public static void main(String[] args) {
        Map<String, Object> map = new HashMap<>();
        int status = processCommandLine(args, map);

        // Command line processing error ?
        if (status != 0)
            System.exit(status);

        // Help mode only ?
        if (map.containsKey("help"))
            System.exit(0);

        Benchmark bench = null;

        try {
            bench = new Benchmark(map);
        } catch (Exception e) {
            System.err.println("Could not create the benchmark: " + e.getMessage());
            System.exit(Error.ERR_INVALID_PARAM);
        }

        System.exit(bench.run());
    }

    /**
     * Creates a benchmark from the options produced by the command line parser.
     *
     * @param map the options: "seed" (Long), "jobs" (Integer), "verbose"
     *            (Integer) and "groups" (String), all optional
     */
    public Benchmark(Map<String, Object> map) {
        Object s = map.get("seed");
        this.seed = (s != null) ? (Long) s : new Random().nextLong();
        Object j = map.get("jobs");
        this.jobs = (j != null) ? (Integer) j : Global.logicalCpus();
        Object v = map.get("verbose");
        this.verbosity = (v != null) ? (Integer) v : 1;
        Object g = map.get("groups");
        this.groups = new ArrayList<>();

        if (g == null) {
            this.groups.addAll(GROUPS.keySet());
        } else {
            for (String name : ((String) g).split(",")) {
                name = name.trim().toLowerCase();

                if (GROUPS.containsKey(name) == false)
                    throw new IllegalArgumentException("Unknown case group: " + name);

                this.groups.add(name);
            }
        }

        if (this.jobs <= 0)
            throw new IllegalArgumentException("The number of jobs must be positive: " + this.jobs);
    }

    public long getSeed() {
        return this.seed;
    }

    /**
     * Runs all the selected case groups.
     *
     * @return 0 on success, an error code otherwise
     */
    public int run() {
        printOut("Using seed " + this.seed, this.verbosity > 0);
        printOut("Using " + this.jobs + " job" + ((this.jobs > 1) ? "s" : ""), this.verbosity > 1);
        Random rnd = new Random(this.seed);
        Sorter<Long> sequential = new SequentialMergeSort<>(Comparator.<Long>naturalOrder());
        SortOptions<Long> parallel = SortOptions.<Long>defaultOrder().threads(this.jobs);

        if (this.verbosity > 1)
            parallel.addListener(new SortPrinter(this.verbosity, System.out));

        try {
            for (String name : this.groups) {
                int[] group = GROUPS.get(name);
                List<Long[]> cases = generateCases(rnd, group[0], group[1], group[2]);
                printOut("", this.verbosity > 0);

                if (runCases(name, cases, sequential, parallel) == false) {
                    System.err.println("Parallel and sequential results differ for " + name);
                    return Error.ERR_SORT_CHECK;
                }
            }
        } catch (SortException e) {
            System.err.println("Sort failure: " + e.getMessage());
            return e.getErrorCode();
        } catch (Exception e) {
            System.err.println("Unexpected error: " + e.getMessage());
            return Error.ERR_UNKNOWN;
        }

        return 0;
    }

    private boolean runCases(String name, List<Long[]> cases, Sorter<Long> sequential, Sorter<Long> parallel) {
        List<List<Long>> expected = new ArrayList<>(cases.size());
        long before = System.nanoTime();

        for (Long[] c : cases)
            expected.add(sequential.sort(c));

        long after = System.nanoTime();
        printOut("Sequential took " + TIME_FORMAT.format((after - before) / 1e9) + "s for " + name,
                this.verbosity > 0);
        boolean valid = true;
        before = System.nanoTime();

        for (int i = 0; i < cases.size(); i++) {
            List<Long> sorted = parallel.sort(cases.get(i));
            valid &= sorted.equals(expected.get(i));
        }

        after = System.nanoTime();
        printOut("Parallel took " + TIME_FORMAT.format((after - before) / 1e9) + "s for " + name,
                this.verbosity > 0);
        return valid;
    }

    /**
     * Generates random cases with a size uniformly chosen in [minElems, maxElems].
     *
     * @param rnd the random generator
     * @param numCases the number of arrays to generate
     * @param minElems the minimum array size
     * @param maxElems the maximum array size
     * @return the generated arrays
     */
    public static List<Long[]> generateCases(Random rnd, int numCases, int minElems, int maxElems) {
        List<Long[]> targets = new ArrayList<>(numCases);

        for (int n = 0; n < numCases; n++) {
            final int size = minElems + rnd.nextInt(maxElems - minElems + 1);
            Long[] target = new Long[size];

            for (int i = 0; i < size; i++)
                target[i] = rnd.nextLong();

            targets.add(target);
        }

        return targets;
    }

    /**
     * Processes the command line arguments and populates the provided map with options.
     *
     * @param args the command line arguments
     * @param map a map to store processed options and their values
     * @return 0 if the arguments are valid, an error code otherwise
     */
    public static int processCommandLine(String[] args, Map<String, Object> map) {
        for (String arg : args) {
            arg = arg.trim();

            if (arg.equals("--help") || arg.equals("-h")) {
                printHelp();
                map.put("help", true);
                return 0;
            }

            if (arg.startsWith("--seed=")) {
                String val = arg.substring(7).trim();

                try {
                    map.put("seed", Long.parseLong(val));
                } catch (NumberFormatException e) {
                    System.err.println("Invalid seed provided on command line: " + val);
                    return Error.ERR_INVALID_PARAM;
                }

                continue;
            }

            if (arg.startsWith("--jobs=") || arg.startsWith("--verbose=")) {
                final boolean isJobs = arg.startsWith("--jobs=");
                String val = arg.substring(arg.indexOf('=') + 1).trim();
                int n;

                try {
                    n = Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    n = -1;
                }

                if (n < 0 || (isJobs && n == 0)) {
                    String what = isJobs ? "number of jobs" : "verbosity level";
                    System.err.println("Invalid " + what + " provided on command line: " + val);
                    return Error.ERR_INVALID_PARAM;
                }

                map.put(isJobs ? "jobs" : "verbose", n);
                continue;
            }

            if (arg.startsWith("--groups=")) {
                map.put("groups", arg.substring(9).trim());
                continue;
            }

            System.err.println("Unknown command line argument: " + arg);
            System.err.println(APP_USAGE);
            return Error.ERR_INVALID_PARAM;
        }

        return 0;
    }

    private static void printHelp() {
        printOut(APP_HEADER, true);
        printOut(APP_USAGE, true);
        printOut("", true);
        printOut("   -h, --help", true);
        printOut("        Display this message\n", true);
        printOut("   --seed=<seed>", true);
        printOut("        Seed of the random generator (default: random)\n", true);
        printOut("   --jobs=<jobs>", true);
        printOut("        Thread budget of the parallel sort (default: number of logical CPUs)\n", true);
        printOut("   --verbose=<level>", true);
        printOut("        0=silent, 1=default, 2=each sort, 3=each worker, 5=all events\n", true);
        printOut("   --groups=<names>", true);
        printOut("        Comma separated case groups among " + GROUPS.keySet() + " (default: all)\n", true);
    }

    private static void printOut(String msg, boolean print) {
        if (print == true)
            System.out.println(msg);
    }
}
