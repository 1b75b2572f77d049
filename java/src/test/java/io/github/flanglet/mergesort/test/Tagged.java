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
import java.util.Comparator;
import java.util.List;


// Element with a sort key and a tag recording its input position
final class Tagged {
    static final Comparator<Tagged> BY_KEY = new Comparator<Tagged>() {
        @Override
        public int compare(Tagged t1, Tagged t2) {
            return Integer.compare(t1.key, t2.key);
        }
    };

    final int key;
    final int tag;

    Tagged(int key, int tag) {
        this.key = key;
        this.tag = tag;
    }

    static List<Integer> tags(List<Tagged> values) {
        List<Integer> res = new ArrayList<>(values.size());

        for (Tagged t : values)
            res.add(t.tag);

        return res;
    }

    @Override
    public String toString() {
        return this.key + "#" + this.tag;
    }
}
