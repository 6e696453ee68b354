package com.github.jsonldkit.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Steinhaus-Johnson-Trotter enumeration of every ordering of a list of
 * strings, starting from the sorted order.
 */
public class Permutator {

    private final List<String> list;
    private boolean done;
    private final Map<String, Boolean> left;

    public Permutator(List<String> list) {
        this.list = new ArrayList<String>(list);
        Collections.sort(this.list);
        this.done = false;
        this.left = new HashMap<String, Boolean>();
        for (final String i : this.list) {
            left.put(i, true);
        }
    }

    public boolean hasNext() {
        return !done;
    }

    /**
     * Gets the next permutation. Call {@link #hasNext()} first.
     */
    public List<String> next() {
        final List<String> rval = new ArrayList<String>(list);

        // get largest mobile element k
        // (mobile: element is greater than the one it is looking at)
        String k = null;
        int pos = 0;
        final int length = list.size();
        for (int i = 0; i < length; ++i) {
            final String element = list.get(i);
            final boolean isLeft = left.get(element);
            if ((k == null || element.compareTo(k) > 0)
                    && ((isLeft && i > 0 && element.compareTo(list.get(i - 1)) > 0)
                            || (!isLeft && i < (length - 1)
                                    && element.compareTo(list.get(i + 1)) > 0))) {
                k = element;
                pos = i;
            }
        }

        // no more permutations
        if (k == null) {
            done = true;
        } else {
            // swap k and the element it is looking at
            final int swap = left.get(k) ? pos - 1 : pos + 1;
            list.set(pos, list.get(swap));
            list.set(swap, k);

            // reverse the direction of all elements larger than k
            for (int i = 0; i < length; i++) {
                if (list.get(i).compareTo(k) > 0) {
                    left.put(list.get(i), !left.get(list.get(i)));
                }
            }
        }

        return rval;
    }
}
