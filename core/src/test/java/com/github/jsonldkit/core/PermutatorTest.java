package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

public class PermutatorTest {

    @Test
    public void enumeratesEveryOrderingOnce() {
        final Permutator permutator = new Permutator(Arrays.asList("c", "a", "b"));
        final List<List<String>> seen = new ArrayList<List<String>>();
        while (permutator.hasNext()) {
            seen.add(permutator.next());
        }
        assertEquals(6, seen.size());
        assertEquals(Arrays.asList("a", "b", "c"), seen.get(0));
        assertEquals(6, new HashSet<List<String>>(seen).size());
    }

    @Test
    public void singleElementHasOnePermutation() {
        final Permutator permutator = new Permutator(Arrays.asList("x"));
        assertEquals(Arrays.asList("x"), permutator.next());
        assertFalse(permutator.hasNext());
    }

    @Test
    public void doesNotModifyInput() {
        final List<String> input = new ArrayList<String>(Arrays.asList("b", "a"));
        final Permutator permutator = new Permutator(input);
        final Set<List<String>> seen = new HashSet<List<String>>();
        while (permutator.hasNext()) {
            seen.add(permutator.next());
        }
        assertEquals(2, seen.size());
        assertEquals(Arrays.asList("b", "a"), input);
    }
}
