package com.frogolio.frogol.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges a client-supplied, possibly partial link ordering with the stored one.
 *
 * <p>Requested ids come first in the order given, each once; ids that are not among
 * {@code existing} are dropped. Existing ids the client did not mention follow in their
 * stored order. The index of an id in the result is its new sort order.
 */
public final class LinkOrderResolver {

    private LinkOrderResolver() {
    }

    public static <T> List<T> resolve(List<T> requested, List<T> existing) {
        Set<T> known = new LinkedHashSet<>(existing);
        Set<T> ordered = new LinkedHashSet<>(existing.size());

        for (T id : requested) {
            if (known.contains(id)) {
                ordered.add(id);
            }
        }
        ordered.addAll(known);

        return new ArrayList<>(ordered);
    }
}
