package org.pathviz.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * {@link IDMapper} backed by a fastutil open hash map for name lookups and a plain array for the
 * reverse direction.
 * <p>
 * Immutable once built and safe for concurrent reads.
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Builds the mapper from an explicit table, checking that indices are dense and 0-based.
     */
    public FastUtilIDMapper(Map<String, Integer> mappings) {
        if (mappings == null) {
            throw new IllegalArgumentException("Mappings cannot be null");
        }
        int size = mappings.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (Map.Entry<String, Integer> entry : mappings.entrySet()) {
            String name = entry.getKey();
            int index = checkedIndex(entry, size, reverse);
            forward.put(name, index);
            reverse[index] = name;
        }
        forward.trim();
    }

    /**
     * Numbers distinct names in natural order.
     */
    static FastUtilIDMapper sorted(Collection<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("Names cannot be null");
        }
        TreeSet<String> ordered = new TreeSet<>(names);
        Map<String, Integer> mappings = new LinkedHashMap<>(ordered.size());
        int next = 0;
        for (String name : ordered) {
            mappings.put(name, next++);
        }
        return new FastUtilIDMapper(mappings);
    }

    private static int checkedIndex(Map.Entry<String, Integer> entry, int size, String[] reverse) {
        if (entry.getKey() == null) {
            throw new IllegalArgumentException("Node names cannot be null");
        }
        Integer boxed = entry.getValue();
        if (boxed == null) {
            throw new IllegalArgumentException("Missing index for node " + entry.getKey());
        }
        int value = boxed;
        if (value < 0 || value >= size) {
            throw new IllegalArgumentException(
                    "Input indices must be dense and 0-indexed. Found out of bounds: " + value
            );
        }
        if (reverse[value] != null) {
            throw new IllegalArgumentException(
                    "Duplicate internal index detected in input map: " + value
            );
        }
        return value;
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownIDException("Node not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
