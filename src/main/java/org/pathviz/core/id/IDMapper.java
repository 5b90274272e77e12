package org.pathviz.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;

/**
 * Bidirectional mapping between node names used by callers and dense internal indices used by planners.
 */
public interface IDMapper {

    /**
     * Converts a node name to its internal index.
     * @param externalId caller-facing node name.
     * @return the internal index.
     * @throws UnknownIDException if the name is not mapped.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to its node name.
     * @param internalId internal index.
     * @return the caller-facing node name.
     * @throws IndexOutOfBoundsException if the index is outside the mapping.
     */
    String toExternal(int internalId);

    /**
     * Checks whether a node name is mapped.
     *
     * @param externalId node name to test.
     * @return true when the name is present.
     */
    boolean containsExternal(String externalId);

    /**
     * Checks whether an internal index is within mapper bounds.
     *
     * @param internalId index to test.
     * @return true when the index is present.
     */
    boolean containsInternal(int internalId);

    /**
     * Returns number of mapped nodes.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Thrown when a node name has no internal index.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates an immutable mapper that numbers the given names in natural string order.
     *
     * <p>Index order equals name order, so comparing indices is the same as comparing names.</p>
     *
     * @param names distinct node names.
     * @return an immutable mapper.
     */
    static IDMapper createSorted(Collection<String> names) {
        return FastUtilIDMapper.sorted(names);
    }
}
