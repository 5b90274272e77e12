package org.pathviz.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Indexed min-priority queue over node ids for priority-selection search.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>One entry per node:</strong> inserting a node already queued is a decrease-key, never a duplicate.</li>
 * <li><strong>Pooled states:</strong> {@link SearchState} instances come from a fixed stack-based pool sized to the
 * capacity; extracted states must be handed back with {@link #recycle(SearchState)}.</li>
 * <li><strong>Deterministic order:</strong> entries compare by distance, then node id.</li>
 * </ul>
 * <p>Not thread-safe.</p>
 */
@Slf4j
public class SearchQueue {

    // Binary heap, 1-based
    private final SearchState[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // positions[nodeId] = heap index, 0 when absent
    private final int[] positions;

    private final SearchState[] pool;
    private int poolTop;

    private int activeStates = 0;

    /**
     * @param maxNodeId largest node id that may be inserted; sizes the position index.
     * @param capacity  max simultaneous entries and pool size.
     * @throws IllegalArgumentException if {@code maxNodeId} is negative or {@code capacity} not positive.
     */
    public SearchQueue(int maxNodeId, int capacity) {
        if (maxNodeId < 0) {
            throw new IllegalArgumentException("maxNodeId must be non-negative");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.heap = new SearchState[capacity + 1];
        this.positions = new int[maxNodeId + 1];
        this.pool = new SearchState[capacity];
        for (int i = 0; i < capacity; i++) {
            pool[i] = new SearchState();
        }
        poolTop = capacity - 1;
    }

    /**
     * Queues a node or lowers its distance if it is already queued.
     * <p>
     * A queued node keeps its current entry when the new distance is not strictly smaller.
     *
     * @throws IllegalArgumentException if {@code nodeId} is out of bounds.
     * @throws IllegalStateException    if the heap or pool is exhausted.
     */
    public void insert(int nodeId, double distance) {
        if (nodeId < 0 || nodeId >= positions.length) {
            throw new IllegalArgumentException("nodeId " + nodeId + " out of bounds (max: " + (positions.length - 1) + ")");
        }

        int existingIdx = positions[nodeId];
        if (existingIdx > 0 && existingIdx <= size) {
            SearchState existing = heap[existingIdx];
            if (distance < existing.distance) {
                existing.set(nodeId, distance);
                swim(existingIdx);
            }
            return;
        }

        if (size >= heap.length - 1) {
            throw new IllegalStateException("Heap full. Increase capacity.");
        }
        if (poolTop < 0) {
            throw new IllegalStateException(
                    "Pool exhausted. Call clear() or recycle extracted states. " +
                            "Active: " + activeStates + ", Capacity: " + pool.length
            );
        }

        SearchState state = pool[poolTop--];
        activeStates++;
        state.set(nodeId, distance);

        size++;
        heap[size] = state;
        positions[nodeId] = size;
        swim(size);
    }

    /**
     * Removes and returns the entry with the smallest distance.
     * <p>
     * The caller owns the returned state until it passes it to {@link #recycle(SearchState)}.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public SearchState extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }

        SearchState min = heap[1];
        int lastIndex = size;
        if (lastIndex == 1) {
            heap[1] = null;
            positions[min.nodeId] = 0;
            size = 0;
            return min;
        }

        SearchState last = heap[lastIndex];
        heap[1] = last;
        heap[lastIndex] = null;
        size = lastIndex - 1;
        positions[last.nodeId] = 1;
        positions[min.nodeId] = 0;
        sink(1);
        return min;
    }

    /**
     * Hands an extracted state back to the pool. {@code null} is ignored.
     *
     * @throws IllegalStateException on pool overflow or when nothing is checked out.
     */
    public void recycle(SearchState state) {
        if (state == null) return;

        if (poolTop >= pool.length - 1) {
            throw new IllegalStateException("Pool overflow or double-recycle detected");
        }
        if (activeStates <= 0) {
            throw new IllegalStateException("Recycle called with no active states");
        }
        activeStates--;
        pool[++poolTop] = state;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Empties the queue and returns queued states to the pool.
     * <p>
     * States that were extracted but never recycled are replaced with fresh ones and reported.
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            SearchState s = heap[i];
            if (s != null) {
                if (positions[s.nodeId] == i) {
                    positions[s.nodeId] = 0;
                }
                recycle(s);
                heap[i] = null;
            }
        }
        size = 0;

        if (activeStates != 0) {
            int leaked = activeStates;
            log.warn("{} search states leaked (extracted but not recycled), replenishing pool", leaked);
            for (int i = 0; i < leaked && poolTop < pool.length - 1; i++) {
                pool[++poolTop] = new SearchState();
            }
            activeStates = 0;
        }
    }

    // --- Heap helpers ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        SearchState s1 = heap[i];
        SearchState s2 = heap[j];
        heap[i] = s2;
        heap[j] = s1;
        positions[s1.nodeId] = j;
        positions[s2.nodeId] = i;
    }
}
