package org.pathviz.core.id;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilIDMapperTest {

    private Map<String, Integer> standardMappings;

    @BeforeEach
    void setUp() {
        standardMappings = new HashMap<>();
        standardMappings.put("A", 0);
        standardMappings.put("B", 1);
        standardMappings.put("C", 2);
    }

    @Test
    @DisplayName("Baseline Correctness: bidirectional mapping")
    void testSimpleMapping() {
        IDMapper mapper = new FastUtilIDMapper(standardMappings);

        assertEquals(0, mapper.toInternal("A"));
        assertEquals(1, mapper.toInternal("B"));
        assertEquals("A", mapper.toExternal(0));
        assertEquals("C", mapper.toExternal(2));

        assertTrue(mapper.containsExternal("A"));
        assertFalse(mapper.containsExternal("Z"));
        assertTrue(mapper.containsInternal(0));
        assertFalse(mapper.containsInternal(99));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Sorted factory numbers names in natural order and collapses duplicates")
    void testSortedFactory() {
        IDMapper mapper = IDMapper.createSorted(List.of("delta", "alpha", "charlie", "bravo", "alpha"));

        assertEquals(4, mapper.size());
        assertEquals("alpha", mapper.toExternal(0));
        assertEquals("bravo", mapper.toExternal(1));
        assertEquals("charlie", mapper.toExternal(2));
        assertEquals("delta", mapper.toExternal(3));
        assertEquals(3, mapper.toInternal("delta"));
    }

    @Test
    @DisplayName("Sorted factory rejects null input")
    void testSortedFactoryRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> IDMapper.createSorted(null));
    }

    @Test
    @DisplayName("Exception Path: unknown and null names")
    void testUnknownExternalId() {
        IDMapper mapper = new FastUtilIDMapper(standardMappings);

        IDMapper.UnknownIDException ex = assertThrows(IDMapper.UnknownIDException.class, () -> mapper.toInternal("Z"));
        assertTrue(ex.getMessage().contains("Z"));
        assertThrows(IDMapper.UnknownIDException.class, () -> mapper.toInternal(null));
        assertFalse(mapper.containsExternal(null));
    }

    @Test
    @DisplayName("Exception Path: invalid internal index")
    void testInvalidInternalId() {
        IDMapper mapper = new FastUtilIDMapper(standardMappings);

        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(100));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(-1));
    }

    @Test
    @DisplayName("Constructor Validation: dense indices")
    void testDenseIndexRequirement() {
        Map<String, Integer> sparseMap = new HashMap<>();
        sparseMap.put("A", 0);
        sparseMap.put("B", 2);

        Exception exception = assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(sparseMap));
        assertTrue(exception.getMessage().contains("out of bounds"));
    }

    @Test
    @DisplayName("Constructor Validation: null entries and null map")
    void testRejectNullEntries() {
        Map<String, Integer> nullKeyMap = new HashMap<>();
        nullKeyMap.put(null, 0);
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(nullKeyMap));

        Map<String, Integer> nullValueMap = new HashMap<>();
        nullValueMap.put("A", null);
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(nullValueMap));

        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(null));
    }

    @Test
    @DisplayName("Constructor Validation: duplicate indices")
    void testDuplicateIndexDetection() {
        Map<String, Integer> duplicateMap = new HashMap<>();
        duplicateMap.put("A", 0);
        duplicateMap.put("B", 0);

        Exception exception = assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(duplicateMap));
        assertTrue(exception.getMessage().contains("Duplicate internal index"));
    }

    @Test
    @DisplayName("Immutability: later changes to the source map are not visible")
    void testImmutability() {
        Map<String, Integer> mutableMap = new HashMap<>(standardMappings);
        IDMapper mapper = new FastUtilIDMapper(mutableMap);

        mutableMap.put("D", 3);

        assertFalse(mapper.containsExternal("D"));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Concurrency: shared reads")
    void testConcurrentReads() throws InterruptedException {
        IDMapper mapper = new FastUtilIDMapper(standardMappings);
        int threads = 8;
        int iterations = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicInteger errors = new AtomicInteger(0);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                for (int i = 0; i < iterations; i++) {
                    int id = mapper.toInternal("B");
                    if (!"B".equals(mapper.toExternal(id)) || !mapper.containsExternal("C")) {
                        errors.incrementAndGet();
                    }
                }
            });
        }

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not finish in time");
        assertEquals(0, errors.get());
    }
}
