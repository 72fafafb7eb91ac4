package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.ExternalFunctionCategory;
import com.flowsentry.analysis.domain.ExternalFunctionInfo;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExternalFunctionCatalogTest {

    private final ExternalFunctionCatalog catalog = new ExternalFunctionCatalog();

    @Test
    void knownFunctionsKeepTheirCatalogEntry() {
        ExternalFunctionInfo malloc = catalog.describe("malloc");

        assertTrue(catalog.isKnown("malloc"));
        assertEquals(ExternalFunctionCategory.STDLIB, malloc.getCategory());
        assertEquals("void*", malloc.getReturnType());
        assertEquals(1, malloc.getParameterCount());
        assertEquals(ExternalFunctionCategory.POSIX, catalog.categorize("read"));
        assertEquals(ExternalFunctionCategory.SYSTEM, catalog.categorize("system"));
        assertTrue(catalog.describe("exit").isSafe());
    }

    @Test
    void categorizesUnknownNamesByPattern() {
        assertEquals(ExternalFunctionCategory.CSTDLIB, catalog.categorize("std::sort"));
        assertEquals(ExternalFunctionCategory.POSIX, catalog.categorize("pthread_create"));
        assertEquals(ExternalFunctionCategory.POSIX, catalog.categorize("socket"));
        assertEquals(ExternalFunctionCategory.POSIX, catalog.categorize("file_read"));
        assertEquals(ExternalFunctionCategory.SYSTEM, catalog.categorize("spawn_worker"));
        assertEquals(ExternalFunctionCategory.UNKNOWN, catalog.categorize("compute_hash"));
    }

    @Test
    void unknownFunctionsAreUnsafeAndVariadic() {
        ExternalFunctionInfo info = catalog.describe("compute_hash");

        assertFalse(catalog.isKnown("compute_hash"));
        assertFalse(info.isSafe());
        assertEquals(ExternalFunctionInfo.VARIADIC, info.getParameterCount());
        assertEquals("auto", info.getReturnType());
    }

    @Test
    void registeredFunctionsOverrideThePatterns() {
        catalog.register(new ExternalFunctionInfo("spawn_worker", ExternalFunctionCategory.STDLIB,
            "Project helper", true, 1, "int"));

        assertEquals(ExternalFunctionCategory.STDLIB, catalog.categorize("spawn_worker"));
    }
}
