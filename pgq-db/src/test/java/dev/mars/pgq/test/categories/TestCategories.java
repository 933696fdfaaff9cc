package dev.mars.pgq.test.categories;

/**
 * Test categories for organizing pgq tests by the infrastructure they need.
 *
 * Usage:
 * - @Tag(TestCategories.CORE) - Fast unit tests, no database
 * - @Tag(TestCategories.INTEGRATION) - Tests against a real PostgreSQL (TestContainers)
 *
 * Maven execution examples:
 * - mvn test -Dgroups="core" (fast core tests only)
 * - mvn test -Dgroups="core,integration" (core + integration)
 */
public final class TestCategories {

    /**
     * CORE - Fast unit tests that validate critical functionality.
     * These run without Docker and test:
     * - Configuration loading
     * - SQL generation
     * - Index naming, parsing and reconciliation planning
     * - Validation logic
     */
    public static final String CORE = "core";

    /**
     * INTEGRATION - Tests that require real infrastructure (PostgreSQL, TestContainers).
     * Skipped when Docker is not available.
     */
    public static final String INTEGRATION = "integration";

    private TestCategories() {
        // Utility class - no instantiation
    }
}
