package dev.mars.pgq.api.error;

import dev.mars.pgq.api.model.FullyQualifiedName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class QueueSchemaExceptionTest {

    private static final FullyQualifiedName FQN = new FullyQualifiedName("public.orders");

    @Test
    void testCategoriesCarryCodeAndName() {
        QueueAlreadyExistsException exists = new QueueAlreadyExistsException(FQN);
        assertEquals(PgqErrorCodes.QUEUE_ALREADY_EXISTS, exists.getErrorCode());
        assertEquals(FQN, exists.getFqn());
        assertTrue(exists.getMessage().contains("public.orders"));

        QueueNotFoundException missing = new QueueNotFoundException(FQN);
        assertEquals(PgqErrorCodes.QUEUE_NOT_FOUND, missing.getErrorCode());
        assertNull(missing.getCause());
    }

    @Test
    void testDdlExceptionKeepsCause() {
        RuntimeException cause = new RuntimeException("relation already exists");
        QueueSchemaException wrapped = QueueDdlException.wrap("create_table", FQN, cause);

        assertTrue(wrapped instanceof QueueDdlException);
        assertSame(cause, wrapped.getCause());
        assertEquals("create_table", wrapped.getOperation());
        assertEquals(PgqErrorCodes.QUEUE_DDL_FAILED, wrapped.getErrorCode());
        assertTrue(wrapped.getMessage().contains("relation already exists"));
    }

    @Test
    void testWrapPassesTypedFailuresThrough() {
        QueueNotFoundException missing = new QueueNotFoundException(FQN);
        assertSame(missing, QueueDdlException.wrap("get", FQN, missing));
        assertSame(missing, PartmanException.wrap("get_config", FQN, missing));
    }

    @Test
    void testPartmanException() {
        QueueSchemaException wrapped = PartmanException.wrap("create_parent", FQN, new IllegalStateException("boom"));
        assertTrue(wrapped instanceof PartmanException);
        assertEquals(PgqErrorCodes.PARTMAN_FAILED, wrapped.getErrorCode());
        assertEquals("create_parent", wrapped.getOperation());
    }
}
