package dev.mars.pgq.api.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class FullyQualifiedNameTest {

    @Test
    void testOfConcatenatesSchemaAndName() {
        FullyQualifiedName fqn = FullyQualifiedName.of(new SchemaName("public"), new QueueName("test_queue"));
        assertEquals("public.test_queue", fqn.value());
        assertEquals("public.test_queue", fqn.toString());
    }

    @Test
    void testSplitIsLeftInverseOfOf() {
        SchemaName schema = new SchemaName("app_schema");
        QueueName name = new QueueName("orders");

        FullyQualifiedName.Parts parts = FullyQualifiedName.of(schema, name).split();

        assertEquals(schema, parts.schema());
        assertEquals(name, parts.name());
    }

    @Test
    void testSplitWithoutSeparatorFails() {
        assertThrows(IllegalArgumentException.class, () -> new FullyQualifiedName("invalid").split());
        assertThrows(IllegalArgumentException.class, () -> new FullyQualifiedName("").split());
    }

    @Test
    void testQueueTemplateNames() {
        Queue queue = new Queue(new QueueName("test"), SchemaName.PUBLIC, true);
        assertEquals("test_template", queue.templateName().value());
        assertEquals("public.test_template", queue.templateFqn().value());
        assertEquals("public.test", queue.fqn().value());
    }

    @Test
    void testNameValidity() {
        assertTrue(new QueueName("valid_queue").isValid());
        assertFalse(new QueueName("123queue").isValid());
        assertTrue(SchemaName.PUBLIC.isValid());
        assertEquals("\"public\"", SchemaName.PUBLIC.quoted());
        assertThrows(NullPointerException.class, () -> new QueueName(null));
    }
}
