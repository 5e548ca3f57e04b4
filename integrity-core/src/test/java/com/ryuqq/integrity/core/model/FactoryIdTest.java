package com.ryuqq.integrity.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FactoryId / EntityId / EntityType Value Object 테스트.
 *
 * @author Integrity Team
 * @since 1.0.0
 */
class FactoryIdTest {

    @Test
    void of_ValidValue_CreatesFactoryId() {
        // Given
        String value = "factory-A_01";

        // When
        FactoryId factoryId = FactoryId.of(value);

        // Then
        assertEquals(value, factoryId.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> FactoryId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_ChannelSeparator_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> FactoryId.of("A:B")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // Given
        String value = "a".repeat(65);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> FactoryId.of(value));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        FactoryId a = FactoryId.of("A");
        FactoryId b = FactoryId.of("A");

        // Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, FactoryId.of("B"));
    }

    @Test
    void entityType_UpperCase_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> EntityType.of("WorkOrders")
        );
        assertTrue(exception.getMessage().contains("lower snake case"));
    }

    @Test
    void entityType_SnakeCase_CreatesType() {
        // When
        EntityType type = EntityType.of("work_orders");

        // Then
        assertEquals("work_orders", type.getValue());
    }

    @Test
    void entityId_Random_IsValidAndUnique() {
        // When
        EntityId first = EntityId.random();
        EntityId second = EntityId.random();

        // Then
        assertNotEquals(first, second);
        assertEquals(36, first.getValue().length());
    }

    @Test
    void entityRef_NullType_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new EntityRef(null, EntityId.of("x"))
        );
        assertEquals("type cannot be null", exception.getMessage());
    }
}
