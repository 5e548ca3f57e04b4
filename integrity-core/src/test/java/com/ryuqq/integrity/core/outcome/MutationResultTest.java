package com.ryuqq.integrity.core.outcome;

import com.ryuqq.integrity.core.json.JsonMappers;
import com.ryuqq.integrity.core.model.ChangeAction;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.ScopedEntity;
import com.ryuqq.integrity.core.policy.Operation;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MutationResult 계층 테스트.
 *
 * @author Integrity Team
 * @since 1.0.0
 */
class MutationResultTest {

    @Test
    void committed_Of_CopiesEntityCoordinates() {
        // Given
        ScopedEntity entity = ScopedEntity.create(EntityType.of("lots"), EntityId.of("lot-1"),
            FactoryId.of("A"), JsonMappers.objectNode(), Instant.parse("2024-05-01T00:00:00Z"));

        // When
        Committed committed = Committed.of(entity, ChangeAction.CREATE);

        // Then
        assertTrue(committed.isCommitted());
        assertFalse(committed.isConflict());
        assertFalse(committed.isDenied());
        assertEquals(1, committed.version());
        assertEquals(FactoryId.of("A"), committed.factoryId());
        assertFalse(committed.isTombstone());
    }

    @Test
    void committed_Deleted_IsTombstoneWithoutEntity() {
        // When
        Committed committed = Committed.deleted(EntityRef.of("lots", "lot-1"), FactoryId.of("A"), 4);

        // Then
        assertTrue(committed.isTombstone());
        assertNull(committed.entity());
        assertEquals(4, committed.version());
    }

    @Test
    void committed_NullEntityForUpdate_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Committed(EntityRef.of("lots", "lot-1"), FactoryId.of("A"), 2, ChangeAction.UPDATE, null)
        );
        assertTrue(exception.getMessage().contains("entity cannot be null"));
    }

    @Test
    void conflict_ExposesErrorCodeAndVersions() {
        // When
        OptimisticLockConflict conflict = OptimisticLockConflict.of(6, 5);

        // Then
        assertTrue(conflict.isConflict());
        assertEquals("VERSION_CONFLICT", conflict.errorCode());
        assertEquals(6, conflict.currentVersion());
        assertTrue(conflict.message().contains("expected 5"));
    }

    @Test
    void conflict_SameVersions_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OptimisticLockConflict.of(3, 3));
    }

    @Test
    void violation_ExposesErrorCode() {
        // When
        AuthorizationViolation violation = AuthorizationViolation.of(Operation.UPDATE);

        // Then
        assertTrue(violation.isDenied());
        assertEquals("ACCESS_DENIED", violation.errorCode());
        assertEquals("Access denied for UPDATE", violation.message());
    }
}
