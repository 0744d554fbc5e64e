package com.example.projectservice.entity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectStatusTest {

    @ParameterizedTest
    @EnumSource(ProjectStatus.class)
    void anyStatusCanReturnToUnderReview(ProjectStatus from) {
        assertTrue(from.canTransitionTo(ProjectStatus.UNDERREVIEW));
    }

    @Test
    void decisionsAreOnlyReachableFromUnderReview() {
        assertTrue(ProjectStatus.UNDERREVIEW.canTransitionTo(ProjectStatus.APPROVED));
        assertTrue(ProjectStatus.UNDERREVIEW.canTransitionTo(ProjectStatus.REJECT));

        assertFalse(ProjectStatus.DRAFT.canTransitionTo(ProjectStatus.APPROVED));
        assertFalse(ProjectStatus.DRAFT.canTransitionTo(ProjectStatus.REJECT));
        assertFalse(ProjectStatus.REJECT.canTransitionTo(ProjectStatus.APPROVED));
        assertFalse(ProjectStatus.APPROVED.canTransitionTo(ProjectStatus.REJECT));
    }

    @Test
    void draftIsNotReachableOnceSubmitted() {
        assertTrue(ProjectStatus.DRAFT.canTransitionTo(ProjectStatus.DRAFT));
        assertFalse(ProjectStatus.UNDERREVIEW.canTransitionTo(ProjectStatus.DRAFT));
        assertFalse(ProjectStatus.APPROVED.canTransitionTo(ProjectStatus.DRAFT));
    }

    @Test
    void nullTargetIsRejected() {
        assertFalse(ProjectStatus.DRAFT.canTransitionTo(null));
    }

    @Test
    void fromValueUsesStoredValue() {
        assertEquals(ProjectStatus.UNDERREVIEW, ProjectStatus.fromValue("underreview"));
        assertEquals("Rejected", ProjectStatus.fromValue("reject").getDisplayName());
        assertThrows(IllegalArgumentException.class, () -> ProjectStatus.fromValue("Under Review"));
    }
}
