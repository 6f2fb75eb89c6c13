package com.dispatchqueue.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JobStatusTest {

    @Test
    public void testTerminalStatuses() {
        assertFalse(JobStatus.PENDING.isTerminal());
        assertFalse(JobStatus.PROCESSING.isTerminal());
        assertTrue(JobStatus.DONE.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
        assertTrue(JobStatus.CANCELLED.isTerminal());
    }

    @Test
    public void testOnlyActiveJobsAreCancellable() {
        assertTrue(JobStatus.PENDING.isCancellable());
        assertTrue(JobStatus.PROCESSING.isCancellable());
        assertFalse(JobStatus.DONE.isCancellable());
        assertFalse(JobStatus.FAILED.isCancellable());
        assertFalse(JobStatus.CANCELLED.isCancellable());
    }

    @Test
    public void testLifecycleTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.PROCESSING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.DONE));

        assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.DONE));
        assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.PENDING));
        assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.FAILED));
        assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.CANCELLED));

        assertTrue(JobStatus.FAILED.canTransitionTo(JobStatus.PENDING));
        assertFalse(JobStatus.FAILED.canTransitionTo(JobStatus.DONE));
    }

    @Test
    public void testDoneAndCancelledAreFinal() {
        for (JobStatus target : JobStatus.values()) {
            assertFalse(JobStatus.DONE.canTransitionTo(target), "DONE -> " + target);
            assertFalse(JobStatus.CANCELLED.canTransitionTo(target), "CANCELLED -> " + target);
        }
    }

    @Test
    public void testStateConflictMessage() {
        StateConflictException e = new StateConflictException(7, JobStatus.DONE, "retry");
        assertEquals("Cannot retry job 7 with status done", e.getMessage());
        assertEquals(JobStatus.DONE, e.getCurrentStatus());
        assertEquals(7, e.getJobId());
    }

    @Test
    public void testSeverityParsing() {
        assertEquals(Severity.INFO, Severity.fromString(null));
        assertEquals(Severity.INFO, Severity.fromString(" "));
        assertEquals(Severity.WARNING, Severity.fromString("warning"));
        assertEquals(Severity.ERROR, Severity.fromString("ERROR"));
        assertThrows(ValidationException.class, () -> Severity.fromString("critical"));
    }
}
