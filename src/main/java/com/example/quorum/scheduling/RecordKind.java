package com.example.quorum.scheduling;

/**
 * Kinds of store records an agent run may write.
 */
public enum RecordKind {
    DOCUMENT, EVENT, TASK, OBSERVATION
}
