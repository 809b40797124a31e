package com.policyqa.indexing;

public enum IndexingOutcome {
    COMPLETED,
    FAILED,
    /** Document was not pending; someone else owns or already finished it. */
    SKIPPED
}
