package com.vet.scheduling.service;

/**
 * Raised inside a commit when another booking took the interval after the
 * pre-check passed. Rolls the transaction back; the coordinator retries.
 */
class CommitConflictException extends RuntimeException {

    CommitConflictException(String message) {
        super(message);
    }
}
