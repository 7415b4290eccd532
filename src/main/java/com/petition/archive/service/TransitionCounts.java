package com.petition.archive.service;

/**
 * Rows copied to the archive and rows deleted from the processing store by one
 * transition. {@code archived} is zero when archiving is disabled.
 */
public record TransitionCounts(int archived, int deleted) {
}
