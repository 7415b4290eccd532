package com.petition.archive.service;

import com.petition.archive.model.RecordCategory;
import com.petition.archive.repository.RecordStore;

/**
 * Pairs the processing store of a record category with the archive store that
 * receives its rows. The two stores are distinct handles, typically backed by
 * different databases.
 *
 * @param category the category being moved
 * @param source   processing store rows are taken from and deleted from
 * @param archive  append-only archive store rows are copied into
 * @param <T>      record type shared by both stores
 */
public record TransitionRoute<T>(RecordCategory category, RecordStore<T> source, RecordStore<T> archive) {
}
