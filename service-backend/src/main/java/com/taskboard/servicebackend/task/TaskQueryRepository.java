package com.taskboard.servicebackend.task;

import java.util.List;

/**
 * Listing queries that need an ordering Spring Data cannot derive.
 */
public interface TaskQueryRepository {

    /**
     * Tasks matching {@code filter} for one owner, highest priority first, newest first within
     * a priority, then by id descending.
     */
    List<Task> findPage(long ownerId, TaskFilter filter, int offset, int limit);

    /** Row count for exactly the predicate {@link #findPage} uses. */
    long countMatching(long ownerId, TaskFilter filter);
}
