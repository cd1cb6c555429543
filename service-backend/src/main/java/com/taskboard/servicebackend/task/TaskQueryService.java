package com.taskboard.servicebackend.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Listings, statistics and bulk operations, always scoped to one owner.
 */
@Service
public class TaskQueryService {
    private static final Logger log = LoggerFactory.getLogger(TaskQueryService.class);

    private final TaskRepository repository;
    private final Clock clock;

    public TaskQueryService(TaskRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public TaskPage list(long ownerId, TaskFilter filter, PageSpec pageSpec) {
        log.debug("Listing tasks of user {} with {} and {}", ownerId, filter, pageSpec);
        long total = repository.countMatching(ownerId, filter);
        List<Task> items = pageSpec.offset() >= total
                ? List.of()
                : repository.findPage(ownerId, filter, Math.toIntExact(pageSpec.offset()), pageSpec.limit());
        return new TaskPage(items, pageSpec.page(), pageSpec.limit(), total);
    }

    @Transactional(readOnly = true)
    public TaskStats stats(long ownerId) {
        long total = repository.countByOwnerId(ownerId);
        long completed = repository.countByOwnerIdAndCompletedTrue(ownerId);

        Map<Priority, Long> byPriority = new EnumMap<>(Priority.class);
        for (TaskRepository.PriorityCount row : repository.countByPriority(ownerId)) {
            byPriority.put(row.getPriority(), row.getTotal());
        }
        return new TaskStats(total, completed, byPriority);
    }

    @Transactional
    public int deleteCompleted(long ownerId) {
        int deleted = repository.deleteCompleted(ownerId);
        log.info("Deleted {} completed task(s) of user {}", deleted, ownerId);
        return deleted;
    }

    /**
     * Marks every pending task of the owner completed in one statement, due dates notwithstanding.
     */
    @Transactional
    public int markAllCompleted(long ownerId) {
        int updated = repository.completeAllPending(ownerId, clock.instant());
        log.info("Marked {} task(s) of user {} as completed", updated, ownerId);
        return updated;
    }
}
