package com.taskboard.servicebackend.task;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Every finder and modifier here is keyed by owner as well as by whatever selects the rows.
 */
public interface TaskRepository extends JpaRepository<Task, Long>, TaskQueryRepository {

    Optional<Task> findByIdAndOwnerId(Long id, Long ownerId);

    long countByOwnerId(Long ownerId);

    long countByOwnerIdAndCompletedTrue(Long ownerId);

    @Query("select t.priority as priority, count(t) as total from Task t "
            + "where t.ownerId = :ownerId group by t.priority")
    List<PriorityCount> countByPriority(@Param("ownerId") Long ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Task t where t.id = :id and t.ownerId = :ownerId")
    int deleteOwned(@Param("id") Long id, @Param("ownerId") Long ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Task t where t.ownerId = :ownerId and t.completed = true")
    int deleteCompleted(@Param("ownerId") Long ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Task t set t.completed = true, t.updatedAt = :now "
            + "where t.ownerId = :ownerId and t.completed = false")
    int completeAllPending(@Param("ownerId") Long ownerId, @Param("now") Instant now);

    interface PriorityCount {
        Priority getPriority();

        long getTotal();
    }
}
