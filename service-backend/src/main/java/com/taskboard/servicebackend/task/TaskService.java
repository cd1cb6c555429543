package com.taskboard.servicebackend.task;

import com.taskboard.servicebackend.error.DomainRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Single-task operations for the authenticated owner.
 */
@Service
public class TaskService {
    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository repository;
    private final TaskOwnershipGuard guard;
    private final TaskInputValidator validator;
    private final Clock clock;

    public TaskService(TaskRepository repository,
                       TaskOwnershipGuard guard,
                       TaskInputValidator validator,
                       Clock clock) {
        this.repository = repository;
        this.guard = guard;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Creates a task and returns it as stored, with store-assigned id and timestamps.
     */
    @Transactional
    public Task create(long ownerId, NewTaskInput input) {
        TaskDraft draft = validator.validateNew(input);
        Task saved = repository.saveAndFlush(new Task(
                ownerId, draft.title(), draft.description(), draft.priority(), draft.dueDate()));
        log.info("Created task {} for user {} (priority {})", saved.getId(), ownerId, saved.getPriority().code());
        return guard.get(saved.getId(), ownerId);
    }

    @Transactional(readOnly = true)
    public Task get(long ownerId, long taskId) {
        return guard.get(taskId, ownerId);
    }

    /**
     * Applies the supplied fields only. Completing an overdue task is refused; the due date
     * checked is the one the task will have after this update.
     */
    @Transactional
    public UpdateResult update(long ownerId, long taskId, TaskPatchInput input) {
        TaskChanges changes = validator.validateChanges(input);
        LocalDate today = LocalDate.now(clock);

        Task updated = guard.mutate(taskId, ownerId, task -> {
            boolean completing = changes.completes() && !task.isCompleted();
            changes.applyTo(task);
            if (completing && task.isOverdueOn(today)) {
                throw DomainRuleException.overdueCompletion();
            }
        });
        log.info("Updated task {} of user {}: {}", taskId, ownerId, changes.fieldNames());
        return new UpdateResult(updated, changes.fieldNames());
    }

    /**
     * Flips the completion flag. Moving an overdue task to completed is refused.
     */
    @Transactional
    public Task toggle(long ownerId, long taskId) {
        LocalDate today = LocalDate.now(clock);
        Task updated = guard.mutate(taskId, ownerId, task -> {
            if (!task.isCompleted() && task.isOverdueOn(today)) {
                throw DomainRuleException.overdueCompletion();
            }
            task.setCompleted(!task.isCompleted());
        });
        log.info("Toggled task {} of user {} to {}", taskId, ownerId, updated.isCompleted() ? "completed" : "pending");
        return updated;
    }

    @Transactional
    public void delete(long ownerId, long taskId) {
        guard.delete(taskId, ownerId);
        log.info("Deleted task {} of user {}", taskId, ownerId);
    }

    public record UpdateResult(Task task, List<String> fieldsUpdated) {
    }
}
