package com.taskboard.servicebackend.task;

import com.taskboard.servicebackend.error.NotFoundException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.Consumer;

/**
 * Single-task access keyed by task id and owner id together. A task owned by someone else
 * fails exactly like a task that does not exist.
 */
@Component
public class TaskOwnershipGuard {

    private final TaskRepository repository;

    public TaskOwnershipGuard(TaskRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public Task get(long taskId, long ownerId) {
        return repository.findByIdAndOwnerId(taskId, ownerId)
                .orElseThrow(NotFoundException::task);
    }

    /**
     * Loads the owned task, lets {@code patch} modify it and writes it back.
     */
    @Transactional
    public Task mutate(long taskId, long ownerId, Consumer<Task> patch) {
        Task task = get(taskId, ownerId);
        patch.accept(task);
        return repository.saveAndFlush(task);
    }

    @Transactional
    public void delete(long taskId, long ownerId) {
        if (repository.deleteOwned(taskId, ownerId) == 0) {
            throw NotFoundException.task();
        }
    }
}
