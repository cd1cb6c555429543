package com.taskboard.servicebackend.web.dto.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskboard.servicebackend.task.FieldPatch;
import com.taskboard.servicebackend.task.TaskPatchInput;

/**
 * Partial update body. Jackson only calls the setters of properties present in the JSON, so an
 * omitted field stays unset while an explicit {@code null} becomes a clear.
 */
public class UpdateTaskRequest {

    private TaskPatchInput input = TaskPatchInput.empty();

    public void setTitle(String title) {
        input = input.withTitle(patchOf(title));
    }

    public void setDescription(String description) {
        input = input.withDescription(patchOf(description));
    }

    public void setCompleted(Boolean completed) {
        input = input.withCompleted(patchOf(completed));
    }

    public void setPriority(String priority) {
        input = input.withPriority(patchOf(priority));
    }

    @JsonProperty("due_date")
    public void setDueDate(String dueDate) {
        input = input.withDueDate(patchOf(dueDate));
    }

    public TaskPatchInput toInput() {
        return input;
    }

    private static <T> FieldPatch<T> patchOf(T value) {
        return value == null ? FieldPatch.clear() : FieldPatch.set(value);
    }
}
