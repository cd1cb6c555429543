package com.taskboard.servicebackend.task;

/**
 * Raw, unvalidated partial update. A JSON {@code null} arrives as {@link FieldPatch#clear()}.
 */
public record TaskPatchInput(
        FieldPatch<String> title,
        FieldPatch<String> description,
        FieldPatch<Boolean> completed,
        FieldPatch<String> priority,
        FieldPatch<String> dueDate
) {
    public static TaskPatchInput empty() {
        return new TaskPatchInput(FieldPatch.unset(), FieldPatch.unset(), FieldPatch.unset(),
                FieldPatch.unset(), FieldPatch.unset());
    }

    public TaskPatchInput withTitle(FieldPatch<String> value) {
        return new TaskPatchInput(value, description, completed, priority, dueDate);
    }

    public TaskPatchInput withDescription(FieldPatch<String> value) {
        return new TaskPatchInput(title, value, completed, priority, dueDate);
    }

    public TaskPatchInput withCompleted(FieldPatch<Boolean> value) {
        return new TaskPatchInput(title, description, value, priority, dueDate);
    }

    public TaskPatchInput withPriority(FieldPatch<String> value) {
        return new TaskPatchInput(title, description, completed, value, dueDate);
    }

    public TaskPatchInput withDueDate(FieldPatch<String> value) {
        return new TaskPatchInput(title, description, completed, priority, value);
    }
}
