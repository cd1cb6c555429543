package com.taskboard.servicebackend.task;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Validated partial update; at least one field is present.
 */
public record TaskChanges(
        FieldPatch<String> title,
        FieldPatch<String> description,
        FieldPatch<Boolean> completed,
        FieldPatch<Priority> priority,
        FieldPatch<LocalDateTime> dueDate
) {

    /** Wire names of the fields this update touches. */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(5);
        if (title.isPresent()) names.add("title");
        if (description.isPresent()) names.add("description");
        if (completed.isPresent()) names.add("completed");
        if (priority.isPresent()) names.add("priority");
        if (dueDate.isPresent()) names.add("due_date");
        return names;
    }

    public boolean completes() {
        return completed.isSet() && completed.value();
    }

    void applyTo(Task task) {
        if (title.isSet()) task.setTitle(title.value());
        if (description.isPresent()) task.setDescription(description.valueOrNull());
        if (completed.isSet()) task.setCompleted(completed.value());
        if (priority.isSet()) task.setPriority(priority.value());
        if (dueDate.isPresent()) task.setDueDate(dueDate.valueOrNull());
    }
}
