package com.taskboard.servicebackend.task;

import com.taskboard.servicebackend.error.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw task input into validated drafts and change sets. Runs before any store access;
 * every problem found is reported at once.
 */
@Component
public class TaskInputValidator {

    static final int TITLE_MAX = 200;
    static final int DESCRIPTION_MAX = 1000;

    private final Clock clock;

    public TaskInputValidator(Clock clock) {
        this.clock = clock;
    }

    public TaskDraft validateNew(NewTaskInput input) {
        List<String> errors = new ArrayList<>();

        String title = input.title() == null ? "" : input.title().trim();
        checkTitle(title, errors);

        String description = blankToNull(input.description());
        checkDescription(description, errors);

        Priority priority = Priority.MEDIUM;
        if (!isBlank(input.priority())) {
            priority = Priority.fromCode(input.priority()).orElse(null);
            if (priority == null) {
                errors.add(invalidPriority(input.priority()));
            }
        }

        LocalDateTime dueDate = null;
        if (!isBlank(input.dueDate())) {
            dueDate = DueDates.parse(input.dueDate(), clock.getZone()).orElse(null);
            if (dueDate == null) {
                errors.add(invalidDueDate());
            }
        }

        throwIfAny(errors, "Invalid task data");
        return new TaskDraft(title, description, priority, dueDate);
    }

    public TaskChanges validateChanges(TaskPatchInput input) {
        List<String> errors = new ArrayList<>();

        FieldPatch<String> title = input.title();
        if (title.isPresent()) {
            String trimmed = title.isSet() ? title.value().trim() : "";
            checkTitle(trimmed, errors);
            title = FieldPatch.set(trimmed);
        }

        FieldPatch<String> description = input.description();
        if (description.isPresent()) {
            String value = blankToNull(description.valueOrNull());
            checkDescription(value, errors);
            description = value == null ? FieldPatch.clear() : FieldPatch.set(value);
        }

        FieldPatch<Boolean> completed = input.completed();
        if (completed.isClear()) {
            errors.add("completed must be true or false");
        }

        FieldPatch<Priority> priority = FieldPatch.unset();
        if (input.priority().isPresent()) {
            String code = input.priority().valueOrNull();
            priority = Priority.fromCode(code).map(FieldPatch::set).orElse(FieldPatch.clear());
            if (priority.isClear()) {
                errors.add(invalidPriority(code));
            }
        }

        FieldPatch<LocalDateTime> dueDate = FieldPatch.unset();
        if (input.dueDate().isPresent()) {
            String raw = input.dueDate().valueOrNull();
            if (isBlank(raw)) {
                dueDate = FieldPatch.clear();
            } else {
                dueDate = DueDates.parse(raw, clock.getZone()).map(FieldPatch::set).orElse(FieldPatch.clear());
                if (dueDate.isClear()) {
                    errors.add(invalidDueDate());
                }
            }
        }

        throwIfAny(errors, "Invalid task data");

        TaskChanges changes = new TaskChanges(title, description, completed, priority, dueDate);
        if (changes.fieldNames().isEmpty()) {
            throw new ValidationException("No valid field supplied for update",
                    List.of("Provide at least one of: title, description, completed, priority, due_date"));
        }
        return changes;
    }

    private static void checkTitle(String title, List<String> errors) {
        if (title.isEmpty()) {
            errors.add("Title is required");
        } else if (title.length() > TITLE_MAX) {
            errors.add("Title has " + title.length() + " characters. Maximum allowed: " + TITLE_MAX);
        }
    }

    private static void checkDescription(String description, List<String> errors) {
        if (description != null && description.length() > DESCRIPTION_MAX) {
            errors.add("Description has " + description.length() + " characters. Maximum allowed: "
                    + DESCRIPTION_MAX);
        }
    }

    static String invalidPriority(String value) {
        return "Priority \"" + value + "\" is not valid. Use: low, medium or high";
    }

    private static String invalidDueDate() {
        return "Due date must be ISO 8601: YYYY-MM-DD or YYYY-MM-DDTHH:mm:ss";
    }

    private static void throwIfAny(List<String> errors, String summary) {
        if (errors.isEmpty()) {
            return;
        }
        throw new ValidationException(errors.size() == 1 ? errors.get(0) : summary, errors);
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
