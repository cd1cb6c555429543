package com.taskboard.servicebackend.task;

import com.taskboard.servicebackend.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskInputValidatorTest {

    private final TaskInputValidator validator = new TaskInputValidator(
            Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void newTaskDefaults() {
        TaskDraft draft = validator.validateNew(new NewTaskInput("  Buy milk  ", "   ", null, ""));

        assertThat(draft.title()).isEqualTo("Buy milk");
        assertThat(draft.description()).isNull();
        assertThat(draft.priority()).isEqualTo(Priority.MEDIUM);
        assertThat(draft.dueDate()).isNull();
    }

    @Test
    void dueDateFormats() {
        assertThat(validator.validateNew(new NewTaskInput("t", null, "low", "2026-03-15")).dueDate())
                .isEqualTo(LocalDateTime.of(2026, 3, 15, 0, 0));
        assertThat(validator.validateNew(new NewTaskInput("t", null, "low", "2026-03-15T14:30")).dueDate())
                .isEqualTo(LocalDateTime.of(2026, 3, 15, 14, 30));
        assertThat(validator.validateNew(new NewTaskInput("t", null, "low", "2026-03-15T10:30:00+02:00")).dueDate())
                .isEqualTo(LocalDateTime.of(2026, 3, 15, 8, 30));
    }

    @Test
    void reportsEveryProblemAtOnce() {
        assertThatThrownBy(() -> validator.validateNew(new NewTaskInput(" ", null, "urgent", "15/03/2026")))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Invalid task data");
                    assertThat(e.getErrors()).hasSize(3)
                            .contains("Title is required",
                                    "Priority \"urgent\" is not valid. Use: low, medium or high");
                });
    }

    @Test
    void singleProblemBecomesTheMessage() {
        String longTitle = "x".repeat(TaskInputValidator.TITLE_MAX + 1);
        assertThatThrownBy(() -> validator.validateNew(new NewTaskInput(longTitle, null, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Title has 201 characters. Maximum allowed: 200");
    }

    @Test
    void changesKeepOnlySuppliedFields() {
        TaskChanges changes = validator.validateChanges(TaskPatchInput.empty()
                .withPriority(FieldPatch.set("high"))
                .withDueDate(FieldPatch.set("")));

        assertThat(changes.fieldNames()).containsExactly("priority", "due_date");
        assertThat(changes.priority()).isEqualTo(FieldPatch.set(Priority.HIGH));
        assertThat(changes.dueDate().isClear()).isTrue();
        assertThat(changes.title().isPresent()).isFalse();
    }

    @Test
    void nullDescriptionClearsIt() {
        TaskChanges changes = validator.validateChanges(TaskPatchInput.empty()
                .withDescription(FieldPatch.clear()));

        assertThat(changes.description().isClear()).isTrue();
    }

    @Test
    void rejectsEmptyAndInvalidChanges() {
        assertThatThrownBy(() -> validator.validateChanges(TaskPatchInput.empty()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No valid field supplied for update");

        assertThatThrownBy(() -> validator.validateChanges(TaskPatchInput.empty().withTitle(FieldPatch.clear())))
                .hasMessage("Title is required");

        assertThatThrownBy(() -> validator.validateChanges(TaskPatchInput.empty().withCompleted(FieldPatch.clear())))
                .hasMessage("completed must be true or false");
    }

    @Test
    void completesOnlyWhenSetToTrue() {
        assertThat(validator.validateChanges(TaskPatchInput.empty().withCompleted(FieldPatch.set(true))).completes())
                .isTrue();
        assertThat(validator.validateChanges(TaskPatchInput.empty().withCompleted(FieldPatch.set(false))).completes())
                .isFalse();
    }
}
