package com.taskboard.servicebackend.error;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * A well formed request rejected by a business rule rather than by input validation.
 */
public class DomainRuleException extends TaskboardException {

    public DomainRuleException(String message, String detail) {
        super(HttpStatus.BAD_REQUEST, message, List.of(detail));
    }

    public static DomainRuleException overdueCompletion() {
        return new DomainRuleException("Overdue task cannot be completed",
                "The due date of this task has already passed");
    }
}
