package com.taskboard.servicebackend.task;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Typed predicates for task listings. Every value reaches the database as a bound parameter.
 */
public final class TaskSpecifications {

    private static final char LIKE_ESCAPE = '\\';

    private TaskSpecifications() {
    }

    public static Specification<Task> ownedBy(long ownerId) {
        return (root, query, cb) -> cb.equal(root.get("ownerId"), ownerId);
    }

    public static Specification<Task> completed(boolean completed) {
        return (root, query, cb) -> cb.equal(root.get("completed"), completed);
    }

    public static Specification<Task> withPriority(Priority priority) {
        return (root, query, cb) -> cb.equal(root.get("priority"), priority);
    }

    public static Specification<Task> titleOrDescriptionContains(String term) {
        String pattern = "%" + escapeLike(term.toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("title")), pattern, LIKE_ESCAPE),
                cb.like(cb.lower(root.get("description")), pattern, LIKE_ESCAPE));
    }

    /**
     * The owner predicate plus one clause per filter component that is set.
     */
    public static Specification<Task> matching(long ownerId, TaskFilter filter) {
        Specification<Task> spec = ownedBy(ownerId);
        if (filter.completed() != null) {
            spec = spec.and(completed(filter.completed()));
        }
        if (filter.priority() != null) {
            spec = spec.and(withPriority(filter.priority()));
        }
        if (filter.search() != null) {
            spec = spec.and(titleOrDescriptionContains(filter.search()));
        }
        return spec;
    }

    /**
     * Sort key mapping each priority to its {@link Priority#rank()}.
     */
    static Expression<Integer> priorityRank(Root<Task> root, CriteriaBuilder cb) {
        CriteriaBuilder.Case<Integer> rank = cb.selectCase();
        for (Priority priority : Priority.byRank()) {
            rank = rank.when(cb.equal(root.get("priority"), priority), cb.literal(priority.rank()));
        }
        return rank.otherwise(cb.literal(Priority.values().length));
    }

    static String escapeLike(String term) {
        StringBuilder escaped = new StringBuilder(term.length());
        for (char c : term.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
