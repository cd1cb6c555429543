package com.taskboard.servicebackend.task;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public class TaskQueryRepositoryImpl implements TaskQueryRepository {

    @PersistenceContext
    private EntityManager em;

    @Override
    @Transactional(readOnly = true)
    public List<Task> findPage(long ownerId, TaskFilter filter, int offset, int limit) {
        Specification<Task> spec = TaskSpecifications.matching(ownerId, filter);
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Task> query = cb.createQuery(Task.class);
        Root<Task> root = query.from(Task.class);

        query.select(root)
                .where(spec.toPredicate(root, query, cb))
                .orderBy(
                        cb.asc(TaskSpecifications.priorityRank(root, cb)),
                        cb.desc(root.get("createdAt")),
                        cb.desc(root.get("id")));

        return em.createQuery(query)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countMatching(long ownerId, TaskFilter filter) {
        Specification<Task> spec = TaskSpecifications.matching(ownerId, filter);
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<Task> root = query.from(Task.class);

        query.select(cb.count(root)).where(spec.toPredicate(root, query, cb));
        return em.createQuery(query).getSingleResult();
    }
}
