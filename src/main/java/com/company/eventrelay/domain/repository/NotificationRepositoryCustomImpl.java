package com.company.eventrelay.domain.repository;

import com.company.eventrelay.domain.model.Notification;

import javax.persistence.EntityManager;
import javax.persistence.PersistenceContext;
import javax.persistence.criteria.CriteriaBuilder;
import javax.persistence.criteria.CriteriaQuery;
import javax.persistence.criteria.Predicate;
import javax.persistence.criteria.Root;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Criteria-based implementation of the notification listing, so optional
 * filters are left out of the SQL rather than bound as nulls.
 */
public class NotificationRepositoryCustomImpl implements NotificationRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Notification> search(NotificationFilter filter, LocalDateTime now, int offset, int limit) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Notification> query = cb.createQuery(Notification.class);
        Root<Notification> root = query.from(Notification.class);

        query.select(root)
                .where(predicates(cb, root, filter, now))
                .orderBy(cb.desc(root.get("createdAt")));

        return entityManager.createQuery(query)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    public long count(NotificationFilter filter, LocalDateTime now) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<Notification> root = query.from(Notification.class);

        query.select(cb.count(root)).where(predicates(cb, root, filter, now));

        return entityManager.createQuery(query).getSingleResult();
    }

    private Predicate[] predicates(CriteriaBuilder cb, Root<Notification> root,
                                   NotificationFilter filter, LocalDateTime now) {
        List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(root.get("hostId"), filter.getHostId()));

        if (filter.isUnreadOnly()) {
            predicates.add(cb.isFalse(root.get("isRead")));
        }
        if (filter.getType() != null) {
            predicates.add(cb.equal(root.get("type"), filter.getType()));
        }
        if (filter.getPriority() != null) {
            predicates.add(cb.equal(root.get("priority"), filter.getPriority()));
        }
        predicates.add(cb.or(
                cb.isNull(root.get("expiresAt")),
                cb.greaterThan(root.<LocalDateTime>get("expiresAt"), now)));
        return predicates.toArray(new Predicate[0]);
    }
}
