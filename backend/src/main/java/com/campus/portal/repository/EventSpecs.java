package com.campus.portal.repository;

import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventStatus;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

public class EventSpecs {

    private EventSpecs() {
    }

    public static Specification<Event> inClub(Long clubId) {
        return (Root<Event> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> {
            if (clubId == null) {
                return cb.conjunction();
            }
            return cb.equal(r.get("club").get("id"), clubId);
        };
    }

    public static Specification<Event> hasStatus(EventStatus status) {
        return (Root<Event> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> {
            if (status == null) {
                return cb.conjunction();
            }
            return cb.equal(r.get("status"), status);
        };
    }

    public static Specification<Event> textLike(String qstr) {
        return (Root<Event> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> {
            if (qstr == null || qstr.isBlank()) {
                return cb.conjunction();
            }
            String like = "%" + qstr.trim().toLowerCase() + "%";

            Predicate titleLike = cb.like(cb.lower(r.get("title")), like);
            Predicate descriptionLike = cb.like(cb.lower(r.get("description")), like);
            Predicate venueLike = cb.like(cb.lower(r.get("venue")), like);

            return cb.or(titleLike, descriptionLike, venueLike);
        };
    }
}
