package com.campus.portal.repository;

import com.campus.portal.entity.Club;
import com.campus.portal.entity.ClubCategory;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

public class ClubSpecs {

    private ClubSpecs() {
    }

    public static Specification<Club> isActive() {
        return (Root<Club> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> cb.isTrue(r.get("active"));
    }

    public static Specification<Club> hasCategory(ClubCategory category) {
        return (Root<Club> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> {
            if (category == null) {
                return cb.conjunction();
            }
            return cb.equal(r.get("category"), category);
        };
    }

    // name OR description, case-insensitive
    public static Specification<Club> textLike(String qstr) {
        return (Root<Club> r, CriteriaQuery<?> q, CriteriaBuilder cb) -> {
            if (qstr == null || qstr.isBlank()) {
                return cb.conjunction();
            }
            String like = "%" + qstr.trim().toLowerCase() + "%";

            Predicate nameLike = cb.like(cb.lower(r.get("name")), like);
            Predicate descriptionLike = cb.like(cb.lower(r.get("description")), like);

            return cb.or(nameLike, descriptionLike);
        };
    }
}
