package dev.hrats.repository;

import dev.hrats.entity.Applicant;
import dev.hrats.model.ApplicantFilter;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translates an {@link ApplicantFilter} into a JPA criteria predicate.
 */
public final class ApplicantSpecifications {

    private ApplicantSpecifications() {
    }

    public static Specification<Applicant> matching(ApplicantFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.statuses() != null && !filter.statuses().isEmpty()) {
                predicates.add(root.get("status").in(filter.statuses()));
            }
            if (filter.jobContains() != null && !filter.jobContains().isBlank()) {
                String pattern = "%" + filter.jobContains().trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.like(cb.lower(root.get("job")), pattern));
            }
            addRange(predicates, cb, root.get("appliedDate"), filter.appliedFrom(), filter.appliedTo());
            addRange(predicates, cb, root.get("interviewDate"), filter.interviewFrom(), filter.interviewTo());

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static void addRange(List<Predicate> predicates, CriteriaBuilder cb, Path<LocalDate> path,
                                 LocalDate from, LocalDate to) {
        if (from != null) {
            predicates.add(cb.greaterThanOrEqualTo(path, from));
        }
        if (to != null) {
            predicates.add(cb.lessThanOrEqualTo(path, to));
        }
    }
}
