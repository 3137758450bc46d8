package com.openforge.kairn.repository;

import com.openforge.kairn.domain.Experience;
import com.openforge.kairn.domain.ExperienceType;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

public final class ExperienceSpecifications {

    private ExperienceSpecifications() {
    }

    public static Specification<Experience> any() {
        return (root, query, cb) -> cb.conjunction();
    }

    public static Specification<Experience> ofType(ExperienceType type) {
        return (root, query, cb) -> cb.equal(root.get("type"), type);
    }

    /** Any token appears in content, context or tags. */
    public static Specification<Experience> mentionsAny(Collection<String> tokens) {
        return (root, query, cb) -> {
            Expression<Set<String>> tags = root.get("tags");
            List<Predicate> any = new ArrayList<>();
            for (String token : tokens) {
                String pattern = "%" + token + "%";
                any.add(cb.like(cb.lower(root.get("content")), pattern));
                any.add(cb.like(cb.lower(root.get("context")), pattern));
                any.add(cb.isMember(token, tags));
            }
            return cb.or(any.toArray(new Predicate[0]));
        };
    }
}
