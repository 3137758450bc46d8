package com.openforge.kairn.repository;

import com.openforge.kairn.domain.KnowledgeNode;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Criteria building blocks for node queries. Combine with {@link Specification#where}.
 */
public final class NodeSpecifications {

    private NodeSpecifications() {
    }

    public static Specification<KnowledgeNode> live() {
        return (root, query, cb) -> cb.isNull(root.get("deletedAt"));
    }

    public static Specification<KnowledgeNode> inNamespace(String namespace) {
        return (root, query, cb) -> cb.equal(root.get("namespace"), namespace);
    }

    public static Specification<KnowledgeNode> ofType(String type) {
        return (root, query, cb) -> cb.equal(root.get("type"), type);
    }

    /** Node must carry every one of the given (lower-cased) tags. */
    public static Specification<KnowledgeNode> taggedWithAll(Collection<String> tags) {
        return (root, query, cb) -> {
            Expression<Set<String>> nodeTags = root.get("tags");
            List<Predicate> all = new ArrayList<>();
            for (String tag : tags) {
                all.add(cb.isMember(tag, nodeTags));
            }
            return cb.and(all.toArray(new Predicate[0]));
        };
    }

    /**
     * Coarse pre-filter: any token appears in name, description or tags.
     * Exact ranking happens in memory (see TextRelevance).
     */
    public static Specification<KnowledgeNode> mentionsAny(Collection<String> tokens) {
        return (root, query, cb) -> {
            Expression<Set<String>> nodeTags = root.get("tags");
            List<Predicate> any = new ArrayList<>();
            for (String token : tokens) {
                String pattern = "%" + token + "%";
                any.add(cb.like(cb.lower(root.get("name")), pattern));
                any.add(cb.like(cb.lower(root.get("description")), pattern));
                any.add(cb.isMember(token, nodeTags));
            }
            return cb.or(any.toArray(new Predicate[0]));
        };
    }
}
