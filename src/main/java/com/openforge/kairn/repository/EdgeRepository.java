package com.openforge.kairn.repository;

import com.openforge.kairn.domain.KnowledgeEdge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EdgeRepository extends JpaRepository<KnowledgeEdge, Long> {

    /** Includes soft-deleted rows so connect/restore can reuse the triple. */
    Optional<KnowledgeEdge> findBySourceIdAndTargetIdAndType(Long sourceId, Long targetId, String type);

    List<KnowledgeEdge> findBySourceIdAndDeletedAtIsNull(Long sourceId);

    List<KnowledgeEdge> findByTargetIdAndDeletedAtIsNull(Long targetId);

    List<KnowledgeEdge> findBySourceIdAndTypeAndDeletedAtIsNull(Long sourceId, String type);

    List<KnowledgeEdge> findByTargetIdAndTypeAndDeletedAtIsNull(Long targetId, String type);

    /** Live edges whose both endpoints are live, i.e. the edges a caller can see. */
    @Query("""
            select count(e) from KnowledgeEdge e
            where e.deletedAt is null
              and exists (select s.id from KnowledgeNode s where s.id = e.sourceId and s.deletedAt is null)
              and exists (select t.id from KnowledgeNode t where t.id = e.targetId and t.deletedAt is null)
            """)
    long countVisible();
}
