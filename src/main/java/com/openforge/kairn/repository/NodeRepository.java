package com.openforge.kairn.repository;

import com.openforge.kairn.domain.KnowledgeNode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NodeRepository extends JpaRepository<KnowledgeNode, Long>,
        JpaSpecificationExecutor<KnowledgeNode> {

    Optional<KnowledgeNode> findByIdAndDeletedAtIsNull(Long id);

    List<KnowledgeNode> findByIdInAndDeletedAtIsNull(Collection<Long> ids);

    /** Every live node, used to rebuild the router index. */
    List<KnowledgeNode> findByDeletedAtIsNull();

    long countByDeletedAtIsNull();

    /** Rows of [namespace, count] over live nodes. */
    @Query("select n.namespace, count(n) from KnowledgeNode n where n.deletedAt is null group by n.namespace")
    List<Object[]> countLiveByNamespace();
}
