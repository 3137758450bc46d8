package com.openforge.kairn.repository;

import com.openforge.kairn.domain.RouteEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface RouteEntryRepository extends JpaRepository<RouteEntry, Long> {

    Optional<RouteEntry> findByKeyword(String keyword);

    List<RouteEntry> findByKeywordIn(Collection<String> keywords);

    List<RouteEntry> findByNodeIdsContaining(Long nodeId);
}
