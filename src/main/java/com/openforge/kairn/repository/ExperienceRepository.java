package com.openforge.kairn.repository;

import com.openforge.kairn.domain.Experience;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;


@Repository
public interface ExperienceRepository extends JpaRepository<Experience, Long>,
        JpaSpecificationExecutor<Experience> {
}
