package com.claude.budgetoptimizer.repository;

import com.claude.budgetoptimizer.entity.AppealProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AppealProfileRepository extends JpaRepository<AppealProfile, Long> {

    Optional<AppealProfile> findByName(String name);
}
