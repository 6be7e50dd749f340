package com.claude.budgetoptimizer.repository;

import com.claude.budgetoptimizer.entity.JobLease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * job lease 레포지토리
 *
 * 상태 변경은 모두 조건부 단일 UPDATE / DELETE 로 처리해서 조회 후 갱신 사이의 경쟁을 피한다.
 */
@Repository
public interface JobLeaseRepository extends JpaRepository<JobLease, Long> {

    Optional<JobLease> findByLockKey(String lockKey);

    /**
     * 만료된 lease 를 새 소유자로 넘긴다. 갱신된 행 수가 1 이면 획득 성공.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE JobLease l SET l.ownerToken = :ownerToken, l.acquiredAt = :now, l.expiresAt = :expiresAt " +
           "WHERE l.lockKey = :lockKey AND l.expiresAt <= :now")
    int takeOverExpired(@Param("lockKey") String lockKey,
                        @Param("ownerToken") String ownerToken,
                        @Param("now") LocalDateTime now,
                        @Param("expiresAt") LocalDateTime expiresAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM JobLease l WHERE l.lockKey = :lockKey AND l.ownerToken = :ownerToken")
    int release(@Param("lockKey") String lockKey, @Param("ownerToken") String ownerToken);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM JobLease l WHERE l.expiresAt <= :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
