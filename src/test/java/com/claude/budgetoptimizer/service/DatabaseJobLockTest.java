package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.LockHandle;
import com.claude.budgetoptimizer.repository.JobLeaseRepository;
import com.claude.budgetoptimizer.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class DatabaseJobLockTest {

    private static final String KEY = "budget-optimization:adv-1";

    @Autowired
    private JobLeaseRepository leaseRepository;

    private MutableClock clock;
    private DatabaseJobLock lock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDateTime.of(2024, 5, 10, 10, 0));
        lock = new DatabaseJobLock(leaseRepository, clock);
    }

    @AfterEach
    void tearDown() {
        leaseRepository.deleteAll();
    }

    @Test
    void heldLockRejectsSecondOwner() {
        assertTrue(lock.tryAcquire(KEY, Duration.ofMinutes(30)).isPresent());
        assertTrue(lock.tryAcquire(KEY, Duration.ofMinutes(30)).isEmpty());
    }

    @Test
    void releaseDeletesOnlyOwnLease() {
        LockHandle handle = lock.tryAcquire(KEY, Duration.ofMinutes(30)).orElseThrow();

        lock.release(handle);

        assertTrue(leaseRepository.findByLockKey(KEY).isEmpty());
        assertTrue(lock.tryAcquire(KEY, Duration.ofMinutes(30)).isPresent());
    }

    @Test
    void expiredLeaseIsTakenOverAndOldOwnerCannotRelease() {
        LockHandle stale = lock.tryAcquire(KEY, Duration.ofMinutes(30)).orElseThrow();
        clock.advance(Duration.ofMinutes(31));

        Optional<LockHandle> fresh = lock.tryAcquire(KEY, Duration.ofMinutes(30));
        assertTrue(fresh.isPresent());

        lock.release(stale);
        assertEquals(fresh.get().getOwnerToken(), leaseRepository.findByLockKey(KEY).orElseThrow().getOwnerToken());
    }

    @Test
    void purgeRemovesExpiredLeases() {
        lock.tryAcquire(KEY, Duration.ofMinutes(10));
        lock.tryAcquire("budget-optimization:adv-2", Duration.ofHours(2));
        clock.advance(Duration.ofMinutes(30));

        assertEquals(1, lock.purgeExpired());
        assertEquals(1, leaseRepository.count());
    }
}
