package com.claude.budgetoptimizer.batch;

import com.claude.budgetoptimizer.domain.HourlyRunResult;
import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.RunStatus;
import com.claude.budgetoptimizer.support.FakeAdvertiserDirectory;
import org.junit.jupiter.api.Test;
import org.springframework.batch.item.Chunk;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptimizationStepComponentsTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 10, 10, 0);

    @Test
    void readerReturnsEachTargetThenNull() {
        FakeAdvertiserDirectory directory = new FakeAdvertiserDirectory();
        directory.targets.put("adv-1", OptimizationTarget.builder().advertiserId("adv-1").build());
        directory.extraIds.add("adv-2");
        TargetAdvertiserReader reader = new TargetAdvertiserReader(directory);

        assertEquals("adv-1", reader.read());
        assertEquals("adv-2", reader.read());
        assertNull(reader.read());
        assertNull(reader.read());
    }

    @Test
    void writerRecordsRunsButNotOutsideWindow() throws Exception {
        FakeAdvertiserDirectory directory = new FakeAdvertiserDirectory();
        RunResultWriter writer = new RunResultWriter(directory);

        writer.write(new Chunk<>(List.of(
                HourlyRunResult.of("adv-1", NOW, false, RunStatus.COMPLETED, null),
                HourlyRunResult.of("adv-2", NOW, false, RunStatus.FAILED, "[C-02] advertiser not found"),
                HourlyRunResult.of("adv-3", NOW, false, RunStatus.OUTSIDE_WINDOW, null))));

        assertEquals(RunStatus.COMPLETED, directory.outcomes.get("adv-1"));
        assertEquals(RunStatus.FAILED, directory.outcomes.get("adv-2"));
        assertFalse(directory.outcomes.containsKey("adv-3"));
    }
}
