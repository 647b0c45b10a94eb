package com.arenastats.parser;

import com.arenastats.parser.model.LifeChangeRecord;
import com.arenastats.parser.model.LifeSnapshot;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LifeChangeCalculatorTest {

    @Test
    void diff_keepsFirstSightingAndActualChangesPerSeat() {
        List<LifeChangeRecord> changes = LifeChangeCalculator.diff(List.of(
                new LifeSnapshot(1, 1, 1, 20),
                new LifeSnapshot(1, 1, 2, 20),
                new LifeSnapshot(2, 1, 1, 20),
                new LifeSnapshot(2, 1, 2, 20),
                new LifeSnapshot(5, 2, 1, 17),
                new LifeSnapshot(5, 2, 2, 20),
                new LifeSnapshot(8, 3, 2, 24)));

        assertEquals(List.of(
                new LifeChangeRecord(1, 1, 1, 20, null),
                new LifeChangeRecord(1, 1, 2, 20, null),
                new LifeChangeRecord(5, 2, 1, 17, -3),
                new LifeChangeRecord(8, 3, 2, 24, 4)), changes);
    }

    @Test
    void diff_comparesAgainstLastRecordedTotal() {
        List<LifeChangeRecord> changes = LifeChangeCalculator.diff(List.of(
                new LifeSnapshot(1, 1, 1, 20),
                new LifeSnapshot(2, 1, 1, 18),
                new LifeSnapshot(3, 1, 1, 18),
                new LifeSnapshot(4, 2, 1, 20)));

        assertEquals(Arrays.asList(null, -2, 2), changes.stream().map(LifeChangeRecord::changeAmount).toList());
    }

    @Test
    void diff_ofNothingIsEmpty() {
        assertTrue(LifeChangeCalculator.diff(List.of()).isEmpty());
    }
}
