package com.lux032.mploader.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

public class RunSummaryTest {

    @Test
    public void testOutcomesSortedBySequenceAndCounted() {
        SourceItem first = new SourceItem("One", "A", "1", 1);
        SourceItem second = new SourceItem("Two", "A", "2", 2);
        SourceItem third = new SourceItem("Three", "A", "3", 3);

        RunSummary summary = new RunSummary(Arrays.asList(
            TrackOutcome.cancelled(third),
            TrackOutcome.failed(second, ErrorKind.NO_MATCH, "nothing"),
            TrackOutcome.downloaded(first, Paths.get("One - A.mp3"))
        ));

        List<TrackOutcome> outcomes = summary.getOutcomes();
        Assertions.assertSame(first, outcomes.get(0).getItem());
        Assertions.assertSame(second, outcomes.get(1).getItem());
        Assertions.assertSame(third, outcomes.get(2).getItem());

        Assertions.assertEquals(3, summary.getTotal());
        Assertions.assertEquals(1, summary.getDownloaded());
        Assertions.assertEquals(0, summary.getSkipped());
        Assertions.assertEquals(1, summary.getFailed());
        Assertions.assertEquals(1, summary.getCancelled());
        Assertions.assertFalse(summary.isAllSucceeded());
        Assertions.assertEquals(1, summary.outcomesOf(TrackOutcome.Kind.FAILED).size());
    }

    @Test
    public void testSkippedCountsAsSuccess() {
        SourceItem item = new SourceItem("One", "A", "1", 1);

        RunSummary summary = new RunSummary(Arrays.asList(
            TrackOutcome.skipped(item, Paths.get("One - A.mp3"), SkipReason.DESTINATION_ALREADY_EXISTS)));

        Assertions.assertTrue(summary.isAllSucceeded());
        Assertions.assertEquals(1, summary.getSucceeded());
    }
}
