package com.lux032.mploader.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 一次运行的汇总结果
 * 结果按 SourceItem 的序号排列, 与线程调度顺序无关
 */
public class RunSummary {

    private final List<TrackOutcome> outcomes;
    private final Map<TrackOutcome.Kind, Integer> counts;

    public RunSummary(List<TrackOutcome> outcomes) {
        List<TrackOutcome> sorted = new ArrayList<>(outcomes);
        sorted.sort(Comparator.comparingInt(o -> o.getItem().getSequenceIndex()));
        this.outcomes = Collections.unmodifiableList(sorted);

        Map<TrackOutcome.Kind, Integer> map = new EnumMap<>(TrackOutcome.Kind.class);
        for (TrackOutcome.Kind kind : TrackOutcome.Kind.values()) {
            map.put(kind, 0);
        }
        for (TrackOutcome outcome : sorted) {
            map.merge(outcome.getKind(), 1, Integer::sum);
        }
        this.counts = Collections.unmodifiableMap(map);
    }

    public List<TrackOutcome> getOutcomes() {
        return outcomes;
    }

    public int getTotal() {
        return outcomes.size();
    }

    public int count(TrackOutcome.Kind kind) {
        return counts.get(kind);
    }

    public Map<TrackOutcome.Kind, Integer> getCounts() {
        return counts;
    }

    public int getDownloaded() {
        return count(TrackOutcome.Kind.DOWNLOADED);
    }

    public int getSkipped() {
        return count(TrackOutcome.Kind.SKIPPED);
    }

    public int getFailed() {
        return count(TrackOutcome.Kind.FAILED);
    }

    public int getCancelled() {
        return count(TrackOutcome.Kind.CANCELLED);
    }

    public int getSucceeded() {
        return getDownloaded() + getSkipped();
    }

    public boolean isAllSucceeded() {
        return getSucceeded() == getTotal();
    }

    public List<TrackOutcome> outcomesOf(TrackOutcome.Kind kind) {
        return outcomes.stream()
            .filter(o -> o.getKind() == kind)
            .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("RunSummary{total=%d, downloaded=%d, skipped=%d, failed=%d, cancelled=%d}",
            getTotal(), getDownloaded(), getSkipped(), getFailed(), getCancelled());
    }
}
