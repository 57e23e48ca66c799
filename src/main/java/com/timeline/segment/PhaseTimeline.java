package com.timeline.segment;

import com.timeline.model.AnchorDates;
import com.timeline.model.Phase;
import com.timeline.model.PhaseSegment;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * The ordered, contiguous phase segments of one project.
 */
public record PhaseTimeline(List<PhaseSegment> segments) {

    public PhaseTimeline {
        segments = List.copyOf(segments);
        if (segments.size() != Phase.values().length) {
            throw new IllegalArgumentException("Expected " + Phase.values().length
                    + " segments, got " + segments.size());
        }
        for (int i = 0; i < segments.size(); i++) {
            PhaseSegment segment = segments.get(i);
            if (segment.phase() != Phase.values()[i]) {
                throw new IllegalArgumentException("Segment " + i + " is " + segment.phase()
                        + ", expected " + Phase.values()[i]);
            }
            if (i > 0 && !segments.get(i - 1).endDate().plusDays(1).equals(segment.startDate())) {
                throw new IllegalArgumentException(segment.phase() + " starts " + segment.startDate()
                        + " but " + segments.get(i - 1).phase() + " ends " + segments.get(i - 1).endDate());
            }
        }
    }

    public PhaseSegment segment(Phase phase) {
        return segments.get(Objects.requireNonNull(phase, "phase").ordinal());
    }

    public LocalDate startDate() {
        return segments.get(0).startDate();
    }

    public LocalDate endDate() {
        return segments.get(segments.size() - 1).endDate();
    }

    /**
     * Anchor dates as the segments currently pin them.
     */
    public AnchorDates toAnchorDates() {
        PhaseSegment fielding = segment(Phase.FIELDING);
        return new AnchorDates(
                segment(Phase.KICKOFF).startDate(),
                fielding.startDate(),
                fielding.endDate(),
                segment(Phase.REPORTING).endDate());
    }

    /**
     * Find the phase containing {@code today}. Empty segments are never active;
     * before the first populated day the project is pending in its first phase.
     */
    public CurrentPhase currentPhase(LocalDate today) {
        List<PhaseSegment> populated = segments.stream().filter(s -> !s.isEmpty()).toList();
        if (populated.isEmpty()) {
            return new CurrentPhase(segments.get(0).phase(), PhaseState.PENDING_START);
        }
        PhaseSegment first = populated.get(0);
        PhaseSegment last = populated.get(populated.size() - 1);
        if (today.isBefore(first.startDate())) {
            return new CurrentPhase(segments.get(0).phase(), PhaseState.PENDING_START);
        }
        if (today.isAfter(last.endDate())) {
            return new CurrentPhase(last.phase(), PhaseState.OVERDUE);
        }
        for (PhaseSegment segment : populated) {
            if (segment.contains(today)) {
                return new CurrentPhase(segment.phase(), PhaseState.ACTIVE);
            }
        }
        throw new IllegalStateException("No segment contains " + today + " in " + segments);
    }
}
