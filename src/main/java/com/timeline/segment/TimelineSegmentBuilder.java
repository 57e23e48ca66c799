package com.timeline.segment;

import com.timeline.exception.InconsistentAnchorsException;
import com.timeline.exception.InvalidSegmentEditException;
import com.timeline.model.AnchorDates;
import com.timeline.model.KeyDate;
import com.timeline.model.Phase;
import com.timeline.model.PhaseSegment;
import com.timeline.model.Task;
import com.timeline.rule.DateRuleResolver;
import com.timeline.rule.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds phase segments from anchor dates and keeps them contiguous under edits.
 *
 * <p>Boundary pins: Kickoff is the KO day alone, Pre-Field runs up to the day
 * before fieldwork, Fielding is the fieldwork range, Reporting is the week of
 * the report deadline (Monday through the due date) and Post-Field Analysis
 * fills the gap. A pin squeezed by its neighbours yields an empty segment.
 */
public class TimelineSegmentBuilder {

    private static final Logger log = LoggerFactory.getLogger(TimelineSegmentBuilder.class);

    private static final Pattern END_WORD = Pattern.compile("\\bend\\b");

    private final DateRuleResolver resolver;

    public TimelineSegmentBuilder(DateRuleResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Build the five phase segments.
     *
     * @param anchors Project anchor dates
     * @return Contiguous timeline covering {@code koDate} through {@code reportDue}
     * @throws InconsistentAnchorsException if the anchors are out of order
     */
    public PhaseTimeline buildSegments(AnchorDates anchors) {
        List<String> violations = anchors.violations();
        if (!violations.isEmpty()) {
            log.warn("Refusing to build segments: {}", violations);
            throw new InconsistentAnchorsException(violations);
        }

        LocalDate ko = anchors.koDate();
        LocalDate fieldStart = anchors.fieldworkStart();
        LocalDate fieldEnd = anchors.fieldworkEnd();
        LocalDate reportDue = anchors.reportDue();

        LocalDate preFieldStart = min(ko.plusDays(1), fieldStart);
        LocalDate postFieldStart = fieldEnd.plusDays(1);
        LocalDate reportingStart = max(
                reportDue.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)), postFieldStart);

        PhaseTimeline timeline = new PhaseTimeline(List.of(
                new PhaseSegment(Phase.KICKOFF, ko, preFieldStart.minusDays(1)),
                new PhaseSegment(Phase.PRE_FIELD, preFieldStart, fieldStart.minusDays(1)),
                new PhaseSegment(Phase.FIELDING, fieldStart, fieldEnd),
                new PhaseSegment(Phase.POST_FIELD_ANALYSIS, postFieldStart, reportingStart.minusDays(1)),
                new PhaseSegment(Phase.REPORTING, reportingStart, reportDue)
        ));

        log.debug("Built timeline {} .. {} from {}", timeline.startDate(), timeline.endDate(), anchors);
        return timeline;
    }

    /**
     * Apply a manual edit to one segment. Only the immediate neighbours move.
     *
     * @param timeline Current timeline
     * @param phase    Edited phase
     * @param newStart New first day of the phase
     * @param newEnd   New last day of the phase
     * @param keyDates Key dates to re-stamp; labels naming the edited phase follow the edit
     * @return The edited timeline and key dates
     * @throws InvalidSegmentEditException if the edit inverts the segment or swallows a neighbour
     */
    public SegmentEdit editSegment(PhaseTimeline timeline, Phase phase, LocalDate newStart, LocalDate newEnd,
                                   List<KeyDate> keyDates) {
        if (newStart.isAfter(newEnd)) {
            throw new InvalidSegmentEditException(phase + " cannot start " + newStart + " after it ends " + newEnd);
        }

        List<PhaseSegment> segments = new ArrayList<>(timeline.segments());
        int index = phase.ordinal();
        segments.set(index, new PhaseSegment(phase, newStart, newEnd));

        if (index > 0) {
            PhaseSegment prev = segments.get(index - 1);
            if (newStart.isBefore(prev.startDate())) {
                throw new InvalidSegmentEditException(phase + " start " + newStart
                        + " would overrun " + prev.phase() + " starting " + prev.startDate());
            }
            segments.set(index - 1, prev.withEndDate(newStart.minusDays(1)));
        }

        if (index < segments.size() - 1) {
            PhaseSegment next = segments.get(index + 1);
            if (newEnd.isAfter(next.endDate())) {
                throw new InvalidSegmentEditException(phase + " end " + newEnd
                        + " would overrun " + next.phase() + " ending " + next.endDate());
            }
            segments.set(index + 1, next.withStartDate(newEnd.plusDays(1)));
        }
        PhaseTimeline edited = new PhaseTimeline(segments);

        String phaseName = phase.displayName().toLowerCase(Locale.ROOT);
        List<KeyDate> restamped = new ArrayList<>(keyDates.size());
        List<String> changedLabels = new ArrayList<>();
        for (KeyDate keyDate : keyDates) {
            String label = keyDate.label() == null ? "" : keyDate.label().toLowerCase(Locale.ROOT);
            if (!label.contains(phaseName)) {
                restamped.add(keyDate);
                continue;
            }
            LocalDate stamp = END_WORD.matcher(label).find() ? newEnd : newStart;
            if (!stamp.equals(keyDate.date())) {
                changedLabels.add(keyDate.label());
            }
            restamped.add(keyDate.withDate(stamp));
        }

        log.info("Edited {} to {} .. {}, re-stamped key dates {}", phase, newStart, newEnd, changedLabels);
        return new SegmentEdit(phase, edited, List.copyOf(restamped), List.copyOf(changedLabels));
    }

    /**
     * Standard milestone labels for a timeline.
     */
    public List<KeyDate> keyDates(PhaseTimeline timeline) {
        return List.of(
                new KeyDate("Kickoff", timeline.segment(Phase.KICKOFF).startDate()),
                new KeyDate("Pre-Field Start", timeline.segment(Phase.PRE_FIELD).startDate()),
                new KeyDate("Fielding Start", timeline.segment(Phase.FIELDING).startDate()),
                new KeyDate("Fielding End", timeline.segment(Phase.FIELDING).endDate()),
                new KeyDate("Post-Field Analysis Start", timeline.segment(Phase.POST_FIELD_ANALYSIS).startDate()),
                new KeyDate("Reporting Start", timeline.segment(Phase.REPORTING).startDate()),
                new KeyDate("Reporting End", timeline.segment(Phase.REPORTING).endDate())
        );
    }

    /**
     * Stamp due dates on every task that carries a date rule.
     * Tasks without a rule keep whatever date they have.
     *
     * @param timeline Timeline whose segments pin the anchors
     * @param tasks    Tasks to stamp
     * @return Tasks in the same order
     */
    public List<Task> applyDueDates(PhaseTimeline timeline, List<Task> tasks) {
        AnchorDates anchors = timeline.toAnchorDates();
        List<Task> result = new ArrayList<>(tasks.size());
        int failed = 0;
        for (Task task : tasks) {
            if (task.dateRule() == null || task.dateRule().isBlank()) {
                result.add(task);
                continue;
            }
            if (task.ongoing()) {
                result.add(task.withDueDate(null));
                continue;
            }
            ResolutionResult resolution = resolver.resolve(task.id(), task.dateRule(), anchors);
            if (resolution.isFailed()) {
                failed++;
            }
            result.add(task.withDueDate(resolution.getDueDate()));
        }
        log.debug("Stamped due dates on {} tasks ({} unresolved)", tasks.size(), failed);
        return result;
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }
}
