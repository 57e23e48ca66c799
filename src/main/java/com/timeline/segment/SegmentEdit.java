package com.timeline.segment;

import com.timeline.model.KeyDate;
import com.timeline.model.Phase;

import java.util.List;

/**
 * Outcome of a manual segment edit.
 *
 * @param editedPhase     Phase the user edited
 * @param timeline        Timeline with the edited segment and its neighbours adjusted
 * @param keyDates        Key dates after re-stamping, in input order
 * @param restampedLabels Labels of the key dates whose date changed
 */
public record SegmentEdit(Phase editedPhase, PhaseTimeline timeline, List<KeyDate> keyDates,
                          List<String> restampedLabels) {
}
