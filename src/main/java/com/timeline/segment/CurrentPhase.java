package com.timeline.segment;

import com.timeline.model.Phase;

public record CurrentPhase(Phase phase, PhaseState state) {
}
