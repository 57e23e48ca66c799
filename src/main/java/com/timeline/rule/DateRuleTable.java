package com.timeline.rule;

import com.timeline.model.AnchorKind;

import java.util.List;
import java.util.Locale;

import static com.timeline.rule.DateShift.NEXT_BUSINESS_DAY;
import static com.timeline.rule.DateShift.PREVIOUS_BUSINESS_DAY;
import static com.timeline.rule.DateShift.SAME_DAY;
import static com.timeline.rule.DateShift.WEEK_BEFORE;
import static com.timeline.rule.RuleModifier.otherwise;
import static com.timeline.rule.RuleModifier.when;

/**
 * Ordered date rule vocabulary. Groups are tried in list order.
 *
 * @param entries  Keyword groups in priority order
 * @param ongoing  Rule text that means "no fixed date"
 */
public record DateRuleTable(List<DateRuleEntry> entries, String ongoing) {

    public static final String DEFAULT_ONGOING = "ongoing";

    public DateRuleTable {
        entries = List.copyOf(entries);
        ongoing = ongoing == null || ongoing.isBlank() ? DEFAULT_ONGOING : ongoing.toLowerCase(Locale.ROOT);
    }

    public DateRuleTable(List<DateRuleEntry> entries) {
        this(entries, DEFAULT_ONGOING);
    }

    /**
     * The vocabulary project templates are written against.
     */
    public static DateRuleTable defaults() {
        return new DateRuleTable(List.of(
                new DateRuleEntry("ko-date", AnchorKind.KO_DATE,
                        List.of("ko date"),
                        List.of(when("1 day before", PREVIOUS_BUSINESS_DAY))),
                new DateRuleEntry("fieldwork-start", AnchorKind.FIELDWORK_START,
                        List.of("fieldwork start", "first day of fieldwork"),
                        List.of(when("1 day before", PREVIOUS_BUSINESS_DAY),
                                when("first day of", SAME_DAY))),
                new DateRuleEntry("fieldwork-end", AnchorKind.FIELDWORK_END,
                        List.of("fieldwork ends", "last day of field"),
                        List.of(when("1 day after", NEXT_BUSINESS_DAY),
                                when("last day of", SAME_DAY))),
                new DateRuleEntry("pre-field", AnchorKind.FIELDWORK_START,
                        List.of("pre-field"),
                        List.of(when("first day of", WEEK_BEFORE))),
                new DateRuleEntry("week-prior", AnchorKind.FIELDWORK_START,
                        List.of("1 week prior to fieldwork start"),
                        List.of(otherwise(WEEK_BEFORE))),
                new DateRuleEntry("first-day-of-field", AnchorKind.FIELDWORK_START,
                        List.of("first day of field"),
                        List.of(when("1 day before", PREVIOUS_BUSINESS_DAY),
                                otherwise(SAME_DAY))),
                new DateRuleEntry("post-field", AnchorKind.FIELDWORK_END,
                        List.of("post-field"),
                        List.of(when("first day of", NEXT_BUSINESS_DAY))),
                new DateRuleEntry("report-due", AnchorKind.REPORT_DUE,
                        List.of("report due date"),
                        List.of(when("1 day before", PREVIOUS_BUSINESS_DAY),
                                when("final", SAME_DAY)))
        ));
    }
}
