package com.astvisualizer.core.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reports of one batch: a page per dump plus the summary page.
 *
 * @param reports per-dump pages, in batch order
 * @param summary summary page linking every report
 */
public record ReportBundle(
    List<ReportFile> reports,
    ReportFile summary
) {
    /**
     * Compact constructor with validation.
     */
    public ReportBundle {
        Objects.requireNonNull(reports, "reports must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        reports = List.copyOf(reports);
    }

    /**
     * Returns every page, the summary last.
     *
     * @return per-dump pages followed by the summary
     */
    public List<ReportFile> all() {
        List<ReportFile> all = new ArrayList<>(reports);
        all.add(summary);
        return all;
    }

    public int size() {
        return reports.size() + 1;
    }
}
