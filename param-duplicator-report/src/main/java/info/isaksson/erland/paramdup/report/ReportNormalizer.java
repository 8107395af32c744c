package info.isaksson.erland.paramdup.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stable ordering for report lists: files by path, duplications by (line, declaringType,
 * declaration, originalParameter). Totals are recomputed from the files.
 */
public final class ReportNormalizer {

    private ReportNormalizer() {}

    public static DuplicationReport normalize(DuplicationReport in) {
        if (in == null) return null;

        List<ReportFile> files = new ArrayList<>();
        int total = 0;
        int parseErrors = 0;
        for (ReportFile f : in.files) {
            if (f == null) continue;
            List<ReportEntry> entries = normalizeEntries(f.duplications);
            files.add(new ReportFile(f.path, entries.size(), f.parseError, entries));
            total += entries.size();
            if (f.parseError != null) parseErrors++;
        }
        files.sort(Comparator.comparing((ReportFile f) -> safe(f.path)));

        return new DuplicationReport(in.schemaVersion, in.input, in.output, total, parseErrors, files);
    }

    private static List<ReportEntry> normalizeEntries(List<ReportEntry> in) {
        List<ReportEntry> out = new ArrayList<>();
        for (ReportEntry e : in) {
            if (e != null) out.add(e);
        }
        out.sort(Comparator
                .comparingInt((ReportEntry e) -> e.line)
                .thenComparing(e -> safe(e.declaringType))
                .thenComparing(e -> safe(e.declaration))
                .thenComparing(e -> safe(e.originalParameter)));
        return List.copyOf(out);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
