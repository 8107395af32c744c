package info.isaksson.erland.paramdup.bridge;

import info.isaksson.erland.paramdup.core.FileOutcome;
import info.isaksson.erland.paramdup.core.ParamDuplicatorResult;
import info.isaksson.erland.paramdup.report.DuplicationReport;
import info.isaksson.erland.paramdup.report.ReportEntry;
import info.isaksson.erland.paramdup.report.ReportFile;
import info.isaksson.erland.paramdup.rewrite.ParameterDuplication;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts a {@link ParamDuplicatorResult} into the serializable {@link DuplicationReport}.
 *
 * <p>Keeps the report module free of rewriter and JavaParser types.</p>
 */
public final class ResultToReportAdapter {

    public DuplicationReport toReport(ParamDuplicatorResult res) {
        if (res == null) throw new IllegalArgumentException("res must not be null");

        List<ReportFile> files = new ArrayList<>(res.files.size());
        int total = 0;
        int parseErrors = 0;
        for (FileOutcome f : res.files) {
            List<ReportEntry> entries = new ArrayList<>(f.duplications.size());
            for (ParameterDuplication d : f.duplications) {
                entries.add(new ReportEntry(
                        d.line,
                        d.declaringType,
                        d.declaration,
                        d.kind.name(),
                        d.parameterType,
                        d.originalParameter,
                        d.addedParameter
                ));
            }
            files.add(new ReportFile(f.relativePath, entries.size(), f.parseError, entries));
            total += entries.size();
            if (f.failed()) parseErrors++;
        }

        return new DuplicationReport(
                DuplicationReport.SCHEMA_VERSION,
                pathString(res.input),
                pathString(res.output),
                total,
                parseErrors,
                files
        );
    }

    private static String pathString(Path p) {
        return p == null ? null : p.toString().replace('\\', '/');
    }
}
