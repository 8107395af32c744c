package info.isaksson.erland.paramdup.report;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReportNormalizerTest {

    private static ReportEntry entry(int line, String decl) {
        return new ReportEntry(line, "T", decl, "METHOD", "int", "x", "x2");
    }

    @Test
    void sortsFilesAndEntriesAndRecomputesTotals() {
        ReportFile b = new ReportFile("p/B.java", 99, null, List.of(entry(20, "g"), entry(3, "f")));
        ReportFile a = new ReportFile("p/A.java", 0, "bad input", List.of());
        DuplicationReport in = new DuplicationReport(null, "in", "out", 0, 0, Arrays.asList(b, a));

        DuplicationReport n = ReportNormalizer.normalize(in);

        assertEquals(DuplicationReport.SCHEMA_VERSION, n.schemaVersion);
        assertEquals(List.of("p/A.java", "p/B.java"), List.of(n.files.get(0).path, n.files.get(1).path));
        assertEquals(3, n.files.get(1).duplications.get(0).line);
        assertEquals(20, n.files.get(1).duplications.get(1).line);
        assertEquals(2, n.files.get(1).declarationsModified);
        assertEquals(2, n.totalDeclarationsModified);
        assertEquals(1, n.parseErrors);
    }

    @Test
    void normalizingTwiceIsStable() {
        DuplicationReport in = new DuplicationReport("1", "in", "out", 0, 0,
                List.of(new ReportFile("Z.java", 0, null, List.of(entry(5, "b"), entry(5, "a")))));

        DuplicationReport once = ReportNormalizer.normalize(in);

        assertEquals(once, ReportNormalizer.normalize(once));
        assertEquals("a", once.files.get(0).duplications.get(0).declaration);
    }
}
