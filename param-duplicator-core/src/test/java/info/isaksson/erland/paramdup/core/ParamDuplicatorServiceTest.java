package info.isaksson.erland.paramdup.core;

import com.github.javaparser.ParseProblemException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ParamDuplicatorServiceTest {

    private final ParamDuplicatorService service = new ParamDuplicatorService();

    private static Path write(Path root, String rel, String code) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, code, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void rewritesSingleFileAndReportsCount(@TempDir Path tmp) throws Exception {
        Path in = write(tmp, "in/Calc.java", "class Calc {\n    int square(int number) {\n        return number * number;\n    }\n    void reset() {\n    }\n}\n");
        Path out = tmp.resolve("out/sub/Calc.java");

        ParamDuplicatorResult res = service.rewriteFile(in, out, new ParamDuplicatorOptions());

        assertEquals(1, res.totalModified());
        assertEquals("Calc.java", res.files.get(0).relativePath);
        String written = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(written.contains("int square(int number, int alternativeNumber) {"));
        assertTrue(written.contains("void reset() {"));
    }

    @Test
    void singleFileParseErrorPropagatesAndWritesNothing(@TempDir Path tmp) throws Exception {
        Path in = write(tmp, "Bad.java", "class Bad { void f(int x { }");
        Path out = tmp.resolve("out/Bad.java");

        assertThrows(ParseProblemException.class, () -> service.rewriteFile(in, out, null));
        assertFalse(Files.exists(out));
    }

    @Test
    void treeModeMirrorsLayoutAndCopiesBrokenFilesUnchanged(@TempDir Path tmp) throws Exception {
        Path inRoot = tmp.resolve("in");
        write(inRoot, "p/A.java", "package p;\nclass A {\n    void a(String name) {\n    }\n}\n");
        write(inRoot, "p/q/B.java", "package p.q;\nclass B {\n    void b(int id) {\n    }\n    void c(long data) {\n    }\n}\n");
        String broken = "package p;\nclass Broken { void f(int x { }\n";
        write(inRoot, "p/Broken.java", broken);
        Path outRoot = tmp.resolve("out");

        ParamDuplicatorResult res = service.rewriteTree(inRoot, outRoot, List.of(), new ParamDuplicatorOptions());

        assertEquals(List.of("p/A.java", "p/Broken.java", "p/q/B.java"),
                res.files.stream().map(f -> f.relativePath).collect(Collectors.toList()));
        assertEquals(3, res.totalModified());
        assertEquals(1, res.parseFailures().size());
        assertTrue(res.parseFailures().get(0).parseError.startsWith("parse error"));

        assertTrue(Files.readString(outRoot.resolve("p/A.java")).contains("void a(String name, String displayName)"));
        String b = Files.readString(outRoot.resolve("p/q/B.java"));
        assertTrue(b.contains("void b(int id, int secondId)"));
        assertTrue(b.contains("void c(long data, long additionalData)"));
        assertEquals(broken, Files.readString(outRoot.resolve("p/Broken.java")));
    }

    @Test
    void totalsDoNotDependOnThreadCount(@TempDir Path tmp) throws Exception {
        Path inRoot = tmp.resolve("in");
        for (int i = 0; i < 12; i++) {
            write(inRoot, "p/C" + i + ".java", "class C" + i + " {\n    void f(int item" + i + ") {\n    }\n    void g() {\n    }\n}\n");
        }

        ParamDuplicatorOptions serial = new ParamDuplicatorOptions();
        serial.threads = 1;
        ParamDuplicatorOptions parallel = new ParamDuplicatorOptions();
        parallel.threads = 4;

        ParamDuplicatorResult r1 = service.rewriteTree(inRoot, tmp.resolve("out1"), null, serial);
        ParamDuplicatorResult r4 = service.rewriteTree(inRoot, tmp.resolve("out4"), null, parallel);

        assertEquals(12, r1.totalModified());
        assertEquals(r1.totalModified(), r4.totalModified());
        for (int i = 0; i < 12; i++) {
            String rel = "p/C" + i + ".java";
            assertEquals(Files.readString(tmp.resolve("out1").resolve(rel)), Files.readString(tmp.resolve("out4").resolve(rel)));
            assertTrue(Files.readString(tmp.resolve("out4").resolve(rel)).contains("item" + i + ", int item" + (i + 1)));
        }
    }

    @Test
    void outputNestedInInputIsNotRescanned(@TempDir Path tmp) throws Exception {
        write(tmp, "p/A.java", "class A {\n    void f(int value) {\n    }\n}\n");
        Path out = tmp.resolve("rewritten");

        service.rewriteTree(tmp, out, List.of(), new ParamDuplicatorOptions());
        ParamDuplicatorResult second = service.rewriteTree(tmp, out, List.of(), new ParamDuplicatorOptions());

        assertEquals(1, second.files.size());
        assertEquals(1, second.totalModified());
    }

    @Test
    void constructorsFollowOption(@TempDir Path tmp) throws Exception {
        Path in = write(tmp, "K.java", "class K {\n    K(int size) {\n    }\n}\n");
        ParamDuplicatorOptions opts = new ParamDuplicatorOptions();

        assertEquals(0, service.rewriteFile(in, tmp.resolve("o1/K.java"), opts).totalModified());
        opts.includeConstructors = true;
        assertEquals(1, service.rewriteFile(in, tmp.resolve("o2/K.java"), opts).totalModified());
        assertTrue(Files.readString(tmp.resolve("o2/K.java")).contains("K(int size, int preferredSize)"));
    }

    @Test
    void undecodableFileIsCopiedAndOthersStillRewritten(@TempDir Path tmp) throws Exception {
        Path inRoot = tmp.resolve("in");
        write(inRoot, "p/A.java", "class A {\n    void f(int value) {\n    }\n}\n");
        byte[] latin1 = "class L { String s = \"caf\u00e9\"; void g(int x) {} }\n".getBytes(StandardCharsets.ISO_8859_1);
        Files.createDirectories(inRoot.resolve("p"));
        Files.write(inRoot.resolve("p/L.java"), latin1);
        Path outRoot = tmp.resolve("out");

        ParamDuplicatorResult res = service.rewriteTree(inRoot, outRoot, List.of(), new ParamDuplicatorOptions());

        assertEquals(2, res.files.size());
        assertEquals(1, res.totalModified());
        assertEquals(1, res.parseFailures().size());
        assertEquals("p/L.java", res.parseFailures().get(0).relativePath);
        assertTrue(res.parseFailures().get(0).parseError.startsWith("not valid UTF-8"));
        assertArrayEquals(latin1, Files.readAllBytes(outRoot.resolve("p/L.java")));
        assertTrue(Files.readString(outRoot.resolve("p/A.java")).contains("void f(int value, int newValue)"));
    }
}
