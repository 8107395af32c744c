package info.isaksson.erland.paramdup;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MainCliArgsTest {

    @Test
    void parsesFlagsAndValues() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "-i", "src", "-o", "out",
                "--exclude", "**/generated/**", "--exclude=legacy",
                "--include-tests",
                "--include-constructors", "yes",
                "--threads", "3",
                "--write-report", "report.json",
                "-v"
        });
        assertEquals("src", a.input);
        assertEquals("out", a.output);
        assertEquals(List.of("**/generated/**", "legacy"), a.excludes);
        assertTrue(a.includeTests);
        assertTrue(a.includeConstructors);
        assertEquals(3, a.threads);
        assertEquals("report.json", a.writeReport);
        assertTrue(a.verbose);
        assertFalse(a.help);
    }

    @Test
    void defaults() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {"In.java", "Out.java"});
        assertEquals("In.java", a.input);
        assertEquals("Out.java", a.output);
        assertFalse(a.includeConstructors);
        assertFalse(a.includeTests);
        assertFalse(a.verbose);
        assertEquals(0, a.threads);
        assertNull(a.writeReport);
        assertTrue(a.excludes.isEmpty());
    }

    @Test
    void rejectsThirdPositional() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Main.CliArgs.parse(new String[] {"a", "b", "c"}));
        assertTrue(ex.getMessage().contains("c"));
    }

    @Test
    void rejectsUnknownFlag() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--frobnicate"}));
    }

    @Test
    void rejectsMissingValue() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--input"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--output", "--verbose"}));
    }

    @Test
    void validatesBooleansAndThreads() {
        assertFalse(Main.CliArgs.parseBoolean("FALSE", "--include-constructors"));
        assertTrue(Main.CliArgs.parseBoolean(" 1 ", "--include-constructors"));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parseBoolean("maybe", "--include-constructors"));

        assertEquals(8, Main.CliArgs.parsePositiveInt("8", "--threads"));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parsePositiveInt("0", "--threads"));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parsePositiveInt("many", "--threads"));
    }

    @Test
    void helpFlag() {
        assertTrue(Main.CliArgs.parse(new String[] {"-h"}).help);
        assertEquals(0, Main.run(new String[] {"--help"}));
    }
}
