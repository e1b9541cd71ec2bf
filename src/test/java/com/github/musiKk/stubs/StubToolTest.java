package com.github.musiKk.stubs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class StubToolTest {

    private static final String SOURCE = """
            if sys.version_info >= (3,):
              x = ...  # type: str
            elif sys.platform == "win32":
              x = ...  # type: bytes
            else:
              x = ...  # type: int
            """;

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(StubTool tool, String... args) {
        return tool.run(args, new PrintStream(out, true), new PrintStream(err, true));
    }

    @Test
    public void testDefaultTarget() throws IOException {
        var file = write("x.pyi", SOURCE);
        assertEquals(0, run(new StubTool(), file));
        assertEquals("x = ...  # type: int\n", out.toString());
    }

    @Test
    public void testFlagsSelectTarget() throws IOException {
        var file = write("x.pyi", SOURCE);
        assertEquals(0, run(new StubTool(), "--platform=win32", file));
        assertEquals("x = ...  # type: bytes\n", out.toString());

        out.reset();
        assertEquals(0, run(new StubTool(), "--version=3.6", file));
        assertEquals("x = ...  # type: str\n", out.toString());
    }

    @Test
    public void testConfigFileSetsTarget() throws IOException {
        var config = Files.writeString(dir.resolve(ConfigReader.CONFIG_FILE), "version = 3.5.2\nplatform = darwin\n");
        var tool = new StubTool();
        ConfigReader.readConfig(config).applyConfig(tool);

        var file = write("x.pyi", SOURCE);
        assertEquals(0, run(tool, file));
        assertEquals("x = ...  # type: str\n", out.toString());

        // flags win over the file
        out.reset();
        tool = new StubTool();
        ConfigReader.readConfig(config).applyConfig(tool);
        assertEquals(0, run(tool, "--version=2.7", file));
        assertEquals("x = ...  # type: int\n", out.toString());
    }

    @Test
    public void testMissingConfigFileMeansDefaults() {
        var tool = new StubTool();
        var config = ConfigReader.readConfig(dir.resolve("missing.cfg"));
        assertEquals("2.7.6", config.version);
        assertEquals("linux", config.platform);
        config.applyConfig(tool);
    }

    @Test
    public void testParseErrorIsReportedWithFileAndLine() throws IOException {
        var file = write("bad.pyi", "x = ...  # type: int\n\ndef foo(*) -> int: ...\n");
        assertEquals(1, run(new StubTool(), file));
        assertEquals(file + ":3: Named arguments must follow bare *", err.toString().trim());
        assertEquals("", out.toString());
    }

    @Test
    public void testModuleWideErrorHasNoLine() throws IOException {
        var file = write("dup.pyi", "x = ...  # type: int\nx = ...  # type: str\n");
        assertEquals(1, run(new StubTool(), file));
        assertEquals(file + ": Duplicate top-level identifier(s): x", err.toString().trim());
    }

    @Test
    public void testUnreadableFile() {
        var missing = dir.resolve("missing.pyi").toString();
        assertEquals(1, run(new StubTool(), missing));
        assertTrue(err.toString().startsWith(missing + ": cannot read: "));
    }

    @Test
    public void testUsage() {
        assertEquals(2, run(new StubTool()));
        assertTrue(err.toString().contains("Usage: StubTool"));

        err.reset();
        assertEquals(2, run(new StubTool(), "--verbose", "x.pyi"));
        assertTrue(err.toString().startsWith("Unknown option: '--verbose'"));
    }

    @ParameterizedTest
    @MethodSource("badVersions")
    public void testBadVersionFlagIsUsageError(String version) throws IOException {
        var file = write("x.pyi", SOURCE);
        assertEquals(2, run(new StubTool(), "--version=" + version, file));
        assertTrue(err.toString().contains(version));
        assertTrue(err.toString().contains("Usage: StubTool"));
        assertEquals("", out.toString());
    }

    @Test
    public void testBadVersionInConfigFileIsUsageError() throws IOException {
        var config = Files.writeString(dir.resolve(ConfigReader.CONFIG_FILE), "version = 3.x\n");
        var tool = new StubTool();
        ConfigReader.readConfig(config).applyConfig(tool);
        assertEquals(2, run(tool, write("x.pyi", SOURCE)));
        assertTrue(err.toString().startsWith("invalid version: 3.x"));

        // a good flag replaces the bad value
        err.reset();
        tool = new StubTool();
        ConfigReader.readConfig(config).applyConfig(tool);
        assertEquals(0, run(tool, "--version=3.6", write("x.pyi", SOURCE)));
        assertEquals("x = ...  # type: str\n", out.toString());
    }

    private static Object[][] badVersions() {
        return new Object[][] {
            { "3.x" },
            { "1.2.3.4" },
            { "99999999999" },
            { "" },
        };
    }

    private String write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content).toString();
    }

}
