package com.github.musiKk.stubs;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.stubs.parser.ParseTarget;

import lombok.Setter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command line front end: parses each stub file given and writes its
 * canonical form to standard output. Flags override {@code stubs.cfg},
 * which overrides the default target.
 */
@Command(
        name = "StubTool",
        description = "Parses type stubs for a target interpreter and prints their canonical form."
)
public class StubTool implements Callable<Integer>, ConfigReader.ConfigTarget {

    private static final Logger log = LoggerFactory.getLogger(StubTool.class);

    @Spec
    private CommandSpec spec;

    // from stubs.cfg
    @Setter
    private String version = ParseTarget.DEFAULT.versionString();
    @Setter
    private String platform = ParseTarget.DEFAULT.platform();

    @Option(names = "--version", paramLabel = "X.Y[.Z]", description = "Target interpreter version")
    private String versionOption;

    @Option(names = "--platform", paramLabel = "P", description = "Target platform, e.g. linux or win32")
    private String platformOption;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    private boolean help;

    @Parameters(arity = "1..*", paramLabel = "file", description = "Stub files to parse")
    private List<Path> files;

    public static void main(String[] args) {
        var tool = new StubTool();
        ConfigReader.readConfig().applyConfig(tool);
        System.exit(tool.run(args, System.out, System.err));
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        var outWriter = new PrintWriter(out, true);
        var errWriter = new PrintWriter(err, true);
        int status = new CommandLine(this)
                .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.OFF))
                .setOut(outWriter)
                .setErr(errWriter)
                .execute(args);
        outWriter.flush();
        errWriter.flush();
        return status;
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        ParseTarget target;
        try {
            target = ParseTarget.of(
                    versionOption != null ? versionOption : version,
                    platformOption != null ? platformOption : platform);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        for (var file : files) {
            log.info("parsing {} for {} on {}", file, target.versionString(), target.platform());
            try {
                var source = Files.readString(file);
                out.print(StubPrinter.print(StubParser.parse(source, target)));
            } catch (ParseError e) {
                err.println(e.describe(file.toString()));
                return 1;
            } catch (IOException e) {
                err.println(file + ": cannot read: " + e.getMessage());
                return 1;
            }
        }
        out.flush();
        return 0;
    }

}
