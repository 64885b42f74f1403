package com.challenges.hushfmt;

import com.challenges.hushfmt.json.AstDecoder;
import com.challenges.hushfmt.json.AstDocument;
import com.challenges.hushfmt.output.AstFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "hushfmt", mixinStandardHelpOptions = true, version = "1.0",
         description = "Render a dumped hush syntax tree as source text or as a diagnostic tree")
public class HushFmt implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(HushFmt.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "JSON tree dump (default: stdin)")
    private File inputFile;

    @Option(names = {"-d", "--diagnostic"}, description = "Dump raw tree structure with symbol handles")
    private boolean diagnostic = false;

    @Option(names = {"-x", "--expanded"}, description = "One entry per line in diagnostic output (implies -d)")
    private boolean expanded = false;

    @Option(names = {"-c", "--compact-output"}, description = "Render source on a single line")
    private boolean compactOutput = false;

    @Option(names = {"-C", "--color-output"}, description = "Colorize output")
    private boolean colorOutput = false;

    @Option(names = {"-M", "--monochrome-output"}, description = "Never colorize output")
    private boolean monochromeOutput = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HushFmt()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : System.in) {
            AstDocument document = new AstDecoder().read(input);

            boolean dump = diagnostic || expanded;
            AstFormatter formatter = dump
                ? AstFormatter.diagnostic(expanded)
                : AstFormatter.human(document.symbols(), !compactOutput, useColor());

            formatter.write(document.ast(), out);
            // diagnostic dumps already end with a newline
            if (!dump) {
                out.println();
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            LOGGER.debug("Rendering failed", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }

    private boolean useColor() {
        if (monochromeOutput) {
            return false;
        }
        return colorOutput || Ansi.AUTO.enabled();
    }
}
