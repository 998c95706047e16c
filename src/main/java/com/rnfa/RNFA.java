package com.rnfa;

import com.rnfa.error.RegexException;
import com.rnfa.json.WordListReader;
import com.rnfa.output.OutputFormatter;
import com.rnfa.regex.ParsedRegex;
import com.rnfa.regex.ParserOptions;
import com.rnfa.regex.RegexParser;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "rnfa", mixinStandardHelpOptions = true, version = "1.0",
         description = "Compile a regular expression into an NFA and test words against it")
public class RNFA implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(RNFA.class);

    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_IO_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "The non-empty regex to be parsed")
    private String regex;

    @Option(names = {"-w", "--word"}, description = "A word to test against the regex (repeatable)")
    private List<String> words;

    @Option(names = {"-f", "--words-file"}, description = "JSON file holding an array of words to test")
    private File wordsFile;

    @Option(names = {"-v", "--verbose"}, description = "Also print the escaped, preprocessed and postfix forms")
    private boolean verbose = false;

    @Option(names = {"-j", "--json"}, description = "Print the expression tree and NFA as JSON")
    private boolean jsonOutput = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = "--lenient-escapes", description = "Drop a trailing lone backslash instead of failing")
    private boolean lenientEscapes = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RNFA()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            RegexParser parser = new RegexParser(new ParserOptions(lenientEscapes));
            ParsedRegex parsed = parser.parse(regex);

            out.println();
            out.println("Raw regex in infix notation:\t\t " + parsed.raw());
            if (verbose) {
                out.println("Escaped regex in infix notation:\t " + parsed.escapedRegex());
                out.println("Preprocessed regex in infix notation:\t " + parsed.preprocessedRegex());
                out.println("Converted regex in postfix notation:\t " + parsed.postfixRegex());
            }

            OutputFormatter formatter = new OutputFormatter(jsonOutput, !compactOutput);
            out.println(formatter.format(parsed.tree()));
            out.println(formatter.format(parsed.nfa()));
            out.println();

            for (String word : collectWords()) {
                if (parsed.recognize(word)) {
                    out.println("The word " + word + " matches the regular expression " + regex + ".");
                } else {
                    out.println("The word " + word + " doesn't match the regular expression " + regex + ".");
                }
            }
            out.flush();
            return 0;
        } catch (RegexException e) {
            LOG.debug("Rejected input for regex '{}'", regex, e);
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (IOException e) {
            LOG.debug("Failed to read words file {}", wordsFile, e);
            err.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    private MutableList<String> collectWords() throws IOException {
        MutableList<String> all = words != null ? Lists.mutable.withAll(words) : Lists.mutable.empty();
        if (wordsFile != null) {
            try (InputStream input = new FileInputStream(wordsFile)) {
                all.addAll(new WordListReader().read(input));
            }
        }
        return all;
    }
}
