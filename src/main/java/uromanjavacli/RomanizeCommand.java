package uromanjavacli;

import picocli.CommandLine.*;
import uromanjava.RomFormat;
import uromanjava.Uroman;
import uromanjava.UromanOptions;

import java.io.*;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.logging.*;

/**
 * Subcommand for romanizing text, a file or standard input.
 */
@Command(name = "romanize", description = "\033[1;34mRomanize text using uromanjava\033[0m", mixinStandardHelpOptions = true)
public class RomanizeCommand implements Runnable {
    @Parameters(paramLabel = "<text>", arity = "0..*", description = "Text to romanize (words are joined with spaces)")
    private List<String> text;

    @Option(names = "--list-languages", description = "List all known ISO 639-3 language codes")
    private boolean listLanguages;

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input file")
    private File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file")
    private File output;

    @Option(names = {"-l", "--lcode"}, paramLabel = "<code>", description = "ISO 639-3 language code (default: detect from script)")
    private String lcode;

    @Option(names = {"-f", "--format"}, paramLabel = "<format>", defaultValue = "str",
            description = "Output format: str, edges, alts or lattice (default: ${DEFAULT-VALUE})")
    private String format;

    @Option(names = "--decode-unicode", description = "Decode \\uXXXX escapes in the input first")
    private boolean decodeUnicode;

    @Option(names = "--max-lines", paramLabel = "<n>", description = "Process at most <n> lines")
    private Integer maxLines;

    @Option(names = "--strict", description = "Reject unknown language codes")
    private boolean strict;

    @Option(names = "--rules", paramLabel = "<dir>", description = "Rule directory containing rulesets.json")
    private String rulesDir;

    @Option(names = {"--in-enc"}, paramLabel = "<encoding>", defaultValue = "UTF-8", description = "Input encoding")
    private String inEncoding;

    @Option(names = {"--out-enc"}, paramLabel = "<encoding>", defaultValue = "UTF-8", description = "Output encoding")
    private String outEncoding;

    @Option(names = {"-v", "--verbose"}, description = "Log rule loading details")
    private boolean verbose;

    private static final Logger LOGGER = Logger.getLogger(RomanizeCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public void run() {
        if (verbose) {
            Uroman.setVerboseLogging(true);
        }
        try {
            Uroman uroman = new Uroman(UromanOptions.builder()
                    .strict(strict)
                    .ruleDirectory(rulesDir)
                    .build());

            if (listLanguages) {
                System.out.println("Known language codes:");
                for (Map.Entry<String, String> e : uroman.getLanguages().entrySet()) {
                    System.out.println("  " + e.getKey() + "  " + e.getValue());
                }
                return;
            }

            handleRomanization(uroman);
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during romanization", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            System.exit(1);
        }
    }

    private void handleRomanization(Uroman uroman) throws IOException {
        RomFormat romFormat = RomFormat.fromStr(format);
        int lines;

        try (BufferedReader reader = openInput();
             Writer writer = openOutput()) {
            lines = uroman.romanizeFile(reader, writer, lcode, romFormat, maxLines, decodeUnicode);
        }

        String inFrom = (text != null && !text.isEmpty()) ? "<args>" : (input != null) ? input.getPath() : "<stdin>";
        String outTo = (output != null) ? output.getPath() : "stdout";
        if (System.console() != null) {
            System.err.println(BLUE + "Romanization completed (" + romFormat.asStr() + ", " + lines + " lines): "
                    + inFrom + " → " + outTo + RESET);
        }
    }

    private BufferedReader openInput() throws IOException {
        if (text != null && !text.isEmpty()) {
            return new BufferedReader(new StringReader(String.join(" ", text)));
        }
        Charset inputCharset = Charset.forName(inEncoding);
        if (input != null) {
            return Files.newBufferedReader(input.toPath(), inputCharset);
        }
        if (System.console() != null) {
            System.err.println("Input (Charset: " + inputCharset + ")");
            System.err.println("Input text to romanize, <Ctrl+D> (Unix) <Ctrl-Z> (Windows) to submit:");
        }
        return new BufferedReader(new InputStreamReader(System.in, inputCharset));
    }

    private Writer openOutput() throws IOException {
        Charset outputCharset = Charset.forName(outEncoding);
        if (output != null) {
            return Files.newBufferedWriter(output.toPath(), outputCharset);
        }
        // Keep System.out open after the command finishes.
        return new BufferedWriter(new OutputStreamWriter(new FilterOutputStream(System.out) {
            @Override
            public void close() throws IOException {
                flush();
            }
        }, outputCharset));
    }
}
