package uromanjavacli;

import picocli.CommandLine.*;
import uromanjava.RuleStore;
import uromanjava.RuleStoreSnapshot;

import java.io.File;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(name = "rulegen", description = "\033[1;34mGenerate the rule store snapshot for uromanjava\033[0m", mixinStandardHelpOptions = true)
public class RulegenCommand implements Runnable {

    @Option(names = {"-f", "--format"}, description = "Snapshot format: [json]", defaultValue = "json")
    private String format;

    @Option(names = {"-r", "--rules"}, paramLabel = "<dir>", defaultValue = "rules",
            description = "Rule directory containing rulesets.json (default: ${DEFAULT-VALUE})")
    private String rulesDir;

    @Option(names = {"-o", "--output"}, paramLabel = "<filename>", description = "Output filename")
    private String output;

    private static final Logger LOGGER = Logger.getLogger(RulegenCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public void run() {
        try {
            String defaultOutput = "json".equals(format) ? RuleStoreSnapshot.FILE_NAME : null;
            if (defaultOutput == null) {
                LOGGER.severe("Unsupported format: " + format);
                System.err.println("❌ Unsupported format: " + format);
                System.exit(1);
            }

            String outputFile = (output != null) ? output : defaultOutput;
            File outputPath = Paths.get(outputFile).toAbsolutePath().toFile();

            RuleStore store = RuleStore.fromRules(rulesDir);
            store.serializeToJson(outputPath.getAbsolutePath());
            System.out.println(BLUE + "Rule store (" + store.getRuleSets().size() + " rule sets, "
                    + store.ruleCount() + " rules) saved in JSON format at: " + outputPath + RESET);

        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Exception during rule store generation", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            System.exit(1);
        }
    }
}
