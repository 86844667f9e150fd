package uromanjavacli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "uromancli",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mUniversal romanizer (uromanjava) CLI\033[0m",
        subcommands = {
                RomanizeCommand.class,
                RulegenCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (romanize / rulegen)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
