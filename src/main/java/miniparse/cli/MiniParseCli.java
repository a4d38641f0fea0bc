package miniparse.cli;

import ch.qos.logback.classic.LoggerContext;
import miniparse.GrammarDefectException;
import miniparse.IniService;
import miniparse.MiniParse;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "miniparse", description = "Simple cli tool to introspect .ini files",
        version = "1.0", mixinStandardHelpOptions = true)
public class MiniParseCli implements Callable<Integer> {

    public static final int EXIT_FOUND = 0;
    public static final int EXIT_NOT_FOUND = 1;
    public static final int EXIT_UNREADABLE = 2;
    public static final int EXIT_INTERNAL_ERROR = 3;

    private static final Logger log = LoggerFactory.getLogger(MiniParseCli.class);
    private static final String INI_EXTENSION = ".ini";

    @CommandLine.Option(names = {"-p", "--path"}, required = true, description = "File path of the .ini file")
    private Path path;

    @CommandLine.Option(names = {"-s", "--section"}, description = "Section name. Leave empty for global section.")
    private String section;

    @CommandLine.Option(names = {"-k", "--key"}, required = true, description = "Key name")
    private String key;

    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = "WARNINGS",
            description = "Verbosity: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Verbosity verbosity;

    private final IniService iniService;

    public MiniParseCli() {
        this(new MiniParse());
    }

    MiniParseCli(IniService iniService) {
        this.iniService = iniService;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new MiniParseCli()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(MiniParseCli cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        applyVerbosity(verbosity);

        if (!StringUtils.endsWith(String.valueOf(path.getFileName()), INI_EXTENSION)) {
            log.warn("Specified file does not have an .ini extension!");
        }

        String contents;
        try {
            contents = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Failed to read {}", path, e);
            System.err.println("Error: could not read " + path + ": " + e.getMessage());
            return EXIT_UNREADABLE;
        }

        Optional<String> found;
        try {
            found = iniService.find(contents, key, section);
        } catch (GrammarDefectException e) {
            log.error("Parser grammar is inconsistent", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_INTERNAL_ERROR;
        }

        if (found.isEmpty()) {
            System.err.println("Error: The given section did not contain the specified key");
            return EXIT_NOT_FOUND;
        }
        System.out.print(found.get());
        System.out.flush();
        return EXIT_FOUND;
    }

    static void applyVerbosity(Verbosity verbosity) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(verbosity.getLevel());
    }
}
