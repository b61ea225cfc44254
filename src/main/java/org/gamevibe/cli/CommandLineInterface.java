package org.gamevibe.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.gamevibe.cli.commands.CompileCommand;
import org.gamevibe.cli.commands.ValidateCommand;
import org.gamevibe.cli.config.LoggingConfigurator;
import org.gamevibe.compiler.api.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "gdlc",
    mixinStandardHelpOptions = true,
    version = "gdlc 1.0",
    description = "gdlc - compiles Game Description Language sources to TypeScript",
    subcommands = {
        CompileCommand.class,
        ValidateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for a successful run. */
    public static final int EXIT_OK = 0;
    /** Exit code when the source has errors. */
    public static final int EXIT_DIAGNOSTICS = 1;
    /** Exit code when files or configuration cannot be used. */
    public static final int EXIT_FAILURE = 2;

    private static final String CONFIG_FILE_NAME = "gdl.conf";
    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: gdl.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("gdlc");
        System.exit(commandLine.execute(args));
    }

    /**
     * Returns the effective configuration, loading it on first use.
     * Load order: system properties, environment, the {@code --config} file (or {@code gdl.conf}
     * in the working directory), then the classpath defaults.
     *
     * @return The resolved configuration.
     * @throws CompilationException if the configuration file is missing or invalid.
     */
    public Config getConfig() throws CompilationException {
        if (config == null) {
            config = loadConfig();
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    private Config loadConfig() throws CompilationException {
        try {
            Config fileConfig = ConfigFactory.empty();
            if (configFile != null) {
                if (!configFile.exists()) {
                    throw new CompilationException("Configuration file specified via --config was not found: "
                            + configFile.getAbsolutePath());
                }
                LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(configFile);
            } else {
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    fileConfig = ConfigFactory.parseFile(cwdConfigFile);
                } else {
                    LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                }
            }
            // Config load order: System Props > Env Vars > File > Classpath defaults
            return ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fileConfig)
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } catch (ConfigException e) {
            throw new CompilationException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }
}
