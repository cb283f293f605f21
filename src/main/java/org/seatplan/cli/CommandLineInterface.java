package org.seatplan.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.seatplan.cli.commands.SolveCommand;
import org.seatplan.cli.commands.ValidateCommand;
import org.seatplan.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "seatplan",
    mixinStandardHelpOptions = true,
    version = "Seatplan 1.0",
    description = "Seatplan - seats guests at tables by replica-exchange simulated annealing",
    subcommands = {
        SolveCommand.class,
        ValidateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "seatplan.conf";

    @Option(
        names = {"--config"},
        description = "Path to custom configuration file (default: seatplan.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Builds the picocli command line with the settings the application runs with.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("seatplan");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        final File selectedFile = selectConfigFile(logger);
        // Config load order: System Props > Env Vars > File > Classpath defaults
        Config loaded = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
        if (selectedFile != null) {
            loaded = loaded.withFallback(ConfigFactory.parseFile(selectedFile));
        }
        this.config = loaded.withFallback(ConfigFactory.load()).resolve();

        if (config.hasPath("logging.format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                    LoggingConfigurator.appenderFor(config.getString("logging.format")));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    /**
     * Resolves which configuration file to layer over the classpath defaults.
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file named by the {@code config.file} system property</li>
     *   <li>{@value #CONFIG_FILE_NAME} in the working directory</li>
     * </ol>
     *
     * @return the file, or {@code null} when the classpath defaults are used alone
     * @throws ConfigException if an explicitly requested file does not exist
     */
    private File selectConfigFile(Logger logger) {
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new ConfigException.Generic(
                        "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            logger.debug("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return this.configFile;
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new ConfigException.Generic(
                        "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile.getAbsolutePath());
            }
            logger.debug("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
            return systemConfigFile;
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.debug("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }

        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return null;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the resolved configuration, loading it on first access.
     *
     * @throws ConfigException if the configuration cannot be found or parsed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
