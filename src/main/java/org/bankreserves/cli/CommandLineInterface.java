package org.bankreserves.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.bankreserves.cli.commands.BatchCommand;
import org.bankreserves.cli.commands.RunCommand;
import org.bankreserves.cli.config.LoggingConfigurator;
import org.bankreserves.runtime.ModelConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "bank-reserves",
    mixinStandardHelpOptions = true,
    version = "Bank Reserves 1.0",
    description = "Bank Reserves - agent-based simulation of money creation through a fractional-reserve bank",
    subcommands = {
        RunCommand.class,
        BatchCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Root path of the application's settings inside the configuration. */
    public static final String ROOT_PATH = "bank-reserves";

    private static final String CONFIG_FILE_NAME = "bank-reserves.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: bank-reserves.conf)"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("bank-reserves");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        // Initialize logger early for config loading feedback
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            final File file = resolveConfigFile(logger);
            // Config load order: System Props > Env Vars > File > Classpath defaults
            Config fallback = ConfigFactory.load();
            if (file != null) {
                fallback = ConfigFactory.parseFile(file).withFallback(fallback);
            }
            this.config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fallback)
                    .resolve();
        } catch (ConfigException e) {
            throw new ModelConfigurationException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        // Logging setup
        if (config.hasPath("logging.format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                    LoggingConfigurator.appenderFor(config.getString("logging.format")));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    /**
     * Finds the configuration file to layer over the classpath defaults.
     * Precedence: {@code --config}, then {@code -Dconfig.file}, then {@code bank-reserves.conf}
     * in the working directory.
     *
     * @return the file, or {@code null} when only classpath defaults apply
     * @throws ModelConfigurationException if an explicitly named file does not exist
     */
    private File resolveConfigFile(final Logger logger) {
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new ModelConfigurationException("Configuration file specified via --config was not found: "
                        + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return this.configFile;
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new ModelConfigurationException("Configuration file specified via -Dconfig.file was not found: "
                        + systemConfigFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
            return systemConfigFile;
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
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
     * Returns the fully resolved configuration, loading it on first access.
     *
     * @return the root configuration
     * @throws ModelConfigurationException if the configuration cannot be loaded
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return the {@code bank-reserves} block of the configuration
     */
    public Config getApplicationConfig() {
        return getConfig().getConfig(ROOT_PATH);
    }
}
