package com.micaixbrl.cli;

import com.micaixbrl.core.config.ConfigLoader;
import com.micaixbrl.core.config.ProjectConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to write a default {@code mica-ixbrl.yaml}.
 */
@Command(
    name = "init",
    description = "Write a default configuration file",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "Configuration file to write", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Option(names = {"-f", "--force"}, description = "Overwrite an existing file")
    private boolean force;

    @Override
    public Integer call() {
        if (Files.exists(configFile) && !force) {
            spec.commandLine().getErr().println(
                "✗ Configuration file already exists: " + configFile + " (use --force to overwrite)");
            return 1;
        }
        try {
            ConfigLoader.write(configFile, ProjectConfig.defaults());
        } catch (UncheckedIOException e) {
            spec.commandLine().getErr().println("✗ Init failed: " + e.getMessage());
            return 1;
        }
        spec.commandLine().getOut().println("✓ Created " + configFile);
        return 0;
    }
}
