package com.ciro.jsonui.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * {@code jsonui build|validate [--config jsonui.config.json]}.
 * <p>
 * Código de salida: 0 si todo compiló, 1 si algún documento no se pudo parsear, 2 por
 * argumentos o configuración inválidos.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int DOCUMENT_FAILURES = 1;
    static final int USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length == 0) {
            usage();
            return USAGE;
        }
        String command = args[0];
        if (!command.equals("build") && !command.equals("validate")) {
            log.error("Unknown command: {}", command);
            usage();
            return USAGE;
        }
        Path configFile = Path.of(ConfigLoader.DEFAULT_FILE);
        for (int i = 1; i < args.length; i++) {
            if ((args[i].equals("--config") || args[i].equals("-c")) && i + 1 < args.length) {
                configFile = Path.of(args[++i]);
            } else {
                log.error("Unknown argument: {}", args[i]);
                usage();
                return USAGE;
            }
        }

        CompilerConfig config;
        try {
            config = new ConfigLoader().load(configFile);
        } catch (ConfigException e) {
            log.error(e.getMessage());
            return USAGE;
        }
        Path root = configFile.toAbsolutePath().getParent();
        BatchCompiler batch = new BatchCompiler(config, root);

        BatchReport report = command.equals("build") ? batch.build() : batch.validate();
        if (report.hasFailures()) {
            log.error("Failed documents: {}", String.join(", ", report.failed()));
            return DOCUMENT_FAILURES;
        }
        return OK;
    }

    private static void usage() {
        System.err.println("Usage: jsonui <build|validate> [--config <jsonui.config.json>]");
    }
}
