package com.ciro.ncl.standalone;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Carga la configuración del servidor. Gana, en este orden: argumentos
 * {@code --clave=valor}, variables de entorno, {@code -Dclave=valor},
 * {@code ncl-preview.conf} del directorio de trabajo y {@code reference.conf}.
 * Una clave sin puntos se entiende bajo {@code ncl.server} ({@code --port=9090}).
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "ncl-preview.conf";
    private static final String SERVER_PREFIX = "ncl.server.";

    private ConfigLoader() {}

    public static Config load(String[] args) {
        return load(new File(CONFIG_FILE_NAME), args);
    }

    static Config load(File configFile) {
        return load(configFile, new String[0]);
    }

    static Config load(File configFile, String[] args) {
        final Config argsConfig = ConfigFactory.parseMap(argOverrides(args), "command line");
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            log.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            log.info("Configuration file '{}' not found, using defaults", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return argsConfig
            .withFallback(envConfig)
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    static Map<String, String> argOverrides(String[] args) {
        Map<String, String> overrides = new LinkedHashMap<>();
        if (args == null) return overrides;
        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (!arg.startsWith("--") || eq <= 2) {
                log.warn("Ignoring argument '{}' (expected --key=value)", arg);
                continue;
            }
            String key = arg.substring(2, eq).trim();
            overrides.put(key.contains(".") ? key : SERVER_PREFIX + key, arg.substring(eq + 1));
        }
        return overrides;
    }
}
