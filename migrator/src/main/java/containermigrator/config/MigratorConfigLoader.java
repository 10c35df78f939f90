package containermigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Loads migrator configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code migrator.properties} on the classpath</li>
 *   <li>{@code migrator.yml} on the classpath</li>
 * </ol>
 *
 * <p>YAML documents are flattened into dotted keys, so
 * {@code migrator: {timeout: {dump: 60}}} is read as {@code migrator.timeout.dump=60}.
 * System properties override file-based values (e.g., {@code -Dmigrator.timeout.dump=60}).
 * An unparseable value is logged and the default is kept.
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migrator.criu.binary} - local checkpoint tool binary</li>
 *   <li>{@code migrator.checkpoint.dir} - base directory for standalone checkpoints</li>
 *   <li>{@code migrator.work.dir} - local working directory</li>
 *   <li>{@code migrator.target.work.dir} - working directory on the target</li>
 *   <li>{@code migrator.target.criu.ssh} / {@code migrator.target.criu.adb} - remote tool invocation</li>
 *   <li>{@code migrator.runtime.command} - container runtime executable</li>
 *   <li>{@code migrator.transport.ssh.command}, {@code .scp.command}, {@code .adb.command}</li>
 *   <li>{@code migrator.timeout.probe}, {@code .dump}, {@code .restore}, {@code .transfer},
 *       {@code .remote.exec} - timeouts in seconds, 0 for none</li>
 *   <li>{@code migrator.validation.poll.interval} - milliseconds</li>
 *   <li>{@code migrator.integrity.require.sidecar} - true or false</li>
 *   <li>{@code migrator.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigratorConfig
 */
public final class MigratorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigratorConfigLoader.class);

    static final String PROPERTIES_FILE = "migrator.properties";
    static final String YAML_FILE = "migrator.yml";

    private MigratorConfigLoader() {}

    /**
     * Load from classpath (migrator.properties or migrator.yml).
     * @throws MigratorConfigException if no config file found
     */
    public static MigratorConfig load() {
        return loadFromClasspath().orElseThrow(() -> new MigratorConfigException(
                "Config file required: " + PROPERTIES_FILE + " or " + YAML_FILE));
    }

    /**
     * Load from classpath, falling back to {@link MigratorConfig#DEFAULTS}
     * (with system-property overrides applied) when no file is present.
     */
    public static MigratorConfig loadOrDefaults() {
        return loadFromClasspath().orElseGet(() -> {
            log.debug("No {} or {} on classpath, using defaults", PROPERTIES_FILE, YAML_FILE);
            return parse(new Properties());
        });
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigratorConfigException if the configuration is invalid
     */
    public static MigratorConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static Optional<MigratorConfig> loadFromClasspath() {
        try (InputStream is = getResource(PROPERTIES_FILE)) {
            if (is != null) {
                return Optional.of(loadProperties(is, PROPERTIES_FILE));
            }
        } catch (IOException e) {
            throw new MigratorConfigException("Failed to read " + PROPERTIES_FILE, e);
        }
        try (InputStream is = getResource(YAML_FILE)) {
            if (is != null) {
                return Optional.of(loadYaml(is, YAML_FILE));
            }
        } catch (IOException e) {
            throw new MigratorConfigException("Failed to read " + YAML_FILE, e);
        }
        return Optional.empty();
    }

    private static InputStream getResource(String name) {
        return MigratorConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigratorConfig loadProperties(InputStream is, String source) {
        try {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigratorConfigException("Failed to load " + source, e);
        }
    }

    private static MigratorConfig loadYaml(InputStream is, String source) {
        Object root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new MigratorConfigException("Failed to parse " + source, e);
        }
        Properties props = new Properties();
        if (root instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) root;
            flatten("", map, props);
        } else if (root != null) {
            throw new MigratorConfigException(source + " must contain a mapping at the top level");
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static MigratorConfig parse(Properties props) {
        MigratorConfig.Builder b = MigratorConfig.builder();

        getString(props, "migrator.criu.binary").ifPresent(v -> b.criuBinary(Path.of(v)));
        getString(props, "migrator.checkpoint.dir").ifPresent(v -> b.checkpointDir(Path.of(v)));
        getString(props, "migrator.work.dir").ifPresent(v -> b.workDir(Path.of(v)));
        getString(props, "migrator.target.work.dir").ifPresent(guarded("target.work.dir", b::targetWorkDir));
        getString(props, "migrator.target.criu.ssh").ifPresent(guarded("target.criu.ssh", b::targetCriuSsh));
        getString(props, "migrator.target.criu.adb").ifPresent(guarded("target.criu.adb", b::targetCriuAdb));
        getString(props, "migrator.runtime.command").ifPresent(guarded("runtime.command", b::runtimeCommand));
        getString(props, "migrator.transport.ssh.command").ifPresent(guarded("transport.ssh.command", b::sshCommand));
        getString(props, "migrator.transport.scp.command").ifPresent(guarded("transport.scp.command", b::scpCommand));
        getString(props, "migrator.transport.adb.command").ifPresent(guarded("transport.adb.command", b::adbCommand));

        getLong(props, "migrator.timeout.probe").ifPresent(guarded("timeout.probe", v -> b.probeTimeoutSeconds(v)));
        getLong(props, "migrator.timeout.dump").ifPresent(guarded("timeout.dump", v -> b.dumpTimeoutSeconds(v)));
        getLong(props, "migrator.timeout.restore").ifPresent(guarded("timeout.restore", v -> b.restoreTimeoutSeconds(v)));
        getLong(props, "migrator.timeout.transfer").ifPresent(guarded("timeout.transfer", v -> b.transferTimeoutSeconds(v)));
        getLong(props, "migrator.timeout.remote.exec").ifPresent(guarded("timeout.remote.exec", v -> b.remoteExecTimeoutSeconds(v)));

        getLong(props, "migrator.validation.poll.interval").ifPresent(v -> {
            if (v > 0) {
                b.validationPollIntervalMillis(v);
            } else {
                log.warn("Invalid validation.poll.interval: {}", v);
            }
        });

        getString(props, "migrator.integrity.require.sidecar").ifPresent(v -> {
            if ("true".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v)) {
                b.requireSidecar(Boolean.parseBoolean(v));
            } else {
                log.warn("Invalid integrity.require.sidecar: {}", v);
            }
        });

        getString(props, "migrator.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static <T> Consumer<T> guarded(String name, Consumer<T> setter) {
        return v -> {
            try {
                setter.accept(v);
            } catch (MigratorConfigException e) {
                log.warn("Invalid {}: {}", name, e.getMessage());
            }
        };
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
