package fr.lapetina.scheduler.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the scheduler YAML and keeps the replica's scheduling settings in step with it.
 *
 * The file is looked up on the file system first, then on the classpath. Only the sections
 * captured by {@link SchedulingSettings} are applied on reload; a reload that changes
 * startup-only settings is accepted with a warning. A file that fails validation never
 * replaces the current settings.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final String location;
    private final AtomicReference<Loaded> current = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService poller;

    /** Validated configuration with the file timestamp it was read at, null for classpath resources */
    private record Loaded(SchedulerConfig config, SchedulingSettings settings, FileTime modified) {
    }

    public ConfigLoader(String location) {
        this.location = location;
    }

    /**
     * Reads and validates the configuration, making it current. Listeners are not called.
     *
     * @throws ConfigurationException if the file is missing or invalid
     */
    public SchedulerConfig load() {
        Path file = Paths.get(location);
        FileTime modified = null;
        SchedulerConfig config;
        if (Files.exists(file)) {
            modified = modifiedTime(file);
            config = readFile(file);
        } else {
            config = readClasspath();
        }
        SchedulingSettings settings = settle(config);
        current.set(new Loaded(config, settings, modified));
        log.info("Configuration loaded: location={}, settings={}", location, describe(settings));
        return config;
    }

    /**
     * Parses and validates a configuration without making it current.
     *
     * @throws ConfigurationException if the document is invalid
     */
    public static SchedulerConfig parse(InputStream in) {
        SchedulerConfig config = readYaml(in, "stream");
        settle(config);
        return config;
    }

    /**
     * Re-reads the configuration and applies the scheduling settings that changed.
     *
     * @throws IllegalStateException if {@link #load()} never succeeded
     */
    public ReloadResult reload() {
        Loaded previous = current.get();
        if (previous == null) {
            throw new IllegalStateException("Configuration must be loaded before it can be reloaded");
        }

        Path file = Paths.get(location);
        FileTime modified = Files.exists(file) ? modifiedTime(file) : null;
        SchedulerConfig candidate;
        SchedulingSettings settings;
        try {
            candidate = modified != null ? readFile(file) : readClasspath();
            settings = settle(candidate);
        } catch (ConfigurationException e) {
            // Remember the timestamp so the poller does not retry the same broken file
            current.compareAndSet(previous, new Loaded(previous.config(), previous.settings(), modified));
            log.error("Configuration reload rejected, keeping current settings: location={}, reason={}",
                    location, e.getMessage());
            return ReloadResult.rejected(previous.settings(), e.getMessage());
        }

        List<String> restartOnly = candidate.restartOnlyChangesFrom(previous.config());
        if (!restartOnly.isEmpty()) {
            log.warn("Configuration changes ignored until restart: location={}, settings={}", location, restartOnly);
        }

        current.set(new Loaded(candidate, settings, modified));
        List<String> changed = settings.changesFrom(previous.settings());
        if (changed.isEmpty()) {
            log.info("Configuration reloaded, scheduling settings unchanged: location={}", location);
            return ReloadResult.unchanged(settings);
        }

        log.info("Configuration reloaded: location={}, changed={}, settings={}", location, changed, describe(settings));
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onSettingsChanged(previous.settings(), settings);
            } catch (RuntimeException e) {
                log.error("Scheduling settings listener failed: listener={}", listener, e);
            }
        }
        return ReloadResult.applied(settings, changed);
    }

    public SchedulerConfig getCurrentConfig() {
        Loaded loaded = current.get();
        return loaded != null ? loaded.config() : null;
    }

    public SchedulingSettings getCurrentSettings() {
        Loaded loaded = current.get();
        return loaded != null ? loaded.settings() : null;
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Polls the configuration file's modification time and reloads when it moves.
     * Classpath configurations are never watched.
     */
    public synchronized void startWatching(Duration interval) {
        Loaded loaded = current.get();
        if (loaded == null || loaded.modified() == null) {
            log.warn("Configuration is not backed by a file, hot reload disabled: location={}", location);
            return;
        }
        if (poller != null) {
            return;
        }
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-poller");
            t.setDaemon(true);
            return t;
        });
        long periodMs = Math.max(1, interval.toMillis());
        poller.scheduleWithFixedDelay(this::reloadIfModified, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Configuration hot reload enabled: location={}, intervalMs={}", location, periodMs);
    }

    private void reloadIfModified() {
        try {
            Path file = Paths.get(location);
            if (!Files.exists(file)) {
                return;
            }
            FileTime modified = Files.getLastModifiedTime(file);
            if (!modified.equals(current.get().modified())) {
                reload();
            }
        } catch (IOException | RuntimeException e) {
            log.error("Configuration poll failed: location={}", location, e);
        }
    }

    @Override
    public synchronized void close() {
        if (poller != null) {
            poller.shutdownNow();
            poller = null;
        }
    }

    private static SchedulingSettings settle(SchedulerConfig config) {
        if (config == null) {
            throw new ConfigurationException("Configuration is empty");
        }
        try {
            return config.validate();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static SchedulerConfig readFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return readYaml(in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration: " + file, e);
        }
    }

    private SchedulerConfig readClasspath() {
        String resource = location.startsWith("/") ? location.substring(1) : location;
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration not found on file system or classpath: " + location);
            }
            return readYaml(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath configuration: " + resource, e);
        }
    }

    private static SchedulerConfig readYaml(InputStream in, String origin) {
        Yaml yaml = new Yaml(new Constructor(SchedulerConfig.class, new LoaderOptions()));
        try {
            return yaml.load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    private static FileTime modifiedTime(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot stat configuration file: " + file, e);
        }
    }

    private static String describe(SchedulingSettings settings) {
        return settings.tierPolicies() + " redistribution=" + settings.redistribution()
                + " maxQueueSize=" + settings.maxQueueSize() + " maxQueueWaitMs=" + settings.maxQueueWait().toMillis();
    }

    /**
     * Missing, malformed or invalid configuration.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
