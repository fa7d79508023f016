/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.rollinglog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration of one rolling log instance.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Drollinglog.directory=/var/log/app})</li>
 *   <li>Environment variables (e.g., {@code ROLLINGLOG_DIRECTORY})</li>
 *   <li>Properties file ({@code rollinglog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 * A value that cannot be parsed is logged at WARN and the next source is consulted.
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>directory</td><td>rollinglog.directory</td><td>ROLLINGLOG_DIRECTORY</td><td>logs</td></tr>
 *   <tr><td>fileName</td><td>rollinglog.fileName</td><td>ROLLINGLOG_FILE_NAME</td><td>record</td></tr>
 *   <tr><td>maxFileSize</td><td>rollinglog.maxFileSize</td><td>ROLLINGLOG_MAX_FILE_SIZE</td><td>20971520</td></tr>
 *   <tr><td>maxFiles</td><td>rollinglog.maxFiles</td><td>ROLLINGLOG_MAX_FILES</td><td>5</td></tr>
 *   <tr><td>async</td><td>rollinglog.async</td><td>ROLLINGLOG_ASYNC</td><td>true</td></tr>
 *   <tr><td>instantFlush</td><td>rollinglog.instantFlush</td><td>ROLLINGLOG_INSTANT_FLUSH</td><td>false</td></tr>
 *   <tr><td>instanceName</td><td>rollinglog.instanceName</td><td>ROLLINGLOG_INSTANCE_NAME</td><td>default</td></tr>
 *   <tr><td>minLevel</td><td>rollinglog.minLevel</td><td>ROLLINGLOG_MIN_LEVEL</td><td>DEBUG</td></tr>
 *   <tr><td>queueCapacity</td><td>rollinglog.queueCapacity</td><td>ROLLINGLOG_QUEUE_CAPACITY</td><td>8192</td></tr>
 *   <tr><td>offerTimeoutMs</td><td>rollinglog.offerTimeoutMs</td><td>ROLLINGLOG_OFFER_TIMEOUT_MS</td><td>0</td></tr>
 *   <tr><td>drainTimeoutMs</td><td>rollinglog.drainTimeoutMs</td><td>ROLLINGLOG_DRAIN_TIMEOUT_MS</td><td>5000</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # rollinglog.properties
 * rollinglog.directory=/var/log/myapp
 * rollinglog.maxFileSize=10485760
 * rollinglog.maxFiles=3
 * rollinglog.async=false
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * LogConfig config = LogConfig.builder()
 *     .instanceName("access")
 *     .directory(Path.of("/var/log/myapp"))
 *     .fileName("access")
 *     .async(false)
 *     .build();
 *
 * RollingLogger access = LoggerRegistry.global().init(config);
 * </pre>
 * <p>
 * The builder accepts any value; {@link #validate()} rejects unusable ones and is
 * called by {@link LoggerRegistry#init(LogConfig)} before anything touches disk.
 */
public final class LogConfig {

    private static final Logger LOG = LoggerFactory.getLogger(LogConfig.class);

    private static final String PROPERTIES_FILE = "rollinglog.properties";

    // Property keys
    private static final String PROP_DIRECTORY = "rollinglog.directory";
    private static final String PROP_FILE_NAME = "rollinglog.fileName";
    private static final String PROP_MAX_FILE_SIZE = "rollinglog.maxFileSize";
    private static final String PROP_MAX_FILES = "rollinglog.maxFiles";
    private static final String PROP_ASYNC = "rollinglog.async";
    private static final String PROP_INSTANT_FLUSH = "rollinglog.instantFlush";
    private static final String PROP_INSTANCE_NAME = "rollinglog.instanceName";
    private static final String PROP_MIN_LEVEL = "rollinglog.minLevel";
    private static final String PROP_QUEUE_CAPACITY = "rollinglog.queueCapacity";
    private static final String PROP_OFFER_TIMEOUT_MS = "rollinglog.offerTimeoutMs";
    private static final String PROP_DRAIN_TIMEOUT_MS = "rollinglog.drainTimeoutMs";

    // Environment variable keys
    private static final String ENV_DIRECTORY = "ROLLINGLOG_DIRECTORY";
    private static final String ENV_FILE_NAME = "ROLLINGLOG_FILE_NAME";
    private static final String ENV_MAX_FILE_SIZE = "ROLLINGLOG_MAX_FILE_SIZE";
    private static final String ENV_MAX_FILES = "ROLLINGLOG_MAX_FILES";
    private static final String ENV_ASYNC = "ROLLINGLOG_ASYNC";
    private static final String ENV_INSTANT_FLUSH = "ROLLINGLOG_INSTANT_FLUSH";
    private static final String ENV_INSTANCE_NAME = "ROLLINGLOG_INSTANCE_NAME";
    private static final String ENV_MIN_LEVEL = "ROLLINGLOG_MIN_LEVEL";
    private static final String ENV_QUEUE_CAPACITY = "ROLLINGLOG_QUEUE_CAPACITY";
    private static final String ENV_OFFER_TIMEOUT_MS = "ROLLINGLOG_OFFER_TIMEOUT_MS";
    private static final String ENV_DRAIN_TIMEOUT_MS = "ROLLINGLOG_DRAIN_TIMEOUT_MS";

    // Defaults
    static final Path DEFAULT_DIRECTORY = Path.of("logs");
    static final String DEFAULT_FILE_NAME = "record";
    static final long DEFAULT_MAX_FILE_SIZE = 20L * 1024 * 1024;
    static final int DEFAULT_MAX_FILES = 5;
    static final boolean DEFAULT_ASYNC = true;
    static final boolean DEFAULT_INSTANT_FLUSH = false;
    static final String DEFAULT_INSTANCE_NAME = "default";
    static final LogLevel DEFAULT_MIN_LEVEL = LogLevel.DEBUG;
    static final int DEFAULT_QUEUE_CAPACITY = 8192;
    static final long DEFAULT_OFFER_TIMEOUT_MS = 0;
    static final long DEFAULT_DRAIN_TIMEOUT_MS = 5000;

    private static final String LOG_EXTENSION = ".log";

    private final Path directory;
    private final String fileName;
    private final long maxFileSize;
    private final int maxFiles;
    private final boolean async;
    private final boolean instantFlush;
    private final String instanceName;
    private final LogLevel minLevel;
    private final int queueCapacity;
    private final long offerTimeoutMs;
    private final long drainTimeoutMs;

    private LogConfig(Builder builder) {
        this.directory = builder.directory;
        this.fileName = stripLogExtension(builder.fileName);
        this.maxFileSize = builder.maxFileSize;
        this.maxFiles = builder.maxFiles;
        this.async = builder.async;
        this.instantFlush = builder.instantFlush;
        this.instanceName = builder.instanceName;
        this.minLevel = builder.minLevel;
        this.queueCapacity = builder.queueCapacity;
        this.offerTimeoutMs = builder.offerTimeoutMs;
        this.drainTimeoutMs = builder.drainTimeoutMs;
    }

    /** Directory holding the active file and its backups. */
    public Path directory() {
        return directory;
    }

    /** File base name, without the {@code .log} extension. */
    public String fileName() {
        return fileName;
    }

    /** Soft rotation threshold in bytes. */
    public long maxFileSize() {
        return maxFileSize;
    }

    /** Number of rotated backups to retain. */
    public int maxFiles() {
        return maxFiles;
    }

    /** Whether lines are written by a background consumer. */
    public boolean async() {
        return async;
    }

    /** Whether every write is forced to the device before returning. */
    public boolean instantFlush() {
        return instantFlush;
    }

    /** Name the instance is registered under. */
    public String instanceName() {
        return instanceName;
    }

    /** Lowest level written; lower levels are discarded. */
    public LogLevel minLevel() {
        return minLevel;
    }

    /** Async queue capacity in lines. */
    public int queueCapacity() {
        return queueCapacity;
    }

    /** How long an async producer may wait for queue space. */
    public long offerTimeoutMs() {
        return offerTimeoutMs;
    }

    /** How long shutdown waits for the async queue to drain. */
    public long drainTimeoutMs() {
        return drainTimeoutMs;
    }

    /** {@link #offerTimeoutMs()} as a duration. */
    public Duration offerTimeout() {
        return Duration.ofMillis(offerTimeoutMs);
    }

    /** {@link #drainTimeoutMs()} as a duration. */
    public Duration drainTimeout() {
        return Duration.ofMillis(drainTimeoutMs);
    }

    /**
     * Absolute, normalised path of the active file. Two configs with the same
     * active path would write the same file.
     */
    public Path activeFile() {
        return directory.toAbsolutePath().normalize().resolve(fileName + LOG_EXTENSION);
    }

    /**
     * Checks that this configuration can be used to open a logger.
     *
     * @throws LoggerInitException naming the first invalid value
     */
    public void validate() {
        if (instanceName == null || instanceName.isBlank()) {
            throw new LoggerInitException("instanceName must not be blank");
        }
        if (directory == null) {
            throw new LoggerInitException("directory must be set for '" + instanceName + "'");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new LoggerInitException("fileName must not be blank for '" + instanceName + "'");
        }
        if (fileName.indexOf('/') >= 0 || fileName.indexOf('\\') >= 0) {
            throw new LoggerInitException("fileName must not contain a path separator: " + fileName);
        }
        if (maxFileSize <= 0) {
            throw new LoggerInitException("maxFileSize must be positive, got " + maxFileSize);
        }
        if (maxFiles <= 0) {
            throw new LoggerInitException("maxFiles must be positive, got " + maxFiles);
        }
        if (queueCapacity <= 0) {
            throw new LoggerInitException("queueCapacity must be positive, got " + queueCapacity);
        }
        if (offerTimeoutMs < 0) {
            throw new LoggerInitException("offerTimeoutMs must not be negative, got " + offerTimeoutMs);
        }
        if (drainTimeoutMs < 0) {
            throw new LoggerInitException("drainTimeoutMs must not be negative, got " + drainTimeoutMs);
        }
        if (minLevel == null) {
            throw new LoggerInitException("minLevel must be set for '" + instanceName + "'");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogConfig)) {
            return false;
        }
        LogConfig that = (LogConfig) o;
        return maxFileSize == that.maxFileSize
                && maxFiles == that.maxFiles
                && async == that.async
                && instantFlush == that.instantFlush
                && queueCapacity == that.queueCapacity
                && offerTimeoutMs == that.offerTimeoutMs
                && drainTimeoutMs == that.drainTimeoutMs
                && Objects.equals(directory, that.directory)
                && Objects.equals(fileName, that.fileName)
                && Objects.equals(instanceName, that.instanceName)
                && minLevel == that.minLevel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(directory, fileName, maxFileSize, maxFiles, async, instantFlush,
                instanceName, minLevel, queueCapacity, offerTimeoutMs, drainTimeoutMs);
    }

    @Override
    public String toString() {
        return "LogConfig{" +
                "instanceName=" + instanceName +
                ", directory=" + directory +
                ", fileName=" + fileName +
                ", maxFileSize=" + maxFileSize +
                ", maxFiles=" + maxFiles +
                ", async=" + async +
                ", instantFlush=" + instantFlush +
                ", minLevel=" + minLevel +
                ", queueCapacity=" + queueCapacity +
                ", offerTimeoutMs=" + offerTimeoutMs +
                ", drainTimeoutMs=" + drainTimeoutMs +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code LogConfig.builder().build()}.
     */
    public static LogConfig load() {
        return builder().build();
    }

    private static String stripLogExtension(String name) {
        if (name != null && name.length() > LOG_EXTENSION.length() && name.endsWith(LOG_EXTENSION)) {
            return name.substring(0, name.length() - LOG_EXTENSION.length());
        }
        return name;
    }

    /**
     * Builder for {@link LogConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path directory;
        private String fileName;
        private Long maxFileSize;
        private Integer maxFiles;
        private Boolean async;
        private Boolean instantFlush;
        private String instanceName;
        private LogLevel minLevel;
        private Integer queueCapacity;
        private Long offerTimeoutMs;
        private Long drainTimeoutMs;

        private final Properties fileProperties;

        private Builder() {
            this(loadPropertiesFile());
        }

        Builder(Properties fileProperties) {
            this.fileProperties = fileProperties;
        }

        /** Sets the log directory. */
        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        /** Sets the log directory from a string path. */
        public Builder directory(String directory) {
            this.directory = Path.of(directory);
            return this;
        }

        /** Sets the file base name; a trailing {@code .log} is ignored (default: record). */
        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        /** Sets the rotation threshold in bytes (default: 20 MiB). */
        public Builder maxFileSize(long maxFileSize) {
            this.maxFileSize = maxFileSize;
            return this;
        }

        /** Sets the number of backups to keep (default: 5). */
        public Builder maxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
            return this;
        }

        /** Enables or disables queued delivery (default: true). */
        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        /** Enables or disables forcing every write to the device (default: false). */
        public Builder instantFlush(boolean instantFlush) {
            this.instantFlush = instantFlush;
            return this;
        }

        /** Sets the registry name of the instance (default: default). */
        public Builder instanceName(String instanceName) {
            this.instanceName = instanceName;
            return this;
        }

        /** Sets the lowest level written (default: DEBUG). */
        public Builder minLevel(LogLevel minLevel) {
            this.minLevel = minLevel;
            return this;
        }

        /** Sets the async queue capacity in lines (default: 8192). */
        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        /** Sets how long a producer may block on a full queue (default: 0, never). */
        public Builder offerTimeoutMs(long offerTimeoutMs) {
            this.offerTimeoutMs = offerTimeoutMs;
            return this;
        }

        /** Sets how long shutdown waits for the queue to drain (default: 5000). */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public LogConfig build() {
            // Resolve each value with priority: programmatic > sysprop > env > file > default
            if (directory == null) {
                directory = Path.of(resolveString(PROP_DIRECTORY, ENV_DIRECTORY, DEFAULT_DIRECTORY.toString()));
            }
            if (fileName == null) {
                fileName = resolveString(PROP_FILE_NAME, ENV_FILE_NAME, DEFAULT_FILE_NAME);
            }
            if (maxFileSize == null) {
                maxFileSize = resolveLong(PROP_MAX_FILE_SIZE, ENV_MAX_FILE_SIZE, DEFAULT_MAX_FILE_SIZE);
            }
            if (maxFiles == null) {
                maxFiles = resolveInt(PROP_MAX_FILES, ENV_MAX_FILES, DEFAULT_MAX_FILES);
            }
            if (async == null) {
                async = resolveBoolean(PROP_ASYNC, ENV_ASYNC, DEFAULT_ASYNC);
            }
            if (instantFlush == null) {
                instantFlush = resolveBoolean(PROP_INSTANT_FLUSH, ENV_INSTANT_FLUSH, DEFAULT_INSTANT_FLUSH);
            }
            if (instanceName == null) {
                instanceName = resolveString(PROP_INSTANCE_NAME, ENV_INSTANCE_NAME, DEFAULT_INSTANCE_NAME);
            }
            if (minLevel == null) {
                minLevel = resolveLevel(PROP_MIN_LEVEL, ENV_MIN_LEVEL, DEFAULT_MIN_LEVEL);
            }
            if (queueCapacity == null) {
                queueCapacity = resolveInt(PROP_QUEUE_CAPACITY, ENV_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY);
            }
            if (offerTimeoutMs == null) {
                offerTimeoutMs = resolveLong(PROP_OFFER_TIMEOUT_MS, ENV_OFFER_TIMEOUT_MS, DEFAULT_OFFER_TIMEOUT_MS);
            }
            if (drainTimeoutMs == null) {
                drainTimeoutMs = resolveLong(PROP_DRAIN_TIMEOUT_MS, ENV_DRAIN_TIMEOUT_MS, DEFAULT_DRAIN_TIMEOUT_MS);
            }

            return new LogConfig(this);
        }

        private String resolveString(String sysProp, String envVar, String defaultValue) {
            return resolve(sysProp, envVar, defaultValue, value -> value);
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            return resolve(sysProp, envVar, defaultValue, Boolean::parseBoolean);
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            return resolve(sysProp, envVar, defaultValue, Integer::parseInt);
        }

        private long resolveLong(String sysProp, String envVar, long defaultValue) {
            return resolve(sysProp, envVar, defaultValue, Long::parseLong);
        }

        private LogLevel resolveLevel(String sysProp, String envVar, LogLevel defaultValue) {
            return resolve(sysProp, envVar, defaultValue, LogLevel::parse);
        }

        /**
         * Returns the first value that parses, trying system property, environment
         * variable and properties file in turn. Blank values are skipped; a value
         * that does not parse is logged and the next source is tried.
         */
        private <T> T resolve(String sysProp, String envVar, T defaultValue, Function<String, T> parser) {
            // 1. System property
            T value = parse("system property " + sysProp, System.getProperty(sysProp), parser);
            if (value != null) {
                return value;
            }

            // 2. Environment variable
            value = parse("environment variable " + envVar, System.getenv(envVar), parser);
            if (value != null) {
                return value;
            }

            // 3. Properties file
            value = parse(PROPERTIES_FILE + " entry " + sysProp, fileProperties.getProperty(sysProp), parser);
            if (value != null) {
                return value;
            }

            // 4. Default
            return defaultValue;
        }

        private static <T> T parse(String source, String raw, Function<String, T> parser) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            try {
                return parser.apply(raw.trim());
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring {}='{}': {}", source, raw, e.getMessage());
                return null;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = LogConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
