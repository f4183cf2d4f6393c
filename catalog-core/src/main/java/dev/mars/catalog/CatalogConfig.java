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
package dev.mars.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for a catalog engine instance.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dcatalog.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code CATALOG_DATA_DIR})</li>
 *   <li>Properties file ({@code catalog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>catalog.dataDir</td><td>CATALOG_DATA_DIR</td><td>~/.catalog/data</td></tr>
 *   <tr><td>syncEnabled</td><td>catalog.syncEnabled</td><td>CATALOG_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>ioThreads</td><td>catalog.ioThreads</td><td>CATALOG_IO_THREADS</td><td>4</td></tr>
 *   <tr><td>cacheMaxMb</td><td>catalog.cacheMaxMb</td><td>CATALOG_CACHE_MAX_MB</td><td>128</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>catalog.minFreeSpaceMb</td><td>CATALOG_MIN_FREE_SPACE_MB</td><td>16</td></tr>
 * </table>
 * <p>
 * The passphrase is never part of this configuration; it is handed to the engine
 * by whoever opens the catalog.
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * CatalogConfig config = CatalogConfig.builder()
 *     .dataDir(Path.of("/home/me/Pictures/catalog"))
 *     .cacheMaxMb(256)
 *     .build();
 *
 * DataEngine engine = new LocalDataEngine(config, passphrase, transcoder);
 * engine.connect();
 * </pre>
 */
public final class CatalogConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogConfig.class);

    private static final String PROPERTIES_FILE = "catalog.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "catalog.dataDir";
    private static final String PROP_SYNC_ENABLED = "catalog.syncEnabled";
    private static final String PROP_IO_THREADS = "catalog.ioThreads";
    private static final String PROP_CACHE_MAX_MB = "catalog.cacheMaxMb";
    private static final String PROP_MIN_FREE_SPACE_MB = "catalog.minFreeSpaceMb";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "CATALOG_DATA_DIR";
    private static final String ENV_SYNC_ENABLED = "CATALOG_SYNC_ENABLED";
    private static final String ENV_IO_THREADS = "CATALOG_IO_THREADS";
    private static final String ENV_CACHE_MAX_MB = "CATALOG_CACHE_MAX_MB";
    private static final String ENV_MIN_FREE_SPACE_MB = "CATALOG_MIN_FREE_SPACE_MB";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".catalog", "data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_IO_THREADS = 4;
    private static final int DEFAULT_CACHE_MAX_MB = 128;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 16;

    private final Path dataDir;
    private final boolean syncEnabled;
    private final int ioThreads;
    private final int cacheMaxMb;
    private final int minFreeSpaceMb;

    private CatalogConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.ioThreads = builder.ioThreads;
        this.cacheMaxMb = builder.cacheMaxMb;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
    }

    /** Storage folder holding the metadata document and the segment files. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether metadata and segment writes are fsynced. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Number of threads issuing chunk reads and writes. */
    public int ioThreads() {
        return ioThreads;
    }

    /** Upper bound of the decoded payload cache in MB. */
    public int cacheMaxMb() {
        return cacheMaxMb;
    }

    /** Minimum free disk space in MB required before payload writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Upper bound of the decoded payload cache in bytes. */
    public long cacheMaxBytes() {
        return (long) cacheMaxMb * 1024 * 1024;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "CatalogConfig{" +
                "dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", ioThreads=" + ioThreads +
                ", cacheMaxMb=" + cacheMaxMb +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
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
     * Shorthand for {@code CatalogConfig.builder().build()}.
     */
    public static CatalogConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link CatalogConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Boolean syncEnabled;
        private Integer ioThreads;
        private Integer cacheMaxMb;
        private Integer minFreeSpaceMb;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the storage folder. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the storage folder from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the I/O thread count (default: 4). */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /** Sets the payload cache bound in MB (default: 128). */
        public Builder cacheMaxMb(int cacheMaxMb) {
            this.cacheMaxMb = cacheMaxMb;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 16). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if ioThreads is not positive or a size is negative
         */
        public CatalogConfig build() {
            if (dataDir == null) {
                dataDir = Path.of(resolve(PROP_DATA_DIR, ENV_DATA_DIR, DEFAULT_DATA_DIR.toString()));
            }
            if (syncEnabled == null) {
                syncEnabled = Boolean.parseBoolean(
                        resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, String.valueOf(DEFAULT_SYNC_ENABLED)));
            }
            if (ioThreads == null) {
                ioThreads = resolveInt(PROP_IO_THREADS, ENV_IO_THREADS, DEFAULT_IO_THREADS);
            }
            if (cacheMaxMb == null) {
                cacheMaxMb = resolveInt(PROP_CACHE_MAX_MB, ENV_CACHE_MAX_MB, DEFAULT_CACHE_MAX_MB);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }

            if (ioThreads < 1) {
                throw new IllegalArgumentException("ioThreads must be positive: " + ioThreads);
            }
            if (cacheMaxMb < 0 || minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("sizes must not be negative: cacheMaxMb="
                        + cacheMaxMb + ", minFreeSpaceMb=" + minFreeSpaceMb);
            }
            return new CatalogConfig(this);
        }

        /**
         * Resolves a raw value: system property, then environment, then properties file,
         * then the default. Blank values are skipped.
         */
        private String resolve(String sysProp, String envVar, String defaultValue) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            return defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolve(sysProp, envVar, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value for {}: '{}'", sysProp, value);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = CatalogConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
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
