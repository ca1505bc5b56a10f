package io.geostream.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration properties for the GeoStream archiver.
 *
 * @see GeoStreamAutoConfiguration
 */
@ConfigurationProperties(prefix = "geostream")
public class GeoStreamProperties {

    /**
     * Directory where matching events are staged before upload.
     */
    private String stagingDirectory = "tweets";

    /**
     * Archive container (bucket) receiving every record.
     */
    private String containerName = "earthlab-geolocated-tweets";

    /**
     * Pause before each event is handled.
     */
    private Duration interEventDelay = Duration.ofSeconds(5);

    /**
     * Subscription filter as {@code west,south,east,north}. Defaults to the contiguous US.
     */
    private String boundingBox = "-124.848974,24.396308,-66.885444,49.384358";

    /**
     * Start streaming when the application context is refreshed.
     */
    private boolean autoStart = true;

    /**
     * Upload files left in the staging directory by a previous run before streaming.
     */
    private boolean resumeOrphans = true;

    private final Archive archive = new Archive();
    private final Reconnect reconnect = new Reconnect();
    private final Dispatcher dispatcher = new Dispatcher();
    private final Twitter twitter = new Twitter();
    private final Azure azure = new Azure();
    private final Metrics metrics = new Metrics();

    public String getStagingDirectory() {
        return stagingDirectory;
    }

    public void setStagingDirectory(String stagingDirectory) {
        this.stagingDirectory = stagingDirectory;
    }

    public String getContainerName() {
        return containerName;
    }

    public void setContainerName(String containerName) {
        this.containerName = containerName;
    }

    public Duration getInterEventDelay() {
        return interEventDelay;
    }

    public void setInterEventDelay(Duration interEventDelay) {
        this.interEventDelay = interEventDelay;
    }

    public String getBoundingBox() {
        return boundingBox;
    }

    public void setBoundingBox(String boundingBox) {
        this.boundingBox = boundingBox;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isResumeOrphans() {
        return resumeOrphans;
    }

    public void setResumeOrphans(boolean resumeOrphans) {
        this.resumeOrphans = resumeOrphans;
    }

    public Archive getArchive() {
        return archive;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Twitter getTwitter() {
        return twitter;
    }

    public Azure getAzure() {
        return azure;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum KeyStrategy {
        /**
         * Remote key mirrors the staged file's local path.
         */
        LOCAL_PATH,
        /**
         * Remote key is {@code <key-prefix><event id>.json}.
         */
        EVENT_ID
    }

    public static class Archive {
        private KeyStrategy keyStrategy = KeyStrategy.LOCAL_PATH;
        private String keyPrefix = "";
        private Duration uploadTimeout = Duration.ofSeconds(30);
        /**
         * Root directory of the filesystem archive used when no other store is configured.
         */
        private String localRoot = "archive";

        public KeyStrategy getKeyStrategy() {
            return keyStrategy;
        }

        public void setKeyStrategy(KeyStrategy keyStrategy) {
            this.keyStrategy = keyStrategy;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getUploadTimeout() {
            return uploadTimeout;
        }

        public void setUploadTimeout(Duration uploadTimeout) {
            this.uploadTimeout = uploadTimeout;
        }

        public String getLocalRoot() {
            return localRoot;
        }

        public void setLocalRoot(String localRoot) {
            this.localRoot = localRoot;
        }
    }

    public static class Reconnect {
        private boolean enabled = true;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 320000;
        private int maxAttempts = 0;
        private Duration stableAfter = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getStableAfter() {
            return stableAfter;
        }

        public void setStableAfter(Duration stableAfter) {
            this.stableAfter = stableAfter;
        }
    }

    public static class Dispatcher {
        /**
         * Worker threads handling events; 0 handles them on the stream thread.
         */
        private int workerCount = 0;
        private int queueCapacity = 1000;
        private Duration drainTimeout = Duration.ofSeconds(5);

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Twitter {
        private URI endpoint = URI.create("https://stream.twitter.com/1.1/statuses/filter.json");
        /**
         * Properties file holding the OAuth secrets. When unset, the secrets are read from
         * {@code GEOSTREAM_*} environment variables.
         */
        private String credentialsFile;
        private Duration stallTimeout = Duration.ofSeconds(90);

        public URI getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(URI endpoint) {
            this.endpoint = endpoint;
        }

        public String getCredentialsFile() {
            return credentialsFile;
        }

        public void setCredentialsFile(String credentialsFile) {
            this.credentialsFile = credentialsFile;
        }

        public Duration getStallTimeout() {
            return stallTimeout;
        }

        public void setStallTimeout(Duration stallTimeout) {
            this.stallTimeout = stallTimeout;
        }
    }

    public static class Azure {
        private String connectionString;
        private boolean createContainers = true;

        public String getConnectionString() {
            return connectionString;
        }

        public void setConnectionString(String connectionString) {
            this.connectionString = connectionString;
        }

        public boolean isCreateContainers() {
            return createContainers;
        }

        public void setCreateContainers(boolean createContainers) {
            this.createContainers = createContainers;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "geostream";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
