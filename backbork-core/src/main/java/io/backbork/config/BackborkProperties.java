package io.backbork.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration of the backup queue.
 */
@ConfigurationProperties(prefix = "backbork")
public class BackborkProperties {

    public enum Storage {
        FILE,
        MONGO
    }

    private boolean enabled = true;
    private Storage storage = Storage.FILE;
    private Path baseDir = Path.of("backbork-data");
    private String zone; // recurrence zone, null = system default
    private Duration lockStaleAfter = Duration.ofHours(1); // only for locks whose holder cannot be checked
    private Duration completedRetention = Duration.ofDays(30);
    private String workerId;
    private boolean ensureIndexesOnStartup = false;
    private final Trigger trigger = new Trigger();
    private List<DestinationProperties> destinations = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(Path baseDir) {
        this.baseDir = baseDir;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    /**
     * Recurrence zone; falls back to the system default when unset or invalid.
     */
    public ZoneId zoneId() {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone);
        } catch (Exception e) {
            return ZoneId.systemDefault();
        }
    }

    public Duration getLockStaleAfter() {
        return lockStaleAfter;
    }

    public void setLockStaleAfter(Duration lockStaleAfter) {
        this.lockStaleAfter = lockStaleAfter;
    }

    public Duration getCompletedRetention() {
        return completedRetention;
    }

    public void setCompletedRetention(Duration completedRetention) {
        this.completedRetention = completedRetention;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public List<DestinationProperties> getDestinations() {
        return destinations;
    }

    public void setDestinations(List<DestinationProperties> destinations) {
        this.destinations = destinations;
    }

    /**
     * In-process periodic trigger. Off by default; an external scheduler (cron, systemd timer)
     * usually invokes the processing pass instead.
     */
    public static class Trigger {
        private boolean enabled = false;
        private Duration processEvery = Duration.ofMinutes(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getProcessEvery() {
            return processEvery;
        }

        public void setProcessEvery(Duration processEvery) {
            this.processEvery = processEvery;
        }
    }

    public static class DestinationProperties {
        private String id;
        private String name;
        private String type = "local";
        private boolean enabled = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
