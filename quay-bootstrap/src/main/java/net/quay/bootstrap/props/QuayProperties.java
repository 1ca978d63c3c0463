package net.quay.bootstrap.props;

import net.quay.core.service.TaskExecutor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("quay")
public class QuayProperties {
    private String zone = "UTC";
    private Store store = new Store();
    private Broker broker = new Broker();
    private Worker worker = new Worker();
    private Results results = new Results();
    private Map<String, String> routes = new LinkedHashMap<>();           // 태스크명 -> 큐
    private Map<String, TaskOverride> tasks = new LinkedHashMap<>();      // 태스크명 -> 덮어쓸 옵션
    private Beat beat = new Beat();
    private Maintenance maintenance = new Maintenance();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Broker getBroker() {
        return broker;
    }

    public void setBroker(Broker broker) {
        this.broker = broker;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Results getResults() {
        return results;
    }

    public void setResults(Results results) {
        this.results = results;
    }

    public Map<String, String> getRoutes() {
        return routes;
    }

    public void setRoutes(Map<String, String> routes) {
        this.routes = routes;
    }

    public Map<String, TaskOverride> getTasks() {
        return tasks;
    }

    public void setTasks(Map<String, TaskOverride> tasks) {
        this.tasks = tasks;
    }

    public Beat getBeat() {
        return beat;
    }

    public void setBeat(Beat beat) {
        this.beat = beat;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    public enum StoreType { JDBC, MEMORY }

    public static class Store {
        /** jdbc: Oracle 테이블, memory: 단일 프로세스용 */
        private StoreType type = StoreType.JDBC;

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }
    }

    public static class Broker {
        private Duration pollInterval = Duration.ofMillis(200);

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    public static class Worker {
        private String hostname;
        private List<String> queues = new ArrayList<>(List.of("default"));
        private int concurrency = Runtime.getRuntime().availableProcessors();
        private int prefetch = 1;
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration visibilityTimeout = Duration.ofMinutes(10);
        private Duration shutdownGrace = Duration.ofSeconds(30);

        public String getHostname() {
            return hostname;
        }

        public void setHostname(String hostname) {
            this.hostname = hostname;
        }

        public List<String> getQueues() {
            return queues;
        }

        public void setQueues(List<String> queues) {
            this.queues = queues;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getPrefetch() {
            return prefetch;
        }

        public void setPrefetch(int prefetch) {
            this.prefetch = prefetch;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }
    }

    public static class Results {
        private Duration ttl = TaskExecutor.DEFAULT_RESULT_TTL;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class TaskOverride {
        private String queue;
        private Integer maxRetries;
        private Duration timeLimit;

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = queue;
        }

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getTimeLimit() {
            return timeLimit;
        }

        public void setTimeLimit(Duration timeLimit) {
            this.timeLimit = timeLimit;
        }
    }

    public static class Beat {
        private boolean enabled = false;
        private long tickDelayMs = 1000;
        private Duration lease = Duration.ofSeconds(30);
        private String owner = "beat";
        private List<EntryDef> entries = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public Duration getLease() {
            return lease;
        }

        public void setLease(Duration lease) {
            this.lease = lease;
        }

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public List<EntryDef> getEntries() {
            return entries;
        }

        public void setEntries(List<EntryDef> entries) {
            this.entries = entries;
        }
    }

    /** every 또는 cron 중 하나만 */
    public static class EntryDef {
        private String name;
        private String task;
        private Duration every;
        private String cron;
        private String queue;
        private boolean enabled = true;
        private List<Object> args = new ArrayList<>();
        private Map<String, Object> kwargs = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTask() {
            return task;
        }

        public void setTask(String task) {
            this.task = task;
        }

        public Duration getEvery() {
            return every;
        }

        public void setEvery(Duration every) {
            this.every = every;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = queue;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<Object> getArgs() {
            return args;
        }

        public void setArgs(List<Object> args) {
            this.args = args;
        }

        public Map<String, Object> getKwargs() {
            return kwargs;
        }

        public void setKwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs;
        }

        @Override
        public String toString() {
            return "EntryDef{" +
                    "name='" + name + '\'' +
                    ", task='" + task + '\'' +
                    ", every=" + every +
                    ", cron='" + cron + '\'' +
                    ", queue='" + queue + '\'' +
                    ", enabled=" + enabled +
                    '}';
        }
    }

    public static class Maintenance {
        private boolean enabled = true;
        private long delayMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }
    }
}
