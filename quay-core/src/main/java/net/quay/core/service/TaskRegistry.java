package net.quay.core.service;

import net.quay.core.handler.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** 태스크 이름 -> 정의. 기동 때 한 번 만들고 이후 읽기 전용. */
public final class TaskRegistry {
    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Map<String, TaskDefinition> definitions;

    private TaskRegistry(Map<String, TaskDefinition> definitions) {
        this.definitions = Map.copyOf(definitions);
    }

    public Optional<TaskDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    public Collection<TaskDefinition> definitions() {
        return definitions.values();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, TaskDefinition> definitions = new LinkedHashMap<>();

        public Builder register(TaskDefinition definition) {
            var previous = definitions.putIfAbsent(definition.name(), definition);
            if (previous != null) {
                throw new IllegalStateException("Task already registered: " + definition.name());
            }
            return this;
        }

        public Builder register(String name, TaskHandler handler, String defaultQueue) {
            return register(TaskDefinition.builder(name, handler).queue(defaultQueue).build());
        }

        public TaskRegistry build() {
            log.info("Task registry built: {}", definitions.keySet());
            return new TaskRegistry(definitions);
        }
    }
}
