package batchflow.engine.task;

import batchflow.engine.error.DuplicateTaskException;
import batchflow.engine.error.UnknownTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps task names to task functions.
 * Jobs reference tasks by name only, so persisted jobs resolve against
 * whatever registry is active when they run.
 */
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final ConcurrentHashMap<String, TaskFunction> functions = new ConcurrentHashMap<>();

    /**
     * Bind a name to a function.
     *
     * @throws DuplicateTaskException if the name is already bound
     */
    public void register(String name, TaskFunction function) {
        register(name, function, false);
    }

    /**
     * Bind a name to a function, replacing an existing binding when
     * {@code overwrite} is true.
     *
     * @throws DuplicateTaskException if the name is bound and overwrite is false
     */
    public void register(String name, TaskFunction function, boolean overwrite) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (function == null) {
            throw new IllegalArgumentException("function is required");
        }
        if (overwrite) {
            TaskFunction previous = functions.put(name, function);
            if (previous != null) {
                log.info("Task '{}' re-registered", name);
            }
        } else if (functions.putIfAbsent(name, function) != null) {
            throw new DuplicateTaskException(name);
        }
        log.debug("Registered task '{}'", name);
    }

    /**
     * @throws UnknownTaskException if the name is not bound
     */
    public TaskFunction resolve(String name) {
        TaskFunction function = name != null ? functions.get(name) : null;
        if (function == null) {
            throw new UnknownTaskException(name);
        }
        return function;
    }

    public boolean contains(String name) {
        return name != null && functions.containsKey(name);
    }

    public boolean unregister(String name) {
        return functions.remove(name) != null;
    }

    public Set<String> names() {
        return new TreeSet<>(functions.keySet());
    }
}
