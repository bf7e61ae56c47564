package batchflow.engine.config;

import batchflow.engine.api.v1.GroupController;
import batchflow.engine.api.v1.HealthController;
import batchflow.engine.api.v1.JobController;
import batchflow.engine.api.v1.StatsController;
import batchflow.engine.core.JobEventBus;
import batchflow.engine.queue.JobJournal;
import batchflow.engine.queue.JobQueue;
import batchflow.engine.repository.JobGroupRepository;
import batchflow.engine.repository.JobRepository;
import batchflow.engine.scheduler.HistoryReaper;
import batchflow.engine.scheduler.MaintenanceScheduler;
import batchflow.engine.scheduler.RetryCoordinator;
import batchflow.engine.scheduler.WorkerPool;
import batchflow.engine.server.EngineHttpServer;
import batchflow.engine.server.RouterHandler;
import batchflow.engine.service.GroupService;
import batchflow.engine.service.JobService;
import batchflow.engine.service.RecoveryService;
import batchflow.engine.store.Database;
import batchflow.engine.store.JdbcJobGroupRepository;
import batchflow.engine.store.JdbcJobRepository;
import batchflow.engine.task.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all engine components and recovers unfinished work from
 * the store before returning.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.taskRegistry().register("resize", ctx -> ...);
 * deps.start(); // workers, housekeeping, HTTP server if enabled
 * String id = deps.jobService().createJob("resize", Map.of("path", "a.png"));
 * deps.jobService().submit(id);
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final JobGroupRepository groupRepository;
    private final TaskRegistry taskRegistry;
    private final JobEventBus eventBus;
    private final JobQueue queue;
    private final WorkerPool workerPool;
    private final MaintenanceScheduler maintenance;
    private final JobService jobService;
    private final GroupService groupService;
    private final RecoveryService recoveryService;

    // Router and server (lazy-initialized)
    private RouterHandler routerHandler;
    private EngineHttpServer httpServer;

    private Dependencies(EngineConfig config, TaskRegistry taskRegistry, Database database,
            JobRepository jobRepository, JobGroupRepository groupRepository) {
        this.config = config;
        this.taskRegistry = taskRegistry;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = database;
        this.jobRepository = jobRepository;
        this.groupRepository = groupRepository;

        // Engine core
        this.eventBus = new JobEventBus();
        JobJournal journal = new JobJournal(jobRepository, groupRepository, eventBus);
        this.queue = new JobQueue(new RetryCoordinator(), journal, config.maxWorkers(), config.maxQueueSize());
        this.workerPool = new WorkerPool(queue, taskRegistry, config.maxWorkers(), config.pollInterval(),
                config.shutdownTimeout());
        this.maintenance = new MaintenanceScheduler(
                new HistoryReaper(queue, config.historyRetention()), config.reaperInterval());

        // Services
        this.jobService = new JobService(queue, taskRegistry, jobRepository, groupRepository, config);
        this.groupService = new GroupService(queue, groupRepository, jobRepository);
        this.recoveryService = new RecoveryService(queue, jobRepository, groupRepository);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and an empty task registry.
     */
    public static Dependencies create(EngineConfig config) {
        return create(config, new TaskRegistry());
    }

    /**
     * Create dependencies backed by the configured database and recover
     * unfinished jobs from it.
     *
     * @throws batchflow.engine.error.PersistenceException if the store cannot be opened or read
     */
    public static Dependencies create(EngineConfig config, TaskRegistry taskRegistry) {
        config.validate();
        Database database = new Database(config);
        try {
            return create(config, taskRegistry, database,
                    new JdbcJobRepository(database), new JdbcJobGroupRepository(database));
        } catch (RuntimeException e) {
            database.close();
            throw e;
        }
    }

    /**
     * Create dependencies over explicit repositories. The database is used for
     * health checks and closed by {@link #close()}.
     */
    public static Dependencies create(EngineConfig config, TaskRegistry taskRegistry, Database database,
            JobRepository jobRepository, JobGroupRepository groupRepository) {
        Dependencies deps = new Dependencies(config, taskRegistry, database, jobRepository, groupRepository);
        deps.recoveryService.recover();
        return deps;
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public JobGroupRepository groupRepository() {
        return groupRepository;
    }

    public TaskRegistry taskRegistry() {
        return taskRegistry;
    }

    public JobEventBus eventBus() {
        return eventBus;
    }

    public JobQueue queue() {
        return queue;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public MaintenanceScheduler maintenance() {
        return maintenance;
    }

    public JobService jobService() {
        return jobService;
    }

    public GroupService groupService() {
        return groupService;
    }

    public RecoveryService recoveryService() {
        return recoveryService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, jobService, workerPool))
                    .registerController(new StatsController(jobService))
                    .registerController(new JobController(jobService, config))
                    .registerController(new GroupController(groupService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the HTTP server (creates it if not yet created). It is not started.
     */
    public synchronized EngineHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new EngineHttpServer(config.serverHost(), config.serverPort(), routerHandler());
        }
        return httpServer;
    }

    /**
     * Start workers and housekeeping, and the HTTP server when enabled.
     */
    public void start() {
        workerPool.start();
        maintenance.start();
        if (config.serverEnabled()) {
            httpServer().start();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        EngineHttpServer server;
        synchronized (this) {
            server = httpServer;
        }
        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        try {
            maintenance.stop();
        } catch (Exception e) {
            log.warn("Error stopping maintenance: {}", e.getMessage());
        }

        try {
            workerPool.stop();
        } catch (Exception e) {
            log.warn("Error stopping worker pool: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
