package io.meterfleet.supervisor;

import io.meterfleet.worker.WorkerMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Starts each worker as a separate JVM running {@link WorkerMain} on the supervisor's class
 * path. Output of a worker goes to {@code <log dir>/<device id>.log}.
 */
public class ProcessWorkerLauncher implements WorkerLauncher {

    private static final Logger logger = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    public static final String DEFAULT_LOG_DIR = "logs";

    private final Function<WorkerSpec, List<String>> commandBuilder;
    private final Path logDir;

    public ProcessWorkerLauncher() {
        this(ProcessWorkerLauncher::javaCommand, Paths.get(System.getProperty("fleet.worker.log.dir", DEFAULT_LOG_DIR)));
    }

    public ProcessWorkerLauncher(Function<WorkerSpec, List<String>> commandBuilder, Path logDir) {
        this.commandBuilder = commandBuilder;
        this.logDir = logDir;
    }

    @Override
    public WorkerHandle launch(WorkerSpec spec) throws IOException {
        Files.createDirectories(logDir);
        Path logFile = logDir.resolve(spec.getDeviceId() + ".log");
        List<String> command = commandBuilder.apply(spec);

        ProcessBuilder builder = new ProcessBuilder(command)
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        Process process = builder.start();

        logger.info("Worker for {} started (pid: {}, log: {})", spec.getDeviceId(), process.pid(), logFile);
        logger.debug("Worker command: {}", command);
        return new ProcessWorkerHandle(process);
    }

    /**
     * {@code java -D... -cp <class path> WorkerMain <id> <type> <interval>}, forwarding the
     * {@code fleet.*}, {@code db.*} and Logback properties of this JVM.
     */
    public static List<String> javaCommand(WorkerSpec spec) {
        List<String> command = new ArrayList<>();
        command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());

        Properties properties = System.getProperties();
        for (String name : new TreeSet<>(properties.stringPropertyNames())) {
            if (name.startsWith("fleet.") || name.startsWith("db.") || name.equals("logback.configurationFile")) {
                command.add("-D" + name + "=" + properties.getProperty(name));
            }
        }

        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(WorkerMain.class.getName());
        command.add(spec.getDeviceId());
        command.add(spec.getDeviceType().getTypeId());
        command.add(String.valueOf(spec.getIntervalSeconds()));
        return command;
    }
}
