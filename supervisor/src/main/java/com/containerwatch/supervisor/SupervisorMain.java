package com.containerwatch.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;

public final class SupervisorMain {
    private static final Logger log = LoggerFactory.getLogger(SupervisorMain.class);

    private SupervisorMain() {}

    public static void main(String[] args) {
        List<String> command = workerCommand(args);
        if (command.isEmpty()) {
            log.error("Usage: java -jar container-watch-supervisor.jar -- <worker command...>");
            System.exit(2);
            return;
        }
        SupervisorSettings settings = SupervisorSettings.fromEnvironment(System.getProperties(), System.getenv());
        Supervisor supervisor = new Supervisor(
            settings,
            new OsProcessLauncher(Path.of("").toAbsolutePath()),
            Clock.systemDefaultZone(),
            Sleeper.SYSTEM
        );
        Thread mainThread = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            supervisor.stop();
            try {
                mainThread.join(settings.terminationGrace().plusSeconds(5).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "supervisor-shutdown"));
        log.info("Starting container-watch supervisor");
        supervisor.run(command);
    }

    static List<String> workerCommand(String[] args) {
        if (args == null || args.length == 0) {
            return List.of();
        }
        List<String> all = Arrays.asList(args);
        int separator = all.indexOf("--");
        List<String> command = separator >= 0 ? all.subList(separator + 1, all.size()) : all;
        return command.stream()
            .filter(part -> part != null && !part.isBlank())
            .toList();
    }
}
