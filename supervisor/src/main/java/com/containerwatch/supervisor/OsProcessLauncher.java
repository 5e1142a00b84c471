package com.containerwatch.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

public class OsProcessLauncher implements ProcessLauncher {
    private static final Logger log = LoggerFactory.getLogger(OsProcessLauncher.class);
    private static final Logger workerLog = LoggerFactory.getLogger("worker");

    private final Path workingDirectory;

    public OsProcessLauncher(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public ChildProcess launch(List<String> command) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.redirectErrorStream(true);
        Process process = builder.start();
        Thread pump = new Thread(() -> pumpOutput(process), "worker-output-" + process.pid());
        pump.setDaemon(true);
        pump.start();
        return new OsChildProcess(process, pump);
    }

    private void pumpOutput(Process process) {
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                workerLog.info(line);
            }
        } catch (IOException e) {
            log.debug("Worker output stream closed for pid {}: {}", process.pid(), e.getMessage());
        }
    }

    private static final class OsChildProcess implements ChildProcess {
        private final Process process;
        private final Thread pump;

        private OsChildProcess(Process process, Thread pump) {
            this.process = process;
            this.pump = pump;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public int waitFor() throws InterruptedException {
            int exitCode = process.waitFor();
            pump.join(TimeUnit.SECONDS.toMillis(2));
            return exitCode;
        }

        @Override
        public void terminate(Duration grace) {
            if (!process.isAlive()) {
                return;
            }
            process.destroy();
            try {
                if (!process.waitFor(Math.max(0L, grace.toMillis()), TimeUnit.MILLISECONDS)) {
                    log.warn("Worker pid {} ignored termination for {}s, killing it", process.pid(), grace.toSeconds());
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}
