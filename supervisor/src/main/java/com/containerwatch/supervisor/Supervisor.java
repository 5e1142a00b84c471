package com.containerwatch.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

public class Supervisor {
    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);
    static final int SPAWN_FAILURE_EXIT_CODE = -1;

    private final SupervisorSettings settings;
    private final ProcessLauncher launcher;
    private final Clock clock;
    private final Sleeper sleeper;
    private final RestartWindow window;
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final Object childLock = new Object();

    private ChildProcess current;
    private volatile Thread loopThread;

    public Supervisor(SupervisorSettings settings, ProcessLauncher launcher, Clock clock, Sleeper sleeper) {
        this.settings = settings;
        this.launcher = launcher;
        this.clock = clock;
        this.sleeper = sleeper;
        this.window = new RestartWindow(settings.window());
    }

    public void run(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("worker command must not be empty");
        }
        loopThread = Thread.currentThread();
        log.info(
            "Supervising worker `{}` (max {} restarts per {} min, backoff {}s)",
            String.join(" ", command),
            settings.maxRestartsPerWindow(),
            settings.window().toMinutes(),
            settings.backoff().toSeconds()
        );
        while (!stopping.get()) {
            try {
                int exitCode = launchAndWait(command);
                if (stopping.get()) {
                    break;
                }
                afterExit(exitCode);
            } catch (InterruptedException e) {
                if (stopping.get()) {
                    break;
                }
                log.warn("Supervisor interrupted without a stop request, continuing");
            } catch (RuntimeException e) {
                log.error("Supervisor loop failure: {}", e.getMessage(), e);
                if (!pause(settings.errorPause())) {
                    break;
                }
            }
        }
        log.info("Supervisor stopped after {} restarts", window.restartCount());
    }

    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        log.info("Stop requested, terminating worker");
        ChildProcess child;
        synchronized (childLock) {
            child = current;
        }
        if (child != null) {
            child.terminate(settings.terminationGrace());
        }
        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
        }
    }

    public boolean isStopping() {
        return stopping.get();
    }

    public long restartCount() {
        return window.restartCount();
    }

    RestartWindow window() {
        return window;
    }

    private int launchAndWait(List<String> command) throws InterruptedException {
        ChildProcess child;
        try {
            child = launcher.launch(command);
        } catch (Exception e) {
            log.error("Failed to start worker at {}: {}", clock.instant(), e.getMessage());
            return SPAWN_FAILURE_EXIT_CODE;
        }
        synchronized (childLock) {
            current = child;
        }
        try {
            if (stopping.get()) {
                child.terminate(settings.terminationGrace());
            }
            log.info("Worker started with pid {}", child.pid());
            return awaitExit(child);
        } finally {
            synchronized (childLock) {
                current = null;
            }
        }
    }

    // a stray interrupt must not leave this worker running next to a relaunched one
    private int awaitExit(ChildProcess child) throws InterruptedException {
        while (true) {
            try {
                return child.waitFor();
            } catch (InterruptedException e) {
                if (stopping.get()) {
                    throw e;
                }
                log.warn("Supervisor interrupted without a stop request, still waiting for worker pid {}", child.pid());
            }
        }
    }

    private void afterExit(int exitCode) throws InterruptedException {
        Instant exitedAt = clock.instant();
        int recent = window.prune(exitedAt);
        log.warn(
            "Worker exited with code {} at {} ({} restarts in the last {} min)",
            exitCode,
            exitedAt,
            recent,
            settings.window().toMinutes()
        );
        if (window.isFull(settings.maxRestartsPerWindow())) {
            log.error(
                "Restart limit reached ({} per {} min), suspending restarts for {} min until {}",
                settings.maxRestartsPerWindow(),
                settings.window().toMinutes(),
                settings.cooldown().toMinutes(),
                exitedAt.plus(settings.cooldown())
            );
            sleeper.sleep(settings.cooldown());
            window.clear();
        } else {
            log.info("Restarting worker in {}s", settings.backoff().toSeconds());
            sleeper.sleep(settings.backoff());
        }
        Instant restartedAt = clock.instant();
        long restart = window.record(restartedAt);
        log.info("Restart #{} at {} (previous exit code {})", restart, restartedAt, exitCode);
    }

    private boolean pause(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            return !stopping.get();
        }
    }
}
