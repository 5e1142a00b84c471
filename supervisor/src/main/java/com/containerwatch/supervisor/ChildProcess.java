package com.containerwatch.supervisor;

import java.time.Duration;

public interface ChildProcess {
    long pid();

    int waitFor() throws InterruptedException;

    /**
     * Asks the child to exit and kills it if it is still alive after {@code grace}.
     */
    void terminate(Duration grace);
}
