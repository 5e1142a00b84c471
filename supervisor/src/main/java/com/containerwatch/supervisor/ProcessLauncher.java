package com.containerwatch.supervisor;

import java.io.IOException;
import java.util.List;

@FunctionalInterface
public interface ProcessLauncher {
    ChildProcess launch(List<String> command) throws IOException;
}
