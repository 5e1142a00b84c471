package com.containerwatch.tracker.execution;

public interface AutomationSessionFactory {

    AutomationSession open();
}
