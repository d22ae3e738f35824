package com.navgraph.core.exception;

/**
 * Malformed or inconsistent input facts: duplicate routes, dangling links,
 * unknown entry points, unreadable manifests.
 *
 * <p>Always fatal to the current run and never repaired silently.
 */
public class NavigationConfigurationException extends NavigationAnalysisException {

    public NavigationConfigurationException(String message) {
        super(message);
    }

    public NavigationConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
