package com.navgraph.core.exception;

/**
 * Thrown when two routes declare the same path.
 */
public class DuplicateNodeException extends NavigationConfigurationException {

    private final String path;

    public DuplicateNodeException(String path) {
        super("Duplicate route path: " + path);
        this.path = path;
    }

    /**
     * @return the path declared more than once
     */
    public String getPath() {
        return path;
    }
}
