package com.mcpcheck.core.plugin;

/**
 * Thrown before a run starts when the supplied plugin set is malformed
 * (blank or duplicate names).
 */
public class PluginConfigurationException extends RuntimeException {

    public PluginConfigurationException(String message) {
        super(message);
    }
}
