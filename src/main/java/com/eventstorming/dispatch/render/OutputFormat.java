package com.eventstorming.dispatch.render;

/**
 * Output format of a command.
 */
public enum OutputFormat {
    MARKDOWN,
    JSON
}
