package org.seatplan.cli.rendering;

/**
 * How a solved seating plan is written to the console.
 */
public enum OutputFormat {
    TEXT,
    JSON
}
