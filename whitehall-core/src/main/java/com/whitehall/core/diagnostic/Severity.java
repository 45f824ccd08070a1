package com.whitehall.core.diagnostic;

/**
 * Severity of a compiler diagnostic.
 */
public enum Severity {
    /** Suppresses output for the file */
    ERROR,
    /** Reported, output still produced */
    WARNING
}
