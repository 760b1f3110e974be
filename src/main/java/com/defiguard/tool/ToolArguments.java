package com.defiguard.tool;

/**
 * Marker for a tool's bound, schema-validated argument object.
 */
public interface ToolArguments {}
