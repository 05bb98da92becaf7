package com.phillippitts.simrecon.service.config;

/**
 * How a merge treats keys that are present in the upper layer with a null (or empty string)
 * value. Keys absent from the upper layer always keep the lower layer's value.
 */
public enum NullHandling {
    /** Null values are ignored; the lower layer's value survives. Used for command-line layers. */
    SKIP,
    /** Null values clear the setting. Used for explicit programmatic overrides. */
    APPLY
}
