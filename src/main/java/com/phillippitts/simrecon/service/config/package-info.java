/**
 * Layered configuration: reading config files, splitting them by engine schema and merging
 * them into immutable per-channel parameters.
 */
package com.phillippitts.simrecon.service.config;
