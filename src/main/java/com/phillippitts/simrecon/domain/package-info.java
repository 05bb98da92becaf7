/**
 * Immutable domain types shared by the configuration, file and orchestration layers.
 *
 * @since 1.0
 */
package com.phillippitts.simrecon.domain;
