/**
 * Engine binary configuration and startup validation.
 */
package com.phillippitts.simrecon.config.engine;
