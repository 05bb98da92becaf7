/**
 * Application-wide configuration beans and properties.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.engine} - native engine binaries and their startup validation</li>
 *   <li>{@code config.dataset} - fallback dataset handler</li>
 *   <li>{@code config.properties} - worker thread properties</li>
 * </ul>
 *
 * @see com.phillippitts.simrecon.config.ThreadPoolConfig
 */
package com.phillippitts.simrecon.config;
