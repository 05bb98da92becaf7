/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.simrecon.exception.SimReconException} so a batch can record any
 * job failure uniformly.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.simrecon.exception.NotFoundException} - missing file, parent
 *       directory or config reference</li>
 *   <li>{@link com.phillippitts.simrecon.exception.AlreadyExistsException} - a path that must be
 *       fresh already exists</li>
 *   <li>{@link com.phillippitts.simrecon.exception.ValidationException} - unknown config key or
 *       invalid argument</li>
 *   <li>{@link com.phillippitts.simrecon.exception.UnsupportedPlatformException} - no filename
 *       rules for the running OS</li>
 *   <li>{@link com.phillippitts.simrecon.exception.StorageException} - unique path exhaustion or
 *       stable-storage failure</li>
 *   <li>{@link com.phillippitts.simrecon.exception.OutputRedirectException} - output streams could
 *       not be redirected</li>
 *   <li>{@link com.phillippitts.simrecon.exception.ConfigurationException} - unreadable or
 *       unmatched configuration</li>
 *   <li>{@link com.phillippitts.simrecon.exception.EngineInvocationException} - native engine
 *       failure</li>
 *   <li>{@link com.phillippitts.simrecon.exception.BatchProcessingException} - surfaced after a
 *       batch with failed jobs</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.simrecon.exception;
