/**
 * Native engine invocation: command-line construction and child-process management.
 */
package com.phillippitts.simrecon.service.engine;
