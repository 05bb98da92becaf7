package com.phillippitts.simrecon.service.capture;

/**
 * Operation run while output is captured.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface CapturedOperation<T> {

    T run(CaptureTarget target);
}
