package io.github.drompincen.aegis.runtime.monitor;

/**
 * The guarded body of a monitored call. {@code E} lets checked exceptions of
 * the body pass through the interceptor with their original type.
 */
@FunctionalInterface
public interface MonitoredAction<T, E extends Exception> {
    T run() throws E;
}
