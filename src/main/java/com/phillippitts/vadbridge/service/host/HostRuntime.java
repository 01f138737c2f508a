package com.phillippitts.vadbridge.service.host;

/**
 * The runtime on the far side of the boundary, which threads must be attached to before they
 * may call into it (deliver callbacks) or be called from it.
 */
public interface HostRuntime {

    /**
     * @return true once the runtime is reachable
     */
    boolean isAvailable();

    boolean isCurrentThreadAttached();

    /**
     * Attaches the calling thread. The thread stays attached until it dies or the runtime shuts down.
     *
     * @throws com.phillippitts.vadbridge.exception.HostUnavailableException if the runtime is not reachable
     */
    void attachCurrentThread();

    String name();
}
