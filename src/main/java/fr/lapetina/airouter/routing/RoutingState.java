package fr.lapetina.airouter.routing;

/**
 * Lifecycle state of one routing pass.
 */
public enum RoutingState {
    /** Request accepted, candidates not yet tried */
    INIT,

    /** A candidate has been dispatched and has not answered yet */
    DISPATCHED,

    /** Last attempt failed with a failover-eligible error; the next candidate follows */
    RETRY_NEXT,

    /** A candidate answered */
    SUCCESS,

    /** No further candidate will be tried */
    TERMINAL_FAILURE;

    public boolean isTerminal() {
        return this == SUCCESS || this == TERMINAL_FAILURE;
    }
}
