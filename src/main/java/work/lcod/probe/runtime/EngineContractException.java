package work.lcod.probe.runtime;

/**
 * The host reported an event that breaks the scope lifecycle: a binding or exit on a scope that is
 * unknown or already closed, or an enter under a closed parent.
 */
public final class EngineContractException extends ProbeRuntimeException {
    public EngineContractException(String message, long scopeId) {
        super("engine_contract", message, scopeId);
    }

    public long scopeId() {
        return (Long) data();
    }
}
