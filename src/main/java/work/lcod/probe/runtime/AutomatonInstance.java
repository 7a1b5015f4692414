package work.lcod.probe.runtime;

import work.lcod.probe.selector.ProbeKind;

/**
 * One live match of a selector root. Lives from the root scope's enter until that scope exits
 * or the activation is deactivated.
 */
final class AutomatonInstance {
    private final Activation activation;
    private final long rootScopeId;
    private final Frame rootFrame;
    private boolean alive = true;

    AutomatonInstance(Activation activation, long rootScopeId) {
        this.activation = activation;
        this.rootScopeId = rootScopeId;
        this.rootFrame = new Frame(null, rootScopeId);
    }

    Activation activation() {
        return activation;
    }

    ProbeKind kind() {
        return activation.kind();
    }

    long rootScopeId() {
        return rootScopeId;
    }

    Frame rootFrame() {
        return rootFrame;
    }

    boolean alive() {
        return alive && activation.isActive();
    }

    void destroy() {
        alive = false;
    }
}
