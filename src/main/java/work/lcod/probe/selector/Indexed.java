package work.lcod.probe.selector;

/**
 * Key constraint of a call, from {@code f[k]} or {@code f{#key=k}}. Either {@code key} is a literal
 * the call key must equal, or {@code rename} names a capture receiving the key.
 */
public record Indexed(Literal key, String rename) implements SelectorNode {
    public Indexed {
        if (key == null && rename == null) {
            throw new IllegalArgumentException("Indexed needs a literal key or a capture name");
        }
    }
}
