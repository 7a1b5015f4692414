package work.lcod.probe.runtime;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.probe.automaton.PatternNode;

/**
 * Decides whether an immediate firing substitutes the focus value.
 */
final class OverrideGate {
    private static final Logger logger = LoggerFactory.getLogger(OverrideGate.class);

    private OverrideGate() {}

    /**
     * Runs the activation's latest override rule against the firing record. Refused, with a warning,
     * when the host marked the binding non-overridable.
     */
    static Optional<Substitution> resolve(Activation activation, PatternNode focus, ResultRecord record,
                                          String variable, boolean overridable) {
        List<OverrideRule> rules = activation.overrideRules();
        if (rules.isEmpty()) {
            return Optional.empty();
        }
        if (!overridable || !focus.overridable()) {
            String message = "Override of '" + variable + "' by '" + activation.selector().text()
                + "' refused: the binding cannot be overridden";
            logger.warn(message);
            activation.note(message);
            return Optional.empty();
        }
        OverrideRule rule = rules.get(rules.size() - 1);
        Object value;
        try {
            value = rule.apply(record);
        } catch (RuntimeException ex) {
            String message = "Override rule (" + rule.description() + ") of '" + variable + "' by '"
                + activation.selector().text() + "' failed: " + ex.getMessage() + "; keeping the bound value";
            logger.error(message, ex);
            activation.note(message);
            activation.deliverError(ex);
            return Optional.empty();
        }
        logger.debug("Override ({}) of '{}' in scope {} by '{}'", rule.description(), variable, record.scopeId(),
            activation.selector().text());
        return Optional.of(new Substitution(value));
    }
}
