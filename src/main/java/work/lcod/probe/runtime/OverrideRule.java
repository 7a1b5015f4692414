package work.lcod.probe.runtime;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Computes the value substituted for a focus binding.
 */
public record OverrideRule(String description, Function<ResultRecord, Object> function) {
    public OverrideRule {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(function, "function");
    }

    /**
     * Rule receiving the full record, focus included.
     */
    public static OverrideRule override(Function<ResultRecord, Object> function) {
        return new OverrideRule("override", function);
    }

    /**
     * Rule receiving the other captures only.
     */
    public static OverrideRule rewrite(Function<Map<String, Object>, Object> function) {
        Objects.requireNonNull(function, "function");
        return new OverrideRule("rewrite", record -> function.apply(record.valuesWithoutFocus()));
    }

    /**
     * Rule substituting a constant.
     */
    public static OverrideRule tweak(Object value) {
        return new OverrideRule("tweak", record -> value);
    }

    public Object apply(ResultRecord record) {
        return function.apply(record);
    }
}
