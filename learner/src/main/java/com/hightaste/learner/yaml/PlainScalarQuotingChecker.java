package com.hightaste.learner.yaml;

import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Quotes every string that a YAML 1.1 reader would resolve to something other
 * than a string when written plain: numbers in any notation ({@code 1e3},
 * {@code 0x1F}, {@code 1_000}, {@code 12:30}, {@code .inf}), timestamps,
 * booleans, nulls and the merge key {@code <<}.
 */
class PlainScalarQuotingChecker extends StringQuotingChecker.Default {

    private static final long serialVersionUID = 1L;

    private final transient Resolver resolver = new Resolver();

    @Override
    public boolean needToQuoteValue(String value) {
        return super.needToQuoteValue(value) || resolvesToNonString(value);
    }

    boolean resolvesToNonString(String value) {
        return !Tag.STR.equals(resolver.resolve(NodeId.scalar, value, true));
    }
}
