package org.psfront.syntax.fixity;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable table of declared operator fixities.
 * Operators without a declaration default to {@code infixl 9}.
 */
public final class FixityTable {

    public static final Fixity DEFAULT_FIXITY = Fixity.infixl(Fixity.MAX_PRECEDENCE);

    private final Map<String, Fixity> fixities;

    private FixityTable(Map<String, Fixity> fixities) {
        this.fixities = Map.copyOf(fixities);
    }

    public static FixityTable empty() {
        return new FixityTable(Map.of());
    }

    /**
     * Returns a new table with {@code operator} declared as {@code fixity}.
     */
    public FixityTable with(String operator, Fixity fixity) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(fixity, "Fixity cannot be null");
        Map<String, Fixity> updated = new HashMap<>(fixities);
        updated.put(operator, fixity);
        return new FixityTable(updated);
    }

    public Fixity fixityOf(String operator) {
        return fixities.getOrDefault(operator, DEFAULT_FIXITY);
    }

    public boolean isDeclared(String operator) {
        return fixities.containsKey(operator);
    }

    public int size() {
        return fixities.size();
    }
}
