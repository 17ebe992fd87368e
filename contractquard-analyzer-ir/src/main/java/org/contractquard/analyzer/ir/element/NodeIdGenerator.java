package org.contractquard.analyzer.ir.element;

/**
 * Produces identifiers of the form {@code prefix_n}. One generator per transformation, so that
 * transforming the same input twice yields the same identifiers.
 */
public class NodeIdGenerator {
    private int counter;

    public String next(String prefix) {
        return prefix + "_" + (++counter);
    }

    public int generated() {
        return counter;
    }
}
