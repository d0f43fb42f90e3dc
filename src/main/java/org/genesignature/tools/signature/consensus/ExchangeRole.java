package org.genesignature.tools.signature.consensus;

/**
 * Which of the two matrices of a bootstrap iteration an exchanged sample was drawn from.
 */
public enum ExchangeRole {
    QUERY("query"),
    REFERENCE("reference");

    private final String name;

    ExchangeRole(final String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
