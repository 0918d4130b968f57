package com.ivamare.reliability.model;

/**
 * Regulatory regimes the audit ledger can report against.
 */
public enum ComplianceFramework {
    /** Anti-money laundering */
    AML("AML"),

    /** Know your customer */
    KYC("KYC"),

    /** Sarbanes-Oxley financial controls */
    SOX("SOX"),

    /** Payment card industry data security */
    PCI_DSS("PCI-DSS");

    private final String value;

    ComplianceFramework(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a framework by its external name ("PCI-DSS") or enum name ("PCI_DSS").
     *
     * @return the framework, or null when the name is unknown
     */
    public static ComplianceFramework fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ComplianceFramework framework : values()) {
            if (framework.value.equalsIgnoreCase(value) || framework.name().equalsIgnoreCase(value)) {
                return framework;
            }
        }
        return null;
    }
}
