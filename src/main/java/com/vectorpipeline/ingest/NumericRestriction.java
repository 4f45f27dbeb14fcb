package com.vectorpipeline.ingest;

/**
 * Numeric filter clause. Exactly one of {@code valueInt} and {@code valueFloat} is set.
 */
public record NumericRestriction(String namespace, Long valueInt, Double valueFloat) {
    public NumericRestriction {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Numeric restriction namespace must not be blank");
        }
        if ((valueInt == null) == (valueFloat == null)) {
            throw new IllegalArgumentException("Numeric restriction " + namespace
                    + " must carry exactly one of valueInt or valueFloat");
        }
    }

    public static NumericRestriction ofInt(String namespace, long value) {
        return new NumericRestriction(namespace, value, null);
    }

    public static NumericRestriction ofFloat(String namespace, double value) {
        return new NumericRestriction(namespace, null, value);
    }

    public boolean isFloat() {
        return valueFloat != null;
    }
}
