package com.questrail.gatt.validation;

/**
 * Declarative constraints a characteristic places on its raw bytes and its
 * decoded value.
 *
 * <p>
 * Every field is optional. Length fields apply to raw input; value fields
 * apply to the decoded (or to-be-encoded) value. A value outside
 * {@code [minValue, maxValue]} fails only if it is a finite number.
 * </p>
 *
 * @param exactLength    required byte count for fixed-length layouts
 * @param minLength      minimum byte count
 * @param maxLength      maximum byte count
 * @param variableLength {@code true} if buffers longer than {@code exactLength}
 *                       are acceptable
 * @param minValue       inclusive lower bound of numeric values
 * @param maxValue       inclusive upper bound of numeric values
 * @param expectedType   runtime type of the decoded value
 */
public record ValidationConstraints(
    Integer exactLength,
    Integer minLength,
    Integer maxLength,
    boolean variableLength,
    Double minValue,
    Double maxValue,
    Class<?> expectedType
) {
    private static final ValidationConstraints NONE = builder().build();

    public ValidationConstraints {
        checkLength("exactLength", exactLength);
        checkLength("minLength", minLength);
        checkLength("maxLength", maxLength);
        if (minLength != null && maxLength != null && minLength > maxLength) {
            throw new IllegalArgumentException(
                    "minLength " + minLength + " exceeds maxLength " + maxLength);
        }
        if (minValue != null && maxValue != null && minValue > maxValue) {
            throw new IllegalArgumentException(
                    "minValue " + minValue + " exceeds maxValue " + maxValue);
        }
    }

    private static void checkLength(String name, Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0 (was " + value + ")");
        }
    }

    public static ValidationConstraints none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer exactLength;
        private Integer minLength;
        private Integer maxLength;
        private boolean variableLength;
        private Double minValue;
        private Double maxValue;
        private Class<?> expectedType;

        public Builder withExactLength(int exactLength) {
            this.exactLength = exactLength;
            return this;
        }

        public Builder withMinLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder withMaxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder withLengthRange(int minLength, int maxLength) {
            this.minLength = minLength;
            this.maxLength = maxLength;
            return this;
        }

        public Builder withVariableLength(boolean variableLength) {
            this.variableLength = variableLength;
            return this;
        }

        public Builder withValueRange(double minValue, double maxValue) {
            this.minValue = minValue;
            this.maxValue = maxValue;
            return this;
        }

        public Builder withMinValue(double minValue) {
            this.minValue = minValue;
            return this;
        }

        public Builder withMaxValue(double maxValue) {
            this.maxValue = maxValue;
            return this;
        }

        public Builder withExpectedType(Class<?> expectedType) {
            this.expectedType = expectedType;
            return this;
        }

        public ValidationConstraints build() {
            return new ValidationConstraints(exactLength, minLength, maxLength, variableLength,
                    minValue, maxValue, expectedType);
        }
    }
}
