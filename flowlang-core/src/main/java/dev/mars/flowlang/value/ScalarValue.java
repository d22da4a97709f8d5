/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowlang.value;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;

/**
 * A scalar leaf of the value tree.
 *
 * <p>The scalar keeps its source text verbatim and exposes typed views through
 * the {@code to*} accessors. Numbers are never converted eagerly, so float text
 * such as {@code 3.141519} survives untouched.
 *
 * @param type     resolved scalar type
 * @param text     source text of the scalar, never null
 * @param position source position, may be null
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public record ScalarValue(ScalarType type, String text, SourcePosition position) implements Value {

    private static final Set<String> TRUE_LITERALS = Set.of("true", "yes", "on", "y");
    private static final Set<String> FALSE_LITERALS = Set.of("false", "no", "off", "n");

    public ScalarValue {
        Objects.requireNonNull(type, "Scalar type cannot be null");
        Objects.requireNonNull(text, "Scalar text cannot be null");
    }

    public static ScalarValue of(String text) {
        return new ScalarValue(ScalarType.STRING, text, null);
    }

    public static ScalarValue ofInteger(long value) {
        return new ScalarValue(ScalarType.INTEGER, Long.toString(value), null);
    }

    public static ScalarValue ofFloat(String text) {
        return new ScalarValue(ScalarType.FLOAT, text, null);
    }

    public static ScalarValue ofBoolean(boolean value) {
        return new ScalarValue(ScalarType.BOOLEAN, Boolean.toString(value), null);
    }

    public static ScalarValue nullValue() {
        return new ScalarValue(ScalarType.NULL, "null", null);
    }

    public ScalarValue withPosition(SourcePosition newPosition) {
        return new ScalarValue(type, text, newPosition);
    }

    public boolean isString() {
        return type == ScalarType.STRING;
    }

    public boolean isNull() {
        return type == ScalarType.NULL;
    }

    public boolean isBoolean() {
        return type == ScalarType.BOOLEAN;
    }

    public boolean isInteger() {
        return type == ScalarType.INTEGER;
    }

    public boolean isNumber() {
        return type.isNumeric();
    }

    /**
     * The string form of the scalar, whatever its type.
     */
    public String asString() {
        return text;
    }

    /**
     * @return the boolean value, or empty when this is not a boolean scalar
     */
    public Optional<Boolean> toBoolean() {
        if (type != ScalarType.BOOLEAN) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(normalized)) {
            return Optional.of(Boolean.TRUE);
        }
        if (FALSE_LITERALS.contains(normalized)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    /**
     * @return the integer value, or empty when this is not an integer scalar or it overflows
     */
    public OptionalLong toLong() {
        if (type != ScalarType.INTEGER) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(parseInteger(text));
        } catch (NumberFormatException | ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * @return the numeric value of an integer or float scalar, or empty otherwise
     */
    public OptionalDouble toDouble() {
        if (type == ScalarType.INTEGER) {
            OptionalLong value = toLong();
            return value.isPresent() ? OptionalDouble.of(value.getAsLong()) : OptionalDouble.empty();
        }
        if (type != ScalarType.FLOAT) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(parseFloat(text));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * YAML 1.1 integer forms: {@code 0b} binary, {@code 0x} hex, a leading
     * {@code 0} for octal, and base 60 for colon-separated digits.
     */
    private static long parseInteger(String source) {
        String value = source.trim().replace("_", "");
        if (value.isEmpty()) {
            throw new NumberFormatException("Empty integer");
        }
        int sign = 1;
        if (value.charAt(0) == '-') {
            sign = -1;
            value = value.substring(1);
        } else if (value.charAt(0) == '+') {
            value = value.substring(1);
        }
        if ("0".equals(value)) {
            return 0;
        }
        if (value.startsWith("0b")) {
            return sign * Long.parseLong(value.substring(2), 2);
        }
        if (value.startsWith("0x")) {
            return sign * Long.parseLong(value.substring(2), 16);
        }
        if (value.startsWith("0")) {
            return sign * Long.parseLong(value.substring(1), 8);
        }
        if (value.indexOf(':') >= 0) {
            String[] digits = value.split(":");
            long result = 0;
            long base = 1;
            for (int i = digits.length - 1; i >= 0; i--) {
                result = Math.addExact(result, Math.multiplyExact(Long.parseLong(digits[i]), base));
                base = Math.multiplyExact(base, 60L);
            }
            return sign * result;
        }
        return sign * Long.parseLong(value);
    }

    private static double parseFloat(String source) {
        String value = source.trim().replace("_", "");
        switch (value.toLowerCase(Locale.ROOT)) {
            case ".inf":
            case "+.inf":
                return Double.POSITIVE_INFINITY;
            case "-.inf":
                return Double.NEGATIVE_INFINITY;
            case ".nan":
                return Double.NaN;
            default:
                break;
        }
        int sign = 1;
        if (value.startsWith("-")) {
            sign = -1;
            value = value.substring(1);
        } else if (value.startsWith("+")) {
            value = value.substring(1);
        }
        if (value.indexOf(':') >= 0) {
            String[] digits = value.split(":");
            double result = 0.0;
            long base = 1;
            for (int i = digits.length - 1; i >= 0; i--) {
                result += Double.parseDouble(digits[i]) * base;
                base *= 60;
            }
            return sign * result;
        }
        return sign * Double.parseDouble(value);
    }

    @Override
    public String toString() {
        return type == ScalarType.STRING ? "\"" + text + "\"" : text;
    }
}
