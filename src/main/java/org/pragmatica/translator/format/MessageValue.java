package org.pragmatica.translator.format;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.function.Function;

/**
 * Value substituted for a tag, void tag or placeholder.
 */
public sealed interface MessageValue {

    /**
     * Render this value. Wrappers receive the already rendered children of the tag,
     * literals and numbers ignore them.
     */
    Object apply(String children);

    /**
     * Plain string.
     */
    record Literal(String text) implements MessageValue {
        @Override
        public Object apply(String children) {
            return text;
        }
    }

    /**
     * Number rendered in its shortest decimal form: {@code 5}, {@code 2.5}, never {@code 5.0}.
     */
    record Numeric(Number number) implements MessageValue {
        @Override
        public Object apply(String children) {
            return decimal(number);
        }
    }

    /**
     * Function re-wrapping the rendered children of a tag, e.g. into a link element.
     * The result may be of any type.
     */
    record Wrapper(Function<? super String, ?> function) implements MessageValue {
        @Override
        public Object apply(String children) {
            return function.apply(children);
        }
    }

    static MessageValue literal(String text) {
        return new Literal(text);
    }

    static MessageValue number(Number number) {
        return new Numeric(number);
    }

    static MessageValue wrapper(Function<? super String, ?> function) {
        return new Wrapper(function);
    }

    /**
     * Convert a raw map value: {@link MessageValue}, {@link CharSequence}, {@link Number} or {@link Function}.
     *
     * @throws IllegalArgumentException for any other type
     */
    @SuppressWarnings("unchecked")
    static MessageValue of(String name, Object value) {
        if (value instanceof MessageValue messageValue) {
            return messageValue;
        }
        if (value instanceof CharSequence text) {
            return literal(text.toString());
        }
        if (value instanceof Number number) {
            return number(number);
        }
        if (value instanceof Function<?, ?> function) {
            return wrapper((Function<? super String, ?>) function);
        }
        throw new IllegalArgumentException("Unsupported value for node \"" + name + "\": "
                                           + (value == null ? "null" : value.getClass().getName()));
    }

    private static String decimal(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
            || number instanceof Byte || number instanceof BigInteger) {
            return number.toString();
        }
        if (number instanceof BigDecimal bigDecimal) {
            return plain(bigDecimal);
        }
        var value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return plain(BigDecimal.valueOf(value));
    }

    private static String plain(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }
}
