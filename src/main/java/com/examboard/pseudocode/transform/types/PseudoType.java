package com.examboard.pseudocode.transform.types;

import java.util.List;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A type in the pseudocode vocabulary: one of the five scalar types, a class name declared
 * in the converted source, or an array of either.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PseudoType {
    public static final String UNKNOWN_SIZE = "SIZE";

    public static final PseudoType INTEGER = new PseudoType("INTEGER", List.of(), false, false);
    public static final PseudoType REAL = new PseudoType("REAL", List.of(), false, false);
    public static final PseudoType STRING = new PseudoType("STRING", List.of(), false, false);
    public static final PseudoType CHAR = new PseudoType("CHAR", List.of(), false, false);
    public static final PseudoType BOOLEAN = new PseudoType("BOOLEAN", List.of(), false, false);

    String name;
    List<String> dimensions;
    /**
     * True when the type could not be mapped and STRING was substituted.
     */
    boolean fallback;
    boolean userDefined;

    public static PseudoType fallbackType() {
        return new PseudoType("STRING", List.of(), true, false);
    }

    public static PseudoType userDefined(String className) {
        return new PseudoType(className, List.of(), false, true);
    }

    public static PseudoType arrayOf(PseudoType element, List<String> dimensions) {
        return new PseudoType(element.getName(), List.copyOf(dimensions), element.isFallback(),
                element.isUserDefined());
    }

    public PseudoType withDimensions(List<String> newDimensions) {
        return new PseudoType(name, List.copyOf(newDimensions), fallback, userDefined);
    }

    public PseudoType elementType() {
        return new PseudoType(name, List.of(), fallback, userDefined);
    }

    /**
     * The type left after one level of indexing.
     */
    public PseudoType indexed() {
        if (dimensions.size() <= 1) {
            return elementType();
        }
        return new PseudoType(name, dimensions.subList(1, dimensions.size()), fallback, userDefined);
    }

    public boolean isArray() {
        return !dimensions.isEmpty();
    }

    public boolean isString() {
        return !isArray() && !fallback && name.equals("STRING");
    }

    public boolean isInteger() {
        return !isArray() && name.equals("INTEGER");
    }

    public boolean isNumeric() {
        return !isArray() && (name.equals("INTEGER") || name.equals("REAL"));
    }

    public String render() {
        if (dimensions.isEmpty()) {
            return name;
        }
        return dimensions.stream()
                .map(d -> "1:" + d)
                .collect(Collectors.joining(", ", "ARRAY[", "] OF " + name));
    }

    @Override
    public String toString() {
        return render();
    }
}
