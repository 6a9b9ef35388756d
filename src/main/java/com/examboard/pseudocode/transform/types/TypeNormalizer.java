package com.examboard.pseudocode.transform.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;

/**
 * Maps a source type spelling onto the pseudocode type vocabulary. Unmappable spellings
 * become STRING and are reported as TYPE_CONVERSION_FALLBACK warnings.
 */
public abstract class TypeNormalizer {

    protected final Set<String> declaredTypeNames;
    protected final Diagnostics diagnostics;

    protected TypeNormalizer(Set<String> declaredTypeNames, Diagnostics diagnostics) {
        this.declaredTypeNames = declaredTypeNames;
        this.diagnostics = diagnostics;
    }

    /**
     * @return the normalized type, or null when the spelling means "no value" (void)
     *         or asks for inference (var)
     */
    public PseudoType normalize(String spelling, int line) {
        if (spelling == null || spelling.isBlank()) {
            return null;
        }
        String type = spelling.trim();
        if (type.endsWith("[]")) {
            int dimensions = 0;
            while (type.endsWith("[]")) {
                type = type.substring(0, type.length() - 2).trim();
                dimensions++;
            }
            PseudoType element = normalize(type, line);
            if (element == null) {
                element = fallback(spelling, "Unknown", line);
            }
            return arrayOf(element, dimensions);
        }
        if (isNoValue(type)) {
            return null;
        }
        PseudoType scalar = mapScalar(type);
        if (scalar != null) {
            return scalar;
        }
        PseudoType special = mapSpecial(type, spelling, line);
        if (special != null) {
            return special;
        }
        if (type.contains("=>")) {
            return fallback(spelling, "Function", line);
        }
        if (type.contains("|") || type.contains(" & ")) {
            return fallback(spelling, "Union", line);
        }
        if (type.contains("<")) {
            return fallback(spelling, "Generic", line);
        }
        if (declaredTypeNames.contains(type)) {
            diagnostics.info(DiagnosticCode.TYPE_CONVERSION_FALLBACK,
                    "Type '" + type + "' kept as a user-defined type", line, null);
            return PseudoType.userDefined(type);
        }
        if (isDynamic(type)) {
            return fallback(spelling, "Dynamic", line);
        }
        return fallback(spelling, "Unknown", line);
    }

    protected PseudoType arrayOf(PseudoType element, int dimensions) {
        List<String> sizes = new ArrayList<>();
        for (int i = 0; i < dimensions; i++) {
            sizes.add(PseudoType.UNKNOWN_SIZE);
        }
        return PseudoType.arrayOf(element, sizes);
    }

    protected PseudoType fallback(String spelling, String category, int line) {
        diagnostics.warning(DiagnosticCode.TYPE_CONVERSION_FALLBACK,
                category + " type '" + spelling.trim() + "' converted to STRING", line, null,
                "Declare the variable with INTEGER, REAL, STRING, CHAR or BOOLEAN");
        return PseudoType.fallbackType();
    }

    /**
     * A normalizer with the same type names that reports into another sink.
     */
    public abstract TypeNormalizer withDiagnostics(Diagnostics sink);

    protected abstract boolean isNoValue(String type);

    /**
     * @return the scalar type for a built-in spelling, or null
     */
    protected abstract PseudoType mapScalar(String type);

    /**
     * Language-specific shapes such as {@code Array<T>}.
     *
     * @return null when the spelling is not special
     */
    protected PseudoType mapSpecial(String type, String spelling, int line) {
        return null;
    }

    protected abstract boolean isDynamic(String type);
}
