package com.examboard.pseudocode.transform.types;

import java.util.Map;
import java.util.Set;

import com.examboard.pseudocode.diagnostics.Diagnostics;

public class TypeScriptTypeNormalizer extends TypeNormalizer {

    private static final Map<String, PseudoType> SCALARS = Map.of(
        "number", PseudoType.REAL,
        "Number", PseudoType.REAL,
        "bigint", PseudoType.INTEGER,
        "string", PseudoType.STRING,
        "String", PseudoType.STRING,
        "boolean", PseudoType.BOOLEAN,
        "Boolean", PseudoType.BOOLEAN
    );

    private static final Set<String> DYNAMIC = Set.of("any", "unknown", "object", "Object", "{}");

    public TypeScriptTypeNormalizer(Set<String> declaredTypeNames, Diagnostics diagnostics) {
        super(declaredTypeNames, diagnostics);
    }

    @Override
    public TypeNormalizer withDiagnostics(Diagnostics sink) {
        return new TypeScriptTypeNormalizer(declaredTypeNames, sink);
    }

    @Override
    protected boolean isNoValue(String type) {
        return type.equals("void") || type.equals("never") || type.equals("undefined");
    }

    @Override
    protected PseudoType mapScalar(String type) {
        return SCALARS.get(type);
    }

    /**
     * {@code Array<T>} and {@code ReadonlyArray<T>} are arrays of T.
     */
    @Override
    protected PseudoType mapSpecial(String type, String spelling, int line) {
        for (String prefix : new String[] {"Array<", "ReadonlyArray<"}) {
            if (type.startsWith(prefix) && type.endsWith(">")) {
                String element = type.substring(prefix.length(), type.length() - 1);
                PseudoType elementType = normalize(element, line);
                if (elementType == null) {
                    elementType = fallback(spelling, "Unknown", line);
                }
                return arrayOf(elementType.elementType(), elementType.getDimensions().size() + 1);
            }
        }
        return null;
    }

    @Override
    protected boolean isDynamic(String type) {
        return DYNAMIC.contains(type) || type.startsWith("{");
    }
}
