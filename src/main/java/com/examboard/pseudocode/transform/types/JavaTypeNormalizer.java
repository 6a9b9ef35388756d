package com.examboard.pseudocode.transform.types;

import java.util.Map;
import java.util.Set;

import com.examboard.pseudocode.diagnostics.Diagnostics;

public class JavaTypeNormalizer extends TypeNormalizer {

    private static final Map<String, PseudoType> SCALARS = Map.ofEntries(
        Map.entry("int", PseudoType.INTEGER),
        Map.entry("long", PseudoType.INTEGER),
        Map.entry("short", PseudoType.INTEGER),
        Map.entry("byte", PseudoType.INTEGER),
        Map.entry("Integer", PseudoType.INTEGER),
        Map.entry("Long", PseudoType.INTEGER),
        Map.entry("Short", PseudoType.INTEGER),
        Map.entry("Byte", PseudoType.INTEGER),
        Map.entry("BigInteger", PseudoType.INTEGER),
        Map.entry("double", PseudoType.REAL),
        Map.entry("float", PseudoType.REAL),
        Map.entry("Double", PseudoType.REAL),
        Map.entry("Float", PseudoType.REAL),
        Map.entry("BigDecimal", PseudoType.REAL),
        Map.entry("String", PseudoType.STRING),
        Map.entry("StringBuilder", PseudoType.STRING),
        Map.entry("StringBuffer", PseudoType.STRING),
        Map.entry("char", PseudoType.CHAR),
        Map.entry("Character", PseudoType.CHAR),
        Map.entry("boolean", PseudoType.BOOLEAN),
        Map.entry("Boolean", PseudoType.BOOLEAN)
    );

    public JavaTypeNormalizer(Set<String> declaredTypeNames, Diagnostics diagnostics) {
        super(declaredTypeNames, diagnostics);
    }

    @Override
    public TypeNormalizer withDiagnostics(Diagnostics sink) {
        return new JavaTypeNormalizer(declaredTypeNames, sink);
    }

    @Override
    protected boolean isNoValue(String type) {
        return type.equals("void") || type.equals("Void") || type.equals("var");
    }

    @Override
    protected PseudoType mapScalar(String type) {
        String simple = type.startsWith("java.") ? type.substring(type.lastIndexOf('.') + 1) : type;
        return SCALARS.get(simple);
    }

    @Override
    protected boolean isDynamic(String type) {
        return type.equals("Object");
    }
}
