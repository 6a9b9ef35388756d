package com.examboard.pseudocode.transform.mapping;

import static com.examboard.pseudocode.transform.mapping.IndexArithmetic.group;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.syntax.SyntaxNode;
import com.examboard.pseudocode.transform.types.PseudoType;

/**
 * Maps string, collection and math library calls onto the pseudocode built-in functions.
 */
public class StringMethodMapper {
    private static final Logger log = LoggerFactory.getLogger(StringMethodMapper.class);

    /**
     * Methods that only exist on strings; applied to receivers of unknown type as well.
     */
    private static final Set<String> STRING_ONLY = Set.of(
        "charAt", "substring", "toUpperCase", "toLowerCase", "concat", "startsWith", "endsWith",
        "equalsIgnoreCase", "trim"
    );

    private final Diagnostics diagnostics;

    public StringMethodMapper(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Maps {@code receiver.method(args)}.
     *
     * @return empty when the call has no mapping and should pass through unchanged
     */
    public Optional<MappedCall> mapInstanceCall(String receiver, PseudoType receiverType, String method,
            List<SyntaxNode> args, ArgumentRenderer renderer, int line) {
        boolean stringReceiver = receiverType != null && receiverType.isString();
        boolean unknownReceiver = receiverType == null || receiverType.isFallback();
        boolean arrayReceiver = receiverType != null && receiverType.isArray();

        if (STRING_ONLY.contains(method) && !stringReceiver && !unknownReceiver) {
            return Optional.empty();
        }
        if (!stringReceiver && !unknownReceiver && !arrayReceiver && !method.equals("equals")
                && !method.equals("size")) {
            return Optional.empty();
        }

        MappedCall mapped = switch (method) {
            case "length", "size" -> args.isEmpty() ? call("LENGTH(" + receiver + ")", PseudoType.INTEGER) : null;
            case "isEmpty" -> args.isEmpty() ? call("LENGTH(" + receiver + ") = 0", PseudoType.BOOLEAN) : null;
            case "equals" -> args.size() == 1
                    ? call(group(receiver) + " = " + group(renderer.value(args.get(0))), PseudoType.BOOLEAN)
                    : null;
            case "charAt" -> args.size() == 1
                    ? call("SUBSTRING(" + receiver + ", " + renderer.oneBased(args.get(0)) + ", 1)", PseudoType.CHAR)
                    : null;
            case "substring" -> substring(receiver, args, renderer);
            case "indexOf" -> args.size() == 1 && !arrayReceiver
                    ? call("FIND(" + receiver + ", " + renderer.value(args.get(0)) + ") - 1", PseudoType.INTEGER)
                    : null;
            case "toUpperCase" -> args.isEmpty() ? call("UCASE(" + receiver + ")", PseudoType.STRING) : null;
            case "toLowerCase" -> args.isEmpty() ? call("LCASE(" + receiver + ")", PseudoType.STRING) : null;
            case "concat", "append" -> args.size() == 1 && !arrayReceiver
                    ? call(receiver + " & " + group(renderer.value(args.get(0))), PseudoType.STRING)
                    : null;
            case "contains", "includes" -> args.size() == 1 && !arrayReceiver
                    ? call("FIND(" + receiver + ", " + renderer.value(args.get(0)) + ") > 0", PseudoType.BOOLEAN)
                    : null;
            case "startsWith" -> affix("LEFT", receiver, args, renderer);
            case "endsWith" -> affix("RIGHT", receiver, args, renderer);
            case "equalsIgnoreCase" -> args.size() == 1
                    ? call("LCASE(" + receiver + ") = LCASE(" + renderer.value(args.get(0)) + ")", PseudoType.BOOLEAN)
                    : null;
            case "trim" -> args.isEmpty() ? call("TRIM(" + receiver + ")", PseudoType.STRING) : null;
            case "toString" -> args.isEmpty() && stringReceiver ? call(receiver, PseudoType.STRING) : null;
            default -> null;
        };

        if (mapped == null) {
            if (stringReceiver) {
                diagnostics.warning(DiagnosticCode.NO_DIRECT_EQUIVALENT,
                        "String method " + method + "() has no pseudocode equivalent and was kept as written",
                        line, null, "Rewrite the operation with LENGTH, SUBSTRING, FIND, UCASE or LCASE");
            }
            return Optional.empty();
        }
        diagnostics.info(DiagnosticCode.METHOD_MAPPING, describe(method, mapped), line, null);
        log.debug("Mapped {}() on line {} to {}", method, line, mapped.getText());
        return Optional.of(mapped);
    }

    /**
     * Maps a {@code .length} property read.
     */
    public MappedCall mapLengthProperty(String receiver, int line) {
        diagnostics.info(DiagnosticCode.METHOD_MAPPING, "length converted to LENGTH", line, null);
        return call("LENGTH(" + receiver + ")", PseudoType.INTEGER);
    }

    /**
     * Maps {@code Math.method(args)}; other owners and unknown math methods pass through.
     */
    public Optional<MappedCall> mapStaticCall(String owner, String method, List<SyntaxNode> args,
            ArgumentRenderer renderer, int line) {
        if (!owner.equals("Math")) {
            return Optional.empty();
        }
        MappedCall mapped = switch (method) {
            case "random" -> args.isEmpty() ? call("RANDOM()", PseudoType.REAL) : null;
            case "round" -> args.size() == 1
                    ? call("ROUND(" + renderer.value(args.get(0)) + ", 0)", PseudoType.INTEGER)
                    : null;
            case "floor" -> args.size() == 1 ? call("INT(" + renderer.value(args.get(0)) + ")", PseudoType.INTEGER) : null;
            default -> null;
        };
        if (mapped == null) {
            return Optional.empty();
        }
        diagnostics.info(DiagnosticCode.METHOD_MAPPING, "Math." + method + " converted to "
                + mapped.getText().substring(0, mapped.getText().indexOf('(')), line, null);
        return Optional.of(mapped);
    }

    private MappedCall substring(String receiver, List<SyntaxNode> args, ArgumentRenderer renderer) {
        if (args.size() == 1) {
            String start = renderer.value(args.get(0));
            return call("SUBSTRING(" + receiver + ", " + renderer.oneBased(args.get(0)) + ", "
                    + IndexArithmetic.difference("LENGTH(" + receiver + ")", start) + ")", PseudoType.STRING);
        }
        if (args.size() == 2) {
            String start = renderer.value(args.get(0));
            String end = renderer.value(args.get(1));
            return call("SUBSTRING(" + receiver + ", " + renderer.oneBased(args.get(0)) + ", "
                    + IndexArithmetic.difference(end, start) + ")", PseudoType.STRING);
        }
        return null;
    }

    private MappedCall affix(String function, String receiver, List<SyntaxNode> args, ArgumentRenderer renderer) {
        if (args.size() != 1) {
            return null;
        }
        String part = renderer.value(args.get(0));
        return call(function + "(" + receiver + ", LENGTH(" + part + ")) = " + group(part), PseudoType.BOOLEAN);
    }

    private static String describe(String method, MappedCall mapped) {
        if (method.equals("indexOf")) {
            return "indexOf converted to FIND - result adjusted for 0-based indexing";
        }
        if (method.equals("toString")) {
            return "toString removed from a string value";
        }
        String text = mapped.getText();
        int paren = text.indexOf('(');
        String target;
        if (text.contains(" & ")) {
            target = "&";
        } else if (paren > 0 && text.substring(0, paren).chars().allMatch(Character::isUpperCase)) {
            target = text.substring(0, paren);
        } else {
            target = "=";
        }
        return method + " converted to " + target;
    }

    private static MappedCall call(String text, PseudoType type) {
        return new MappedCall(text, type);
    }
}
