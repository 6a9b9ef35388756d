package com.examboard.pseudocode.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Diagnostics;
import com.examboard.pseudocode.model.ir.IrKind;
import com.examboard.pseudocode.model.ir.IrMetadata;
import com.examboard.pseudocode.model.ir.IrNode;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Renders an IR tree as pseudocode text.
 *
 * The tree is walked with an explicit work stack, so nesting depth is bounded by heap rather than
 * by the call stack. Every line goes through one {@link IndentationTracker}; block structure is
 * expressed only through {@link LineRole}s.
 */
public class PseudocodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(PseudocodeGenerator.class);

    private static final String ARROW = "←";

    private final ConversionOptions options;
    private final Diagnostics diagnostics = new Diagnostics();

    public PseudocodeGenerator(ConversionOptions options) {
        this.options = options;
    }

    public String generate(IrNode program) {
        int width = options.getIndentWidth();
        if (width <= 0) {
            diagnostics.info(DiagnosticCode.INVALID_CONFIGURATION,
                    "Indent width " + width + " is not positive; output is not indented", null, null);
        }
        IndentationTracker indentation = new IndentationTracker(width);
        List<String> lines = new ArrayList<>();
        Deque<Step> work = new ArrayDeque<>();
        work.push(Step.visit(program));

        while (!work.isEmpty()) {
            Step step = work.pop();
            switch (step.getType()) {
                case VISIT -> expand(step.getNode(), work);
                case EMIT -> lines.add(indentation.place(step.getRole(), step.getText()));
                case BLANK -> lines.add("");
            }
        }
        if (indentation.getLevel() != 0) {
            log.warn("Generation finished at indentation level {}", indentation.getLevel());
        }
        String text = new PseudocodeFormatter(options, diagnostics).format(lines);
        log.debug("Generated {} lines of pseudocode", lines.size());
        return text;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics.toList();
    }

    /**
     * Pushes the steps for one node. Steps are collected in output order, then pushed in reverse.
     */
    private void expand(IrNode node, Deque<Step> work) {
        List<Step> steps = new ArrayList<>();
        if (node.getKind() != IrKind.COMMENT && node.getKind() != IrKind.INTERFACE_SUMMARY) {
            comments(node.getAnnotations(), steps);
        }
        switch (node.getKind()) {
            case PROGRAM -> topLevel(node.getChildren(), steps);
            case CLASS_BLOCK -> topLevel(node.getChildren(), steps);
            case INTERFACE_SUMMARY, COMMENT -> comments(node.getAnnotations(), steps);
            case BLOCK, CASE_BRANCH, OTHERWISE_BRANCH -> node.getChildren().forEach(c -> steps.add(Step.visit(c)));
            case VARIABLE_DECLARATION -> steps.add(Step.plain(declaration(node)));
            case CONSTANT_DECLARATION -> steps.add(Step.plain(
                    "CONSTANT " + node.meta(IrMetadata.NAME) + " = " + node.meta(IrMetadata.VALUE)));
            case PROCEDURE -> callable(node, "PROCEDURE " + node.meta(IrMetadata.NAME)
                    + "(" + node.optionalMeta(IrMetadata.PARAMETERS).orElse("") + ")", "ENDPROCEDURE", steps);
            case FUNCTION -> callable(node, "FUNCTION " + node.meta(IrMetadata.NAME)
                    + "(" + node.optionalMeta(IrMetadata.PARAMETERS).orElse("") + ") RETURNS "
                    + node.meta(IrMetadata.RETURN_TYPE), "ENDFUNCTION", steps);
            case IF -> conditional(node, steps);
            case WHILE -> {
                steps.add(Step.opener("WHILE " + node.meta(IrMetadata.CONDITION) + " DO"));
                steps.add(Step.visit(node.child(0)));
                steps.add(Step.closer("ENDWHILE"));
            }
            case REPEAT_UNTIL -> {
                steps.add(Step.opener("REPEAT"));
                steps.add(Step.visit(node.child(0)));
                steps.add(Step.closer("UNTIL " + node.meta(IrMetadata.CONDITION)));
            }
            case FOR -> {
                String variable = node.meta(IrMetadata.VARIABLE);
                String header = "FOR " + variable + " " + ARROW + " " + node.meta(IrMetadata.START) + " TO "
                        + node.meta(IrMetadata.END)
                        + node.optionalMeta(IrMetadata.STEP).map(s -> " STEP " + s).orElse("");
                steps.add(Step.opener(header));
                steps.add(Step.visit(node.child(0)));
                steps.add(Step.closer("NEXT " + variable));
            }
            case CASE -> selection(node, steps);
            case ASSIGNMENT -> steps.add(Step.plain(
                    node.meta(IrMetadata.TARGET) + " " + ARROW + " " + node.meta(IrMetadata.EXPRESSION)));
            case OUTPUT -> steps.add(Step.plain("OUTPUT " + node.meta(IrMetadata.EXPRESSION)));
            case INPUT -> steps.add(Step.plain("INPUT " + node.meta(IrMetadata.TARGET)));
            case PROCEDURE_CALL -> steps.add(Step.plain("CALL " + node.meta(IrMetadata.TEXT)));
            case RETURN -> steps.add(Step.plain(
                    node.optionalMeta(IrMetadata.EXPRESSION).map(e -> "RETURN " + e).orElse("RETURN")));
            case EXPRESSION -> steps.add(Step.plain(node.meta(IrMetadata.TEXT)));
            case ERROR_RECOVERY -> steps.add(Step.plain("// ERROR: " + node.meta(IrMetadata.MESSAGE)));
        }
        for (int i = steps.size() - 1; i >= 0; i--) {
            work.push(steps.get(i));
        }
    }

    private void comments(List<String> annotations, List<Step> steps) {
        if (!options.isIncludeAnnotationComments()) {
            return;
        }
        for (String annotation : annotations) {
            steps.add(Step.plain("// " + annotation));
        }
    }

    /**
     * Program and class members; callables are set apart by blank lines.
     */
    private static void topLevel(List<IrNode> items, List<Step> steps) {
        for (int i = 0; i < items.size(); i++) {
            IrNode item = items.get(i);
            boolean callable = item.getKind() == IrKind.PROCEDURE || item.getKind() == IrKind.FUNCTION
                    || item.getKind() == IrKind.CLASS_BLOCK;
            if (callable && i > 0) {
                steps.add(Step.blank());
            }
            steps.add(Step.visit(item));
            if (callable && i < items.size() - 1) {
                steps.add(Step.blank());
            }
        }
    }

    private static String declaration(IrNode node) {
        String text = "DECLARE " + node.meta(IrMetadata.NAME) + " : " + node.meta(IrMetadata.DATA_TYPE);
        return node.optionalMeta(IrMetadata.VALUE).map(v -> text + " " + ARROW + " " + v).orElse(text);
    }

    private static void callable(IrNode node, String header, String closer, List<Step> steps) {
        steps.add(Step.opener(header));
        node.getChildren().forEach(c -> steps.add(Step.visit(c)));
        steps.add(Step.closer(closer));
    }

    /**
     * IF with an optional ELSE. An else branch holding nothing but another unannotated IF
     * continues the chain as ELSE IF under the same ENDIF.
     */
    private static void conditional(IrNode node, List<Step> steps) {
        steps.add(Step.opener("IF " + node.meta(IrMetadata.CONDITION) + " THEN"));
        IrNode current = node;
        while (true) {
            steps.add(Step.visit(current.child(0)));
            if (current.getChildren().size() < 2) {
                break;
            }
            IrNode otherwise = current.child(1);
            if (otherwise.getChildren().size() == 1 && otherwise.child(0).getKind() == IrKind.IF
                    && otherwise.child(0).getAnnotations().isEmpty()) {
                current = otherwise.child(0);
                steps.add(Step.continuation("ELSE IF " + current.meta(IrMetadata.CONDITION) + " THEN"));
                continue;
            }
            steps.add(Step.continuation("ELSE"));
            steps.add(Step.visit(otherwise));
            break;
        }
        steps.add(Step.closer("ENDIF"));
    }

    /**
     * CASE OF: labels sit at the level of CASE OF and ENDCASE, their bodies one level deeper.
     */
    private void selection(IrNode node, List<Step> steps) {
        steps.add(Step.opener("CASE OF " + node.meta(IrMetadata.EXPRESSION)));
        for (IrNode branch : node.getChildren()) {
            String label = branch.getKind() == IrKind.OTHERWISE_BRANCH
                    ? "OTHERWISE:"
                    : branch.meta(IrMetadata.LABEL) + ":";
            steps.add(Step.continuation(label));
            comments(branch.getAnnotations(), steps);
            branch.getChildren().forEach(c -> steps.add(Step.visit(c)));
        }
        steps.add(Step.closer("ENDCASE"));
    }

    private enum StepType {
        VISIT,
        EMIT,
        BLANK
    }

    @Value
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    private static class Step {
        StepType type;
        IrNode node;
        LineRole role;
        String text;

        static Step visit(IrNode node) {
            return new Step(StepType.VISIT, node, null, null);
        }

        static Step plain(String text) {
            return new Step(StepType.EMIT, null, LineRole.PLAIN, text);
        }

        static Step opener(String text) {
            return new Step(StepType.EMIT, null, LineRole.OPENER, text);
        }

        static Step closer(String text) {
            return new Step(StepType.EMIT, null, LineRole.CLOSER, text);
        }

        static Step continuation(String text) {
            return new Step(StepType.EMIT, null, LineRole.CONTINUATION, text);
        }

        static Step blank() {
            return new Step(StepType.BLANK, null, null, null);
        }
    }
}
