package com.examboard.pseudocode.converter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examboard.pseudocode.config.ConversionOptions;
import com.examboard.pseudocode.converter.validation.InputValidator;
import com.examboard.pseudocode.diagnostics.Diagnostic;
import com.examboard.pseudocode.diagnostics.DiagnosticCode;
import com.examboard.pseudocode.diagnostics.Severity;
import com.examboard.pseudocode.generator.PseudocodeGenerator;
import com.examboard.pseudocode.model.Language;
import com.examboard.pseudocode.model.ir.IrKind;
import com.examboard.pseudocode.model.ir.IrNode;
import com.examboard.pseudocode.parser.JavaSourceParser;
import com.examboard.pseudocode.parser.ParseResult;
import com.examboard.pseudocode.parser.SourceParser;
import com.examboard.pseudocode.parser.TypeScriptSourceParser;
import com.examboard.pseudocode.transform.AstTransformer;
import com.examboard.pseudocode.transform.JavaAstTransformer;
import com.examboard.pseudocode.transform.TransformResult;
import com.examboard.pseudocode.transform.TypeScriptAstTransformer;

/**
 * Runs validation, parsing, transformation and generation for one source text and merges the
 * diagnostics of every stage. Each call creates its own stage instances.
 */
public class PseudocodeConverter {
    private static final Logger log = LoggerFactory.getLogger(PseudocodeConverter.class);

    private static final Set<IrKind> UNCOUNTED = Set.of(IrKind.PROGRAM, IrKind.BLOCK, IrKind.CLASS_BLOCK,
            IrKind.CASE_BRANCH, IrKind.OTHERWISE_BRANCH, IrKind.COMMENT);

    private final InputValidator validator;

    public PseudocodeConverter() {
        this(new InputValidator());
    }

    public PseudocodeConverter(InputValidator validator) {
        this.validator = validator;
    }

    public ConversionResult convertJava(String source, ConversionOptions options) {
        return convertCode(source, Language.JAVA, options);
    }

    public ConversionResult convertTypeScript(String source, ConversionOptions options) {
        return convertCode(source, Language.TYPESCRIPT, options);
    }

    public ConversionResult convertCode(String source, Language language, ConversionOptions options) {
        long started = System.nanoTime();
        ConversionOptions effective = options == null ? ConversionOptions.defaults() : options;

        List<Diagnostic> validation = validator.validate(source);
        if (validation.stream().anyMatch(Diagnostic::isError)) {
            log.warn("Rejected {} input: {}", language.getDisplayName(), validation.get(0).getMessage());
            return result("", validation, false, language, 0, started);
        }

        List<Diagnostic> diagnostics = new ArrayList<>(validation);
        ParseResult parsed = parserFor(language, effective).parse(source);
        diagnostics.addAll(parsed.getDiagnostics());

        boolean structuralErrors = parsed.hasStructuralErrors();
        TransformResult transformed = transformerFor(language, effective).transform(parsed.getTree());
        transformed.getDiagnostics().stream()
                .filter(d -> !(structuralErrors && d.getCode() == DiagnosticCode.EMPTY_PROGRAM))
                .forEach(diagnostics::add);

        PseudocodeGenerator generator = new PseudocodeGenerator(effective);
        String text = generator.generate(transformed.getProgram());
        diagnostics.addAll(generator.getDiagnostics());

        if (structuralErrors) {
            long found = parsed.getDiagnostics().stream().filter(Diagnostic::isError).count();
            text = "// ERROR: STRUCTURAL_ERROR (" + found + " found) - output is best-effort\n" + text;
            log.warn("{} source has {} structural errors; output is best-effort", language.getDisplayName(), found);
        }
        int statements = countStatements(transformed.getProgram());
        log.info("Converted {} source: {} statements, {} diagnostics", language.getDisplayName(), statements,
                diagnostics.size());
        return result(text, diagnostics, !structuralErrors, language, statements, started);
    }

    private static SourceParser parserFor(Language language, ConversionOptions options) {
        return switch (language) {
            case JAVA -> new JavaSourceParser(options);
            case TYPESCRIPT -> new TypeScriptSourceParser(options);
        };
    }

    private static AstTransformer transformerFor(Language language, ConversionOptions options) {
        return switch (language) {
            case JAVA -> new JavaAstTransformer(options);
            case TYPESCRIPT -> new TypeScriptAstTransformer(options);
        };
    }

    private static int countStatements(IrNode program) {
        int count = 0;
        Deque<IrNode> pending = new ArrayDeque<>();
        pending.push(program);
        while (!pending.isEmpty()) {
            IrNode node = pending.pop();
            if (!UNCOUNTED.contains(node.getKind())) {
                count++;
            }
            node.getChildren().forEach(pending::push);
        }
        return count;
    }

    private static ConversionResult result(String text, List<Diagnostic> diagnostics, boolean success,
            Language language, int statements, long started) {
        ConversionMetadata metadata = ConversionMetadata.builder()
                .language(language)
                .statementCount(statements)
                .errorCount(count(diagnostics, Severity.ERROR))
                .warningCount(count(diagnostics, Severity.WARNING))
                .infoCount(count(diagnostics, Severity.INFO))
                .durationMillis((System.nanoTime() - started) / 1_000_000)
                .build();
        return ConversionResult.builder()
                .pseudocode(text)
                .diagnostics(diagnostics)
                .success(success)
                .metadata(metadata)
                .build();
    }

    private static long count(List<Diagnostic> diagnostics, Severity severity) {
        return diagnostics.stream().filter(d -> d.getSeverity() == severity).count();
    }
}
