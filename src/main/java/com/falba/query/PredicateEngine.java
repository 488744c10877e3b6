package com.falba.query;

import com.falba.model.AttributeValue;
import dev.cel.common.CelAbstractSyntaxTree;
import dev.cel.common.CelValidationException;
import dev.cel.common.types.CelType;
import dev.cel.common.types.SimpleType;
import dev.cel.compiler.CelCompiler;
import dev.cel.compiler.CelCompilerBuilder;
import dev.cel.compiler.CelCompilerFactory;
import dev.cel.runtime.CelEvaluationException;
import dev.cel.runtime.CelRuntime;
import dev.cel.runtime.CelRuntimeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Evaluates one CEL expression against per-run bindings.
 *
 * Facts are schemaless, so the variable declarations are inferred from each
 * binding's runtime values: bool, int, double and string map to the CEL type
 * of the same name, lists and maps to {@code dyn}. The expression is compiled
 * once per distinct declaration set and the program reused.
 *
 * Names that are not CEL identifiers, or are reserved words, cannot appear in
 * an expression and are left undeclared. Null values are treated as absent:
 * a null fact is not bound and nulls nested in lists or maps are dropped.
 */
public class PredicateEngine {

    private static final Logger log = LoggerFactory.getLogger(PredicateEngine.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[_a-zA-Z][_a-zA-Z0-9]*");

    private static final Set<String> RESERVED = Set.of(
        "true", "false", "null", "in", "as", "break", "const", "continue", "else",
        "for", "function", "if", "import", "let", "loop", "package", "namespace",
        "return", "var", "void", "while"
    );

    private static final CelRuntime RUNTIME = CelRuntimeFactory.standardCelRuntimeBuilder().build();

    private final String expression;
    private final Map<Map<String, CelType>, CelRuntime.Program> programs = new HashMap<>();

    public PredicateEngine(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("expression is required");
        }
        this.expression = expression;
    }

    /**
     * @return the boolean the expression yields for this binding
     * @throws EvaluationException if the expression does not compile against the
     *         binding, fails at runtime or yields something other than a boolean
     */
    public boolean evaluate(Map<String, AttributeValue> binding) {
        Map<String, CelType> declarations = new TreeMap<>();
        Map<String, Object> activation = new HashMap<>();
        for (Map.Entry<String, AttributeValue> entry : binding.entrySet()) {
            String name = entry.getKey();
            AttributeValue value = entry.getValue();
            if (!isBindable(name) || value.kind() == AttributeValue.Kind.NULL) {
                continue;
            }
            declarations.put(name, inferType(value));
            activation.put(name, toCel(value));
        }

        CelRuntime.Program program = programFor(declarations);
        Object result;
        try {
            result = program.eval(activation);
        } catch (CelEvaluationException ex) {
            throw new EvaluationException("evaluation failed: " + ex.getMessage(), ex);
        }
        if (!(result instanceof Boolean matched)) {
            throw new EvaluationException("expression yielded "
                + (result == null ? "null" : result.getClass().getSimpleName()) + ", not a boolean");
        }
        return matched;
    }

    static boolean isBindable(String name) {
        return IDENTIFIER.matcher(name).matches() && !RESERVED.contains(name);
    }

    static CelType inferType(AttributeValue value) {
        return switch (value.kind()) {
            case BOOL -> SimpleType.BOOL;
            case INT -> SimpleType.INT;
            case DOUBLE -> SimpleType.DOUBLE;
            case STRING -> SimpleType.STRING;
            case LIST, MAP, NULL -> SimpleType.DYN;
        };
    }

    /** Converts to the Java types the CEL runtime expects; int is always Long. */
    static Object toCel(AttributeValue value) {
        return switch (value.kind()) {
            case BOOL -> ((AttributeValue.BoolValue) value).value();
            case INT -> ((AttributeValue.IntValue) value).value();
            case DOUBLE -> ((AttributeValue.DoubleValue) value).value();
            case STRING -> ((AttributeValue.StringValue) value).value();
            case LIST -> {
                List<Object> out = new ArrayList<>();
                for (AttributeValue element : ((AttributeValue.ListValue) value).values()) {
                    if (element.kind() != AttributeValue.Kind.NULL) {
                        out.add(toCel(element));
                    }
                }
                yield out;
            }
            case MAP -> {
                Map<String, Object> out = new LinkedHashMap<>();
                ((AttributeValue.MapValue) value).entries().forEach((k, v) -> {
                    if (v.kind() != AttributeValue.Kind.NULL) {
                        out.put(k, toCel(v));
                    }
                });
                yield out;
            }
            case NULL -> throw new IllegalArgumentException("null values are not bound");
        };
    }

    private CelRuntime.Program programFor(Map<String, CelType> declarations) {
        CelRuntime.Program cached = programs.get(declarations);
        if (cached != null) {
            return cached;
        }

        CelCompilerBuilder builder = CelCompilerFactory.standardCelCompilerBuilder();
        declarations.forEach(builder::addVar);
        CelCompiler compiler = builder.build();

        CelRuntime.Program program;
        try {
            CelAbstractSyntaxTree ast = compiler.compile(expression).getAst();
            program = RUNTIME.createProgram(ast);
        } catch (CelValidationException ex) {
            throw new EvaluationException("expression does not compile: " + ex.getMessage(), ex);
        } catch (CelEvaluationException ex) {
            throw new EvaluationException("expression cannot be planned: " + ex.getMessage(), ex);
        }
        log.debug("Compiled expression for {} declared names", declarations.size());
        programs.put(Map.copyOf(declarations), program);
        return program;
    }
}
