package me.bechberger.dyntrace.cast;

import me.bechberger.dyntrace.cast.CAST.PrimaryExpression.Variable;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Represents an abstract syntax tree for the subset of C
 * that is used in generated tracing probes,
 * loosely based on the grammar from <a href="https://www.lysator.liu.se/c/ANSI-C-grammar-y.html">lysator.liu.se</a>.
 * <p>
 * Example: <pre>{@code
 *  variableDefinition(Declarator.identifier("int32_t"), variable("var"),
 *       call(variable("PT_REGS_SP"), variable("ctx")))
 * }</pre>
 * is printed as {@code int32_t var = PT_REGS_SP(ctx);}
 */
public interface CAST {

    /**
     * Print with two spaces per nesting level
     */
    default String toPrettyString() {
        return toPrettyString("", "  ");
    }

    /**
     * @param indent    prefix of the first line
     * @param increment added to the indent for every nested level (struct members, function bodies)
     */
    String toPrettyString(String indent, String increment);

    sealed interface Expression extends CAST permits Declarator, Initializer, OperatorExpression, PrimaryExpression {

        static PrimaryExpression.Constant constant(Object value) {
            if (value instanceof Integer i) {
                return new PrimaryExpression.Constant(i);
            }
            if (value instanceof Long l) {
                return new PrimaryExpression.Constant(l);
            }
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass());
        }

        static Variable variable(String name) {
            return new Variable(name);
        }

        static PrimaryExpression.VerbatimExpression verbatim(String code) {
            return new PrimaryExpression.VerbatimExpression(code);
        }

        static PrimaryExpression.TypeExpression type(Declarator declarator) {
            return new PrimaryExpression.TypeExpression(declarator);
        }
    }

    /**
     * <pre>
     * primary_expression
     * 	: IDENTIFIER
     * 	| constant
     * 	;
     * </pre>
     */
    sealed interface PrimaryExpression extends Expression {

        /**
         * Variable, function or field name
         */
        record Variable(String name) implements PrimaryExpression {
            @Override
            public String toPrettyString(String indent, String increment) {
                return indent + name;
            }

            @Override
            public String toString() {
                return name;
            }
        }

        /**
         * Integer literal, printed without suffix as clang widens it where needed
         */
        record Constant(Number value) implements PrimaryExpression {
            @Override
            public String toPrettyString(String indent, String increment) {
                return indent + value;
            }
        }

        /**
         * Code that is printed as is, e.g. a register base like {@code sp}
         */
        record VerbatimExpression(String code) implements PrimaryExpression {
            @Override
            public String toPrettyString(String indent, String increment) {
                return indent + code;
            }
        }

        /**
         * A type used as an expression, e.g. in {@code sizeof(int32_t)}
         */
        record TypeExpression(Declarator declarator) implements PrimaryExpression {
            @Override
            public String toPrettyString(String indent, String increment) {
                return indent + declarator.toPrettyString("", increment);
            }
        }
    }

    /**
     * Operators with precedence (lower binds tighter),
     * based on <a href="https://en.cppreference.com/w/cpp/language/operator_precedence">cppreference.com</a>
     */
    enum Operator {
        FUNCTION_CALL("()", 2), MEMBER_ACCESS(".", 2), ADDRESS_OF("&", 3), SIZEOF("sizeof", 3), CAST("cast", 3),
        ADDITION("+", 6), SUBTRACTION("-", 6), SHIFT_RIGHT(">>", 7), ASSIGNMENT("=", 16);

        private static final Map<String, Operator> BINARY = new HashMap<>();

        static {
            for (Operator op : values()) {
                if (op.precedence > 3 && op.precedence < 16) {
                    BINARY.put(op.symbol, op);
                }
            }
        }

        public final String symbol;
        public final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        static Operator binary(String symbol) {
            var op = BINARY.get(symbol);
            if (op == null) {
                throw new IllegalArgumentException("Unknown binary operator " + symbol);
            }
            return op;
        }
    }

    record OperatorExpression(Operator operator, List<Expression> operands) implements Expression {

        public OperatorExpression {
            operands = List.copyOf(operands);
        }

        private String operand(int index) {
            return operand(index, false);
        }

        /**
         * @param rightOfLeftAssociative also parenthesize an operand of equal precedence, {@code a - (b - c)}
         */
        private String operand(int index, boolean rightOfLeftAssociative) {
            var expr = operands.get(index);
            var code = expr.toPrettyString("", "");
            if (expr instanceof OperatorExpression inner && (inner.operator.precedence > operator.precedence
                    || (rightOfLeftAssociative && inner.operator.precedence == operator.precedence))) {
                return "(" + code + ")";
            }
            return code;
        }

        @Override
        public String toPrettyString(String indent, String increment) {
            String code;
            switch (operator) {
                case FUNCTION_CALL -> code = operand(0) + "(" + operands.stream().skip(1)
                        .map(e -> e.toPrettyString("", "")).collect(Collectors.joining(", ")) + ")";
                case MEMBER_ACCESS -> code = operand(0) + "." + operand(1);
                case ADDRESS_OF -> code = "&" + operand(0);
                case SIZEOF -> code = "sizeof(" + operands.get(0).toPrettyString("", "") + ")";
                case CAST -> code = "(" + operands.get(0).toPrettyString("", "") + ")" + operand(1);
                case ASSIGNMENT -> code = operand(0) + " = " + operand(1);
                default -> code = operand(0) + " " + operator.symbol + " " + operand(1, true);
            }
            return indent + code;
        }

        public static OperatorExpression binary(String op, Expression left, Expression right) {
            return new OperatorExpression(Operator.binary(op), List.of(left, right));
        }

        public static OperatorExpression addressOf(Expression expression) {
            return new OperatorExpression(Operator.ADDRESS_OF, List.of(expression));
        }

        public static OperatorExpression assignment(Expression target, Expression value) {
            return new OperatorExpression(Operator.ASSIGNMENT, List.of(target, value));
        }

        public static OperatorExpression memberAccess(Expression target, Expression member) {
            return new OperatorExpression(Operator.MEMBER_ACCESS, List.of(target, member));
        }

        public static OperatorExpression call(Expression function, Expression... args) {
            return new OperatorExpression(Operator.FUNCTION_CALL,
                    Stream.concat(Stream.of(function), Arrays.stream(args)).toList());
        }

        public static OperatorExpression sizeof(Expression expression) {
            return new OperatorExpression(Operator.SIZEOF, List.of(expression));
        }

        public static OperatorExpression cast(Declarator type, Expression expression) {
            return new OperatorExpression(Operator.CAST, List.of(type, expression));
        }
    }

    sealed interface Initializer extends Expression {

        /**
         * Zero initializer {@code {}}
         */
        record EmptyInitializer() implements Initializer {
            @Override
            public String toPrettyString(String indent, String increment) {
                return indent + "{}";
            }
        }

        static Initializer empty() {
            return new EmptyInitializer();
        }
    }

    sealed interface Declarator extends Expression {

        /**
         * Pointer, the star is attached to the pointee type: {@code void* name}
         */
        record PointerDeclarator(Declarator pointee) implements Declarator {
            @Override
            public String toPrettyString(String indent, String increment) {
                return pointee.toPrettyString(indent, increment) + "*";
            }
        }

        record StructMember(Declarator type, Variable name) implements Declarator {
            @Override
            public String toPrettyString(String indent, String increment) {
                return type.toPrettyString(indent, increment) + " " + name + ";";
            }
        }

        /**
         * Struct definition, one member per line
         */
        record StructDeclarator(Variable name, List<StructMember> members) implements Declarator {

            public StructDeclarator {
                members = List.copyOf(members);
            }

            @Override
            public String toPrettyString(String indent, String increment) {
                var lines = members.stream().map(m -> m.toPrettyString(indent + increment, increment) + "\n")
                        .collect(Collectors.joining());
                return indent + "struct " + name + " {\n" + lines + indent + "}";
            }
        }

        record FunctionParameter(Variable name, Declarator type) implements Declarator {
            @Override
            public String toPrettyString(String indent, String increment) {
                return type.toPrettyString(indent, increment) + " " + name;
            }
        }

        record FunctionDeclarator(Variable name, Declarator returnType,
                                  List<FunctionParameter> parameters) implements Declarator {

            public FunctionDeclarator {
                parameters = List.copyOf(parameters);
            }

            @Override
            public String toPrettyString(String indent, String increment) {
                return returnType.toPrettyString(indent, increment) + " " + name + "(" +
                        parameters.stream().map(p -> p.toPrettyString("", increment))
                                .collect(Collectors.joining(", ")) + ")";
            }
        }

        /**
         * Plain type name like {@code int32_t}
         */
        record IdentifierDeclarator(Variable name) implements Declarator {
            @Override
            public String toPrettyString(String indent, String increment) {
                return indent + name;
            }
        }

        /**
         * Reference to a struct type, {@code struct name}
         */
        record StructIdentifierDeclarator(Variable name) implements Declarator {
            @Override
            public String toPrettyString(String indent, String increment) {
                return indent + "struct " + name;
            }
        }

        static Declarator pointer(Declarator pointee) {
            return new PointerDeclarator(pointee);
        }

        static Declarator voidPointer() {
            return pointer(identifier("void"));
        }

        static FunctionDeclarator function(Variable name, Declarator returnType, List<FunctionParameter> parameters) {
            return new FunctionDeclarator(name, returnType, parameters);
        }

        static FunctionParameter parameter(Variable name, Declarator type) {
            return new FunctionParameter(name, type);
        }

        static Declarator identifier(String name) {
            return new IdentifierDeclarator(new Variable(name));
        }

        static StructDeclarator struct(Variable name, List<StructMember> members) {
            return new StructDeclarator(name, members);
        }

        static StructMember structMember(Declarator type, Variable name) {
            return new StructMember(type, name);
        }

        static Declarator structIdentifier(String name) {
            return new StructIdentifierDeclarator(new Variable(name));
        }
    }

    interface Statement extends CAST {

        record ExpressionStatement(Expression expression) implements Statement {
            @Override
            public String toPrettyString(String indent, String increment) {
                return expression.toPrettyString(indent, increment) + ";";
            }
        }

        /**
         * {@code type name;} or {@code type name = value;}
         */
        record VariableDefinition(Declarator type, Variable name, @Nullable Expression value) implements Statement {
            @Override
            public String toPrettyString(String indent, String increment) {
                var init = value == null ? "" : " = " + value.toPrettyString("", increment);
                return type.toPrettyString(indent, increment) + " " + name + init + ";";
            }
        }

        record ReturnStatement(@Nullable Expression expression) implements Statement {
            @Override
            public String toPrettyString(String indent, String increment) {
                return indent + "return" + (expression == null ? "" : " " + expression.toPrettyString("", "")) + ";";
            }
        }

        record StructDeclarationStatement(Declarator.StructDeclarator declarator) implements Statement {
            @Override
            public String toPrettyString(String indent, String increment) {
                return declarator.toPrettyString(indent, increment) + ";";
            }
        }

        /**
         * Function definition, the body is indented by the increment
         */
        record FunctionDeclarationStatement(Declarator.FunctionDeclarator declarator,
                                            List<Statement> body) implements Statement {

            public FunctionDeclarationStatement {
                body = List.copyOf(body);
            }

            /**
             * Only the opening line, e.g. <code>int name(struct pt_regs* ctx) {</code>
             */
            public String header(String indent) {
                return declarator.toPrettyString(indent, "") + " {";
            }

            @Override
            public String toPrettyString(String indent, String increment) {
                var statements = body.stream().map(s -> s.toPrettyString(indent + increment, increment) + "\n")
                        .collect(Collectors.joining());
                return header(indent) + "\n" + statements + indent + "}";
            }
        }

        record Include(String file) implements Statement {
            @Override
            public String toPrettyString(String indent, String increment) {
                return indent + "#include <" + file + ">";
            }
        }

        static Statement expression(Expression expression) {
            return new ExpressionStatement(expression);
        }

        static Statement returnStatement(@Nullable Expression expression) {
            return new ReturnStatement(expression);
        }

        static Statement structDeclarationStatement(Declarator.StructDeclarator declarator) {
            return new StructDeclarationStatement(declarator);
        }

        static FunctionDeclarationStatement functionDeclarationStatement(Declarator.FunctionDeclarator declarator,
                                                                         List<Statement> body) {
            return new FunctionDeclarationStatement(declarator, body);
        }

        static Statement include(String file) {
            return new Include(file);
        }

        static Statement variableDefinition(Declarator type, Variable name) {
            return new VariableDefinition(type, name, null);
        }

        static Statement variableDefinition(Declarator type, Variable name, Expression value) {
            return new VariableDefinition(type, name, value);
        }
    }
}
