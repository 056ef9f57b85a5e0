package me.bechberger.dyntrace.cast;

import me.bechberger.dyntrace.cast.CAST.Declarator;
import me.bechberger.dyntrace.cast.CAST.Initializer;
import me.bechberger.dyntrace.cast.CAST.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static me.bechberger.dyntrace.cast.CAST.Declarator.identifier;
import static me.bechberger.dyntrace.cast.CAST.Declarator.pointer;
import static me.bechberger.dyntrace.cast.CAST.Declarator.struct;
import static me.bechberger.dyntrace.cast.CAST.Declarator.structIdentifier;
import static me.bechberger.dyntrace.cast.CAST.Declarator.structMember;
import static me.bechberger.dyntrace.cast.CAST.Expression.constant;
import static me.bechberger.dyntrace.cast.CAST.Expression.variable;
import static me.bechberger.dyntrace.cast.CAST.Expression.verbatim;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.addressOf;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.assignment;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.binary;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.call;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.cast;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.memberAccess;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.sizeof;
import static me.bechberger.dyntrace.cast.CAST.Statement.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Basic AST tests
 */
public class CASTTest {

    static Stream<Arguments> exprAstAndExpectedCode() {
        return Stream.of(Arguments.of(expression(binary("+", constant(1), constant(2))), "1 + 2;"),
                Arguments.of(expression(binary("+", verbatim("sp"), constant(123))), "sp + 123;"),
                Arguments.of(expression(binary(">>", call(variable("bpf_get_current_pid_tgid")), constant(32))),
                        "bpf_get_current_pid_tgid() >> 32;"),
                Arguments.of(expression(cast(identifier("uint32_t"), call(variable("f")))), "(uint32_t)f();"),
                Arguments.of(expression(binary("+", binary(">>", variable("a"), variable("b")), constant(1))),
                        "(a >> b) + 1;"),
                Arguments.of(expression(binary(">>", binary("+", variable("a"), variable("b")), constant(1))),
                        "a + b >> 1;"),
                Arguments.of(expression(binary("-", binary("-", variable("a"), variable("b")), variable("c"))),
                        "a - b - c;"),
                Arguments.of(expression(binary("-", variable("a"), binary("-", variable("b"), variable("c")))),
                        "a - (b - c);"),
                Arguments.of(expression(binary("-", variable("a"), binary("+", variable("b"), variable("c")))),
                        "a - (b + c);"),
                Arguments.of(expression(assignment(memberAccess(variable("v"), variable("i32")), variable("foo"))),
                        "v.i32 = foo;"),
                Arguments.of(expression(call(memberAccess(variable("test"), variable("update")),
                        addressOf(variable("foo")), addressOf(variable("bar")))), "test.update(&foo, &bar);"),
                Arguments.of(expression(call(variable("bpf_probe_read"), addressOf(variable("var")),
                                sizeof(CAST.Expression.type(identifier("int32_t"))),
                                binary("+", verbatim("sp"), constant(8L)))),
                        "bpf_probe_read(&var, sizeof(int32_t), sp + 8);"));
    }

    @ParameterizedTest
    @MethodSource("exprAstAndExpectedCode")
    void testExpr(Statement statement, String expectedCode) {
        assertEquals(expectedCode, statement.toPrettyString());
    }

    static Stream<Arguments> declAstAndExpectedCode() {
        return Stream.of(
                Arguments.of(variableDefinition(identifier("int32_t"), variable("var")), "int32_t var;"),
                Arguments.of(variableDefinition(Declarator.voidPointer(), variable("var"),
                        call(variable("PT_REGS_SP"), variable("ctx"))), "void* var = PT_REGS_SP(ctx);"),
                Arguments.of(variableDefinition(structIdentifier("x"), variable("v"), Initializer.empty()),
                        "struct x v = {};"),
                Arguments.of(structDeclarationStatement(struct(variable("x"),
                                List.of(structMember(identifier("int32_t"), variable("a")),
                                        structMember(pointer(identifier("char")), variable("s")),
                                        structMember(structIdentifier("y"), variable("inner"))))),
                        """
                        struct x {
                          int32_t a;
                          char* s;
                          struct y inner;
                        };"""),
                Arguments.of(structDeclarationStatement(struct(variable("empty"), List.of())),
                        "struct empty {\n};"),
                Arguments.of(functionDeclarationStatement(Declarator.function(variable("probe"), identifier("int"),
                                List.of(Declarator.parameter(variable("ctx"), pointer(structIdentifier("pt_regs"))))),
                                List.of(returnStatement(constant(0)))),
                        """
                        int probe(struct pt_regs* ctx) {
                          return 0;
                        }"""),
                Arguments.of(include("linux/ptrace.h"), "#include <linux/ptrace.h>"));
    }

    @ParameterizedTest
    @MethodSource("declAstAndExpectedCode")
    void testDecl(Statement ast, String expectedCode) {
        assertEquals(expectedCode, ast.toPrettyString());
    }

    @Test
    public void testStructIndent() {
        var st = structDeclarationStatement(struct(variable("x"),
                List.of(structMember(identifier("int64_t"), variable("a")))));
        assertEquals("struct x {\n    int64_t a;\n};", st.toPrettyString("", "    "));
    }

    @Test
    public void testUnknownOperator() {
        assertThrows(IllegalArgumentException.class, () -> binary("**", constant(1), constant(2)));
        assertThrows(IllegalArgumentException.class, () -> binary("&", constant(1), constant(2)));
    }
}
