/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.exprnav.nav;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.exprnav.api.CheckedAst;
import dev.exprnav.api.Expr;
import dev.exprnav.api.expressions.Call;
import dev.exprnav.api.expressions.Ident;
import dev.exprnav.api.expressions.Literal;
import dev.exprnav.api.types.Type;
import dev.exprnav.api.types.Types;
import dev.exprnav.api.values.LiteralConversionException;
import dev.exprnav.api.values.Val;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public final class TestNavigableExpr {
    @Test
    public void testTypeLookup() {
        NavigableExpr root = NavigableExprs.navigate(ExprFixtures.greetFunction(), ExprFixtures.typesOf(2, Types.STRING));
        assertEquals(Types.STRING, root.type());
        // The argument has no recorded type.
        assertEquals(Types.DYN, root.children().get(0).type());
    }

    @Test
    public void testNavigateCheckedAst() {
        CheckedAst ast = CheckedAst.of(ExprFixtures.andOr(), ExprFixtures.andOrTypes());
        NavigableExpr root = NavigableExprs.navigate(ast);
        assertEquals(5, root.id());
        assertEquals(ExprKind.CALL, root.kind());
        assertEquals(Types.BOOL, root.type());
        assertSame(ast.expr(), root.toExpr());
    }

    @Test
    public void testParent() {
        NavigableExpr root = ExprFixtures.navigate(ExprFixtures.andOr());
        assertFalse(root.parent().isPresent());

        NavigableExpr or = root.children().get(1);
        assertSame(root, or.parent().orElseThrow());
        NavigableExpr c = or.children().get(1);
        assertEquals("c", c.asIdent());
        assertSame(or, c.parent().orElseThrow());
    }

    @Test
    public void testChildrenAreRebuiltOnEachCall() {
        NavigableExpr root = ExprFixtures.navigate(ExprFixtures.andOr());
        List<NavigableExpr> first = root.children();
        List<NavigableExpr> second = root.children();

        assertEquals(first, second);
        assertEquals(ids(first), ids(second));
        for (int i = 0; i < first.size(); i++) {
            assertNotSame(first.get(i), second.get(i));
            assertEquals(first.get(i).kind(), second.get(i).kind());
        }
    }

    @Test
    public void testToExprIsPassthrough() {
        Call call = ExprFixtures.greetMethod();
        NavigableExpr root = ExprFixtures.navigate(call);
        assertSame(call, root.toExpr());
        assertSame(call.getTarget().orElseThrow(), root.children().get(0).toExpr());
    }

    @Test
    public void testFunctionCall() {
        NavigableExpr root = NavigableExprs.navigate(ExprFixtures.greetFunction(), ExprFixtures.typesOf(2, Types.STRING));
        NavigableCallExpr call = root.asCall();

        assertEquals("greet", call.functionName());
        assertFalse(call.target().isPresent());
        assertEquals(ImmutableList.of("name"), idents(call.args()));
        assertEquals(ImmutableList.of("name"), idents(root.children()));
        assertEquals(Types.STRING, call.returnType());
    }

    @Test
    public void testMethodCall() {
        NavigableExpr root = ExprFixtures.navigate(ExprFixtures.greetMethod());
        NavigableCallExpr call = root.asCall();

        assertEquals("greet", call.functionName());
        assertEquals("name", call.target().orElseThrow().asIdent());
        assertTrue(call.args().isEmpty());
        assertEquals(ImmutableList.of("name"), idents(root.children()));
        assertEquals(Types.DYN, call.returnType());
    }

    @Test
    public void testList() {
        NavigableListExpr list = ExprFixtures.navigate(ExprFixtures.mixedList()).asList();

        assertEquals(3, list.size());
        assertEquals(ImmutableList.of(1), list.optionalIndices());
        List<NavigableExpr> elements = list.elements();
        assertEquals(ImmutableList.of(ExprKind.LITERAL, ExprKind.IDENT, ExprKind.LITERAL), kinds(elements));
        assertEquals("x", elements.get(1).asIdent());
    }

    @Test
    public void testMap() {
        NavigableMapExpr map = ExprFixtures.navigate(ExprFixtures.stringIntMap()).asMap();

        assertEquals(2, map.size());
        List<NavigableEntry> entries = map.entries();
        assertEquals(2, entries.size());

        NavigableEntry first = entries.get(0);
        assertEquals(Val.of(Types.STRING, "a"), first.key().asLiteral().orElseThrow());
        assertEquals(Val.of(Types.INT, 1L), first.value().asLiteral().orElseThrow());
        assertFalse(first.isOptional());

        NavigableEntry second = entries.get(1);
        assertEquals(Val.of(Types.STRING, "b"), second.key().asLiteral().orElseThrow());
        assertEquals("x", second.value().asIdent());
        assertTrue(second.isOptional());
    }

    @Test
    public void testStruct() {
        NavigableExpr root = ExprFixtures.navigate(ExprFixtures.person());
        NavigableStructExpr struct = root.asStruct();

        assertEquals("acme.Person", struct.typeName());
        List<NavigableField> fields = struct.fields();
        assertEquals(2, fields.size());
        assertEquals("name", fields.get(0).fieldName());
        assertEquals(Val.of(Types.STRING, "ada"), fields.get(0).value().asLiteral().orElseThrow());
        assertFalse(fields.get(0).isOptional());
        assertEquals("age", fields.get(1).fieldName());
        assertTrue(fields.get(1).isOptional());
        assertSame(root, fields.get(1).value().parent().orElseThrow());
    }

    @Test
    public void testSelect() {
        NavigableSelectExpr select = ExprFixtures.navigate(ExprFixtures.hasField()).asSelect();

        assertEquals("field", select.fieldName());
        assertTrue(select.isTestOnly());
        assertEquals("msg", select.operand().orElseThrow().asIdent());
    }

    @Test
    public void testComprehension() {
        NavigableExpr root = ExprFixtures.navigate(ExprFixtures.sumOfItems());
        NavigableComprehensionExpr comp = root.asComprehension();

        assertEquals("items", comp.iterRange().orElseThrow().asIdent());
        assertEquals("x", comp.iterVar());
        assertEquals("sum", comp.accuVar());
        assertEquals(Val.of(Types.INT, 0L), comp.accuInit().orElseThrow().asLiteral().orElseThrow());
        assertEquals(Val.of(Types.BOOL, true), comp.loopCondition().orElseThrow().asLiteral().orElseThrow());
        assertEquals("_+_", comp.loopStep().orElseThrow().asCall().functionName());
        assertEquals("sum", comp.result().orElseThrow().asIdent());

        List<NavigableExpr> parts = ImmutableList.of(
                comp.iterRange().orElseThrow(),
                comp.accuInit().orElseThrow(),
                comp.loopCondition().orElseThrow(),
                comp.loopStep().orElseThrow(),
                comp.result().orElseThrow());
        assertEquals(parts, root.children());
    }

    @Test
    public void testExactlyOneAdapterFitsEachKind() {
        for (Expr expr : ExprFixtures.oneOfEachKind()) {
            NavigableExpr nav = ExprFixtures.navigate(expr);
            int expected = nav.kind() == ExprKind.UNSPECIFIED ? 0 : 1;
            assertEquals(expected, fittingAdapters(nav), "adapters fitting " + nav);
        }
    }

    @Test
    public void testMismatchedAdaptersAreEmpty() {
        NavigableExpr ident = ExprFixtures.navigate(Ident.of(1, "x"));

        NavigableCallExpr call = ident.asCall();
        assertEquals("", call.functionName());
        assertFalse(call.target().isPresent());
        assertTrue(call.args().isEmpty());

        NavigableComprehensionExpr comp = ident.asComprehension();
        assertFalse(comp.iterRange().isPresent());
        assertFalse(comp.accuInit().isPresent());
        assertFalse(comp.loopCondition().isPresent());
        assertFalse(comp.loopStep().isPresent());
        assertFalse(comp.result().isPresent());
        assertEquals("", comp.iterVar());
        assertEquals("", comp.accuVar());

        assertTrue(ident.asList().elements().isEmpty());
        assertTrue(ident.asList().optionalIndices().isEmpty());
        assertEquals(0, ident.asList().size());
        assertTrue(ident.asMap().entries().isEmpty());
        assertEquals(0, ident.asMap().size());
        assertEquals("", ident.asStruct().typeName());
        assertTrue(ident.asStruct().fields().isEmpty());
        assertFalse(ident.asSelect().operand().isPresent());
        assertEquals("", ident.asSelect().fieldName());
        assertFalse(ident.asSelect().isTestOnly());
        assertFalse(ident.asLiteral().isPresent());

        assertEquals("", ExprFixtures.navigate(Literal.int64(1, 3)).asIdent());
    }

    @Test
    public void testMapAndStructDoNotShareAdapters() {
        NavigableExpr map = ExprFixtures.navigate(ExprFixtures.stringIntMap());
        assertTrue(map.asStruct().fields().isEmpty());
        assertEquals("", map.asStruct().typeName());

        NavigableExpr struct = ExprFixtures.navigate(ExprFixtures.person());
        assertTrue(struct.asMap().entries().isEmpty());
        assertEquals(0, struct.asMap().size());
    }

    @Test
    public void testMalformedLiteralIsFatal() {
        NavigableExpr root = ExprFixtures.navigate(Literal.unset(3));
        assertEquals(ExprKind.LITERAL, root.kind());

        VerifyException e = assertThrows(VerifyException.class, root::asLiteral);
        LiteralConversionException cause = assertInstanceOf(LiteralConversionException.class, e.getCause());
        assertEquals(3, cause.getExprId());
    }

    @Test
    public void testCustomLiteralConverter() {
        Val fixed = Val.of(Types.STRING, "converted");
        NavigationOptions options =
                NavigationOptions.builder().literalConverter(literal -> fixed).build();
        NavigableExpr root = NavigableExprs.navigate(ExprFixtures.mixedList(), ImmutableMap.of(), options);

        // Options reach every descendant.
        assertEquals(fixed, root.children().get(0).asLiteral().orElseThrow());
    }

    @Test
    public void testSharedTypeMap() {
        ImmutableMap<Long, Type> types = ExprFixtures.andOrTypes();
        NavigableExpr root = NavigableExprs.navigate(ExprFixtures.andOr(), types);
        NavigableExpr b = root.children().get(1).children().get(0);
        assertEquals("b", b.asIdent());
        assertEquals(Types.BOOL, b.type());
    }

    @Test
    public void testNavigateRejectsMissingArguments() {
        NullPointerException noTypes = assertThrows(
                NullPointerException.class, () -> NavigableExprs.navigate(ExprFixtures.andOr(), null));
        assertEquals("typeMap", noTypes.getMessage());

        NullPointerException noRoot =
                assertThrows(NullPointerException.class, () -> NavigableExprs.navigate(null, ImmutableMap.of()));
        assertEquals("root", noRoot.getMessage());
    }

    private static int fittingAdapters(NavigableExpr nav) {
        int fitting = 0;
        if (!nav.asCall().functionName().isEmpty()) fitting++;
        if (nav.asComprehension().iterRange().isPresent()) fitting++;
        if (!nav.asIdent().isEmpty()) fitting++;
        if (nav.asLiteral().isPresent()) fitting++;
        if (nav.asList().size() > 0) fitting++;
        if (nav.asMap().size() > 0) fitting++;
        if (nav.asSelect().operand().isPresent()) fitting++;
        if (!nav.asStruct().typeName().isEmpty()) fitting++;
        return fitting;
    }

    private static List<Long> ids(List<NavigableExpr> exprs) {
        return exprs.stream().map(NavigableExpr::id).collect(Collectors.toList());
    }

    private static List<ExprKind> kinds(List<NavigableExpr> exprs) {
        return exprs.stream().map(NavigableExpr::kind).collect(Collectors.toList());
    }

    private static List<String> idents(List<NavigableExpr> exprs) {
        return exprs.stream().map(NavigableExpr::asIdent).collect(Collectors.toList());
    }
}
