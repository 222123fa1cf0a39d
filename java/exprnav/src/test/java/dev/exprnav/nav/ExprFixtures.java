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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.exprnav.api.Expr;
import dev.exprnav.api.expressions.*;
import dev.exprnav.api.types.Type;
import dev.exprnav.api.types.Types;

/**
 * Expressions shared by the navigation and matcher tests. Ids are assigned bottom-up, as a parser would.
 */
public final class ExprFixtures {
    private ExprFixtures() {}

    /**
     * {@code greet(name)}
     */
    public static Call greetFunction() {
        return Call.function(2, "greet", Ident.of(1, "name"));
    }

    /**
     * {@code name.greet()}
     */
    public static Call greetMethod() {
        return Call.method(2, "greet", Ident.of(1, "name"));
    }

    /**
     * {@code a && (b || c)}
     */
    public static Call andOr() {
        return Call.function(
                5, "_&&_", Ident.of(1, "a"), Call.function(4, "_||_", Ident.of(2, "b"), Ident.of(3, "c")));
    }

    /**
     * Sum of {@code items} into {@code sum}: {@code items.fold(x, sum = 0, true, sum + x, sum)}.
     */
    public static Comprehension sumOfItems() {
        return Comprehension.builder(8)
                .iterRange(Ident.of(1, "items"))
                .iterVar("x")
                .accuVar("sum")
                .accuInit(Literal.int64(2, 0))
                .loopCondition(Literal.bool(3, true))
                .loopStep(Call.function(6, "_+_", Ident.of(4, "sum"), Ident.of(5, "x")))
                .result(Ident.of(7, "sum"))
                .build();
    }

    /**
     * {@code {"a": 1, ?"b": x}}
     */
    public static CreateStruct stringIntMap() {
        return CreateStruct.map(
                7,
                CreateStruct.Entry.mapEntry(3, Literal.string(1, "a"), Literal.int64(2, 1)),
                CreateStruct.Entry.mapEntry(6, Literal.string(4, "b"), Ident.of(5, "x"), true));
    }

    /**
     * {@code acme.Person{name: "ada", ?age: 36}}
     */
    public static CreateStruct person() {
        return CreateStruct.message(
                5,
                "acme.Person",
                CreateStruct.Entry.field(2, "name", Literal.string(1, "ada")),
                CreateStruct.Entry.field(4, "age", Literal.int64(3, 36), true));
    }

    /**
     * {@code [1, ?x, "three"]}
     */
    public static CreateList mixedList() {
        return CreateList.of(4, ImmutableList.of(Literal.int64(1, 1), Ident.of(2, "x"), Literal.string(3, "three")), 1);
    }

    /**
     * {@code has(msg.field)}
     */
    public static Select hasField() {
        return Select.presenceTest(2, Ident.of(1, "msg"), "field");
    }

    /**
     * One expression of every kind, for tests that run against all of them.
     */
    public static ImmutableList<Expr> oneOfEachKind() {
        return ImmutableList.of(
                Literal.int64(1, 42),
                Ident.of(1, "x"),
                hasField(),
                greetMethod(),
                mixedList(),
                stringIntMap(),
                person(),
                sumOfItems(),
                Unspecified.of(1));
    }

    public static ImmutableMap<Long, Type> typesOf(Object... idTypePairs) {
        ImmutableMap.Builder<Long, Type> types = ImmutableMap.builder();
        for (int i = 0; i < idTypePairs.length; i += 2) {
            types.put(((Number) idTypePairs[i]).longValue(), (Type) idTypePairs[i + 1]);
        }
        return types.build();
    }

    public static NavigableExpr navigate(Expr expr) {
        return NavigableExprs.navigate(expr, ImmutableMap.of());
    }

    public static ImmutableMap<Long, Type> andOrTypes() {
        return typesOf(1, Types.BOOL, 2, Types.BOOL, 3, Types.BOOL, 4, Types.BOOL, 5, Types.BOOL);
    }
}
