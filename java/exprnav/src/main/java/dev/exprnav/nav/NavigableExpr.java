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

import dev.exprnav.api.Expr;
import dev.exprnav.api.types.Type;
import dev.exprnav.api.values.Val;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of an expression node that knows its kind, its static type, its parent and how to reach its
 * children.
 * <p>
 * The {@code as*} adapters never fail. An adapter that does not fit {@link #kind()} returns an empty view: empty
 * lists, empty strings, {@code false} and {@link Optional#empty()}. Generic traversal code can therefore call any
 * adapter without checking the kind first.
 * <p>
 * Children are rebuilt on every call to {@link #children()}. Handles returned by two calls are equal but not the same
 * instance.
 */
public interface NavigableExpr {
    /**
     * Id of the expression as it appears in the AST.
     */
    long id();

    ExprKind kind();

    /**
     * Static type recorded for this node, {@link dev.exprnav.api.types.Types#DYN} when the checker recorded none.
     */
    Type type();

    /**
     * Parent node, empty only for the root.
     */
    Optional<NavigableExpr> parent();

    /**
     * Child nodes in traversal order. See {@link ExprKind} for the order per kind.
     */
    List<NavigableExpr> children();

    /**
     * The wrapped raw expression, unchanged.
     */
    Expr toExpr();

    NavigableCallExpr asCall();

    NavigableComprehensionExpr asComprehension();

    /**
     * Identifier name, or the empty string when this is not an identifier.
     */
    String asIdent();

    /**
     * Runtime value of a literal, empty when this is not a literal.
     *
     * @throws com.google.common.base.VerifyException if the literal payload is malformed
     */
    Optional<Val> asLiteral();

    NavigableListExpr asList();

    NavigableMapExpr asMap();

    NavigableSelectExpr asSelect();

    NavigableStructExpr asStruct();
}
