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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import dev.exprnav.api.Expr;
import dev.exprnav.api.expressions.Call;
import dev.exprnav.api.expressions.Comprehension;
import dev.exprnav.api.expressions.CreateList;
import dev.exprnav.api.expressions.CreateStruct;
import dev.exprnav.api.expressions.Ident;
import dev.exprnav.api.expressions.Literal;
import dev.exprnav.api.expressions.Select;
import dev.exprnav.api.types.Type;
import dev.exprnav.api.types.Types;
import dev.exprnav.api.values.LiteralConversionException;
import dev.exprnav.api.values.Val;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node of a navigable tree. Kind and child factory are fixed at construction; children are built on demand and not
 * cached.
 */
final class NavigableExprImpl implements NavigableExpr {
    private final Optional<NavigableExpr> parent;
    private final ExprKind kind;
    private final Expr expr;
    private final Expr variant;
    private final Map<Long, Type> typeMap;
    private final NavigationOptions options;
    private final ChildFactory createChildren;

    NavigableExprImpl(Optional<NavigableExpr> parent, Expr expr, Map<Long, Type> typeMap, NavigationOptions options) {
        this.parent = checkNotNull(parent, "parent");
        this.expr = checkNotNull(expr, "expr");
        this.typeMap = checkNotNull(typeMap, "typeMap");
        this.options = checkNotNull(options, "options");

        ExprClassifier.Classification classification = ExprClassifier.classify(expr);
        this.kind = classification.getKind();
        this.createChildren = classification.getChildFactory();
        this.variant = classification.getVariant();
    }

    @Override
    public long id() {
        return expr.id();
    }

    @Override
    public ExprKind kind() {
        return kind;
    }

    @Override
    public Type type() {
        return typeMap.getOrDefault(id(), Types.DYN);
    }

    @Override
    public Optional<NavigableExpr> parent() {
        return parent;
    }

    @Override
    public List<NavigableExpr> children() {
        return createChildren.create(this);
    }

    @Override
    public Expr toExpr() {
        return expr;
    }

    @Override
    public NavigableCallExpr asCall() {
        return new NavigableCallImpl(this, rawAs(ExprKind.CALL, Call.class));
    }

    @Override
    public NavigableComprehensionExpr asComprehension() {
        return new NavigableComprehensionImpl(this, rawAs(ExprKind.COMPREHENSION, Comprehension.class));
    }

    @Override
    public String asIdent() {
        return rawAs(ExprKind.IDENT, Ident.class).map(Ident::getName).orElse("");
    }

    @Override
    public Optional<Val> asLiteral() {
        if (kind != ExprKind.LITERAL) {
            return Optional.empty();
        }
        Literal<?> literal = (Literal<?>) variant;
        try {
            return Optional.of(options.literalConverter().convert(literal));
        } catch (LiteralConversionException e) {
            throw new VerifyException("literal " + id() + " cannot be converted to a value", e);
        }
    }

    @Override
    public NavigableListExpr asList() {
        return new NavigableListImpl(this, rawAs(ExprKind.LIST, CreateList.class));
    }

    @Override
    public NavigableMapExpr asMap() {
        return new NavigableMapImpl(this, rawAs(ExprKind.MAP, CreateStruct.class));
    }

    @Override
    public NavigableSelectExpr asSelect() {
        return new NavigableSelectImpl(this, rawAs(ExprKind.SELECT, Select.class));
    }

    @Override
    public NavigableStructExpr asStruct() {
        return new NavigableStructImpl(this, rawAs(ExprKind.STRUCT, CreateStruct.class));
    }

    /**
     * The variant {@link #kind()} was derived from. Same as {@link #toExpr()} unless the raw node delegates
     * {@code accept} to another node.
     */
    Expr variant() {
        return variant;
    }

    NavigableExpr createChild(Expr child) {
        return new NavigableExprImpl(Optional.of(this), child, typeMap, options);
    }

    List<NavigableExpr> createChildren(List<Expr> exprs) {
        ImmutableList.Builder<NavigableExpr> children = ImmutableList.builderWithExpectedSize(exprs.size());
        for (Expr child : exprs) {
            children.add(createChild(child));
        }
        return children.build();
    }

    private <T> Optional<T> rawAs(ExprKind expected, Class<T> rawType) {
        return kind == expected ? Optional.of(rawType.cast(variant)) : Optional.empty();
    }

    /**
     * Two handles are equal when they wrap the same raw node.
     */
    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NavigableExprImpl)) return false;
        NavigableExprImpl other = (NavigableExprImpl) o;
        return kind == other.kind && expr == other.expr;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(expr);
    }

    @Override
    public String toString() {
        return kind + "#" + id() + "(" + expr + ")";
    }
}
