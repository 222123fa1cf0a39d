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
import dev.exprnav.api.expressions.*;

/**
 * Maps a raw expression to its {@link ExprKind} and the {@link ChildFactory} that enumerates its children.
 */
final class ExprClassifier implements Expr.Visitor<ExprClassifier.Classification> {
    static final ExprClassifier INSTANCE = new ExprClassifier();

    private ExprClassifier() {}

    static Classification classify(Expr expr) {
        Classification classification = expr.accept(INSTANCE);
        // Expr implementations outside this library may not dispatch to any visit method.
        if (classification == null) {
            return new Classification(ExprKind.UNSPECIFIED, ChildFactory.NONE, expr);
        }
        return classification;
    }

    @Override
    public Classification visitLiteral(Literal<?> literal) {
        return new Classification(ExprKind.LITERAL, ChildFactory.NONE, literal);
    }

    @Override
    public Classification visitIdent(Ident ident) {
        return new Classification(ExprKind.IDENT, ChildFactory.NONE, ident);
    }

    @Override
    public Classification visitSelect(Select select) {
        return new Classification(ExprKind.SELECT, ChildFactory.SELECT, select);
    }

    @Override
    public Classification visitCall(Call call) {
        return new Classification(ExprKind.CALL, ChildFactory.CALL, call);
    }

    @Override
    public Classification visitCreateList(CreateList createList) {
        return new Classification(ExprKind.LIST, ChildFactory.LIST, createList);
    }

    @Override
    public Classification visitCreateStruct(CreateStruct createStruct) {
        if (createStruct.getMessageName().isEmpty()) {
            return new Classification(ExprKind.MAP, ChildFactory.MAP, createStruct);
        }
        return new Classification(ExprKind.STRUCT, ChildFactory.STRUCT, createStruct);
    }

    @Override
    public Classification visitComprehension(Comprehension comprehension) {
        return new Classification(ExprKind.COMPREHENSION, ChildFactory.COMPREHENSION, comprehension);
    }

    @Override
    public Classification visitUnspecified(Unspecified unspecified) {
        return new Classification(ExprKind.UNSPECIFIED, ChildFactory.NONE, unspecified);
    }

    /**
     * Kind and child factory together with the variant the visitor was handed, which is the node children and views
     * read. It differs from the classified expression when that expression delegates {@code accept}.
     */
    static final class Classification {
        private final ExprKind kind;
        private final ChildFactory childFactory;
        private final Expr variant;

        private Classification(ExprKind kind, ChildFactory childFactory, Expr variant) {
            this.kind = kind;
            this.childFactory = childFactory;
            this.variant = variant;
        }

        ExprKind getKind() {
            return kind;
        }

        ChildFactory getChildFactory() {
            return childFactory;
        }

        Expr getVariant() {
            return variant;
        }
    }
}
