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
package dev.exprnav.api;

import dev.exprnav.api.expressions.*;

/**
 * Node of a parsed expression tree.
 * <p>
 * Every node carries an id that is unique within its tree. The id is the key into the type map produced by the
 * type checker.
 */
public interface Expr {
    long id();

    String type();

    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitLiteral(Literal<?> literal);

        T visitIdent(Ident ident);

        T visitSelect(Select select);

        T visitCall(Call call);

        T visitCreateList(CreateList createList);

        T visitCreateStruct(CreateStruct createStruct);

        T visitComprehension(Comprehension comprehension);

        T visitUnspecified(Unspecified unspecified);
    }
}
