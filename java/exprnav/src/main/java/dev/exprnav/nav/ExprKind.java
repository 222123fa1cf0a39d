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

/**
 * Shape of a {@link NavigableExpr}.
 * <p>
 * The kind fixes the order of {@link NavigableExpr#children()}, which is also the order searches visit siblings in:
 * <ul>
 *  <li>{@link #LITERAL}, {@link #IDENT}, {@link #UNSPECIFIED}: no children</li>
 *  <li>{@link #SELECT}: the operand</li>
 *  <li>{@link #CALL}: the target when present, then the arguments</li>
 *  <li>{@link #LIST}: the elements</li>
 *  <li>{@link #MAP}: each key followed by its value</li>
 *  <li>{@link #STRUCT}: the field values; field names are not nodes</li>
 *  <li>{@link #COMPREHENSION}: iteration range, accumulator initializer, loop condition, loop step, result</li>
 * </ul>
 */
public enum ExprKind {
    /**
     * Expression with no kind set. It has no children.
     */
    UNSPECIFIED,
    LITERAL,
    IDENT,
    SELECT,
    CALL,
    LIST,
    MAP,
    STRUCT,
    /**
     * Fold over a range, generated by macros.
     */
    COMPREHENSION,
    ;
}
