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
package dev.exprnav.api.expressions;

import static com.google.common.base.Preconditions.checkNotNull;

import dev.exprnav.api.Expr;
import java.util.Objects;

/**
 * Field selection {@code operand.field}, or the presence test {@code has(operand.field)} when {@link #isTestOnly()}.
 */
public final class Select implements Expr {
    private final long id;
    private final Expr operand;
    private final String field;
    private final boolean testOnly;

    private Select(long id, Expr operand, String field, boolean testOnly) {
        this.id = id;
        this.operand = checkNotNull(operand, "operand");
        this.field = checkNotNull(field, "field");
        this.testOnly = testOnly;
    }

    public static Select of(long id, Expr operand, String field) {
        return new Select(id, operand, field, false);
    }

    public static Select presenceTest(long id, Expr operand, String field) {
        return new Select(id, operand, field, true);
    }

    @Override
    public long id() {
        return id;
    }

    public Expr getOperand() {
        return operand;
    }

    public String getField() {
        return field;
    }

    public boolean isTestOnly() {
        return testOnly;
    }

    @Override
    public String type() {
        return "select";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitSelect(this);
    }

    @Override
    public String toString() {
        String selection = operand + "." + field;
        return testOnly ? "has(" + selection + ")" : selection;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Select select = (Select) o;
        return id == select.id
                && testOnly == select.testOnly
                && Objects.equals(operand, select.operand)
                && Objects.equals(field, select.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, operand, field, testOnly);
    }
}
