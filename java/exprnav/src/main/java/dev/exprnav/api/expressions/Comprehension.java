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
 * Fold over a range, as produced by macros such as {@code all}, {@code exists} and {@code map}.
 * <p>
 * Evaluation binds {@code accuVar} to {@code accuInit}, then for each element of {@code iterRange} bound to
 * {@code iterVar} evaluates {@code loopCondition} and, while it holds, rebinds {@code accuVar} to
 * {@code loopStep}. The value of the whole expression is {@code result}.
 */
public final class Comprehension implements Expr {
    private final long id;
    private final Expr iterRange;
    private final String iterVar;
    private final String accuVar;
    private final Expr accuInit;
    private final Expr loopCondition;
    private final Expr loopStep;
    private final Expr result;

    private Comprehension(Builder builder) {
        this.id = builder.id;
        this.iterRange = checkNotNull(builder.iterRange, "iterRange");
        this.iterVar = checkNotNull(builder.iterVar, "iterVar");
        this.accuVar = checkNotNull(builder.accuVar, "accuVar");
        this.accuInit = checkNotNull(builder.accuInit, "accuInit");
        this.loopCondition = checkNotNull(builder.loopCondition, "loopCondition");
        this.loopStep = checkNotNull(builder.loopStep, "loopStep");
        this.result = checkNotNull(builder.result, "result");
    }

    public static Builder builder(long id) {
        return new Builder(id);
    }

    @Override
    public long id() {
        return id;
    }

    public Expr getIterRange() {
        return iterRange;
    }

    public String getIterVar() {
        return iterVar;
    }

    public String getAccuVar() {
        return accuVar;
    }

    public Expr getAccuInit() {
        return accuInit;
    }

    public Expr getLoopCondition() {
        return loopCondition;
    }

    public Expr getLoopStep() {
        return loopStep;
    }

    public Expr getResult() {
        return result;
    }

    @Override
    public String type() {
        return "comprehension";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitComprehension(this);
    }

    @Override
    public String toString() {
        return "__comprehension__(" + iterVar + " in " + iterRange + ", " + accuVar + " = " + accuInit + ", "
                + loopCondition + ", " + loopStep + ", " + result + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Comprehension that = (Comprehension) o;
        return id == that.id
                && Objects.equals(iterRange, that.iterRange)
                && Objects.equals(iterVar, that.iterVar)
                && Objects.equals(accuVar, that.accuVar)
                && Objects.equals(accuInit, that.accuInit)
                && Objects.equals(loopCondition, that.loopCondition)
                && Objects.equals(loopStep, that.loopStep)
                && Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, iterRange, iterVar, accuVar, accuInit, loopCondition, loopStep, result);
    }

    public static final class Builder {
        private final long id;
        private Expr iterRange;
        private String iterVar;
        private String accuVar;
        private Expr accuInit;
        private Expr loopCondition;
        private Expr loopStep;
        private Expr result;

        private Builder(long id) {
            this.id = id;
        }

        public Builder iterRange(Expr iterRange) {
            this.iterRange = iterRange;
            return this;
        }

        public Builder iterVar(String iterVar) {
            this.iterVar = iterVar;
            return this;
        }

        public Builder accuVar(String accuVar) {
            this.accuVar = accuVar;
            return this;
        }

        public Builder accuInit(Expr accuInit) {
            this.accuInit = accuInit;
            return this;
        }

        public Builder loopCondition(Expr loopCondition) {
            this.loopCondition = loopCondition;
            return this;
        }

        public Builder loopStep(Expr loopStep) {
            this.loopStep = loopStep;
            return this;
        }

        public Builder result(Expr result) {
            this.result = result;
            return this;
        }

        public Comprehension build() {
            return new Comprehension(this);
        }
    }
}
