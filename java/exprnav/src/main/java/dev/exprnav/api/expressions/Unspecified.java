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

import dev.exprnav.api.Expr;

/**
 * An expression whose kind was never set. It has an id but no other content.
 */
public final class Unspecified implements Expr {
    private final long id;

    private Unspecified(long id) {
        this.id = id;
    }

    public static Unspecified of(long id) {
        return new Unspecified(id);
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public String type() {
        return "unspecified";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitUnspecified(this);
    }

    @Override
    public String toString() {
        return "<unspecified>";
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Unspecified)) return false;
        return id == ((Unspecified) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }
}
