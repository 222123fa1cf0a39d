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

public final class Ident implements Expr {
    private final long id;
    private final String name;

    private Ident(long id, String name) {
        this.id = id;
        this.name = checkNotNull(name, "name");
    }

    public static Ident of(long id, String name) {
        return new Ident(id, name);
    }

    @Override
    public long id() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public String type() {
        return "ident";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitIdent(this);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Ident)) return false;
        Ident ident = (Ident) o;
        return id == ident.id && Objects.equals(name, ident.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }
}
