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

import dev.exprnav.api.CheckedAst;
import dev.exprnav.api.Expr;
import dev.exprnav.api.types.Type;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for opening an expression tree for navigation.
 */
public final class NavigableExprs {
    private static final Logger log = LoggerFactory.getLogger(NavigableExprs.class);

    private NavigableExprs() {}

    /**
     * Navigate a checked AST from its root.
     */
    public static NavigableExpr navigate(CheckedAst ast) {
        return navigate(ast, NavigationOptions.of());
    }

    public static NavigableExpr navigate(CheckedAst ast, NavigationOptions options) {
        checkNotNull(ast, "ast");
        return navigate(ast.expr(), ast.typeMap(), options);
    }

    /**
     * Navigate a raw expression tree. The type map is shared by every node, not copied, and must not change while
     * the tree is in use.
     */
    public static NavigableExpr navigate(Expr root, Map<Long, Type> typeMap) {
        return navigate(root, typeMap, NavigationOptions.of());
    }

    public static NavigableExpr navigate(Expr root, Map<Long, Type> typeMap, NavigationOptions options) {
        checkNotNull(root, "root");
        checkNotNull(typeMap, "typeMap");
        checkNotNull(options, "options");
        log.debug("Navigating expression {} with {} typed nodes", root.id(), typeMap.size());
        return new NavigableExprImpl(Optional.empty(), root, typeMap, options);
    }
}
