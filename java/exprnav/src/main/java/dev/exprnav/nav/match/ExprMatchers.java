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
package dev.exprnav.nav.match;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import dev.exprnav.nav.ExprKind;
import dev.exprnav.nav.NavigableExpr;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in matchers and the breadth-first search that applies them.
 */
public final class ExprMatchers {
    private static final Logger log = LoggerFactory.getLogger(ExprMatchers.class);

    private static final ExprMatcher ALL = expr -> true;
    private static final ExprMatcher CONSTANT_VALUE = ExprMatchers::isConstantValue;

    private ExprMatchers() {}

    /**
     * Matches nodes of the given kind.
     */
    public static ExprMatcher kindMatcher(ExprKind kind) {
        checkNotNull(kind, "kind");
        return expr -> expr.kind() == kind;
    }

    /**
     * Matches calls to the function named exactly {@code functionName}.
     */
    public static ExprMatcher functionMatcher(String functionName) {
        checkNotNull(functionName, "functionName");
        return expr -> expr.kind() == ExprKind.CALL && expr.asCall().functionName().equals(functionName);
    }

    /**
     * Matches every node. Combined with {@link #matchDescendants} this flattens a subtree into a list that later
     * {@link #matchSubset} calls can narrow.
     */
    public static ExprMatcher allMatcher() {
        return ALL;
    }

    /**
     * Matches literals, and list, map and struct literals built only from literals. No folding is attempted, so
     * {@code 1 + 2} does not match.
     */
    public static ExprMatcher constantValueMatcher() {
        return CONSTANT_VALUE;
    }

    /**
     * Search the subtree rooted at {@code expr}, including {@code expr} itself, breadth-first.
     *
     * @return matching nodes in visitation order
     */
    public static List<NavigableExpr> matchDescendants(NavigableExpr expr, ExprMatcher matcher) {
        checkNotNull(expr, "expr");
        return matchListInternal(ImmutableList.of(expr), matcher, true);
    }

    /**
     * Test exactly the given nodes without descending into their children.
     *
     * @return the given nodes that match, in their original order
     */
    public static List<NavigableExpr> matchSubset(Collection<? extends NavigableExpr> exprs, ExprMatcher matcher) {
        checkNotNull(exprs, "exprs");
        return matchListInternal(exprs, matcher, false);
    }

    private static List<NavigableExpr> matchListInternal(
            Collection<? extends NavigableExpr> seed, ExprMatcher matcher, boolean visitDescendants) {
        checkNotNull(matcher, "matcher");
        Deque<NavigableExpr> visit = new ArrayDeque<>(seed);
        ImmutableList.Builder<NavigableExpr> matched = ImmutableList.builder();
        int visited = 0;
        while (!visit.isEmpty()) {
            NavigableExpr expr = visit.removeFirst();
            visited++;
            if (matcher.matches(expr)) {
                matched.add(expr);
            }
            if (visitDescendants) {
                visit.addAll(expr.children());
            }
        }
        List<NavigableExpr> result = matched.build();
        log.debug("Visited {} nodes, matched {}", visited, result.size());
        return result;
    }

    private static boolean isConstantValue(NavigableExpr expr) {
        switch (expr.kind()) {
            case LITERAL:
                return true;
            case LIST:
            case MAP:
            case STRUCT:
                for (NavigableExpr child : expr.children()) {
                    if (!isConstantValue(child)) {
                        return false;
                    }
                }
                return true;
            default:
                return false;
        }
    }
}
