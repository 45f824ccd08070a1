package com.whitehall.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code @if}, {@code @for} and {@code @when} directives inside markup.
 */
public interface ControlDirective extends MarkupChild {

    /**
     * {@code @if (c) { } else if (d) { } else { }}.
     *
     * @param branches branches in order; only the last may have a null condition (the else)
     */
    record If(List<Branch> branches, SourcePosition position) implements ControlDirective {
        public If {
            branches = branches != null ? List.copyOf(branches) : List.of();
            Objects.requireNonNull(position, "position must not be null");
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("if directive needs at least one branch");
            }
        }

        public boolean hasElse() {
            return branches.get(branches.size() - 1).condition() == null;
        }
    }

    /**
     * One branch of an {@code @if} or {@code @when}.
     *
     * @param condition branch condition, or null for else
     * @param conditions extra comma-separated {@code @when} conditions
     * @param children branch body
     */
    record Branch(ExprNode condition, List<ExprNode> conditions, List<MarkupChild> children) {
        public Branch {
            conditions = conditions != null ? List.copyOf(conditions) : List.of();
            children = children != null ? List.copyOf(children) : List.of();
        }

        public Branch(ExprNode condition, List<MarkupChild> children) {
            this(condition, List.of(), children);
        }
    }

    /**
     * {@code @for ([index,] item in iterable[, key = selector]) { } [empty { }]}.
     *
     * @param indexVar index variable, or null
     * @param loopVar element variable
     * @param iterable any expression, re-evaluated per render
     * @param keySelector key selector lambda, or null
     * @param body element body
     * @param emptyBody body rendered for an empty iterable; empty when not given
     */
    record For(
        String indexVar,
        String loopVar,
        ExprNode iterable,
        ExprNode keySelector,
        List<MarkupChild> body,
        List<MarkupChild> emptyBody,
        SourcePosition position
    ) implements ControlDirective {
        public For {
            Objects.requireNonNull(loopVar, "loopVar must not be null");
            Objects.requireNonNull(iterable, "iterable must not be null");
            Objects.requireNonNull(position, "position must not be null");
            body = body != null ? List.copyOf(body) : List.of();
            emptyBody = emptyBody != null ? List.copyOf(emptyBody) : List.of();
        }
    }

    /**
     * {@code @when [(subject)] { cond -> body ... else -> body }}.
     *
     * @param subject subject expression, or null
     * @param branches branches; an else branch has a null condition
     */
    record When(ExprNode subject, List<Branch> branches, SourcePosition position) implements ControlDirective {
        public When {
            branches = branches != null ? List.copyOf(branches) : List.of();
            Objects.requireNonNull(position, "position must not be null");
        }
    }
}
