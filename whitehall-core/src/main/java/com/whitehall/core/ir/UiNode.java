package com.whitehall.core.ir;

import com.whitehall.core.ast.ExprNode;

import java.util.List;
import java.util.Objects;

/**
 * Statement of a lowered composable body.
 *
 * <p>Every node maps to one Kotlin construct; the emitter prints them without further decisions.
 */
public interface UiNode {

    /**
     * {@code Name(args) { content }}.
     *
     * @param name callee, possibly qualified
     * @param arguments named or positional arguments
     * @param content trailing content lambda, or null
     */
    record ComponentCall(String name, List<ExprNode.Argument> arguments, Content content) implements UiNode {
        public ComponentCall {
            Objects.requireNonNull(name, "name must not be null");
            arguments = arguments != null ? List.copyOf(arguments) : List.of();
        }
    }

    /** Trailing lambda of a {@link ComponentCall}, {@code { params -> children }}. */
    record Content(List<String> parameters, List<UiNode> children) {
        public Content {
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
            children = children != null ? List.copyOf(children) : List.of();
        }

        public static Content of(List<UiNode> children) {
            return new Content(List.of(), children);
        }
    }

    /** {@code if (..) { } else if (..) { } else { }}. */
    record IfChain(List<IfBranch> branches) implements UiNode {
        public IfChain {
            branches = branches != null ? List.copyOf(branches) : List.of();
        }
    }

    /** @param condition branch condition, or null for the final else */
    record IfBranch(ExprNode condition, List<UiNode> body) {
        public IfBranch {
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    /** {@code when (subject) { ... }}; the subject may be null. */
    record WhenBlock(ExprNode subject, List<WhenBranch> branches) implements UiNode {
        public WhenBlock {
            branches = branches != null ? List.copyOf(branches) : List.of();
        }
    }

    /** @param conditions branch conditions; empty for else */
    record WhenBranch(List<ExprNode> conditions, List<UiNode> body) {
        public WhenBranch {
            conditions = conditions != null ? List.copyOf(conditions) : List.of();
            body = body != null ? List.copyOf(body) : List.of();
        }

        public boolean isElse() {
            return conditions.isEmpty();
        }
    }

    /**
     * {@code iterable.forEach { loopVar -> key(key) { body } }}; indexed when {@code indexVar} is set.
     *
     * @param key key expression over the loop variable, or null
     */
    record InlineRepeat(ExprNode iterable, String indexVar, String loopVar, ExprNode key, List<UiNode> body)
        implements UiNode {
        public InlineRepeat {
            Objects.requireNonNull(iterable, "iterable must not be null");
            Objects.requireNonNull(loopVar, "loopVar must not be null");
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    /**
     * {@code items(iterable, key = selector) { loopVar -> body }} inside a lazy list scope.
     *
     * @param keySelector key lambda, or null
     */
    record LazyItems(ExprNode iterable, String indexVar, String loopVar, ExprNode keySelector, List<UiNode> body)
        implements UiNode {
        public LazyItems {
            Objects.requireNonNull(iterable, "iterable must not be null");
            Objects.requireNonNull(loopVar, "loopVar must not be null");
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    /** {@code item { body }} inside a lazy list scope. */
    record LazyItem(List<UiNode> body) implements UiNode {
        public LazyItem {
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    /**
     * {@code val name[: type] = value} or {@code var name by value}.
     *
     * @param delegated true for {@code by} property delegation
     */
    record LocalValue(boolean mutable, String name, String type, boolean delegated, ExprNode value)
        implements UiNode {
        public LocalValue {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Local function with an already rewritten body. */
    record LocalFunction(String signature, String body) implements UiNode {
        public LocalFunction {
            Objects.requireNonNull(signature, "signature must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /** Verbatim code statements. */
    record RawCode(String text) implements UiNode {
        public RawCode {
            Objects.requireNonNull(text, "text must not be null");
        }
    }
}
