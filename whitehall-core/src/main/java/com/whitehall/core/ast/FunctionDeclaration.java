package com.whitehall.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code fun Name(params): Type { body }}.
 *
 * <p>A function whose body begins with markup is a composable entry point and carries the parsed
 * {@code markup}; any other function keeps its body as verbatim {@code code}. A body-less function
 * (native signature) has neither.
 *
 * @param name function name
 * @param parameters declared parameters
 * @param returnType declared return type, or null
 * @param suspend true for {@code suspend fun}
 * @param annotations annotations in source order
 * @param markup root elements and directives of a composable body
 * @param code verbatim body, or null
 * @param synthesized true for the entry point built from bare top-level markup
 * @param position source location
 */
public record FunctionDeclaration(
    String name,
    List<Parameter> parameters,
    String returnType,
    boolean suspend,
    List<Annotation> annotations,
    List<MarkupChild> markup,
    CodeBlock code,
    boolean synthesized,
    SourcePosition position
) implements Declaration {

    public FunctionDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(position, "position must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        markup = markup != null ? List.copyOf(markup) : List.of();
    }

    public boolean isComposable() {
        return !markup.isEmpty();
    }

    public boolean hasBody() {
        return code != null || !markup.isEmpty();
    }

    /**
     * Finds an annotation by name.
     *
     * @param annotationName name without {@code @}
     * @return the annotation, or null
     */
    public Annotation annotation(String annotationName) {
        return annotations.stream()
            .filter(a -> a.name().equals(annotationName))
            .findFirst()
            .orElse(null);
    }
}
