package com.whitehall.core.parser;

import com.whitehall.core.ast.Annotation;
import com.whitehall.core.ast.CodeBlock;
import com.whitehall.core.ast.DataClass;
import com.whitehall.core.ast.Declaration;
import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.FunctionDeclaration;
import com.whitehall.core.ast.ImportDeclaration;
import com.whitehall.core.ast.LifecycleHook;
import com.whitehall.core.ast.MarkupChild;
import com.whitehall.core.ast.MarkupNode;
import com.whitehall.core.ast.Parameter;
import com.whitehall.core.ast.PropDeclaration;
import com.whitehall.core.ast.SourceFile;
import com.whitehall.core.ast.SourcePosition;
import com.whitehall.core.ast.StateScope;
import com.whitehall.core.ast.StateVar;
import com.whitehall.core.ast.StoreClass;
import com.whitehall.core.diagnostic.SyntaxError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses a {@code .wh} source file into a {@link SourceFile}.
 *
 * <p>Parsing runs in two phases over one pass of the text. Top-level declarations are scanned
 * first; plain function bodies are captured verbatim by brace matching and never deep-parsed.
 * When a function body (or the file itself) begins with a markup tag, the full markup subtree is
 * parsed instead. Every composable function in a file is therefore parsed the same way, whatever
 * its position.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceFile file = new WhitehallParser().parse(source, "counter.wh");
 * file.composables().forEach(f -> System.out.println(f.name()));
 * }</pre>
 *
 * <p>Any unparseable construct throws {@link SyntaxError} with its line and column.
 */
public final class WhitehallParser {

    private static final Logger log = LoggerFactory.getLogger(WhitehallParser.class);

    private static final Set<String> TYPE_KEYWORDS = Set.of(
        "data", "enum", "sealed", "abstract", "open", "class", "object", "interface", "typealias", "value"
    );
    private static final Set<String> MODIFIERS = Set.of(
        "private", "internal", "public", "protected", "override", "lateinit", "inline", "operator", "infix"
    );
    private static final Set<String> STORE_ANNOTATIONS = Set.of("store");
    private static final Set<String> HILT_ANNOTATIONS = Set.of("hilt", "HiltViewModel");

    /**
     * Parses a whole file.
     *
     * @param source file contents
     * @param fileName file name, used for diagnostics and to name bare markup
     * @return parsed file
     * @throws SyntaxError when the source cannot be parsed
     */
    public SourceFile parse(String source, String fileName) {
        log.debug("Parsing {}", fileName);
        return new FileParser(source, fileName).parseFile();
    }

    /**
     * Derives the entry-point name for bare markup from a file name:
     * {@code todo-list.wh} becomes {@code TodoList}.
     *
     * @param fileName file name, with or without directories
     * @return PascalCase name
     */
    public static String componentName(String fileName) {
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        int dot = base.indexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        StringBuilder name = new StringBuilder();
        for (String part : base.split("[-_ .]+")) {
            if (!part.isEmpty()) {
                name.append(part.substring(0, 1).toUpperCase(Locale.ROOT)).append(part.substring(1));
            }
        }
        return name.length() == 0 ? "App" : name.toString();
    }

    /**
     * Per-file parse state.
     */
    private static final class FileParser {

        private final String fileName;
        private final SourceCursor cursor;
        private final ExpressionParser expressions;
        private final MarkupParser markup;
        private final List<Declaration> declarations = new ArrayList<>();
        private final List<Annotation> pendingAnnotations = new ArrayList<>();
        private String packageName;
        private boolean hasRootMarkup;

        FileParser(String source, String fileName) {
            this.fileName = fileName;
            this.cursor = new SourceCursor(new Lexer(source, fileName));
            this.expressions = new ExpressionParser(cursor);
            this.markup = new MarkupParser(cursor, expressions);
        }

        SourceFile parseFile() {
            while (true) {
                cursor.skipTrivia();
                if (cursor.atEnd()) {
                    break;
                }
                if (cursor.lookingAt("<!--")) {
                    int close = cursor.source().indexOf("-->", cursor.pos());
                    if (close < 0) {
                        throw cursor.error(cursor.pos(), "Unterminated comment");
                    }
                    cursor.reset(close + 3);
                    continue;
                }
                if (markup.atRootStart()) {
                    parseRootMarkup();
                    continue;
                }
                parseDeclaration();
            }
            if (!pendingAnnotations.isEmpty()) {
                throw cursor.error(cursor.pos(), "Annotation @" + pendingAnnotations.get(0).name()
                    + " is not followed by a declaration");
            }
            return new SourceFile(fileName, packageName, withPropsOnRoot());
        }

        /**
         * Gives the function synthesized from bare markup the file's {@code @prop} parameters,
         * wherever they were declared.
         */
        private List<Declaration> withPropsOnRoot() {
            List<Parameter> props = declarations.stream()
                .filter(PropDeclaration.class::isInstance)
                .map(d -> ((PropDeclaration) d).parameter())
                .toList();
            return declarations.stream()
                .map(d -> d instanceof FunctionDeclaration f && f.synthesized()
                    ? new FunctionDeclaration(f.name(), props, null, false, List.of(), f.markup(), null, true,
                        f.position())
                    : d)
                .toList();
        }

        private void parseRootMarkup() {
            SourcePosition position = cursor.position();
            if (hasRootMarkup) {
                throw cursor.error(cursor.pos(), "Only one top-level markup block is allowed per file");
            }
            hasRootMarkup = true;
            List<MarkupChild> roots = new ArrayList<>();
            while (true) {
                roots.add(markup.parseRoot());
                int save = cursor.pos();
                cursor.skipTrivia();
                while (cursor.lookingAt("<!--")) {
                    int close = cursor.source().indexOf("-->", cursor.pos());
                    if (close < 0) {
                        throw cursor.error(cursor.pos(), "Unterminated comment");
                    }
                    cursor.reset(close + 3);
                    cursor.skipTrivia();
                }
                if (!markup.atRootStart()) {
                    cursor.reset(save);
                    break;
                }
            }
            if (roots.size() > 1) {
                roots = List.of(new MarkupNode("Column", null, List.copyOf(roots), position));
            }
            declarations.add(new FunctionDeclaration(componentName(fileName), List.of(), null, false,
                List.of(), roots, null, true, position));
        }

        private void parseDeclaration() {
            Token token = cursor.peek();
            if (token.is("@")) {
                pendingAnnotations.add(parseAnnotation());
                return;
            }
            if (MODIFIERS.contains(token.text())) {
                cursor.next();
                return;
            }
            switch (token.text()) {
                case "package" -> parsePackage();
                case "import" -> declarations.add(parseImport());
                case "val", "var" -> parseTopLevelVariable();
                case "fun", "suspend" -> declarations.add(parseFunction(takeAnnotations(), true));
                case "$onMount", "$onDispose" -> declarations.add(parseLifecycleHook());
                default -> {
                    if (TYPE_KEYWORDS.contains(token.text())) {
                        parseTypeDeclaration();
                    } else {
                        throw cursor.error(token, "Unexpected " + token.describe() + " at top level");
                    }
                }
            }
        }

        private Annotation parseAnnotation() {
            cursor.expect("@", "'@'");
            Token name = cursor.expectIdentifier("annotation name");
            Token open = cursor.peek();
            String arguments = null;
            if (open.is("(") && open.start() == name.end()) {
                Token close = cursor.skipBalanced("(", ")");
                arguments = cursor.source().substring(open.end(), close.start());
            }
            return new Annotation(name.text(), arguments);
        }

        private List<Annotation> takeAnnotations() {
            List<Annotation> annotations = List.copyOf(pendingAnnotations);
            pendingAnnotations.clear();
            return annotations;
        }

        private void parsePackage() {
            cursor.next();
            packageName = readDottedName();
        }

        private ImportDeclaration parseImport() {
            Token keyword = cursor.next();
            String path = readDottedName();
            String alias = null;
            if (cursor.peek().is("as") && !cursor.peek().newlineBefore()) {
                cursor.next();
                alias = cursor.expectIdentifier("import alias").text();
            }
            return new ImportDeclaration(path, alias, keyword.position());
        }

        private String readDottedName() {
            StringBuilder name = new StringBuilder(cursor.expectIdentifier("name").text());
            while (cursor.peek().is(".") && !cursor.peek().newlineBefore()) {
                cursor.next();
                Token part = cursor.peek();
                if (part.is("*")) {
                    cursor.next();
                    name.append(".*");
                    break;
                }
                name.append('.').append(cursor.expectIdentifier("name").text());
            }
            return name.toString();
        }

        private void parseTopLevelVariable() {
            List<Annotation> annotations = takeAnnotations();
            boolean isProp = annotations.stream().anyMatch(a -> a.name().equals("prop"));
            if (isProp) {
                Token keyword = cursor.next();
                String name = cursor.expectIdentifier("prop name").text();
                String type = cursor.accept(":") ? cursor.readTypeText(Set.of("=")) : null;
                String defaultValue = null;
                if (cursor.accept("=")) {
                    int start = cursor.peek().start();
                    expressions.parseExpression();
                    defaultValue = cursor.source().substring(start, cursor.pos()).trim();
                }
                declarations.add(new PropDeclaration(new Parameter(name, type, defaultValue), keyword.position()));
                return;
            }
            declarations.add(parseVariable(StateScope.LOCAL, false));
        }

        /**
         * Parses {@code val|var name[: Type] [= expr | = $derived(expr)] [get() = expr]}.
         */
        private StateVar parseVariable(StateScope scope, boolean privateMember) {
            Token keyword = cursor.next();
            boolean mutable = keyword.is("var");
            String name = cursor.expectIdentifier("variable name").text();
            String type = cursor.accept(":") ? cursor.readTypeText(Set.of("=", "{")) : null;
            ExprNode initializer = null;
            StateVar.Kind kind = StateVar.Kind.PLAIN;

            if (cursor.accept("=")) {
                Token value = cursor.peek();
                if (value.is("$derived")) {
                    cursor.next();
                    cursor.expect("(", "'(' after $derived");
                    initializer = expressions.parseExpression();
                    cursor.expect(")", "')' to close $derived");
                    kind = StateVar.Kind.DERIVED;
                    if (mutable) {
                        throw cursor.error(keyword, "Derived value '" + name + "' must be declared with val");
                    }
                } else {
                    initializer = expressions.parseExpression();
                }
            }
            if (cursor.peek().is("get")) {
                Token get = cursor.next();
                cursor.expect("(", "'(' after get");
                cursor.expect(")", "')' after get(");
                cursor.expect("=", "'=' after get()");
                if (initializer != null) {
                    throw cursor.error(get, "Property '" + name + "' cannot have both an initializer and a getter");
                }
                initializer = expressions.parseExpression();
                kind = StateVar.Kind.COMPUTED;
            }
            if (initializer == null && kind == StateVar.Kind.PLAIN && type == null) {
                throw cursor.error(keyword, "Variable '" + name + "' needs a type or an initial value");
            }
            return new StateVar(name, type, initializer, mutable, scope, kind, privateMember, keyword.position());
        }

        private FunctionDeclaration parseFunction(List<Annotation> annotations, boolean allowMarkup) {
            Token first = cursor.next();
            boolean suspend = first.is("suspend");
            if (suspend) {
                cursor.expect("fun", "'fun' after suspend");
            }
            String name = cursor.expectIdentifier("function name").text();
            Token open = cursor.peek();
            Token close = cursor.skipBalanced("(", ")");
            List<Parameter> parameters = parseParameters(cursor.source().substring(open.end(), close.start()));
            String returnType = cursor.accept(":") ? cursor.readTypeText(Set.of("{", "=")) : null;

            Token body = cursor.peek();
            if (body.is("=")) {
                throw cursor.error(body, "Expression-bodied function '" + name + "' is not supported; use a block body");
            }
            if (!body.is("{") || body.newlineBefore()) {
                boolean external = annotations.stream().anyMatch(a -> a.name().equals("ffi"));
                if (!external) {
                    throw cursor.error(first, "Function '" + name + "' has no body");
                }
                return new FunctionDeclaration(name, parameters, returnType, suspend, annotations,
                    List.of(), null, false, first.position());
            }

            cursor.next();
            int afterBrace = cursor.pos();
            cursor.skipTrivia();
            if (allowMarkup && markup.atRootStart()) {
                List<MarkupChild> roots = new ArrayList<>();
                while (markup.atRootStart()) {
                    roots.add(markup.parseRoot());
                    cursor.skipTrivia();
                }
                cursor.expect("}", "'}' to close composable function '" + name + "'");
                return new FunctionDeclaration(name, parameters, returnType, suspend, annotations,
                    roots, null, false, first.position());
            }
            cursor.reset(afterBrace);
            CodeBlock code = captureBlock(body);
            return new FunctionDeclaration(name, parameters, returnType, suspend, annotations,
                List.of(), code, false, first.position());
        }

        /**
         * Captures everything up to the brace matching {@code open}, which is already consumed.
         */
        private CodeBlock captureBlock(Token open) {
            int start = cursor.pos();
            int depth = 1;
            while (true) {
                Token token = cursor.next();
                if (token.isEof()) {
                    throw cursor.error(open, "Unterminated block");
                }
                if (token.is("{")) {
                    depth++;
                } else if (token.is("}")) {
                    depth--;
                    if (depth == 0) {
                        return new CodeBlock(cursor.source().substring(start, token.start()), cursor.positionOf(start));
                    }
                }
            }
        }

        private List<Parameter> parseParameters(String text) {
            List<Parameter> parameters = new ArrayList<>();
            for (String part : SourceCursor.splitTopLevel(text)) {
                String declaration = part.replaceFirst("^(private\\s+|val\\s+|var\\s+)+", "");
                int colon = declaration.indexOf(':');
                int equals = indexOfAssignment(declaration);
                String name = (colon >= 0 ? declaration.substring(0, colon)
                    : equals >= 0 ? declaration.substring(0, equals) : declaration).trim();
                String type = colon >= 0
                    ? declaration.substring(colon + 1, equals >= 0 ? equals : declaration.length()).trim()
                    : null;
                String defaultValue = equals >= 0 ? declaration.substring(equals + 1).trim() : null;
                parameters.add(new Parameter(name, type, defaultValue));
            }
            return parameters;
        }

        private static int indexOfAssignment(String text) {
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '=') {
                    boolean operator = (i + 1 < text.length() && (text.charAt(i + 1) == '=' || text.charAt(i + 1) == '>'))
                        || (i > 0 && "=!<>".indexOf(text.charAt(i - 1)) >= 0);
                    if (!operator) {
                        return i;
                    }
                }
            }
            return -1;
        }

        private LifecycleHook parseLifecycleHook() {
            Token keyword = cursor.next();
            if (!takeAnnotations().isEmpty()) {
                throw cursor.error(keyword, "Lifecycle hooks cannot be annotated");
            }
            Token open = cursor.expect("{", "'{' after " + keyword.text());
            LifecycleHook.Kind kind = keyword.is("$onMount") ? LifecycleHook.Kind.MOUNT : LifecycleHook.Kind.DISPOSE;
            return new LifecycleHook(kind, captureBlock(open), keyword.position());
        }

        private void parseTypeDeclaration() {
            List<Annotation> annotations = takeAnnotations();
            boolean store = annotations.stream().anyMatch(a -> STORE_ANNOTATIONS.contains(a.name()));
            Token first = cursor.peek();
            if (store) {
                declarations.add(parseStore(annotations));
                return;
            }
            if (first.is("typealias")) {
                cursor.next();
                String name = cursor.expectIdentifier("type alias name").text();
                cursor.expect("=", "'=' in typealias");
                cursor.readTypeText(Set.of());
                declarations.add(new DataClass(name, text(first), first.position()));
                return;
            }
            String name = null;
            int depth = 0;
            while (true) {
                Token token = cursor.peek();
                if (token.isEof()) {
                    break;
                }
                if (depth == 0 && name != null && token.newlineBefore()) {
                    break;
                }
                if (depth == 0 && token.is("{")) {
                    cursor.next();
                    captureBlock(token);
                    break;
                }
                cursor.next();
                if (token.is("(")) {
                    depth++;
                } else if (token.is(")")) {
                    depth--;
                } else if (name == null && (token.is("class") || token.is("object") || token.is("interface"))) {
                    name = cursor.expectIdentifier("type name").text();
                }
            }
            if (name == null) {
                throw cursor.error(first, "Expected a type declaration");
            }
            declarations.add(new DataClass(name, text(first), first.position()));
        }

        private String text(Token first) {
            return cursor.source().substring(first.start(), cursor.pos());
        }

        private StoreClass parseStore(List<Annotation> annotations) {
            Token keyword = cursor.next();
            boolean singleton;
            if (keyword.is("object")) {
                singleton = true;
            } else if (keyword.is("class")) {
                singleton = false;
            } else {
                throw cursor.error(keyword, "@store applies to a class or an object, not '" + keyword.text() + "'");
            }
            String name = cursor.expectIdentifier("store name").text();
            boolean hilt = annotations.stream().anyMatch(a -> HILT_ANNOTATIONS.contains(a.name()));

            String constructorParameters = null;
            if (cursor.peek().is("@")) {
                Annotation inject = parseAnnotation();
                if (!inject.name().equals("Inject")) {
                    throw cursor.error(keyword, "Unexpected annotation @" + inject.name() + " on store constructor");
                }
                hilt = true;
                cursor.expect("constructor", "'constructor' after @Inject");
            } else if (cursor.peek().is("constructor")) {
                cursor.next();
            }
            if (cursor.peek().is("(")) {
                Token open = cursor.peek();
                Token close = cursor.skipBalanced("(", ")");
                constructorParameters = cursor.source().substring(open.end(), close.start()).trim();
            }
            if (singleton && constructorParameters != null) {
                throw cursor.error(keyword, "Store object '" + name + "' cannot declare constructor parameters");
            }
            if (cursor.accept(":")) {
                cursor.readTypeText(Set.of("{"));
            }
            Token open = cursor.expect("{", "'{' to open store '" + name + "'");

            List<StateVar> fields = new ArrayList<>();
            List<FunctionDeclaration> functions = new ArrayList<>();
            List<CodeBlock> initBlocks = new ArrayList<>();
            List<Annotation> memberAnnotations = new ArrayList<>();
            boolean privateMember = false;
            while (true) {
                Token token = cursor.peek();
                if (token.is("}")) {
                    cursor.next();
                    break;
                }
                if (token.isEof()) {
                    throw cursor.error(open, "Unterminated store '" + name + "'");
                }
                if (token.is("@")) {
                    memberAnnotations.add(parseAnnotation());
                    continue;
                }
                if (MODIFIERS.contains(token.text())) {
                    privateMember |= token.is("private");
                    cursor.next();
                    continue;
                }
                switch (token.text()) {
                    case "val", "var" -> fields.add(parseVariable(StateScope.STORE, privateMember));
                    case "fun", "suspend" -> functions.add(parseFunction(List.copyOf(memberAnnotations), false));
                    case "init" -> {
                        cursor.next();
                        Token initOpen = cursor.expect("{", "'{' after init");
                        initBlocks.add(captureBlock(initOpen));
                    }
                    default -> throw cursor.error(token, "Unexpected " + token.describe() + " in store '" + name + "'");
                }
                memberAnnotations.clear();
                privateMember = false;
            }
            return new StoreClass(name, singleton, hilt, constructorParameters, fields, functions, initBlocks,
                keyword.position());
        }
    }
}
