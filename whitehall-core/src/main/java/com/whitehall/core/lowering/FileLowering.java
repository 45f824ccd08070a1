package com.whitehall.core.lowering;

import com.whitehall.core.ast.CodeBlock;
import com.whitehall.core.ast.DataClass;
import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.Lambda;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.LiteralKind;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.ast.FunctionDeclaration;
import com.whitehall.core.ast.ImportDeclaration;
import com.whitehall.core.ast.LifecycleHook;
import com.whitehall.core.ast.Parameter;
import com.whitehall.core.ast.SourceFile;
import com.whitehall.core.ast.StateVar;
import com.whitehall.core.ast.StoreClass;
import com.whitehall.core.diagnostic.Diagnostics;
import com.whitehall.core.diagnostic.TypeInferenceError;
import com.whitehall.core.emit.CodeWriter;
import com.whitehall.core.emit.ExpressionPrinter;
import com.whitehall.core.ir.LoweredComposable;
import com.whitehall.core.ir.LoweredFile;
import com.whitehall.core.ir.StoreModel;
import com.whitehall.core.ir.UiNode;
import com.whitehall.core.ir.UiNode.ComponentCall;
import com.whitehall.core.ir.UiNode.Content;
import com.whitehall.core.ir.UiNode.LocalValue;
import com.whitehall.core.parser.WhitehallParser;
import com.whitehall.core.registry.ComponentRegistry;
import com.whitehall.core.state.StateSynthesizer;
import com.whitehall.core.transform.ExpressionTransformer;
import com.whitehall.core.transform.PropTransformer;
import com.whitehall.core.transform.RawCodeRewriter;
import com.whitehall.core.transform.ScopeSymbols;
import com.whitehall.core.transform.StoreBinding;
import com.whitehall.core.transform.TransformContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lowers a parsed source file to composables, declarations and store models.
 *
 * <p>Every composable of the file is lowered, the main entry first. The main entry owns the file's
 * local state, store bindings, plain functions and lifecycle hooks; helper composables see only
 * their parameters and file-level symbols.
 */
public final class FileLowering {

    private static final Logger log = LoggerFactory.getLogger(FileLowering.class);

    private final ComponentRegistry registry;
    private final String basePackage;
    private final boolean strict;

    /**
     * Creates a lowering.
     *
     * @param registry component registry
     * @param basePackage configured package, used when the file declares none
     * @param strict true to treat unknown components and props as errors
     */
    public FileLowering(ComponentRegistry registry, String basePackage, boolean strict) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.basePackage = basePackage != null ? basePackage : "";
        this.strict = strict;
    }

    /**
     * Lowers one file.
     *
     * @param file parsed file
     * @param diagnostics collector for recoverable problems
     * @return lowered file
     */
    public LoweredFile lower(SourceFile file, Diagnostics diagnostics) {
        return new Pass(file, diagnostics).run();
    }

    /**
     * State of lowering one file.
     */
    private final class Pass {

        private final SourceFile file;
        private final Diagnostics diagnostics;
        private final ExpressionTransformer expressions = new ExpressionTransformer();
        private final ExpressionPrinter printer = new ExpressionPrinter();
        private final RawCodeRewriter rewriter = new RawCodeRewriter(expressions, printer);
        private final MarkupLowering markup;

        Pass(SourceFile file, Diagnostics diagnostics) {
            this.file = file;
            this.diagnostics = diagnostics;
            Set<String> userComponents = new HashSet<>();
            file.composables().forEach(f -> userComponents.add(f.name()));
            file.imports().stream()
                .map(ImportDeclaration::simpleName)
                .filter(n -> !n.isEmpty() && Character.isUpperCase(n.charAt(0)))
                .forEach(userComponents::add);
            PropTransformer props = new PropTransformer(expressions, diagnostics, strict);
            this.markup = new MarkupLowering(registry, props, expressions, diagnostics, strict, userComponents);
        }

        LoweredFile run() {
            String fileName = file.fileName();
            String packageName = file.packageName() != null ? file.packageName() : basePackage;

            StateSynthesizer synthesizer = new StateSynthesizer(expressions, rewriter, diagnostics);
            List<StoreModel> stores = file.stores().stream()
                .map(store -> synthesizer.synthesize(store, fileName))
                .toList();

            List<LoweredComposable> composables = new ArrayList<>();
            List<String> declarations = new ArrayList<>();
            List<FunctionDeclaration> entries = file.composables();
            if (entries.isEmpty()) {
                declarations.addAll(fileLevelCode());
            } else {
                composables.add(lowerMain(entries.get(0)));
                for (FunctionDeclaration helper : entries.subList(1, entries.size())) {
                    composables.add(lowerHelper(helper));
                }
            }
            file.dataClasses().stream().map(DataClass::code).forEach(declarations::add);

            Set<String> storeNames = file.stores().stream().map(StoreClass::name).collect(Collectors.toSet());
            String mainFileName = WhitehallParser.componentName(fileName);
            if (storeNames.contains(mainFileName)) {
                mainFileName = mainFileName + "Components";
            }

            log.debug("Lowered {}: {} composable(s), {} store(s), {} declaration(s)",
                fileName, composables.size(), stores.size(), declarations.size());
            return new LoweredFile(packageName, mainFileName, imports(), composables, declarations, stores,
                declaredNames());
        }

        private LoweredComposable lowerMain(FunctionDeclaration main) {
            Map<String, StoreBinding> bindings = new LinkedHashMap<>(singletonBindings());
            Map<String, StateVar> localState = new LinkedHashMap<>();
            for (StateVar variable : file.stateVars()) {
                StoreClass store = boundStore(variable);
                if (store != null) {
                    bindings.put(variable.name(), StoreBinding.of(variable.name(), store));
                } else {
                    localState.put(variable.name(), variable);
                }
            }
            ScopeSymbols symbols = new ScopeSymbols(localState, bindings, null, ScopeSymbols.COMPONENT_SCOPE);
            TransformContext ctx = TransformContext.forComponent(file.fileName(), main.name(), symbols);

            List<UiNode> factories = new ArrayList<>();
            for (StoreBinding binding : bindings.values()) {
                if (!binding.store().singleton()) {
                    String factory = binding.store().hilt() ? "hiltViewModel" : "viewModel";
                    factories.add(new LocalValue(false, binding.name(), null, false,
                        new Call(new Identifier(factory), "<" + binding.store().name() + ">", List.of(), null)));
                }
            }
            List<UiNode> state = new ArrayList<>();
            for (StateVar variable : localState.values()) {
                state.add(localValue(variable, ctx));
            }

            List<UiNode> functions = new ArrayList<>();
            for (FunctionDeclaration function : file.plainFunctions()) {
                functions.add(new UiNode.LocalFunction(signature(function), rewriter.rewrite(function.code(), ctx)));
            }
            List<UiNode> hooks = new ArrayList<>();
            for (LifecycleHook hook : file.lifecycleHooks()) {
                hooks.add(lifecycleEffect(hook, ctx));
            }
            List<UiNode> body = markup.lowerAll(main.markup(), ContainerKind.LAYOUT, ctx);

            List<UiNode> rest = new ArrayList<>(factories);
            rest.addAll(state);
            rest.addAll(functions);
            rest.addAll(hooks);
            rest.addAll(body);
            String text = printer.printNodes(rest);

            // Snapshots read the store, so they follow its factory call
            List<UiNode> statements = new ArrayList<>(factories);
            for (StoreBinding binding : bindings.values()) {
                if (!binding.store().singleton() || references(text, binding.stateName())) {
                    statements.add(collectState(binding));
                }
            }
            statements.addAll(state);
            if (references(text, ScopeSymbols.COMPONENT_SCOPE)) {
                statements.add(new LocalValue(false, ScopeSymbols.COMPONENT_SCOPE, null, false,
                    Call.of("rememberCoroutineScope")));
            }
            statements.addAll(functions);
            statements.addAll(hooks);
            statements.addAll(body);
            return new LoweredComposable(main.name(), main.parameters(), statements);
        }

        private LoweredComposable lowerHelper(FunctionDeclaration helper) {
            Map<String, StoreBinding> bindings = singletonBindings();
            ScopeSymbols symbols = new ScopeSymbols(Map.of(), bindings, null, ScopeSymbols.COMPONENT_SCOPE);
            TransformContext ctx = TransformContext.forComponent(file.fileName(), helper.name(), symbols);
            List<UiNode> body = markup.lowerAll(helper.markup(), ContainerKind.LAYOUT, ctx);

            String text = printer.printNodes(body);
            List<UiNode> statements = new ArrayList<>();
            for (StoreBinding binding : bindings.values()) {
                if (references(text, binding.stateName())) {
                    statements.add(collectState(binding));
                }
            }
            if (references(text, ScopeSymbols.COMPONENT_SCOPE)) {
                statements.add(new LocalValue(false, ScopeSymbols.COMPONENT_SCOPE, null, false,
                    Call.of("rememberCoroutineScope")));
            }
            statements.addAll(body);
            return new LoweredComposable(helper.name(), helper.parameters(), statements);
        }

        /**
         * Object stores are visible by name in every composable of the file.
         */
        private Map<String, StoreBinding> singletonBindings() {
            Map<String, StoreBinding> bindings = new LinkedHashMap<>();
            file.stores().stream()
                .filter(StoreClass::singleton)
                .forEach(store -> bindings.put(store.name(), StoreBinding.of(store.name(), store)));
            return bindings;
        }

        /**
         * The store a local {@code val s = StoreName()} binds, or null.
         */
        private StoreClass boundStore(StateVar variable) {
            if (variable.mutable() || !(variable.initializer() instanceof Call call)
                || !(call.callee() instanceof Identifier callee)) {
                return null;
            }
            return file.store(callee.name()).filter(store -> !store.singleton()).orElse(null);
        }

        private UiNode collectState(StoreBinding binding) {
            String flow = binding.store().singleton() ? "state" : "uiState";
            ExprNode collected = new Call(new MemberAccess(
                new MemberAccess(new Identifier(binding.name()), flow, false), "collectAsState", false),
                null, List.of(), null);
            return new LocalValue(false, binding.stateName(), null, true, collected);
        }

        private UiNode localValue(StateVar variable, TransformContext ctx) {
            ExprNode initializer = variable.initializer() != null
                ? expressions.transform(variable.initializer(), ctx)
                : null;
            switch (variable.kind()) {
                case DERIVED -> {
                    Call derived = new Call(new Identifier("derivedStateOf"), null, List.of(),
                        new Lambda(List.of(), List.of(initializer), false));
                    return new LocalValue(false, variable.name(), null, true, remember(derived));
                }
                case COMPUTED -> {
                    return new LocalValue(false, variable.name(), variable.type(), false, initializer);
                }
                default -> {
                    // plain values below
                }
            }
            if (!variable.mutable()) {
                return new LocalValue(false, variable.name(), variable.type(), false, initializer);
            }
            if (initializer == null) {
                if (variable.type() == null || !variable.type().endsWith("?")) {
                    throw new TypeInferenceError(file.fileName(), variable.position(),
                        "State variable '" + variable.name() + "' needs an initial value");
                }
                initializer = new Literal(LiteralKind.NULL, "null");
            }
            String typeArguments = variable.type() != null ? "<" + variable.type() + ">" : null;
            Call state = new Call(new Identifier("mutableStateOf"), typeArguments,
                List.of(Argument.positional(initializer)), null);
            return new LocalValue(true, variable.name(), null, true, remember(state));
        }

        private UiNode lifecycleEffect(LifecycleHook hook, TransformContext ctx) {
            UiNode code = new UiNode.RawCode(rewriter.rewrite(hook.code(), ctx));
            List<Argument> unit = List.of(Argument.positional(new Identifier("Unit")));
            if (hook.kind() == LifecycleHook.Kind.MOUNT) {
                return new ComponentCall("LaunchedEffect", unit, Content.of(List.of(code)));
            }
            UiNode onDispose = new ComponentCall("onDispose", List.of(), Content.of(List.of(code)));
            return new ComponentCall("DisposableEffect", unit, Content.of(List.of(onDispose)));
        }

        /**
         * Without a composable, state and functions are plain file-level declarations.
         */
        private List<String> fileLevelCode() {
            List<String> code = new ArrayList<>();
            for (StateVar variable : file.stateVars()) {
                StringBuilder sb = new StringBuilder(variable.mutable() ? "var " : "val ").append(variable.name());
                if (variable.type() != null) {
                    sb.append(": ").append(variable.type());
                }
                if (variable.kind() == StateVar.Kind.COMPUTED) {
                    sb.append("\n").append(ExpressionPrinter.indent("get() = " + printer.print(variable.initializer())));
                } else if (variable.initializer() != null) {
                    sb.append(" = ").append(printer.print(variable.initializer()));
                }
                code.add(sb.toString());
            }
            for (FunctionDeclaration function : file.plainFunctions()) {
                code.add(functionText(signature(function), function.code()));
            }
            return code;
        }

        private List<String> imports() {
            return file.imports().stream()
                .map(i -> i.resolve(basePackage) + (i.alias() != null ? " as " + i.alias() : ""))
                .distinct()
                .toList();
        }

        private Set<String> declaredNames() {
            Set<String> names = new HashSet<>();
            file.functions().forEach(f -> {
                names.add(f.name());
                f.parameters().forEach(p -> names.add(p.name()));
            });
            file.stores().forEach(s -> names.add(s.name()));
            file.dataClasses().forEach(d -> names.add(d.name()));
            file.stateVars().forEach(v -> names.add(v.name()));
            file.props().forEach(p -> names.add(p.parameter().name()));
            return names;
        }
    }

    private static Call remember(Call value) {
        return new Call(new Identifier("remember"), null, List.of(), new Lambda(List.of(), List.of(value), false));
    }

    private static boolean references(String code, String name) {
        return Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(code).find();
    }

    private static String signature(FunctionDeclaration function) {
        String parameters = function.parameters().stream()
            .map(Parameter::toSignature)
            .collect(Collectors.joining(", "));
        return (function.suspend() ? "suspend " : "") + "fun " + function.name() + "(" + parameters + ")"
            + (function.returnType() != null ? ": " + function.returnType() : "");
    }

    private static String functionText(String signature, CodeBlock body) {
        String text = CodeWriter.dedent(body.text());
        return text.isEmpty() ? signature + " {}" : signature + " {\n" + ExpressionPrinter.indent(text) + "\n}";
    }
}
