package com.whitehall.core.state;

import com.whitehall.core.ast.FunctionDeclaration;
import com.whitehall.core.ast.Parameter;
import com.whitehall.core.ast.StateVar;
import com.whitehall.core.ast.StoreClass;
import com.whitehall.core.diagnostic.Diagnostic;
import com.whitehall.core.diagnostic.DiagnosticKind;
import com.whitehall.core.diagnostic.Diagnostics;
import com.whitehall.core.diagnostic.TypeInferenceError;
import com.whitehall.core.ir.StoreModel;
import com.whitehall.core.ir.StoreModel.ComputedProperty;
import com.whitehall.core.ir.StoreModel.PrivateField;
import com.whitehall.core.ir.StoreModel.StateField;
import com.whitehall.core.ir.StoreModel.StoreMethod;
import com.whitehall.core.ir.StoreModel.UpdateMethod;
import com.whitehall.core.transform.ExpressionTransformer;
import com.whitehall.core.transform.RawCodeRewriter;
import com.whitehall.core.transform.TransformContext;
import com.whitehall.core.transform.TypeInference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the reactive state container for a store class.
 *
 * <p>Each public field becomes a property of an immutable state data class held in a
 * {@code MutableStateFlow}; writable fields get an {@code updateX} method that replaces the
 * snapshot. Derived and computed fields become read-only getters, private members stay plain
 * fields. Suspending methods of a view model run inside its {@code viewModelScope}.
 */
public final class StateSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(StateSynthesizer.class);

    private final ExpressionTransformer transformer;
    private final RawCodeRewriter rewriter;
    private final Diagnostics diagnostics;

    public StateSynthesizer(ExpressionTransformer transformer, RawCodeRewriter rewriter, Diagnostics diagnostics) {
        this.transformer = transformer;
        this.rewriter = rewriter;
        this.diagnostics = diagnostics;
    }

    /**
     * Synthesizes the container for one store.
     *
     * @param store store declaration
     * @param fileName file name for diagnostics
     * @return store model ready for emission
     * @throws TypeInferenceError if a state field has neither a type nor an inferable initializer
     */
    public StoreModel synthesize(StoreClass store, String fileName) {
        TransformContext ctx = TransformContext.forStore(fileName, store);

        List<StateField> fields = new ArrayList<>();
        List<UpdateMethod> updates = new ArrayList<>();
        List<ComputedProperty> computed = new ArrayList<>();
        List<PrivateField> privateFields = new ArrayList<>();

        for (StateVar field : store.fields()) {
            if (field.privateMember()) {
                privateFields.add(new PrivateField(field.mutable(), field.name(), field.type(),
                    field.initializer() != null ? transformer.transform(field.initializer(), ctx) : null));
                continue;
            }
            if (field.kind() != StateVar.Kind.PLAIN) {
                computed.add(new ComputedProperty(field.name(), TypeInference.typeOf(field).orElse(null),
                    transformer.transform(field.initializer(), ctx)));
                continue;
            }
            String type = TypeInference.typeOf(field).orElseThrow(() -> new TypeInferenceError(fileName,
                field.position(), "Cannot infer the type of '" + field.name() + "' in store " + store.name()
                    + "; declare it, e.g. var " + field.name() + ": List<Item> = emptyList()"));
            if (field.initializer() == null) {
                throw new TypeInferenceError(fileName, field.position(),
                    "State field '" + field.name() + "' of store " + store.name() + " needs an initial value");
            }
            fields.add(new StateField(field.name(), type, transformer.transform(field.initializer(), ctx)));

            if (field.isWritable()) {
                String update = ExpressionTransformer.updateMethodName(field.name());
                if (store.declaresFunction(update)) {
                    diagnostics.report(Diagnostic.warning(DiagnosticKind.NAME_CONFLICT, fileName, field.position(),
                        "Store " + store.name() + " already declares " + update + "; keeping it instead of generating one"));
                } else {
                    updates.add(new UpdateMethod(update, field.name(), type));
                }
            }
        }

        boolean ownScope = false;
        List<StoreMethod> methods = new ArrayList<>();
        for (FunctionDeclaration function : store.functions()) {
            if (function.code() == null) {
                continue;
            }
            String body = rewriter.rewrite(function.code(), ctx.inFunction(function.name()));
            boolean dispatches = RawCodeRewriter.usesDispatch(function.code(), fileName);
            if (store.singleton()) {
                ownScope |= dispatches;
                // Objects have no lifecycle scope: suspend functions stay suspending
                methods.add(new StoreMethod(signature(function, function.suspend()), body, false));
            } else {
                methods.add(new StoreMethod(signature(function, false), body, function.suspend()));
            }
        }

        List<String> initBlocks = new ArrayList<>();
        store.initBlocks().forEach(block -> initBlocks.add(rewriter.rewrite(block, ctx)));
        if (store.singleton()) {
            ownScope |= store.initBlocks().stream().anyMatch(b -> RawCodeRewriter.usesDispatch(b, fileName));
        }

        log.debug("Store {}: {} state field(s), {} update method(s), {} method(s)",
            store.name(), fields.size(), updates.size(), methods.size());
        return new StoreModel(store.name(), store.singleton(), store.hilt(), store.constructorParameters(),
            store.singleton() ? "State" : "UiState", fields, updates, computed, privateFields, methods,
            initBlocks, ownScope && store.singleton());
    }

    private static String signature(FunctionDeclaration function, boolean suspend) {
        String parameters = function.parameters().stream()
            .map(Parameter::toSignature)
            .collect(Collectors.joining(", "));
        return (suspend ? "suspend " : "") + "fun " + function.name() + "(" + parameters + ")"
            + (function.returnType() != null ? ": " + function.returnType() : "");
    }
}
