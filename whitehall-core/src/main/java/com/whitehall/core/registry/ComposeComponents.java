package com.whitehall.core.registry;

import java.util.ArrayList;
import java.util.List;

import static com.whitehall.core.registry.ChildrenMode.CONTENT;
import static com.whitehall.core.registry.ChildrenMode.LAZY;
import static com.whitehall.core.registry.ChildrenMode.NONE;
import static com.whitehall.core.registry.ChildrenMode.PADDED_CONTENT;
import static com.whitehall.core.registry.ChildrenMode.TEXT;
import static com.whitehall.core.registry.PropSpec.binding;
import static com.whitehall.core.registry.PropSpec.callback;
import static com.whitehall.core.registry.PropSpec.childText;
import static com.whitehall.core.registry.PropSpec.modifier;
import static com.whitehall.core.registry.PropSpec.plain;
import static com.whitehall.core.registry.PropSpec.slot;

/**
 * Built-in Material 3 and foundation components.
 *
 * <p>Every component-specific prop quirk is a row here. Adding a component never touches the
 * lowering code:</p>
 * <pre>{@code
 * component("Badge", MATERIAL + "Badge", CONTENT,
 *     plain("containerColor", ValueFormat.COLOR))
 * }</pre>
 */
public final class ComposeComponents {

    private static final String MATERIAL = "androidx.compose.material3.";
    private static final String LAYOUT = "androidx.compose.foundation.layout.";
    private static final String LAZY_LAYOUT = "androidx.compose.foundation.lazy.";

    private ComposeComponents() {
        // Utility class - no instantiation
    }

    /**
     * Modifier props every component accepts.
     */
    public static final List<PropSpec> COMMON_MODIFIERS = List.of(
        modifier("modifier", ValueFormat.RAW, "modifier"),
        modifier("padding", ValueFormat.DP, "padding"),
        modifier("w", ValueFormat.DP, "width"),
        modifier("h", ValueFormat.DP, "height"),
        modifier("size", ValueFormat.DP, "size"),
        modifier("fillMaxWidth", ValueFormat.FLAG, "fillMaxWidth"),
        modifier("fillMaxSize", ValueFormat.FLAG, "fillMaxSize"),
        modifier("fillMaxHeight", ValueFormat.FLAG, "fillMaxHeight"),
        modifier("weight", ValueFormat.FLOAT, "weight")
    );

    public static final List<ComponentSpec> ALL = List.of(
        // Text and layout
        component("Text", MATERIAL + "Text", TEXT,
            plain("text"),
            plain("fontSize", ValueFormat.SP),
            plain("fontWeight", ValueFormat.FONT_WEIGHT),
            plain("color", ValueFormat.COLOR),
            plain("textAlign", ValueFormat.TEXT_ALIGN),
            plain("style", ValueFormat.TYPOGRAPHY),
            plain("maxLines"),
            plain("softWrap")),
        component("Column", LAYOUT + "Column", CONTENT,
            plain("spacing", ValueFormat.SPACED_BY, "verticalArrangement"),
            plain("verticalArrangement"),
            plain("horizontalAlignment")),
        component("Row", LAYOUT + "Row", CONTENT,
            plain("spacing", ValueFormat.SPACED_BY, "horizontalArrangement"),
            plain("horizontalArrangement"),
            plain("verticalAlignment")),
        component("Box", LAYOUT + "Box", CONTENT,
            plain("contentAlignment")),
        component("Spacer", LAYOUT + "Spacer", NONE),
        component("LazyColumn", LAZY_LAYOUT + "LazyColumn", LAZY,
            plain("spacing", ValueFormat.SPACED_BY, "verticalArrangement"),
            plain("padding", ValueFormat.PADDING_VALUES, "contentPadding"),
            plain("contentPadding"),
            plain("state")),
        component("LazyRow", LAZY_LAYOUT + "LazyRow", LAZY,
            plain("spacing", ValueFormat.SPACED_BY, "horizontalArrangement"),
            plain("padding", ValueFormat.PADDING_VALUES, "contentPadding"),
            plain("contentPadding"),
            plain("state")),

        // Buttons
        button("Button"),
        button("OutlinedButton"),
        button("TextButton"),
        button("ElevatedButton"),
        button("FilledTonalButton"),
        component("IconButton", MATERIAL + "IconButton", CONTENT,
            callback("onClick", 0),
            plain("enabled")),
        component("FloatingActionButton", MATERIAL + "FloatingActionButton", CONTENT,
            callback("onClick", 0),
            plain("containerColor", ValueFormat.COLOR)),

        // Surfaces
        component("Card", MATERIAL + "Card", CONTENT,
            callback("onClick", 0),
            plain("elevation", ValueFormat.CARD_ELEVATION)),
        component("Surface", MATERIAL + "Surface", CONTENT,
            plain("color", ValueFormat.COLOR),
            plain("tonalElevation", ValueFormat.DP),
            plain("shadowElevation", ValueFormat.DP),
            plain("shape")),
        component("Scaffold", MATERIAL + "Scaffold", PADDED_CONTENT,
            slot("topBar"),
            slot("bottomBar"),
            slot("floatingActionButton"),
            slot("snackbarHost")),
        component("TopAppBar", MATERIAL + "TopAppBar", NONE,
            slot("title"),
            slot("navigationIcon"),
            slot("actions")),
        component("AlertDialog", MATERIAL + "AlertDialog", NONE,
            callback("onDismissRequest", 0),
            slot("title"),
            slot("text"),
            slot("icon"),
            slot("confirmButton"),
            slot("dismissButton")),
        component("ModalBottomSheet", MATERIAL + "ModalBottomSheet", CONTENT,
            callback("onDismissRequest", 0)),
        component("DropdownMenu", MATERIAL + "DropdownMenu", CONTENT,
            plain("expanded"),
            callback("onDismissRequest", 0)),
        component("DropdownMenuItem", MATERIAL + "DropdownMenuItem", NONE,
            slot("text"),
            slot("leadingIcon"),
            slot("trailingIcon"),
            callback("onClick", 0),
            plain("enabled")),
        component("NavigationBar", MATERIAL + "NavigationBar", CONTENT),
        component("NavigationBarItem", MATERIAL + "NavigationBarItem", NONE,
            plain("selected"),
            callback("onClick", 0),
            slot("icon"),
            slot("label")),

        // Inputs
        textField("TextField"),
        textField("OutlinedTextField"),
        toggle("Checkbox"),
        toggle("Switch"),
        component("Slider", MATERIAL + "Slider", NONE,
            plain("value"),
            callback("onValueChange", 1),
            binding("bind:value", "value", "onValueChange"),
            plain("valueRange"),
            plain("steps")),

        // Display
        component("Icon", MATERIAL + "Icon", NONE,
            plain("imageVector"),
            plain("painter"),
            plain("contentDescription"),
            plain("tint", ValueFormat.COLOR)),
        component("Image", "androidx.compose.foundation.Image", NONE,
            plain("painter"),
            plain("contentDescription"),
            plain("contentScale")),
        component("CircularProgressIndicator", MATERIAL + "CircularProgressIndicator", NONE,
            plain("progress"),
            plain("color", ValueFormat.COLOR)),
        component("LinearProgressIndicator", MATERIAL + "LinearProgressIndicator", NONE,
            plain("progress"),
            plain("color", ValueFormat.COLOR)),
        component("HorizontalDivider", MATERIAL + "HorizontalDivider", NONE,
            plain("thickness", ValueFormat.DP),
            plain("color", ValueFormat.COLOR))
    );

    private static ComponentSpec button(String name) {
        return component(name, MATERIAL + name, CONTENT,
            callback("onClick", 0),
            plain("enabled"),
            childText("text"));
    }

    private static ComponentSpec textField(String name) {
        return component(name, MATERIAL + name, NONE,
            plain("value"),
            callback("onValueChange", 1),
            binding("bind:value", "value", "onValueChange"),
            slot("label"),
            slot("placeholder"),
            slot("leadingIcon"),
            slot("trailingIcon"),
            slot("supportingText"),
            plain("type", ValueFormat.PASSWORD, "visualTransformation"),
            plain("singleLine"),
            plain("enabled"),
            plain("readOnly"),
            plain("isError"),
            plain("maxLines"));
    }

    private static ComponentSpec toggle(String name) {
        return component(name, MATERIAL + name, NONE,
            plain("checked"),
            callback("onCheckedChange", 1),
            binding("bind:checked", "checked", "onCheckedChange"),
            plain("enabled"));
    }

    static ComponentSpec component(String name, String importPath, ChildrenMode children, PropSpec... props) {
        List<PropSpec> all = new ArrayList<>(COMMON_MODIFIERS);
        all.addAll(List.of(props));
        return ComponentSpec.of(name, importPath, children, all);
    }
}
