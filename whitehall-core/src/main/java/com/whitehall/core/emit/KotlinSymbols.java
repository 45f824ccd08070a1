package com.whitehall.core.emit;

import java.util.Map;

/**
 * External symbols the generated code may reference, keyed by simple name.
 *
 * <p>Component imports come from the registry; this table covers everything else the lowering
 * introduces or authors commonly write.
 */
public final class KotlinSymbols {

    private KotlinSymbols() {
        // Utility class - no instantiation
    }

    private static final String RUNTIME = "androidx.compose.runtime.";
    private static final String LAYOUT = "androidx.compose.foundation.layout.";
    private static final String COROUTINES = "kotlinx.coroutines.";
    private static final String FLOW = "kotlinx.coroutines.flow.";

    /**
     * Symbols referenced by simple name.
     */
    public static final Map<String, String> TOP_LEVEL = Map.ofEntries(
        // Compose runtime
        Map.entry("Composable", RUNTIME + "Composable"),
        Map.entry("remember", RUNTIME + "remember"),
        Map.entry("mutableStateOf", RUNTIME + "mutableStateOf"),
        Map.entry("mutableStateListOf", RUNTIME + "mutableStateListOf"),
        Map.entry("derivedStateOf", RUNTIME + "derivedStateOf"),
        Map.entry("LaunchedEffect", RUNTIME + "LaunchedEffect"),
        Map.entry("DisposableEffect", RUNTIME + "DisposableEffect"),
        Map.entry("rememberCoroutineScope", RUNTIME + "rememberCoroutineScope"),
        Map.entry("key", RUNTIME + "key"),

        // UI and layout
        Map.entry("Modifier", "androidx.compose.ui.Modifier"),
        Map.entry("Alignment", "androidx.compose.ui.Alignment"),
        Map.entry("Arrangement", LAYOUT + "Arrangement"),
        Map.entry("PaddingValues", LAYOUT + "PaddingValues"),
        Map.entry("Color", "androidx.compose.ui.graphics.Color"),
        Map.entry("FontWeight", "androidx.compose.ui.text.font.FontWeight"),
        Map.entry("TextAlign", "androidx.compose.ui.text.style.TextAlign"),
        Map.entry("PasswordVisualTransformation", "androidx.compose.ui.text.input.PasswordVisualTransformation"),
        Map.entry("MaterialTheme", "androidx.compose.material3.MaterialTheme"),
        Map.entry("CardDefaults", "androidx.compose.material3.CardDefaults"),
        Map.entry("Icons", "androidx.compose.material.icons.Icons"),
        Map.entry("items", "androidx.compose.foundation.lazy.items"),
        Map.entry("itemsIndexed", "androidx.compose.foundation.lazy.itemsIndexed"),

        // Coroutines and view models
        Map.entry("Dispatchers", COROUTINES + "Dispatchers"),
        Map.entry("CoroutineScope", COROUTINES + "CoroutineScope"),
        Map.entry("SupervisorJob", COROUTINES + "SupervisorJob"),
        Map.entry("delay", COROUTINES + "delay"),
        Map.entry("withContext", COROUTINES + "withContext"),
        Map.entry("MutableStateFlow", FLOW + "MutableStateFlow"),
        Map.entry("StateFlow", FLOW + "StateFlow"),
        Map.entry("ViewModel", "androidx.lifecycle.ViewModel"),
        Map.entry("viewModelScope", "androidx.lifecycle.viewModelScope"),
        Map.entry("viewModel", "androidx.lifecycle.viewmodel.compose.viewModel"),
        Map.entry("hiltViewModel", "androidx.hilt.navigation.compose.hiltViewModel"),
        Map.entry("HiltViewModel", "dagger.hilt.android.lifecycle.HiltViewModel"),
        Map.entry("Inject", "javax.inject.Inject")
    );

    /**
     * Extension members referenced after a dot.
     */
    public static final Map<String, MemberSymbol> MEMBERS = Map.ofEntries(
        Map.entry("dp", new MemberSymbol("androidx.compose.ui.unit.dp", null)),
        Map.entry("sp", new MemberSymbol("androidx.compose.ui.unit.sp", null)),
        Map.entry("launch", new MemberSymbol(COROUTINES + "launch", null)),
        Map.entry("collectAsState", new MemberSymbol(RUNTIME + "collectAsState", null)),
        Map.entry("asStateFlow", new MemberSymbol(FLOW + "asStateFlow", null)),
        Map.entry("update", new MemberSymbol(FLOW + "update", null)),
        Map.entry("padding", new MemberSymbol(LAYOUT + "padding", "Modifier")),
        Map.entry("width", new MemberSymbol(LAYOUT + "width", "Modifier")),
        Map.entry("height", new MemberSymbol(LAYOUT + "height", "Modifier")),
        Map.entry("size", new MemberSymbol(LAYOUT + "size", "Modifier")),
        Map.entry("fillMaxWidth", new MemberSymbol(LAYOUT + "fillMaxWidth", "Modifier")),
        Map.entry("fillMaxHeight", new MemberSymbol(LAYOUT + "fillMaxHeight", "Modifier")),
        Map.entry("fillMaxSize", new MemberSymbol(LAYOUT + "fillMaxSize", "Modifier")),
        Map.entry("clickable", new MemberSymbol("androidx.compose.foundation.clickable", "Modifier")),
        Map.entry("background", new MemberSymbol("androidx.compose.foundation.background", "Modifier"))
    );

    /** Property delegate operators needed by {@code val x by state}. */
    public static final String GET_VALUE = RUNTIME + "getValue";

    /** Property delegate operator needed by {@code var x by state}. */
    public static final String SET_VALUE = RUNTIME + "setValue";

    /**
     * Extension member import.
     *
     * @param importPath fully qualified name
     * @param receiverRoot required root of the receiver chain, such as {@code Modifier}; null for any
     */
    public record MemberSymbol(String importPath, String receiverRoot) {}
}
