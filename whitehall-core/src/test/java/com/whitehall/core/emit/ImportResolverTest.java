package com.whitehall.core.emit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ImportResolver}.
 */
class ImportResolverTest {

    private ImportResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ImportResolver(Map.of(
            "Text", "androidx.compose.material3.Text",
            "Column", "androidx.compose.foundation.layout.Column"));
    }

    @Test
    void resolve_delegatedState_importsRuntimeAccessors() {
        // When
        Set<String> imports = resolver.resolve("var count by remember { mutableStateOf(0) }", Set.of());

        // Then
        assertThat(imports).containsExactly(
            "androidx.compose.runtime.getValue",
            "androidx.compose.runtime.mutableStateOf",
            "androidx.compose.runtime.remember",
            "androidx.compose.runtime.setValue");
    }

    @Test
    void resolve_readOnlyDelegate_skipsSetValue() {
        // When
        Set<String> imports = resolver.resolve("val state by store.uiState.collectAsState()", Set.of());

        // Then
        assertThat(imports)
            .contains("androidx.compose.runtime.getValue", "androidx.compose.runtime.collectAsState")
            .doesNotContain("androidx.compose.runtime.setValue");
    }

    @Test
    void resolve_modifierChain_importsExtensionFunctions() {
        // When
        Set<String> imports = resolver.resolve("Column(modifier = Modifier.padding(16.dp).fillMaxWidth()) {}", Set.of());

        // Then
        assertThat(imports).containsExactly(
            "androidx.compose.foundation.layout.Column",
            "androidx.compose.foundation.layout.fillMaxWidth",
            "androidx.compose.foundation.layout.padding",
            "androidx.compose.ui.Modifier",
            "androidx.compose.ui.unit.dp");
    }

    @Test
    void resolve_paddingOnOtherReceiver_isNotImported() {
        // When
        Set<String> imports = resolver.resolve("val p = insets.padding", Set.of());

        // Then
        assertThat(imports).isEmpty();
    }

    @Test
    void resolve_namedArgumentsAndDeclarations_areNotReferences() {
        // When
        Set<String> imports = resolver.resolve("fun key() {}\nshow(key = 1, Text = 2)", Set.of());

        // Then
        assertThat(imports).isEmpty();
    }

    @Test
    void resolve_namesDeclaredByFile_areExcluded() {
        // When
        Set<String> imports = resolver.resolve("Text(text = \"a\")", Set.of("Text"));

        // Then
        assertThat(imports).isEmpty();
    }

    @Test
    void resolve_stringTemplates_areScanned() {
        // When
        Set<String> imports = resolver.resolve("Text(text = \"Color: ${Color.Red}\")", Set.of());

        // Then
        assertThat(imports).containsExactly(
            "androidx.compose.material3.Text",
            "androidx.compose.ui.graphics.Color");
    }
}
