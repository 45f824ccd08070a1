package com.whitehall.core.registry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ComponentRegistry} and the built-in {@link ComposeComponents} table.
 */
class ComponentRegistryTest {

    private final ComponentRegistry registry = ComponentRegistry.defaults();

    @Test
    void defaults_containsCoreComponents() {
        assertThat(registry.contains("Text")).isTrue();
        assertThat(registry.contains("LazyColumn")).isTrue();
        assertThat(registry.contains("Scaffold")).isTrue();
        assertThat(registry.contains("RecyclerView")).isFalse();
    }

    @Test
    void defaults_everyComponentAcceptsCommonModifiers() {
        // Given / When / Then
        assertThat(registry.all()).allSatisfy(spec -> {
            assertThat(spec.props()).containsKeys("modifier", "w", "h", "fillMaxWidth", "weight");
            assertThat(spec.prop("w").orElseThrow().target()).isEqualTo("width");
        });
    }

    @Test
    void find_lazyColumn_mapsPaddingToContentPadding() {
        // When
        ComponentSpec lazyColumn = registry.find("LazyColumn").orElseThrow();

        // Then
        assertThat(lazyColumn.isLazyContainer()).isTrue();
        PropSpec padding = lazyColumn.prop("padding").orElseThrow();
        assertThat(padding.kind()).isEqualTo(PropKind.PLAIN);
        assertThat(padding.format()).isEqualTo(ValueFormat.PADDING_VALUES);
        assertThat(padding.target()).isEqualTo("contentPadding");
    }

    @Test
    void find_slotProps_areComposableSlots() {
        // Given
        List<String> slotOwners = List.of("Scaffold", "TopAppBar", "AlertDialog", "NavigationBarItem");

        // When / Then
        for (String owner : slotOwners) {
            ComponentSpec spec = registry.find(owner).orElseThrow();
            assertThat(spec.props().values())
                .as("slots of %s", owner)
                .anyMatch(p -> p.kind() == PropKind.COMPOSABLE_SLOT);
        }
        assertThat(registry.find("TopAppBar").orElseThrow().prop("title").orElseThrow().kind())
            .isEqualTo(PropKind.COMPOSABLE_SLOT);
    }

    @Test
    void find_textFieldBinding_namesValueAndCallback() {
        // When
        PropSpec bind = registry.find("TextField").orElseThrow().prop("bind:value").orElseThrow();

        // Then
        assertThat(bind.kind()).isEqualTo(PropKind.BINDING);
        assertThat(bind.target()).isEqualTo("value");
        assertThat(bind.callback()).isEqualTo("onValueChange");
    }

    @Test
    void find_buttonText_isChildText() {
        // When
        ComponentSpec button = registry.find("OutlinedButton").orElseThrow();

        // Then
        assertThat(button.prop("text").orElseThrow().kind()).isEqualTo(PropKind.CHILD_TEXT);
        assertThat(button.prop("onClick").orElseThrow().arity()).isZero();
        assertThat(button.children()).isEqualTo(ChildrenMode.CONTENT);
    }

    @Test
    void withComponents_sameName_replacesBuiltIn() {
        // Given
        ComponentSpec custom = ComponentSpec.of("Text", "com.example.ui.Text", ChildrenMode.TEXT,
            List.of(PropSpec.plain("text")));

        // When
        ComponentRegistry extended = registry.withComponents(List.of(custom));

        // Then
        assertThat(extended.find("Text").orElseThrow().importPath()).isEqualTo("com.example.ui.Text");
        assertThat(registry.find("Text").orElseThrow().importPath()).isEqualTo("androidx.compose.material3.Text");
    }

    @Test
    void withComponents_newComponent_isAddedAlongsideDefaults() {
        // Given
        ComponentSpec avatar = ComponentSpec.of("Avatar", "com.example.ui.Avatar", ChildrenMode.NONE,
            List.of(PropSpec.plain("url"), PropSpec.callback("onTap", 0)));

        // When
        ComponentRegistry extended = registry.withComponents(List.of(avatar));

        // Then
        assertThat(extended.contains("Avatar")).isTrue();
        assertThat(extended.contains("Column")).isTrue();
        assertThat(registry.contains("Avatar")).isFalse();
    }

    @Test
    void withComponents_emptyCollection_returnsSameRegistry() {
        assertThat(registry.withComponents(List.of())).isSameAs(registry);
    }

    @Test
    void all_isSortedByName() {
        assertThat(registry.all())
            .extracting(ComponentSpec::name)
            .isSorted();
    }

    @Test
    void binding_withoutCallback_isRejected() {
        assertThatThrownBy(() -> new PropSpec("bind:x", PropKind.BINDING, null, null, 1, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("needs a callback");
    }
}
