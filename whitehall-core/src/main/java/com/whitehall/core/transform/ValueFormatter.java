package com.whitehall.core.transform;

import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.Argument;
import com.whitehall.core.ast.ExprNode.Call;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.Literal;
import com.whitehall.core.ast.ExprNode.LiteralKind;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.registry.ValueFormat;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts literal prop values according to their {@link ValueFormat}.
 */
final class ValueFormatter {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?[fF]?");
    private static final Pattern HEX_COLOR = Pattern.compile("#([0-9a-fA-F]{6}|[0-9a-fA-F]{8})");

    private static final Set<String> NUMERIC_FORMATS = Set.of(
        "DP", "SP", "SPACED_BY", "CARD_ELEVATION", "PADDING_VALUES", "FLOAT");

    private static final Set<String> THEME_COLORS = Set.of(
        "primary", "onPrimary", "primaryContainer", "onPrimaryContainer",
        "secondary", "onSecondary", "secondaryContainer", "onSecondaryContainer",
        "tertiary", "onTertiary", "tertiaryContainer", "onTertiaryContainer",
        "error", "onError", "errorContainer", "onErrorContainer",
        "background", "onBackground", "surface", "onSurface",
        "surfaceVariant", "onSurfaceVariant", "outline", "outlineVariant",
        "inverseSurface", "inverseOnSurface", "inversePrimary", "scrim"
    );

    private static final Map<String, String> BASIC_COLORS = Map.ofEntries(
        Map.entry("black", "Black"),
        Map.entry("white", "White"),
        Map.entry("red", "Red"),
        Map.entry("green", "Green"),
        Map.entry("blue", "Blue"),
        Map.entry("yellow", "Yellow"),
        Map.entry("cyan", "Cyan"),
        Map.entry("magenta", "Magenta"),
        Map.entry("gray", "Gray"),
        Map.entry("grey", "Gray"),
        Map.entry("darkgray", "DarkGray"),
        Map.entry("lightgray", "LightGray"),
        Map.entry("transparent", "Transparent")
    );

    private static final Set<String> FONT_WEIGHTS = Set.of(
        "thin", "extralight", "light", "normal", "medium", "semibold", "bold", "extrabold", "black");

    private static final Map<String, String> TEXT_ALIGNMENTS = Map.of(
        "left", "Left",
        "right", "Right",
        "center", "Center",
        "justify", "Justify",
        "start", "Start",
        "end", "End"
    );

    private ValueFormatter() {
        // Utility class - no instantiation
    }

    /**
     * Converts a quoted prop value.
     *
     * @param format target format
     * @param text literal text
     * @return converted expression, or empty when the text is not valid for the format
     */
    static Optional<ExprNode> fromText(ValueFormat format, String text) {
        String value = text.strip();
        return switch (format) {
            case RAW -> Optional.of(Literal.string(text));
            case DP -> number(value, "dp").map(n -> new MemberAccess(n, "dp", false));
            case SP -> number(value, "sp").map(n -> new MemberAccess(n, "sp", false));
            case COLOR -> color(value);
            case FONT_WEIGHT -> fontWeight(value);
            case TEXT_ALIGN -> Optional.ofNullable(TEXT_ALIGNMENTS.get(value.toLowerCase()))
                .map(a -> qualified("TextAlign", a));
            case TYPOGRAPHY -> isIdentifier(value)
                ? Optional.of(qualified("MaterialTheme", "typography", value))
                : Optional.empty();
            case SPACED_BY -> number(value, "dp").map(n -> call(qualified("Arrangement", "spacedBy"),
                Argument.positional(new MemberAccess(n, "dp", false))));
            case PASSWORD -> value.equals("password")
                ? Optional.of(call(new Identifier("PasswordVisualTransformation")))
                : Optional.empty();
            case CARD_ELEVATION -> number(value, "dp").map(n -> call(qualified("CardDefaults", "cardElevation"),
                new Argument("defaultElevation", new MemberAccess(n, "dp", false))));
            case PADDING_VALUES -> number(value, "dp").map(n -> call(new Identifier("PaddingValues"),
                Argument.positional(new MemberAccess(n, "dp", false))));
            case FLAG -> value.equals("true") || value.equals("false")
                ? Optional.of(Literal.bool(Boolean.parseBoolean(value)))
                : Optional.empty();
            case FLOAT -> number(value, "f").map(n -> Literal.number(n.text().endsWith("f") ? n.text() : n.text() + "f"));
        };
    }

    /**
     * Converts a {@code {expr}} prop value. Numeric and string literals are converted like quoted
     * text; any other expression is passed through and must already have the target type.
     *
     * @param format target format
     * @param expr transformed expression
     * @return converted expression, or empty when a literal is invalid for the format
     */
    static Optional<ExprNode> fromExpression(ValueFormat format, ExprNode expr) {
        if (format == ValueFormat.RAW || !(expr instanceof Literal literal)) {
            return Optional.of(expr);
        }
        if (literal.kind() == LiteralKind.STRING
            || (literal.kind() == LiteralKind.NUMBER && NUMERIC_FORMATS.contains(format.name()))) {
            return fromText(format, literal.text());
        }
        return Optional.of(expr);
    }

    private static Optional<Literal> number(String value, String unitSuffix) {
        String digits = value.endsWith(unitSuffix) && !unitSuffix.equals("f")
            ? value.substring(0, value.length() - unitSuffix.length()).strip()
            : value;
        return NUMBER.matcher(digits).matches() ? Optional.of(Literal.number(digits)) : Optional.empty();
    }

    private static Optional<ExprNode> color(String value) {
        if (HEX_COLOR.matcher(value).matches()) {
            String hex = value.substring(1).toUpperCase();
            String argb = hex.length() == 6 ? "FF" + hex : hex;
            return Optional.of(call(new Identifier("Color"), Argument.positional(Literal.number("0x" + argb))));
        }
        if (THEME_COLORS.contains(value)) {
            return Optional.of(qualified("MaterialTheme", "colorScheme", value));
        }
        String basic = BASIC_COLORS.get(value.toLowerCase());
        return basic != null ? Optional.of(qualified("Color", basic)) : Optional.empty();
    }

    private static Optional<ExprNode> fontWeight(String value) {
        if (NUMBER.matcher(value).matches() && !value.contains(".")) {
            return Optional.of(call(new Identifier("FontWeight"), Argument.positional(Literal.number(value))));
        }
        String lower = value.toLowerCase();
        if (!FONT_WEIGHTS.contains(lower)) {
            return Optional.empty();
        }
        String name = switch (lower) {
            case "extralight" -> "ExtraLight";
            case "semibold" -> "SemiBold";
            case "extrabold" -> "ExtraBold";
            default -> Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
        };
        return Optional.of(qualified("FontWeight", name));
    }

    private static boolean isIdentifier(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isLetterOrDigit)
            && Character.isLetter(value.charAt(0));
    }

    private static ExprNode qualified(String root, String... members) {
        ExprNode expr = new Identifier(root);
        for (String member : members) {
            expr = new MemberAccess(expr, member, false);
        }
        return expr;
    }

    private static ExprNode call(ExprNode callee, Argument... arguments) {
        return new Call(callee, null, List.of(arguments), null);
    }
}
