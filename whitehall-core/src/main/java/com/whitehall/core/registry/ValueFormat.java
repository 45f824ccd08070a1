package com.whitehall.core.registry;

/**
 * Conversion applied to a literal prop value before it is passed to the component.
 *
 * <p>Expression values ({@code prop={expr}}) are passed through unchanged except where noted on
 * the constant.
 */
public enum ValueFormat {
    /** Strings become string literals, numbers and booleans stay as written */
    RAW,
    /** {@code 16} → {@code 16.dp}; a numeric literal inside {@code {}} is converted too */
    DP,
    /** {@code 14} → {@code 14.sp} */
    SP,
    /** {@code #RRGGBB}, theme color names and basic color names */
    COLOR,
    /** {@code bold} → {@code FontWeight.Bold} */
    FONT_WEIGHT,
    /** {@code center} → {@code TextAlign.Center} */
    TEXT_ALIGN,
    /** {@code headlineMedium} → {@code MaterialTheme.typography.headlineMedium} */
    TYPOGRAPHY,
    /** {@code 8} → {@code Arrangement.spacedBy(8.dp)} */
    SPACED_BY,
    /** {@code password} → {@code PasswordVisualTransformation()} */
    PASSWORD,
    /** {@code 4} → {@code CardDefaults.cardElevation(defaultElevation = 4.dp)} */
    CARD_ELEVATION,
    /** {@code 16} → {@code PaddingValues(16.dp)} */
    PADDING_VALUES,
    /** Boolean flag: {@code true} appends a no-argument modifier call */
    FLAG,
    /** {@code 1} → {@code 1f} */
    FLOAT
}
