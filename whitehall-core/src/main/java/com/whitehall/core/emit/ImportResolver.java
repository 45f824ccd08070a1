package com.whitehall.core.emit;

import com.whitehall.core.parser.Lexer;
import com.whitehall.core.parser.Token;
import com.whitehall.core.parser.TokenType;
import com.whitehall.core.ast.SourcePosition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the imports generated code needs by scanning its tokens for known external symbols.
 *
 * <p>Identifiers are matched against {@link KotlinSymbols#TOP_LEVEL} and the component imports;
 * members after a dot are matched against {@link KotlinSymbols#MEMBERS}, honouring the required
 * receiver root. Declarations, named arguments and names the file declares or imports itself are
 * never treated as references. Expressions inside string templates are scanned as well.
 */
public final class ImportResolver {

    private final Map<String, String> topLevel;

    /**
     * @param componentImports component name to import path, from the registry
     */
    public ImportResolver(Map<String, String> componentImports) {
        Map<String, String> symbols = new HashMap<>(KotlinSymbols.TOP_LEVEL);
        symbols.putAll(componentImports);
        this.topLevel = Map.copyOf(symbols);
    }

    /**
     * Resolves the imports for a generated body.
     *
     * @param code generated code without package and import lines
     * @param excludedNames simple names declared or imported by the file
     * @return fully qualified imports, sorted
     */
    public Set<String> resolve(String code, Set<String> excludedNames) {
        Set<String> imports = new TreeSet<>();
        scan(code, excludedNames, imports);
        return imports;
    }

    private void scan(String code, Set<String> excludedNames, Set<String> imports) {
        Lexer lexer = new Lexer(code, "<generated>", new SourcePosition(1, 1));
        List<Token> tokens = new ArrayList<>();
        int offset = 0;
        while (true) {
            Token token = lexer.scan(offset);
            if (token.isEof()) {
                break;
            }
            tokens.add(token);
            offset = token.end();
        }

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.STRING) {
                scanTemplates(lexer, token, excludedNames, imports);
                continue;
            }
            if (!token.isIdentifier()) {
                continue;
            }
            Token previous = i > 0 ? tokens.get(i - 1) : null;
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

            if (token.is("by")) {
                imports.add(KotlinSymbols.GET_VALUE);
                if (i >= 2 && tokens.get(i - 2).is("var")) {
                    imports.add(KotlinSymbols.SET_VALUE);
                }
                continue;
            }
            if (previous != null && (previous.is(".") || previous.is("?."))) {
                KotlinSymbols.MemberSymbol member = KotlinSymbols.MEMBERS.get(token.text());
                if (member != null && (member.receiverRoot() == null
                    || member.receiverRoot().equals(receiverRoot(tokens, i - 1)))) {
                    imports.add(member.importPath());
                }
                continue;
            }
            if (excludedNames.contains(token.text()) || isDeclaration(previous) || isNamedArgument(previous, next)) {
                continue;
            }
            String importPath = topLevel.get(token.text());
            if (importPath != null) {
                imports.add(importPath);
            }
        }
    }

    private void scanTemplates(Lexer lexer, Token string, Set<String> excludedNames, Set<String> imports) {
        String text = lexer.source();
        int i = string.start();
        while (i < string.end()) {
            if (text.charAt(i) == '\\') {
                i += 2;
                continue;
            }
            if (text.startsWith("${", i)) {
                int end = lexer.skipTemplate(i + 2);
                scan(text.substring(i + 2, end - 1), excludedNames, imports);
                i = end;
                continue;
            }
            i++;
        }
    }

    private static boolean isDeclaration(Token previous) {
        return previous != null && (previous.is("fun") || previous.is("val") || previous.is("var")
            || previous.is("class") || previous.is("object"));
    }

    private static boolean isNamedArgument(Token previous, Token next) {
        return next != null && next.is("=") && previous != null && (previous.is("(") || previous.is(","));
    }

    /**
     * Walks back from the dot before a member to the first identifier of the receiver chain.
     */
    private static String receiverRoot(List<Token> tokens, int dotIndex) {
        int j = dotIndex - 1;
        while (j >= 0) {
            Token token = tokens.get(j);
            if (token.is(")") || token.is("]")) {
                j = matchingOpen(tokens, j) - 1;
                continue;
            }
            if (token.isIdentifier() && j > 0 && (tokens.get(j - 1).is(".") || tokens.get(j - 1).is("?."))) {
                j -= 2;
                continue;
            }
            return token.text();
        }
        return null;
    }

    private static int matchingOpen(List<Token> tokens, int closeIndex) {
        String close = tokens.get(closeIndex).text();
        String open = close.equals(")") ? "(" : "[";
        int depth = 0;
        for (int j = closeIndex; j >= 0; j--) {
            if (tokens.get(j).is(close)) {
                depth++;
            } else if (tokens.get(j).is(open)) {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return 0;
    }
}
