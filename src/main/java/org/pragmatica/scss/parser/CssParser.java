package org.pragmatica.scss.parser;

import org.pragmatica.scss.error.Diagnostic;
import org.pragmatica.scss.error.ErrorKind;
import org.pragmatica.scss.error.ParseError;
import org.pragmatica.scss.scanner.Scanner;
import org.pragmatica.scss.scanner.Token;
import org.pragmatica.scss.scanner.TokenType;
import org.pragmatica.scss.tree.Node;
import org.pragmatica.scss.tree.NodeType;
import org.pragmatica.scss.tree.ReferenceType;
import org.pragmatica.scss.tree.Role;
import org.pragmatica.scss.tree.SourceSpan;

import java.util.Set;
import java.util.regex.Pattern;

import static org.pragmatica.scss.scanner.TokenType.AT_KEYWORD;
import static org.pragmatica.scss.scanner.TokenType.BAD_STRING;
import static org.pragmatica.scss.scanner.TokenType.BRACKET_L;
import static org.pragmatica.scss.scanner.TokenType.BRACKET_R;
import static org.pragmatica.scss.scanner.TokenType.CDC;
import static org.pragmatica.scss.scanner.TokenType.CDO;
import static org.pragmatica.scss.scanner.TokenType.CHARSET;
import static org.pragmatica.scss.scanner.TokenType.COLON;
import static org.pragmatica.scss.scanner.TokenType.COMMA;
import static org.pragmatica.scss.scanner.TokenType.CURLY_L;
import static org.pragmatica.scss.scanner.TokenType.CURLY_R;
import static org.pragmatica.scss.scanner.TokenType.EXCLAMATION;
import static org.pragmatica.scss.scanner.TokenType.HASH;
import static org.pragmatica.scss.scanner.TokenType.IDENT;
import static org.pragmatica.scss.scanner.TokenType.INTERPOLATION_START;
import static org.pragmatica.scss.scanner.TokenType.PARENTHESIS_L;
import static org.pragmatica.scss.scanner.TokenType.PARENTHESIS_R;
import static org.pragmatica.scss.scanner.TokenType.SEMICOLON;
import static org.pragmatica.scss.scanner.TokenType.STRING;

/**
 * Error-tolerant recursive-descent parser for plain CSS.
 *
 * <p>Every production returns the node it built, or {@code null} without consuming input when the
 * construct is absent. Committed productions that hit malformed input finish their node with a
 * diagnostic and optionally skip ahead to a synchronization token, so parsing never aborts.
 * Productions are {@code protected} so that a dialect can try its own alternatives first and fall
 * back to these through {@code super}.
 */
public class CssParser {
    protected static final Set<TokenType> NONE = Set.of();
    protected static final Set<TokenType> COLON_ONLY = Set.of(COLON);
    protected static final Set<TokenType> SEMICOLON_ONLY = Set.of(SEMICOLON);
    protected static final Set<TokenType> OPENING_CURLY = Set.of(CURLY_L);
    protected static final Set<TokenType> CLOSING_CURLY = Set.of(CURLY_R);
    protected static final Set<TokenType> OPENING_PARENTHESIS = Set.of(PARENTHESIS_L);
    protected static final Set<TokenType> CLOSING_PARENTHESIS = Set.of(PARENTHESIS_R);
    protected static final Set<TokenType> BLOCK_BOUNDARY = Set.of(CURLY_R, SEMICOLON);
    protected static final Set<TokenType> BODY_EDGES = Set.of(CURLY_L, CURLY_R);
    protected static final Set<TokenType> CURLY_OPENERS = Set.of(CURLY_L, INTERPOLATION_START);

    /**
     * Deepest nesting of blocks, parentheses and function arguments that is parsed. Deeper groups
     * are skipped with a single diagnostic.
     */
    public static final int MAX_NESTING = 128;

    private static final Pattern KEYFRAMES = Pattern.compile("^@(-(webkit|ms|moz|o)-)?keyframes$",
                                                             Pattern.CASE_INSENSITIVE);
    private static final Pattern HEX_COLOR = Pattern.compile(
        "^#([A-Fa-f0-9]{3}|[A-Fa-f0-9]{4}|[A-Fa-f0-9]{6}|[A-Fa-f0-9]{8})$");
    private static final Pattern URL = Pattern.compile("^url(-prefix)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern AND_OR = Pattern.compile("^(and|or)$", Pattern.CASE_INSENSITIVE);
    protected static final Pattern CUSTOM_PROPERTY = Pattern.compile("^--");

    private static final Set<String> PAGE_BOX_DIRECTIVES = Set.of(
        "@bottom-center", "@bottom-left", "@bottom-left-corner", "@bottom-right", "@bottom-right-corner",
        "@left-bottom", "@left-middle", "@left-top", "@right-bottom", "@right-middle", "@right-top",
        "@top-center", "@top-left", "@top-left-corner", "@top-right", "@top-right-corner");

    protected final TokenCursor cursor;
    private final int sourceLength;
    private int nesting;

    protected CssParser(Scanner scanner) {
        this.cursor = TokenCursor.create(scanner);
        this.sourceLength = scanner.input()
                                   .length();
    }

    public static CssParser create(String source) {
        return new CssParser(new Scanner(source));
    }

    // === Node lifecycle ===

    protected Node create(NodeType type) {
        var token = cursor.current();
        return Node.create(type, token.offset(), token.length());
    }

    protected Node finish(Node node) {
        return finish(node, null, NONE, NONE);
    }

    protected Node finish(Node node, ErrorKind error) {
        return finish(node, error, NONE, NONE);
    }

    protected Node finish(Node node, ErrorKind error, Set<TokenType> resyncTokens) {
        return finish(node, error, resyncTokens, NONE);
    }

    /**
     * Close the node at the end of the last consumed token. With an error, attach a diagnostic at the
     * current token and, when synchronization tokens are given, skip ahead to them.
     */
    protected Node finish(Node node, ErrorKind error, Set<TokenType> resyncTokens, Set<TokenType> stopTokens) {
        if (node.type() == NodeType.NODE_LIST) {
            return node;
        }
        if (error != null) {
            markError(node, error, resyncTokens, stopTokens);
        }
        var end = cursor.previousEnd();
        for (var child : node.children()) {
            end = Math.max(end, child.end());
        }
        node.setLength(end > node.offset()
                       ? end - node.offset()
                       : 0);
        return node;
    }

    protected void markError(Node node, ErrorKind error) {
        markError(node, error, NONE, NONE);
    }

    /**
     * Report {@code error} at the current token unless that token was already reported on, then skip
     * ahead if synchronization tokens are given.
     */
    protected void markError(Node node, ErrorKind error, Set<TokenType> resyncTokens, Set<TokenType> stopTokens) {
        var diagnostic = claimDiagnostic(error);
        if (!resyncTokens.isEmpty() || !stopTokens.isEmpty()) {
            diagnostic = withSkipped(diagnostic, cursor.resync(resyncTokens, stopTokens));
        }
        if (diagnostic != null) {
            node.addDiagnostic(diagnostic);
        }
    }

    private Diagnostic claimDiagnostic(ErrorKind error) {
        return cursor.claimErrorToken()
               ? Diagnostic.error(error, cursor.current()
                                               .span())
               : null;
    }

    private static Diagnostic withSkipped(Diagnostic diagnostic, SourceSpan skipped) {
        return diagnostic != null && skipped.length() > 0
               ? diagnostic.withSecondaryLabel(skipped, "skipped")
               : diagnostic;
    }

    // === Nesting ===

    /**
     * Parse the content of a group whose opening token was just consumed, one nesting level deeper.
     * Past {@link #MAX_NESTING} levels the content is skipped up to and including the matching
     * {@code close} token instead, and {@code node} is finished with a diagnostic.
     */
    protected Node nested(Node node, Set<TokenType> openers, TokenType close, Production content) {
        if (nesting >= MAX_NESTING) {
            var diagnostic = withSkipped(claimDiagnostic(ParseError.NESTING_TOO_DEEP),
                                         cursor.skipGroup(openers, close));
            if (diagnostic != null) {
                node.addDiagnostic(diagnostic);
            }
            return finish(node);
        }
        nesting++;
        try {
            return content.parse();
        } finally {
            nesting--;
        }
    }

    /**
     * Ordered alternation: the first production that matches wins, later ones are not tried.
     */
    protected static Node first(Production... alternatives) {
        for (var alternative : alternatives) {
            var node = alternative.parse();
            if (node != null) {
                return node;
            }
        }
        return null;
    }

    /**
     * Run {@code production} speculatively, rewinding the cursor if it does not match.
     */
    protected Node attempt(Production production) {
        var mark = cursor.mark();
        var node = production.parse();
        if (node == null) {
            cursor.restore(mark);
        }
        return node;
    }

    protected int previousOffset() {
        return cursor.previous()
                     .map(Token::offset)
                     .orElse(-1);
    }

    protected void recordSemicolon(Node node) {
        if (cursor.peek(SEMICOLON)) {
            node.setSemicolonPosition(cursor.offset());
        }
    }

    // === Style sheet ===

    /**
     * Parse the whole input. Always returns a stylesheet node spanning the entire source.
     */
    public Node parseStylesheet() {
        var node = Node.create(NodeType.STYLESHEET, 0, 0);
        while (node.addChild(parseCharset())) {
            // repeated @charset
        }
        var inRecovery = false;
        while (true) {
            var hasMatch = true;
            while (hasMatch) {
                hasMatch = false;
                var start = cursor.offset();
                var statement = parseStylesheetStatement(false);
                if (statement != null && cursor.offset() > start) {
                    node.addChild(statement);
                    hasMatch = true;
                    inRecovery = false;
                    if (!cursor.isAtEnd() && needsSemicolonAfter(statement) && !cursor.accept(SEMICOLON)) {
                        markError(node, ParseError.SEMICOLON_EXPECTED);
                    }
                }
                while (cursor.accept(SEMICOLON) || cursor.accept(CDO) || cursor.accept(CDC)) {
                    hasMatch = true;
                    inRecovery = false;
                }
            }
            if (cursor.isAtEnd()) {
                break;
            }
            if (!inRecovery) {
                markError(node, cursor.peek(AT_KEYWORD)
                                ? ParseError.UNKNOWN_AT_RULE
                                : ParseError.RULE_OR_SELECTOR_EXPECTED);
                inRecovery = true;
            }
            cursor.consume();
        }
        node.setLength(sourceLength);
        return node;
    }

    protected Node parseCharset() {
        if (!cursor.peek(CHARSET)) {
            return null;
        }
        var node = create(NodeType.CHARSET);
        cursor.consume();
        if (!cursor.accept(STRING)) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED);
        }
        if (!cursor.accept(SEMICOLON)) {
            return finish(node, ParseError.SEMICOLON_EXPECTED);
        }
        return finish(node);
    }

    /**
     * Whether a statement of this kind must be followed by a semicolon before the next one.
     */
    protected boolean needsSemicolonAfter(Node node) {
        return switch (node.type()) {
            case IMPORT, MEDIA_QUERY, CUSTOM_PROPERTY_DECLARATION -> true;
            case DECLARATION -> node.get(Role.NESTED_PROPERTIES)
                                    .isEmpty();
            default -> false;
        };
    }

    protected Node parseStylesheetStatement(boolean nested) {
        if (cursor.peek(AT_KEYWORD)) {
            return parseStylesheetAtStatement(nested);
        }
        return parseRuleset(nested);
    }

    protected Node parseStylesheetAtStatement(boolean nested) {
        return first(this::parseImport,
                     () -> parseMedia(nested),
                     this::parsePage,
                     this::parseFontFace,
                     this::parseKeyframe,
                     () -> parseSupports(nested),
                     () -> parseLayer(nested),
                     this::parsePropertyAtRule,
                     this::parseUnknownAtRule);
    }

    // === Rulesets and bodies ===

    protected Node parseRuleset(boolean nested) {
        var node = create(NodeType.RULESET);
        var selectors = node.list(Role.SELECTORS);
        if (!selectors.addChild(parseSelector(nested))) {
            return null;
        }
        while (cursor.accept(COMMA)) {
            if (!selectors.addChild(parseSelector(nested))) {
                return finish(node, ParseError.SELECTOR_EXPECTED);
            }
        }
        return parseBody(node, this::parseRuleSetDeclaration);
    }

    /**
     * A ruleset, but only if the selector list is followed by an opening brace.
     */
    protected Node tryParseRuleset(boolean nested) {
        var mark = cursor.mark();
        if (parseSelector(nested) != null) {
            while (cursor.accept(COMMA) && parseSelector(nested) != null) {
                // selector list
            }
            if (cursor.peek(CURLY_L)) {
                cursor.restore(mark);
                return parseRuleset(nested);
            }
        }
        cursor.restore(mark);
        return null;
    }

    protected Node parseRuleSetDeclarationAtStatement() {
        return first(() -> parseMedia(true),
                     () -> parseSupports(true),
                     () -> parseLayer(true),
                     this::parseUnknownAtRule);
    }

    protected Node parseRuleSetDeclaration() {
        if (cursor.peek(AT_KEYWORD)) {
            return parseRuleSetDeclarationAtStatement();
        }
        return first(() -> tryParseRuleset(true), this::parseDeclaration);
    }

    /**
     * Statements inside {@code @supports} and {@code @layer} blocks.
     */
    protected Node parseGroupBodyStatement(boolean nested) {
        if (nested) {
            return first(() -> tryParseRuleset(true),
                         () -> tryToParseDeclaration(NONE),
                         () -> parseStylesheetStatement(true));
        }
        return parseStylesheetStatement(false);
    }

    /**
     * Parse a brace-delimited block into the {@link Role#DECLARATIONS} of {@code node}.
     */
    protected Node parseBody(Node node, Production statement) {
        parseBlock(node, statement);
        return finish(node);
    }

    /**
     * Like {@link #parseBody(Node, Production)}, but leaves {@code node} open for further content.
     */
    protected boolean parseBlock(Node node, Production statement) {
        if (node.set(Role.DECLARATIONS, parseDeclarations(statement))) {
            return true;
        }
        markError(node, ParseError.LEFT_CURLY_EXPECTED, BLOCK_BOUNDARY, NONE);
        return false;
    }

    protected Node parseDeclarations(Production statement) {
        var node = create(NodeType.DECLARATIONS);
        if (!cursor.accept(CURLY_L)) {
            return null;
        }
        return nested(node, CURLY_OPENERS, CURLY_R, () -> parseDeclarationList(node, statement));
    }

    private Node parseDeclarationList(Node node, Production statement) {
        while (cursor.accept(SEMICOLON)) {
            // empty statements
        }
        var start = cursor.offset();
        var declaration = statement.parse();
        while (declaration != null && cursor.offset() > start) {
            node.addChild(declaration);
            if (cursor.peek(CURLY_R)) {
                break;
            }
            if (needsSemicolonAfter(declaration) && !cursor.accept(SEMICOLON)) {
                return finish(node, ParseError.SEMICOLON_EXPECTED, BLOCK_BOUNDARY);
            }
            var terminator = cursor.previous();
            if (terminator.isPresent() && terminator.get()
                                                    .type() == SEMICOLON) {
                declaration.setSemicolonPosition(terminator.get()
                                                           .offset());
            }
            while (cursor.accept(SEMICOLON)) {
                // empty statements
            }
            start = cursor.offset();
            declaration = statement.parse();
        }
        if (!cursor.accept(CURLY_R)) {
            return finish(node, ParseError.RIGHT_CURLY_EXPECTED, BLOCK_BOUNDARY);
        }
        return finish(node);
    }

    // === Selectors ===

    protected Node parseSelector(boolean nested) {
        var node = create(NodeType.SELECTOR);
        var hasContent = false;
        if (nested) {
            hasContent = node.addChild(parseCombinator());
        }
        while (node.addChild(parseSimpleSelector())) {
            hasContent = true;
            node.addChild(parseCombinator());
        }
        return hasContent
               ? finish(node)
               : null;
    }

    protected Node parseSimpleSelector() {
        var node = create(NodeType.SIMPLE_SELECTOR);
        var count = 0;
        if (node.addChild(first(this::parseElementName, this::parseNestingSelector))) {
            count++;
        }
        while ((count == 0 || !cursor.hasWhitespace()) && node.addChild(parseSimpleSelectorBody())) {
            count++;
        }
        return count > 0
               ? finish(node)
               : null;
    }

    protected Node parseSimpleSelectorBody() {
        return first(this::parsePseudo, this::parseHash, this::parseClass, this::parseAttribute);
    }

    protected Node parseSelectorIdent() {
        return parseIdent();
    }

    protected Node parseElementName() {
        var mark = cursor.mark();
        var node = create(NodeType.ELEMENT_NAME_SELECTOR);
        node.set(Role.NAMESPACE_PREFIX, parseNamespacePrefix());
        if (!node.addChild(parseSelectorIdent()) && !cursor.acceptDelim("*")) {
            cursor.restore(mark);
            return null;
        }
        return finish(node);
    }

    protected Node parseNamespacePrefix() {
        var mark = cursor.mark();
        var node = create(NodeType.NAMESPACE_PREFIX);
        if (!node.addChild(parseIdent())) {
            cursor.acceptDelim("*");
        }
        if (!cursor.acceptDelim("|")) {
            cursor.restore(mark);
            return null;
        }
        return finish(node);
    }

    protected Node parseNestingSelector() {
        if (!cursor.peekDelim("&")) {
            return null;
        }
        var node = create(NodeType.SELECTOR_COMBINATOR);
        cursor.consume();
        return finish(node);
    }

    protected Node parseHash() {
        if (!cursor.peek(HASH) && !cursor.peekDelim("#")) {
            return null;
        }
        var node = create(NodeType.IDENTIFIER_SELECTOR);
        if (cursor.acceptDelim("#")) {
            if (cursor.hasWhitespace() || !node.addChild(parseSelectorIdent())) {
                return finish(node, ParseError.IDENTIFIER_EXPECTED);
            }
        } else {
            cursor.consume();
        }
        return finish(node);
    }

    protected Node parseClass() {
        if (!cursor.peekDelim(".")) {
            return null;
        }
        var node = create(NodeType.CLASS_SELECTOR);
        cursor.consume();
        if (cursor.hasWhitespace() || !node.addChild(parseSelectorIdent())) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED);
        }
        return finish(node);
    }

    protected Node parseAttribute() {
        if (!cursor.peek(BRACKET_L)) {
            return null;
        }
        var node = create(NodeType.ATTRIBUTE_SELECTOR);
        cursor.consume();
        node.set(Role.NAMESPACE_PREFIX, parseNamespacePrefix());
        if (!node.setIdentifier(parseIdent())) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED);
        }
        if (node.set(Role.OPERATOR, parseOperator())) {
            node.setValue(parseBinaryExpr());
            cursor.acceptIdent("i");
            cursor.acceptIdent("s");
        }
        if (!cursor.accept(BRACKET_R)) {
            return finish(node, ParseError.RIGHT_SQUARE_BRACKET_EXPECTED);
        }
        return finish(node);
    }

    protected Node parsePseudo() {
        var node = tryParsePseudoIdentifier();
        if (node == null) {
            return null;
        }
        if (!cursor.hasWhitespace() && cursor.accept(PARENTHESIS_L)) {
            return nested(node, OPENING_PARENTHESIS, PARENTHESIS_R, () -> parsePseudoArguments(node));
        }
        return finish(node);
    }

    private Node parsePseudoArguments(Node node) {
        if (!node.addChild(attempt(this::parsePseudoSelectorArguments))
            && node.addChild(parseBinaryExpr())
            && cursor.acceptIdent("of")
            && !node.addChild(attempt(this::parsePseudoSelectorArguments))) {
            return finish(node, ParseError.SELECTOR_EXPECTED);
        }
        return closeParenthesis(node);
    }

    private Node parsePseudoSelectorArguments() {
        var selectors = create(NodeType.UNDEFINED);
        if (!selectors.addChild(parseSelector(true))) {
            return null;
        }
        while (cursor.accept(COMMA) && selectors.addChild(parseSelector(true))) {
            // selector list
        }
        return cursor.peek(PARENTHESIS_R)
               ? finish(selectors)
               : null;
    }

    protected Node tryParsePseudoIdentifier() {
        if (!cursor.peek(COLON)) {
            return null;
        }
        var mark = cursor.mark();
        var node = create(NodeType.PSEUDO_SELECTOR);
        cursor.consume();
        if (cursor.hasWhitespace()) {
            cursor.restore(mark);
            return null;
        }
        cursor.accept(COLON);
        if (cursor.hasWhitespace() || !node.addChild(parseIdent())) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED);
        }
        return finish(node);
    }

    protected Node parseCombinator() {
        if (cursor.peekDelim(">")) {
            var node = create(NodeType.SELECTOR_COMBINATOR_PARENT);
            cursor.consume();
            var mark = cursor.mark();
            if (!cursor.hasWhitespace() && cursor.acceptDelim(">")) {
                if (!cursor.hasWhitespace() && cursor.acceptDelim(">")) {
                    node.setType(NodeType.SELECTOR_COMBINATOR_SHADOW_PIERCING_DESCENDANT);
                    return finish(node);
                }
                cursor.restore(mark);
            }
            return finish(node);
        }
        if (cursor.peekDelim("+")) {
            var node = create(NodeType.SELECTOR_COMBINATOR_SIBLING);
            cursor.consume();
            return finish(node);
        }
        if (cursor.peekDelim("~")) {
            var node = create(NodeType.SELECTOR_COMBINATOR_ALL_SIBLINGS);
            cursor.consume();
            return finish(node);
        }
        return null;
    }

    // === Declarations ===

    protected Node parseDeclaration() {
        return parseDeclaration(NONE);
    }

    protected Node parseDeclaration(Set<TokenType> stopTokens) {
        var customProperty = tryParseCustomPropertyDeclaration(stopTokens);
        if (customProperty != null) {
            return customProperty;
        }
        var node = create(NodeType.DECLARATION);
        if (!node.set(Role.PROPERTY, parseProperty())) {
            return null;
        }
        if (!cursor.accept(COLON)) {
            return finish(node, ParseError.COLON_EXPECTED, COLON_ONLY, declarationStop(stopTokens));
        }
        node.setColonPosition(previousOffset());
        if (!node.setValue(parseExpr(false))) {
            return finish(node, ParseError.PROPERTY_VALUE_EXPECTED);
        }
        node.addChild(parsePrio());
        recordSemicolon(node);
        return finish(node);
    }

    protected static Set<TokenType> declarationStop(Set<TokenType> stopTokens) {
        return stopTokens.isEmpty()
               ? BLOCK_BOUNDARY
               : stopTokens;
    }

    /**
     * A declaration, but only if a property and a colon follow.
     */
    protected Node tryToParseDeclaration(Set<TokenType> stopTokens) {
        var mark = cursor.mark();
        if (parseProperty() != null && cursor.accept(COLON)) {
            cursor.restore(mark);
            return parseDeclaration(stopTokens);
        }
        cursor.restore(mark);
        return null;
    }

    protected Node parseProperty() {
        var node = create(NodeType.PROPERTY);
        var mark = cursor.mark();
        if (cursor.acceptDelim("*") || cursor.acceptDelim("_")) {
            // star and underscore hacks
            if (cursor.hasWhitespace()) {
                cursor.restore(mark);
                return null;
            }
        }
        if (node.setIdentifier(parsePropertyIdentifier())) {
            return finish(node);
        }
        cursor.restore(mark);
        return null;
    }

    protected Node parsePropertyIdentifier() {
        return parseIdent();
    }

    protected Node tryParseCustomPropertyDeclaration(Set<TokenType> stopTokens) {
        if (!cursor.peekText(IDENT, CUSTOM_PROPERTY)) {
            return null;
        }
        var node = create(NodeType.CUSTOM_PROPERTY_DECLARATION);
        if (!node.set(Role.PROPERTY, parseProperty())) {
            return null;
        }
        if (!cursor.accept(COLON)) {
            return finish(node, ParseError.COLON_EXPECTED, COLON_ONLY, BLOCK_BOUNDARY);
        }
        node.setColonPosition(previousOffset());
        node.setValue(parseCustomPropertyValue(stopTokens.isEmpty()
                                               ? CLOSING_CURLY
                                               : stopTokens));
        node.addChild(parsePrio());
        if (cursor.offset() == node.colonPosition() + 1) {
            return finish(node, ParseError.PROPERTY_VALUE_EXPECTED);
        }
        recordSemicolon(node);
        return finish(node);
    }

    /**
     * Any balanced token sequence, up to a top-level semicolon, priority or unmatched closing token.
     */
    protected Node parseCustomPropertyValue(Set<TokenType> stopTokens) {
        var node = create(NodeType.UNDEFINED);
        var curly = 0;
        var parens = 0;
        var brackets = 0;
        while (true) {
            var topLevel = curly == 0 && parens == 0 && brackets == 0;
            switch (cursor.current()
                          .type()) {
                case SEMICOLON, EXCLAMATION:
                    if (topLevel) {
                        return finish(node);
                    }
                    break;
                case CURLY_L:
                    curly++;
                    break;
                case CURLY_R:
                    curly--;
                    if (curly < 0) {
                        if (stopTokens.contains(CURLY_R) && parens == 0 && brackets == 0) {
                            return finish(node);
                        }
                        return finish(node, ParseError.LEFT_CURLY_EXPECTED);
                    }
                    break;
                case PARENTHESIS_L:
                    parens++;
                    break;
                case PARENTHESIS_R:
                    parens--;
                    if (parens < 0) {
                        if (stopTokens.contains(PARENTHESIS_R) && curly == 0 && brackets == 0) {
                            return finish(node);
                        }
                        return finish(node, ParseError.LEFT_PARENTHESIS_EXPECTED);
                    }
                    break;
                case BRACKET_L:
                    brackets++;
                    break;
                case BRACKET_R:
                    brackets--;
                    if (brackets < 0) {
                        return finish(node, ParseError.LEFT_SQUARE_BRACKET_EXPECTED);
                    }
                    break;
                case BAD_STRING:
                    return finish(node);
                case EOF:
                    return finish(node, unclosed(curly, parens, brackets));
                default:
                    break;
            }
            cursor.consume();
        }
    }

    private static ErrorKind unclosed(int curly, int parens, int brackets) {
        if (curly > 0) {
            return ParseError.RIGHT_CURLY_EXPECTED;
        }
        if (brackets > 0) {
            return ParseError.RIGHT_SQUARE_BRACKET_EXPECTED;
        }
        if (parens > 0) {
            return ParseError.RIGHT_PARENTHESIS_EXPECTED;
        }
        return null;
    }

    /**
     * {@code !important}. Consumes nothing unless both tokens are present.
     */
    protected Node parsePrio() {
        if (!cursor.peek(EXCLAMATION)) {
            return null;
        }
        var mark = cursor.mark();
        var node = create(NodeType.PRIO);
        if (cursor.accept(EXCLAMATION) && cursor.acceptIdent("important")) {
            return finish(node);
        }
        cursor.restore(mark);
        return null;
    }

    // === Expressions ===

    protected Node parseExpr(boolean stopOnComma) {
        var node = create(NodeType.EXPRESSION);
        if (!node.addChild(parseBinaryExpr())) {
            return null;
        }
        while (true) {
            if (cursor.peek(COMMA)) {
                if (stopOnComma) {
                    return finish(node);
                }
                cursor.consume();
            } else if (!cursor.hasWhitespace()) {
                break;
            }
            if (!node.addChild(parseBinaryExpr())) {
                break;
            }
        }
        return finish(node);
    }

    /**
     * Left-to-right chain of terms and operators. Each completed operation becomes the left side of
     * the next one, so {@code a + b - c} is {@code (a + b) - c}.
     */
    protected Node parseBinaryExpr() {
        var node = create(NodeType.BINARY_EXPRESSION);
        if (!node.set(Role.LEFT, parseTerm())) {
            return null;
        }
        var operator = parseOperator();
        if (operator == null) {
            return finish(node);
        }
        while (true) {
            node.set(Role.OPERATOR, operator);
            if (!node.set(Role.RIGHT, parseTerm())) {
                return finish(node, ParseError.TERM_EXPECTED);
            }
            finish(node);
            operator = parseOperator();
            if (operator == null) {
                return node;
            }
            var left = node;
            node = create(NodeType.BINARY_EXPRESSION);
            node.set(Role.LEFT, left);
        }
    }

    protected Node parseTerm() {
        var mark = cursor.mark();
        var node = create(NodeType.TERM);
        node.set(Role.OPERATOR, parseUnaryOperator());
        if (node.set(Role.EXPRESSION, parseTermExpression())) {
            return finish(node);
        }
        cursor.restore(mark);
        return null;
    }

    protected Node parseOperator() {
        if (cursor.peekDelim("/")
            || cursor.peekDelim("*")
            || cursor.peekDelim("+")
            || cursor.peekDelim("-")
            || cursor.peek(TokenType.DASHMATCH)
            || cursor.peek(TokenType.INCLUDES)
            || cursor.peek(TokenType.SUBSTRING_OPERATOR)
            || cursor.peek(TokenType.PREFIX_OPERATOR)
            || cursor.peek(TokenType.SUFFIX_OPERATOR)
            || cursor.peekDelim("=")) {
            return consumeLeaf(NodeType.OPERATOR);
        }
        return null;
    }

    protected Node parseUnaryOperator() {
        if (!cursor.peekDelim("+") && !cursor.peekDelim("-")) {
            return null;
        }
        return consumeLeaf(NodeType.OPERATOR);
    }

    /**
     * A node covering exactly the current token.
     */
    protected Node consumeLeaf(NodeType type) {
        var node = create(type);
        cursor.consume();
        return finish(node);
    }

    protected Node parseTermExpression() {
        return first(this::parseURILiteral,
                     this::parseFunction,
                     () -> parseIdent(),
                     this::parseStringLiteral,
                     this::parseNumeric,
                     this::parseHexColor,
                     this::parseOperation,
                     this::parseNamedLine);
    }

    protected Node parseOperation() {
        if (!cursor.peek(PARENTHESIS_L)) {
            return null;
        }
        var node = create(NodeType.UNDEFINED);
        cursor.consume();
        return nested(node, OPENING_PARENTHESIS, PARENTHESIS_R, () -> {
            node.addChild(parseExpr(false));
            return closeParenthesis(node);
        });
    }

    protected Node closeParenthesis(Node node) {
        if (!cursor.accept(PARENTHESIS_R)) {
            return finish(node, ParseError.RIGHT_PARENTHESIS_EXPECTED);
        }
        return finish(node);
    }

    protected Node parseNumeric() {
        if (cursor.peek(TokenType.NUM) || cursor.peek(TokenType.PERCENTAGE) || cursor.peek(TokenType.DIMENSION)) {
            return consumeLeaf(NodeType.NUMERIC_VALUE);
        }
        return null;
    }

    protected Node parseHexColor() {
        if (cursor.peekText(HASH, HEX_COLOR)) {
            return consumeLeaf(NodeType.HEX_COLOR_VALUE);
        }
        return null;
    }

    protected Node parseStringLiteral() {
        if (!cursor.peek(STRING) && !cursor.peek(BAD_STRING)) {
            return null;
        }
        return consumeLeaf(NodeType.STRING_LITERAL);
    }

    protected Node parseNamedLine() {
        if (!cursor.peek(BRACKET_L)) {
            return null;
        }
        var node = create(NodeType.GRID_LINE);
        cursor.consume();
        while (node.addChild(parseIdent())) {
            // line names
        }
        if (!cursor.accept(BRACKET_R)) {
            return finish(node, ParseError.RIGHT_SQUARE_BRACKET_EXPECTED);
        }
        return finish(node);
    }

    protected Node parseURILiteral() {
        if (!cursor.peekText(IDENT, URL)) {
            return null;
        }
        var mark = cursor.mark();
        var node = create(NodeType.URI_LITERAL);
        cursor.consume();
        if (cursor.hasWhitespace() || !cursor.peek(PARENTHESIS_L)) {
            cursor.restore(mark);
            return null;
        }
        cursor.setInUrl(true);
        cursor.consume();
        node.addChild(parseURLArgument());
        cursor.setInUrl(false);
        if (!cursor.accept(PARENTHESIS_R)) {
            return finish(node, ParseError.RIGHT_PARENTHESIS_EXPECTED);
        }
        return finish(node);
    }

    protected Node parseURLArgument() {
        var node = create(NodeType.UNDEFINED);
        if (!cursor.accept(STRING) && !cursor.accept(BAD_STRING) && !cursor.acceptUnquotedString()) {
            return null;
        }
        return finish(node);
    }

    protected Node parseFunction() {
        var mark = cursor.mark();
        var node = create(NodeType.FUNCTION);
        if (!node.setIdentifier(parseFunctionIdentifier())) {
            return null;
        }
        if (cursor.hasWhitespace() || !cursor.accept(PARENTHESIS_L)) {
            cursor.restore(mark);
            return null;
        }
        return nested(node, OPENING_PARENTHESIS, PARENTHESIS_R, () -> parseFunctionArguments(node));
    }

    private Node parseFunctionArguments(Node node) {
        var arguments = node.list(Role.ARGUMENTS);
        if (arguments.addChild(parseFunctionArgument())) {
            while (cursor.accept(COMMA)) {
                if (cursor.peek(PARENTHESIS_R)) {
                    break;
                }
                if (!arguments.addChild(parseFunctionArgument())) {
                    markError(node, ParseError.EXPRESSION_EXPECTED);
                }
            }
        }
        return closeParenthesis(node);
    }

    protected Node parseFunctionIdentifier() {
        if (!cursor.peek(IDENT)) {
            return null;
        }
        var node = create(NodeType.IDENTIFIER);
        node.setReferenceTypes(Set.of(ReferenceType.FUNCTION));
        cursor.consume();
        return finish(node);
    }

    protected Node parseFunctionArgument() {
        var node = create(NodeType.FUNCTION_ARGUMENT);
        if (node.setValue(parseExpr(true))) {
            return finish(node);
        }
        return null;
    }

    protected Node parseIdent(ReferenceType... referenceTypes) {
        if (!cursor.peek(IDENT)) {
            return null;
        }
        var node = create(NodeType.IDENTIFIER);
        node.setReferenceTypes(Set.of(referenceTypes));
        node.setCustomProperty(cursor.peekText(IDENT, CUSTOM_PROPERTY));
        cursor.consume();
        return finish(node);
    }

    // === @import ===

    protected Node parseImport() {
        if (!cursor.peekKeyword("@import")) {
            return null;
        }
        var node = create(NodeType.IMPORT);
        cursor.consume();
        if (!node.addChild(parseURILiteral()) && !node.addChild(parseStringLiteral())) {
            return finish(node, ParseError.URI_OR_STRING_EXPECTED);
        }
        return completeParseImport(node);
    }

    /**
     * Optional {@code layer(...)}, {@code supports(...)} and media list after the import target.
     */
    protected Node completeParseImport(Node node) {
        if (cursor.acceptIdent("layer") && cursor.accept(PARENTHESIS_L)) {
            if (!node.addChild(parseLayerName())) {
                return finish(node, ParseError.IDENTIFIER_EXPECTED, SEMICOLON_ONLY);
            }
            if (!cursor.accept(PARENTHESIS_R)) {
                return finish(node, ParseError.RIGHT_PARENTHESIS_EXPECTED, CLOSING_PARENTHESIS);
            }
        }
        if (cursor.acceptIdent("supports") && cursor.accept(PARENTHESIS_L)) {
            node.addChild(first(() -> tryToParseDeclaration(NONE), this::parseSupportsCondition));
            if (!cursor.accept(PARENTHESIS_R)) {
                return finish(node, ParseError.RIGHT_PARENTHESIS_EXPECTED, CLOSING_PARENTHESIS);
            }
        }
        if (!cursor.peek(SEMICOLON) && !cursor.isAtEnd()) {
            node.set(Role.MEDIA_LIST, parseMediaQueryList());
        }
        return finish(node);
    }

    // === @media ===

    protected Node parseMedia(boolean nested) {
        if (!cursor.peekKeyword("@media")) {
            return null;
        }
        var node = create(NodeType.MEDIA);
        cursor.consume();
        if (!node.addChild(parseMediaQueryList())) {
            return finish(node, ParseError.MEDIA_QUERY_EXPECTED);
        }
        return parseBody(node, () -> nested
                                     ? parseRuleSetDeclaration()
                                     : parseStylesheetStatement(false));
    }

    protected Node parseMediaQueryList() {
        var node = create(NodeType.MEDIA_QUERY_LIST);
        if (!node.addChild(parseMediaQuery())) {
            return finish(node, ParseError.MEDIA_QUERY_EXPECTED);
        }
        while (cursor.accept(COMMA)) {
            if (!node.addChild(parseMediaQuery())) {
                return finish(node, ParseError.MEDIA_QUERY_EXPECTED);
            }
        }
        return finish(node);
    }

    protected Node parseMediaQuery() {
        var node = create(NodeType.MEDIA_QUERY);
        var mark = cursor.mark();
        cursor.acceptIdent("not");
        if (!cursor.peek(PARENTHESIS_L)) {
            cursor.acceptIdent("only");
            if (!node.addChild(parseIdent())) {
                cursor.restore(mark);
                return null;
            }
            if (cursor.acceptIdent("and")) {
                node.addChild(parseMediaCondition());
            }
        } else {
            cursor.restore(mark);
            node.addChild(parseMediaCondition());
        }
        return finish(node);
    }

    protected Node parseMediaCondition() {
        var node = create(NodeType.MEDIA_CONDITION);
        cursor.acceptIdent("not");
        var parseExpression = true;
        while (parseExpression) {
            if (!cursor.accept(PARENTHESIS_L)) {
                return finish(node, ParseError.LEFT_PARENTHESIS_EXPECTED, NONE, OPENING_CURLY);
            }
            if (cursor.peek(PARENTHESIS_L) || cursor.peekIdent("not")) {
                node.addChild(parseMediaCondition());
            } else {
                node.addChild(parseMediaFeature());
            }
            if (!cursor.accept(PARENTHESIS_R)) {
                return finish(node, ParseError.RIGHT_PARENTHESIS_EXPECTED, NONE, OPENING_CURLY);
            }
            parseExpression = cursor.acceptIdent("and") || cursor.acceptIdent("or");
        }
        return finish(node);
    }

    protected Node parseMediaFeature() {
        var node = create(NodeType.MEDIA_FEATURE);
        if (node.addChild(parseMediaFeatureName())) {
            if (cursor.accept(COLON)) {
                if (!node.addChild(parseMediaFeatureValue())) {
                    return finish(node, ParseError.TERM_EXPECTED, NONE, CLOSING_PARENTHESIS);
                }
            } else if (parseMediaFeatureRangeOperator()) {
                if (!node.addChild(parseMediaFeatureValue())) {
                    return finish(node, ParseError.TERM_EXPECTED, NONE, CLOSING_PARENTHESIS);
                }
                if (parseMediaFeatureRangeOperator() && !node.addChild(parseMediaFeatureValue())) {
                    return finish(node, ParseError.TERM_EXPECTED, NONE, CLOSING_PARENTHESIS);
                }
            }
        } else if (node.addChild(parseMediaFeatureValue())) {
            if (!parseMediaFeatureRangeOperator()) {
                return finish(node, ParseError.OPERATOR_EXPECTED, NONE, CLOSING_PARENTHESIS);
            }
            if (!node.addChild(parseMediaFeatureName())) {
                return finish(node, ParseError.IDENTIFIER_EXPECTED, NONE, CLOSING_PARENTHESIS);
            }
            if (parseMediaFeatureRangeOperator() && !node.addChild(parseMediaFeatureValue())) {
                return finish(node, ParseError.TERM_EXPECTED, NONE, CLOSING_PARENTHESIS);
            }
        } else {
            return finish(node, ParseError.IDENTIFIER_EXPECTED, NONE, CLOSING_PARENTHESIS);
        }
        return finish(node);
    }

    protected boolean parseMediaFeatureRangeOperator() {
        if (cursor.acceptDelim("<") || cursor.acceptDelim(">")) {
            if (!cursor.hasWhitespace()) {
                cursor.acceptDelim("=");
            }
            return true;
        }
        return cursor.acceptDelim("=");
    }

    protected Node parseMediaFeatureName() {
        return parseIdent();
    }

    protected Node parseMediaFeatureValue() {
        return first(this::parseRatio, this::parseTermExpression);
    }

    protected Node parseRatio() {
        var mark = cursor.mark();
        var node = create(NodeType.RATIO_VALUE);
        if (parseNumeric() == null) {
            return null;
        }
        if (!cursor.acceptDelim("/")) {
            cursor.restore(mark);
            return null;
        }
        if (parseNumeric() == null) {
            return finish(node, ParseError.NUMBER_EXPECTED);
        }
        return finish(node);
    }

    // === @supports ===

    protected Node parseSupports(boolean nested) {
        if (!cursor.peekKeyword("@supports")) {
            return null;
        }
        var node = create(NodeType.SUPPORTS);
        cursor.consume();
        node.addChild(parseSupportsCondition());
        return parseBody(node, () -> parseGroupBodyStatement(nested));
    }

    protected Node parseSupportsCondition() {
        var node = create(NodeType.SUPPORTS_CONDITION);
        if (cursor.acceptIdent("not")) {
            node.addChild(parseSupportsConditionInParens());
        } else {
            node.addChild(parseSupportsConditionInParens());
            if (cursor.peekText(IDENT, AND_OR)) {
                var connective = cursor.current()
                                       .text();
                while (cursor.acceptIdent(connective)) {
                    node.addChild(parseSupportsConditionInParens());
                }
            }
        }
        return finish(node);
    }

    private Node parseSupportsConditionInParens() {
        var node = create(NodeType.SUPPORTS_CONDITION);
        if (cursor.accept(PARENTHESIS_L)) {
            if (!node.addChild(tryToParseDeclaration(CLOSING_PARENTHESIS))
                && !node.addChild(parseSupportsCondition())) {
                return finish(node, ParseError.CONDITION_EXPECTED);
            }
            if (!cursor.accept(PARENTHESIS_R)) {
                return finish(node, ParseError.RIGHT_PARENTHESIS_EXPECTED, CLOSING_PARENTHESIS);
            }
            return finish(node);
        }
        if (cursor.peek(IDENT)) {
            var mark = cursor.mark();
            cursor.consume();
            if (!cursor.hasWhitespace() && cursor.accept(PARENTHESIS_L)) {
                var depth = 1;
                while (!cursor.isAtEnd() && depth != 0) {
                    if (cursor.peek(PARENTHESIS_L)) {
                        depth++;
                    } else if (cursor.peek(PARENTHESIS_R)) {
                        depth--;
                    }
                    cursor.consume();
                }
                return finish(node);
            }
            cursor.restore(mark);
        }
        return finish(node, ParseError.LEFT_PARENTHESIS_EXPECTED, NONE, Set.of(PARENTHESIS_L, CURLY_L));
    }

    // === @layer, @property, @font-face ===

    protected Node parseLayer(boolean nested) {
        if (!cursor.peekKeyword("@layer")) {
            return null;
        }
        var node = create(NodeType.LAYER);
        cursor.consume();
        var names = parseLayerNameList();
        node.set(Role.NAMES, names);
        if ((names == null || names.children()
                                   .size() == 1) && cursor.peek(CURLY_L)) {
            return parseBody(node, () -> parseGroupBodyStatement(nested));
        }
        if (!cursor.accept(SEMICOLON)) {
            return finish(node, ParseError.SEMICOLON_EXPECTED);
        }
        return finish(node);
    }

    protected Node parseLayerNameList() {
        var node = create(NodeType.LAYER_NAME_LIST);
        if (!node.addChild(parseLayerName())) {
            return null;
        }
        while (cursor.accept(COMMA)) {
            if (!node.addChild(parseLayerName())) {
                return finish(node, ParseError.IDENTIFIER_EXPECTED);
            }
        }
        return finish(node);
    }

    protected Node parseLayerName() {
        if (!cursor.peek(IDENT)) {
            return null;
        }
        var node = create(NodeType.LAYER_NAME);
        node.addChild(parseIdent());
        while (!cursor.hasWhitespace() && cursor.acceptDelim(".")) {
            if (cursor.hasWhitespace() || !node.addChild(parseIdent())) {
                return finish(node, ParseError.IDENTIFIER_EXPECTED);
            }
        }
        return finish(node);
    }

    protected Node parsePropertyAtRule() {
        if (!cursor.peekKeyword("@property")) {
            return null;
        }
        var node = create(NodeType.PROPERTY_AT_RULE);
        cursor.consume();
        if (!cursor.peekText(IDENT, CUSTOM_PROPERTY) || !node.setIdentifier(parseIdent(ReferenceType.PROPERTY))) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED);
        }
        return parseBody(node, this::parseDeclaration);
    }

    protected Node parseFontFace() {
        if (!cursor.peekKeyword("@font-face")) {
            return null;
        }
        var node = create(NodeType.FONT_FACE);
        cursor.consume();
        return parseBody(node, this::parseRuleSetDeclaration);
    }

    // === @keyframes ===

    protected Node parseKeyframe() {
        if (!cursor.peekText(AT_KEYWORD, KEYFRAMES)) {
            return null;
        }
        var node = create(NodeType.KEYFRAME);
        var keyword = consumeLeaf(NodeType.UNDEFINED);
        node.set(Role.KEYWORD, keyword);
        if (cursor.previous()
                  .map(token -> token.text()
                                     .equalsIgnoreCase("@-ms-keyframes"))
                  .orElse(false)) {
            keyword.addDiagnostic(Diagnostic.error(ParseError.UNKNOWN_KEYWORD, keyword.span()));
        }
        if (!node.setIdentifier(parseKeyframeIdent())) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED, CLOSING_CURLY);
        }
        return parseBody(node, this::parseKeyframeSelector);
    }

    protected Node parseKeyframeIdent() {
        return parseIdent(ReferenceType.KEYFRAME);
    }

    protected Node parseKeyframeSelector() {
        var node = create(NodeType.KEYFRAME_SELECTOR);
        if (!parseKeyframeSelectorEntry(node)) {
            return null;
        }
        while (cursor.accept(COMMA)) {
            if (!parseKeyframeSelectorEntry(node)) {
                return finish(node, ParseError.PERCENTAGE_EXPECTED);
            }
        }
        return parseBody(node, this::parseRuleSetDeclaration);
    }

    /**
     * A keyframe selector, but only if it is complete and followed by a block.
     */
    protected Node tryParseKeyframeSelector() {
        var node = create(NodeType.KEYFRAME_SELECTOR);
        var mark = cursor.mark();
        if (!parseKeyframeSelectorEntry(node)) {
            return null;
        }
        while (cursor.accept(COMMA)) {
            if (!parseKeyframeSelectorEntry(node)) {
                cursor.restore(mark);
                return null;
            }
        }
        if (!cursor.peek(CURLY_L)) {
            cursor.restore(mark);
            return null;
        }
        return parseBody(node, this::parseRuleSetDeclaration);
    }

    private boolean parseKeyframeSelectorEntry(Node node) {
        var hasContent = node.addChild(parseIdent());
        if (cursor.peek(TokenType.PERCENTAGE)) {
            node.addChild(consumeLeaf(NodeType.NUMERIC_VALUE));
            hasContent = true;
        }
        return hasContent;
    }

    // === @page ===

    protected Node parsePage() {
        if (!cursor.peekKeyword("@page")) {
            return null;
        }
        var node = create(NodeType.PAGE);
        cursor.consume();
        if (node.addChild(parsePageSelector())) {
            while (cursor.accept(COMMA)) {
                if (!node.addChild(parsePageSelector())) {
                    return finish(node, ParseError.IDENTIFIER_EXPECTED);
                }
            }
        }
        return parseBody(node, () -> first(this::parsePageMarginBox, this::parseRuleSetDeclaration));
    }

    protected Node parsePageMarginBox() {
        if (!cursor.peek(AT_KEYWORD) || !PAGE_BOX_DIRECTIVES.contains(cursor.current()
                                                                            .text()
                                                                            .toLowerCase())) {
            return null;
        }
        var node = create(NodeType.PAGE_BOX_MARGIN_BOX);
        cursor.consume();
        return parseBody(node, this::parseRuleSetDeclaration);
    }

    protected Node parsePageSelector() {
        if (!cursor.peek(IDENT) && !cursor.peek(COLON)) {
            return null;
        }
        var node = create(NodeType.UNDEFINED);
        node.addChild(parseIdent());
        if (cursor.accept(COLON) && !node.addChild(parseIdent())) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED);
        }
        return finish(node);
    }

    // === Unknown at-rules ===

    /**
     * Any other at-rule: skips a balanced token sequence up to a top-level semicolon or the end of the
     * first block.
     */
    protected Node parseUnknownAtRule() {
        if (!cursor.peek(AT_KEYWORD)) {
            return null;
        }
        var node = create(NodeType.UNKNOWN_AT_RULE);
        node.set(Role.KEYWORD, consumeLeaf(NodeType.IDENTIFIER));
        var blocks = 0;
        var curly = 0;
        var parens = 0;
        var brackets = 0;
        while (true) {
            switch (cursor.current()
                          .type()) {
                case SEMICOLON:
                    if (curly == 0 && parens == 0 && brackets == 0) {
                        return finish(node);
                    }
                    break;
                case EOF:
                    return finish(node, unclosed(curly, parens, brackets));
                case CURLY_L:
                    blocks++;
                    curly++;
                    break;
                case CURLY_R:
                    curly--;
                    if (blocks > 0 && curly == 0) {
                        cursor.consume();
                        return finish(node, unclosed(0, parens, brackets));
                    }
                    if (curly < 0) {
                        if (parens == 0 && brackets == 0) {
                            return finish(node);
                        }
                        return finish(node, ParseError.LEFT_CURLY_EXPECTED);
                    }
                    break;
                case PARENTHESIS_L:
                    parens++;
                    break;
                case PARENTHESIS_R:
                    parens--;
                    if (parens < 0) {
                        return finish(node, ParseError.LEFT_PARENTHESIS_EXPECTED);
                    }
                    break;
                case BRACKET_L:
                    brackets++;
                    break;
                case BRACKET_R:
                    brackets--;
                    if (brackets < 0) {
                        return finish(node, ParseError.LEFT_SQUARE_BRACKET_EXPECTED);
                    }
                    break;
                default:
                    break;
            }
            cursor.consume();
        }
    }
}
