package org.pragmatica.scss.parser;

import org.pragmatica.scss.error.ErrorKind;
import org.pragmatica.scss.error.ParseError;
import org.pragmatica.scss.error.ScssParseError;
import org.pragmatica.scss.scanner.ScssScanner;
import org.pragmatica.scss.scanner.TokenType;
import org.pragmatica.scss.tree.Node;
import org.pragmatica.scss.tree.NodeType;
import org.pragmatica.scss.tree.ReferenceType;
import org.pragmatica.scss.tree.Role;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static org.pragmatica.scss.scanner.TokenType.AT_KEYWORD;
import static org.pragmatica.scss.scanner.TokenType.COLON;
import static org.pragmatica.scss.scanner.TokenType.COMMA;
import static org.pragmatica.scss.scanner.TokenType.CURLY_L;
import static org.pragmatica.scss.scanner.TokenType.CURLY_R;
import static org.pragmatica.scss.scanner.TokenType.DIMENSION;
import static org.pragmatica.scss.scanner.TokenType.ELLIPSIS;
import static org.pragmatica.scss.scanner.TokenType.EXCLAMATION;
import static org.pragmatica.scss.scanner.TokenType.IDENT;
import static org.pragmatica.scss.scanner.TokenType.INTERPOLATION_START;
import static org.pragmatica.scss.scanner.TokenType.NUM;
import static org.pragmatica.scss.scanner.TokenType.PARENTHESIS_L;
import static org.pragmatica.scss.scanner.TokenType.PARENTHESIS_R;
import static org.pragmatica.scss.scanner.TokenType.SEMICOLON;
import static org.pragmatica.scss.scanner.TokenType.VARIABLE_NAME;

/**
 * Error-tolerant parser for SCSS.
 *
 * <p>Adds variables, interpolation, module members, control flow, mixins, functions and the module
 * system on top of {@link CssParser}. Each override tries the dialect alternatives first and falls
 * back to the plain CSS production.
 *
 * <p>Example usage:
 * <pre>{@code
 * var root = ScssParser.create("$x: 1px; .a { width: $x; }").parseStylesheet();
 * }</pre>
 */
public class ScssParser extends CssParser {
    private static final Set<TokenType> PARAMETER_END = Set.of(COMMA, PARENTHESIS_R);
    private static final Pattern DEFAULT_OR_GLOBAL = Pattern.compile("^(default|global)$");
    private static final Pattern AS_OR_WITH = Pattern.compile("^(as|with)$");
    private static final Pattern WORD_CONTINUATION = Pattern.compile("^[\\w-]");

    protected ScssParser(ScssScanner scanner) {
        super(scanner);
    }

    public static ScssParser create(String source) {
        return new ScssParser(new ScssScanner(source));
    }

    @Override
    protected boolean needsSemicolonAfter(Node node) {
        return switch (node.type()) {
            case EXTENDS_REFERENCE, MIXIN_CONTENT_REFERENCE, RETURN_STATEMENT, DEBUG, VARIABLE_DECLARATION -> true;
            case MIXIN_REFERENCE -> node.get(Role.CONTENT)
                                        .isEmpty();
            default -> super.needsSemicolonAfter(node);
        };
    }

    // === Statement dispatch ===

    @Override
    protected Node parseStylesheetStatement(boolean nested) {
        if (cursor.peek(AT_KEYWORD)) {
            return first(this::parseWarnAndDebug,
                         () -> parseControlStatement(this::parseRuleSetDeclaration),
                         this::parseMixinDeclaration,
                         this::parseMixinContent,
                         this::parseMixinReference,
                         this::parseFunctionDeclaration,
                         this::parseForward,
                         this::parseUse,
                         () -> parseRuleset(nested),
                         () -> parseStylesheetAtStatement(nested));
        }
        return first(() -> parseRuleset(true), this::parseVariableDeclaration);
    }

    @Override
    protected Node parseRuleSetDeclaration() {
        if (cursor.peek(AT_KEYWORD)) {
            return first(this::parseKeyframe,
                         this::parseImport,
                         () -> parseMedia(true),
                         this::parseFontFace,
                         this::parseWarnAndDebug,
                         () -> parseControlStatement(this::parseRuleSetDeclaration),
                         this::parseFunctionDeclaration,
                         this::parseExtends,
                         this::parseMixinReference,
                         this::parseMixinContent,
                         this::parseMixinDeclaration,
                         () -> parseRuleset(true),
                         () -> parseSupports(true),
                         () -> parseLayer(true),
                         this::parsePropertyAtRule,
                         this::parseRuleSetDeclarationAtStatement);
        }
        return first(this::parseVariableDeclaration, () -> tryParseRuleset(true), this::parseDeclaration);
    }

    @Override
    protected Node parseImport() {
        if (!cursor.peekKeyword("@import")) {
            return null;
        }
        var node = create(NodeType.IMPORT);
        cursor.consume();
        if (!node.addChild(parseURILiteral()) && !node.addChild(parseStringLiteral())) {
            return finish(node, ParseError.URI_OR_STRING_EXPECTED);
        }
        while (cursor.accept(COMMA)) {
            if (!node.addChild(parseURILiteral()) && !node.addChild(parseStringLiteral())) {
                return finish(node, ParseError.URI_OR_STRING_EXPECTED);
            }
        }
        return completeParseImport(node);
    }

    protected Node parseVariableDeclaration() {
        if (!cursor.peek(VARIABLE_NAME)) {
            return null;
        }
        var node = create(NodeType.VARIABLE_DECLARATION);
        if (!node.setVariable(parseVariable())) {
            return null;
        }
        if (!cursor.accept(COLON)) {
            return finish(node, ParseError.COLON_EXPECTED);
        }
        node.setColonPosition(previousOffset());
        if (!node.setValue(parseExpr(false))) {
            return finish(node, ParseError.VARIABLE_VALUE_EXPECTED);
        }
        while (cursor.peek(EXCLAMATION)) {
            if (!node.addChild(parsePrio())) {
                cursor.consume();
                if (!cursor.peekText(IDENT, DEFAULT_OR_GLOBAL)) {
                    return finish(node, ParseError.UNKNOWN_KEYWORD);
                }
                cursor.consume();
            }
        }
        recordSemicolon(node);
        return finish(node);
    }

    @Override
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
        var hasContent = false;
        if (node.setValue(parseExpr(false))) {
            hasContent = true;
            node.addChild(parsePrio());
        }
        if (cursor.peek(CURLY_L)) {
            node.set(Role.NESTED_PROPERTIES, parseBody(create(NodeType.NESTED_PROPERTIES), this::parseDeclaration));
        } else if (!hasContent) {
            return finish(node, ParseError.PROPERTY_VALUE_EXPECTED);
        }
        recordSemicolon(node);
        return finish(node);
    }

    protected Node parseExtends() {
        if (!cursor.peekKeyword("@extend")) {
            return null;
        }
        var node = create(NodeType.EXTENDS_REFERENCE);
        cursor.consume();
        var selectors = node.list(Role.SELECTORS);
        if (!selectors.addChild(parseSimpleSelector())) {
            return finish(node, ParseError.SELECTOR_EXPECTED);
        }
        while (cursor.accept(COMMA)) {
            selectors.addChild(parseSimpleSelector());
        }
        if (cursor.accept(EXCLAMATION) && !cursor.acceptIdent("optional")) {
            return finish(node, ParseError.UNKNOWN_KEYWORD);
        }
        return finish(node);
    }

    protected Node parseWarnAndDebug() {
        if (!cursor.peekKeyword("@debug") && !cursor.peekKeyword("@warn") && !cursor.peekKeyword("@error")) {
            return null;
        }
        var node = create(NodeType.DEBUG);
        cursor.consume();
        node.addChild(parseExpr(false));
        return finish(node);
    }

    // === Expressions and lexical units ===

    protected Node parseVariable() {
        if (!cursor.peek(VARIABLE_NAME)) {
            return null;
        }
        return consumeLeaf(NodeType.VARIABLE);
    }

    /**
     * {@code module.$variable} or {@code module.function(...)}, with no whitespace around the dot.
     */
    protected Node parseModuleMember() {
        var mark = cursor.mark();
        var node = create(NodeType.MODULE);
        if (!node.setIdentifier(parseIdent(ReferenceType.MODULE))) {
            return null;
        }
        if (cursor.hasWhitespace() || !cursor.acceptDelim(".") || cursor.hasWhitespace()) {
            cursor.restore(mark);
            return null;
        }
        if (!node.addChild(first(this::parseVariable, this::parseFunction))) {
            return finish(node, ParseError.IDENTIFIER_OR_VARIABLE_EXPECTED);
        }
        return finish(node);
    }

    /**
     * Identifier made of plain words and interpolations, e.g. {@code foo-#{$bar}-baz}.
     */
    @Override
    protected Node parseIdent(ReferenceType... referenceTypes) {
        if (!cursor.peek(IDENT) && !cursor.peek(INTERPOLATION_START) && !cursor.peekDelim("-")) {
            return null;
        }
        var mark = cursor.mark();
        var node = create(NodeType.IDENTIFIER);
        node.setReferenceTypes(Set.of(referenceTypes));
        node.setCustomProperty(cursor.peekText(IDENT, CUSTOM_PROPERTY));
        var hasContent = false;
        while (cursor.accept(IDENT)
               || node.addChild(parseHyphenatedInterpolation())
               || (hasContent && cursor.acceptText(WORD_CONTINUATION))) {
            hasContent = true;
            if (cursor.hasWhitespace()) {
                break;
            }
        }
        if (!hasContent) {
            cursor.restore(mark);
            return null;
        }
        return finish(node);
    }

    private Node parseHyphenatedInterpolation() {
        var mark = cursor.mark();
        if (cursor.acceptDelim("-")) {
            if (!cursor.hasWhitespace()) {
                cursor.acceptDelim("-");
            }
            if (cursor.hasWhitespace()) {
                cursor.restore(mark);
                return null;
            }
        }
        var node = parseInterpolation();
        if (node == null) {
            cursor.restore(mark);
        }
        return node;
    }

    protected Node parseInterpolation() {
        if (!cursor.peek(INTERPOLATION_START)) {
            return null;
        }
        var node = create(NodeType.INTERPOLATION);
        cursor.consume();
        return nested(node, CURLY_OPENERS, CURLY_R, () -> parseInterpolationContent(node));
    }

    private Node parseInterpolationContent(Node node) {
        if (!node.addChild(parseExpr(false)) && !node.addChild(parseNestingSelector())) {
            if (cursor.accept(CURLY_R)) {
                return finish(node);
            }
            return finish(node, ParseError.EXPRESSION_EXPECTED);
        }
        if (!cursor.accept(CURLY_R)) {
            return finish(node, ParseError.RIGHT_CURLY_EXPECTED);
        }
        return finish(node);
    }

    @Override
    protected Node parseTermExpression() {
        return first(this::parseModuleMember,
                     this::parseVariable,
                     this::parseNestingSelector,
                     super::parseTermExpression);
    }

    @Override
    protected Node parseOperator() {
        if (cursor.peek(TokenType.EQUALS_OPERATOR)
            || cursor.peek(TokenType.NOT_EQUALS_OPERATOR)
            || cursor.peek(TokenType.GREATER_EQUALS_OPERATOR)
            || cursor.peek(TokenType.SMALLER_EQUALS_OPERATOR)
            || cursor.peekDelim(">")
            || cursor.peekDelim("<")
            || cursor.peekIdent("and")
            || cursor.peekIdent("or")
            || cursor.peekDelim("%")) {
            return consumeLeaf(NodeType.OPERATOR);
        }
        return super.parseOperator();
    }

    @Override
    protected Node parseUnaryOperator() {
        if (cursor.peekIdent("not")) {
            return consumeLeaf(NodeType.OPERATOR);
        }
        return super.parseUnaryOperator();
    }

    /**
     * Parenthesized list or map: {@code (a, b)}, {@code (key: value, ...)}.
     */
    @Override
    protected Node parseOperation() {
        if (!cursor.peek(PARENTHESIS_L)) {
            return null;
        }
        var node = create(NodeType.UNDEFINED);
        cursor.consume();
        return nested(node, OPENING_PARENTHESIS, PARENTHESIS_R, () -> {
            while (node.addChild(parseListElement())) {
                cursor.accept(COMMA);
            }
            return closeParenthesis(node);
        });
    }

    protected Node parseListElement() {
        var node = create(NodeType.LIST_ENTRY);
        var child = parseBinaryExpr();
        if (child == null) {
            return null;
        }
        if (cursor.accept(COLON)) {
            node.set(Role.KEY, child);
            if (!node.setValue(parseBinaryExpr())) {
                return finish(node, ParseError.EXPRESSION_EXPECTED);
            }
        } else {
            node.setValue(child);
        }
        return finish(node);
    }

    /**
     * {@code url(...)} whose argument is not a plain URL is parsed as an expression.
     */
    @Override
    protected Node parseURLArgument() {
        var mark = cursor.mark();
        var node = super.parseURLArgument();
        if (node != null && cursor.peek(PARENTHESIS_R)) {
            return node;
        }
        cursor.restore(mark);
        var expression = create(NodeType.UNDEFINED);
        expression.addChild(parseBinaryExpr());
        return finish(expression);
    }

    @Override
    protected Node parseFunctionArgument() {
        var node = create(NodeType.FUNCTION_ARGUMENT);
        var mark = cursor.mark();
        var argument = parseVariable();
        if (argument != null) {
            if (cursor.accept(COLON)) {
                node.setIdentifier(argument);
            } else if (cursor.accept(ELLIPSIS)) {
                node.setValue(argument);
                return finish(node);
            } else {
                cursor.restore(mark);
            }
        }
        if (node.setValue(parseExpr(true))) {
            cursor.accept(ELLIPSIS);
            node.addChild(parsePrio());
            return finish(node);
        }
        if (node.setValue(parsePrio())) {
            return finish(node);
        }
        cursor.restore(mark);
        return null;
    }

    // === Selectors ===

    @Override
    protected Node parseSimpleSelectorBody() {
        return first(this::parseSelectorPlaceholder, super::parseSimpleSelectorBody);
    }

    /**
     * {@code &}, optionally extended with a suffix such as {@code &-item} or {@code &__1}.
     */
    @Override
    protected Node parseNestingSelector() {
        if (!cursor.peekDelim("&")) {
            return null;
        }
        var node = create(NodeType.SELECTOR_COMBINATOR);
        cursor.consume();
        while (!cursor.hasWhitespace() && (cursor.acceptDelim("-")
                                           || cursor.accept(NUM)
                                           || cursor.accept(DIMENSION)
                                           || node.addChild(parseIdent())
                                           || cursor.acceptDelim("&"))) {
            // suffix
        }
        return finish(node);
    }

    protected Node parseSelectorPlaceholder() {
        if (cursor.peekDelim("%")) {
            var node = create(NodeType.SELECTOR_PLACEHOLDER);
            cursor.consume();
            node.addChild(parseIdent());
            return finish(node);
        }
        if (cursor.peekKeyword("@at-root")) {
            var node = create(NodeType.SELECTOR_PLACEHOLDER);
            cursor.consume();
            if (cursor.accept(PARENTHESIS_L)) {
                if (!cursor.acceptIdent("with") && !cursor.acceptIdent("without")) {
                    return finish(node, ParseError.IDENTIFIER_EXPECTED);
                }
                if (!cursor.accept(COLON)) {
                    return finish(node, ParseError.COLON_EXPECTED);
                }
                if (!node.addChild(parseIdent())) {
                    return finish(node, ParseError.IDENTIFIER_EXPECTED);
                }
                if (!cursor.accept(PARENTHESIS_R)) {
                    return finish(node, ParseError.RIGHT_PARENTHESIS_EXPECTED, CLOSING_CURLY);
                }
            }
            return finish(node);
        }
        return null;
    }

    /**
     * An element name directly followed by {@code (} is a function call, not a selector.
     */
    @Override
    protected Node parseElementName() {
        var mark = cursor.mark();
        var node = super.parseElementName();
        if (node != null && !cursor.hasWhitespace() && cursor.peek(PARENTHESIS_L)) {
            cursor.restore(mark);
            return null;
        }
        return node;
    }

    @Override
    protected Node tryParsePseudoIdentifier() {
        return first(this::parseInterpolation, super::tryParsePseudoIdentifier);
    }

    // === At-rule hooks ===

    @Override
    protected Node parseMediaCondition() {
        return first(this::parseInterpolation, super::parseMediaCondition);
    }

    @Override
    protected boolean parseMediaFeatureRangeOperator() {
        return cursor.accept(TokenType.SMALLER_EQUALS_OPERATOR)
               || cursor.accept(TokenType.GREATER_EQUALS_OPERATOR)
               || super.parseMediaFeatureRangeOperator();
    }

    @Override
    protected Node parseMediaFeatureName() {
        return first(this::parseModuleMember, this::parseFunction, () -> parseIdent(), this::parseVariable);
    }

    @Override
    protected Node parseSupportsCondition() {
        return first(this::parseInterpolation, super::parseSupportsCondition);
    }

    @Override
    protected Node parseKeyframeSelector() {
        return first(this::tryParseKeyframeSelector,
                     () -> parseControlStatement(this::parseKeyframeSelector),
                     this::parseWarnAndDebug,
                     this::parseMixinReference,
                     this::parseFunctionDeclaration,
                     this::parseVariableDeclaration,
                     this::parseMixinContent);
    }

    // === Control flow ===

    /**
     * {@code @if}, {@code @for}, {@code @each} or {@code @while} whose bodies hold {@code statement}s.
     */
    protected Node parseControlStatement(Production statement) {
        if (!cursor.peek(AT_KEYWORD)) {
            return null;
        }
        return first(() -> parseIfStatement(statement),
                     () -> parseForStatement(statement),
                     () -> parseEachStatement(statement),
                     () -> parseWhileStatement(statement));
    }

    protected Node parseIfStatement(Production statement) {
        if (!cursor.peekKeyword("@if")) {
            return null;
        }
        return parseIfClause(statement);
    }

    // Entered on '@if' or on the 'if' of '@else if'
    private Node parseIfClause(Production statement) {
        var node = create(NodeType.IF_STATEMENT);
        cursor.consume();
        if (!node.setCondition(parseExpr(true))) {
            return finish(node, ParseError.EXPRESSION_EXPECTED);
        }
        parseBlock(node, statement);
        if (cursor.acceptKeyword("@else")) {
            if (cursor.peekIdent("if")) {
                node.set(Role.ELSE_CLAUSE, parseIfClause(statement));
            } else if (cursor.peek(CURLY_L)) {
                node.set(Role.ELSE_CLAUSE, parseBody(create(NodeType.ELSE_CLAUSE), statement));
            }
        }
        return finish(node);
    }

    protected Node parseForStatement(Production statement) {
        if (!cursor.peekKeyword("@for")) {
            return null;
        }
        var node = create(NodeType.FOR_STATEMENT);
        cursor.consume();
        if (!node.setVariable(parseVariable())) {
            return finish(node, ParseError.VARIABLE_NAME_EXPECTED, CLOSING_CURLY);
        }
        if (!cursor.acceptIdent("from")) {
            return finish(node, ScssParseError.FROM_EXPECTED, CLOSING_CURLY);
        }
        if (!node.addChild(parseBinaryExpr())) {
            return finish(node, ParseError.EXPRESSION_EXPECTED, CLOSING_CURLY);
        }
        if (!cursor.acceptIdent("to") && !cursor.acceptIdent("through")) {
            return finish(node, ScssParseError.THROUGH_OR_TO_EXPECTED, CLOSING_CURLY);
        }
        if (!node.addChild(parseBinaryExpr())) {
            return finish(node, ParseError.EXPRESSION_EXPECTED, CLOSING_CURLY);
        }
        return parseBody(node, statement);
    }

    protected Node parseEachStatement(Production statement) {
        if (!cursor.peekKeyword("@each")) {
            return null;
        }
        var node = create(NodeType.EACH_STATEMENT);
        cursor.consume();
        var variables = node.list(Role.VARIABLES);
        if (!variables.addChild(parseVariable())) {
            return finish(node, ParseError.VARIABLE_NAME_EXPECTED, CLOSING_CURLY);
        }
        while (cursor.accept(COMMA)) {
            if (!variables.addChild(parseVariable())) {
                return finish(node, ParseError.VARIABLE_NAME_EXPECTED, CLOSING_CURLY);
            }
        }
        if (!cursor.acceptIdent("in")) {
            return finish(node, ScssParseError.IN_EXPECTED, CLOSING_CURLY);
        }
        if (!node.addChild(parseExpr(false))) {
            return finish(node, ParseError.EXPRESSION_EXPECTED, CLOSING_CURLY);
        }
        return parseBody(node, statement);
    }

    protected Node parseWhileStatement(Production statement) {
        if (!cursor.peekKeyword("@while")) {
            return null;
        }
        var node = create(NodeType.WHILE_STATEMENT);
        cursor.consume();
        if (!node.addChild(parseBinaryExpr())) {
            return finish(node, ParseError.EXPRESSION_EXPECTED, CLOSING_CURLY);
        }
        return parseBody(node, statement);
    }

    /**
     * Statements allowed in a function body: no rulesets, no declarations, no mixin inclusion.
     */
    protected Node parseFunctionBodyDeclaration() {
        return first(this::parseVariableDeclaration,
                     this::parseReturnStatement,
                     this::parseWarnAndDebug,
                     () -> parseControlStatement(this::parseFunctionBodyDeclaration));
    }

    protected Node parseReturnStatement() {
        if (!cursor.peekKeyword("@return")) {
            return null;
        }
        var node = create(NodeType.RETURN_STATEMENT);
        cursor.consume();
        if (!node.addChild(parseExpr(false))) {
            return finish(node, ParseError.EXPRESSION_EXPECTED);
        }
        return finish(node);
    }

    // === Mixins and functions ===

    protected Node parseFunctionDeclaration() {
        if (!cursor.peekKeyword("@function")) {
            return null;
        }
        var node = create(NodeType.FUNCTION_DECLARATION);
        cursor.consume();
        if (!node.setIdentifier(parseIdent(ReferenceType.FUNCTION))) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED, CLOSING_CURLY);
        }
        if (!cursor.accept(PARENTHESIS_L)) {
            return recoverToBody(node, ParseError.LEFT_PARENTHESIS_EXPECTED, this::parseFunctionBodyDeclaration);
        }
        var error = parseParameters(node.list(Role.PARAMETERS));
        if (error.isPresent()) {
            return recoverToBody(node, error.get(), this::parseFunctionBodyDeclaration);
        }
        return parseBody(node, this::parseFunctionBodyDeclaration);
    }

    protected Node parseMixinDeclaration() {
        if (!cursor.peekKeyword("@mixin")) {
            return null;
        }
        var node = create(NodeType.MIXIN_DECLARATION);
        cursor.consume();
        if (!node.setIdentifier(parseIdent(ReferenceType.MIXIN))) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED, CLOSING_CURLY);
        }
        if (cursor.accept(PARENTHESIS_L)) {
            var error = parseParameters(node.list(Role.PARAMETERS));
            if (error.isPresent()) {
                return recoverToBody(node, error.get(), this::parseRuleSetDeclaration);
            }
        }
        return parseBody(node, this::parseRuleSetDeclaration);
    }

    /**
     * Report a malformed header, then parse the body if one follows.
     */
    private Node recoverToBody(Node node, ErrorKind error, Production statement) {
        markError(node, error, NONE, BODY_EDGES);
        if (cursor.peek(CURLY_L)) {
            return parseBody(node, statement);
        }
        return finish(node);
    }

    /**
     * Parameters after an opening parenthesis, up to and including the closing one.
     */
    private Optional<ErrorKind> parseParameters(Node parameters) {
        if (parameters.addChild(parseParameterDeclaration())) {
            while (cursor.accept(COMMA)) {
                if (cursor.peek(PARENTHESIS_R)) {
                    break;
                }
                if (!parameters.addChild(parseParameterDeclaration())) {
                    return Optional.of(ParseError.VARIABLE_NAME_EXPECTED);
                }
            }
        }
        if (!cursor.accept(PARENTHESIS_R)) {
            return Optional.of(ParseError.RIGHT_PARENTHESIS_EXPECTED);
        }
        return Optional.empty();
    }

    /**
     * Arguments after an opening parenthesis, up to and including the closing one.
     */
    private Optional<ErrorKind> parseArguments(Node arguments) {
        if (arguments.addChild(parseFunctionArgument())) {
            while (cursor.accept(COMMA)) {
                if (cursor.peek(PARENTHESIS_R)) {
                    break;
                }
                if (!arguments.addChild(parseFunctionArgument())) {
                    return Optional.of(ParseError.EXPRESSION_EXPECTED);
                }
            }
        }
        if (!cursor.accept(PARENTHESIS_R)) {
            return Optional.of(ParseError.RIGHT_PARENTHESIS_EXPECTED);
        }
        return Optional.empty();
    }

    /**
     * {@code $name}, {@code $name...} or {@code $name: default}.
     */
    protected Node parseParameterDeclaration() {
        var node = create(NodeType.FUNCTION_PARAMETER);
        if (!node.setIdentifier(parseVariable())) {
            return null;
        }
        cursor.accept(ELLIPSIS);
        if (cursor.accept(COLON) && !node.set(Role.DEFAULT_VALUE, parseExpr(true))) {
            return finish(node, ParseError.VARIABLE_VALUE_EXPECTED, NONE, PARAMETER_END);
        }
        return finish(node);
    }

    protected Node parseMixinContent() {
        if (!cursor.peekKeyword("@content")) {
            return null;
        }
        var node = create(NodeType.MIXIN_CONTENT_REFERENCE);
        cursor.consume();
        if (cursor.accept(PARENTHESIS_L)) {
            var error = parseArguments(node.list(Role.ARGUMENTS));
            if (error.isPresent()) {
                return finish(node, error.get());
            }
        }
        return finish(node);
    }

    protected Node parseMixinReference() {
        if (!cursor.peekKeyword("@include")) {
            return null;
        }
        var node = create(NodeType.MIXIN_REFERENCE);
        cursor.consume();
        var firstIdent = parseIdent(ReferenceType.MIXIN);
        if (!node.setIdentifier(firstIdent)) {
            return finish(node, ParseError.IDENTIFIER_EXPECTED, CLOSING_CURLY);
        }
        var mark = cursor.mark();
        if (!cursor.hasWhitespace() && cursor.acceptDelim(".")) {
            if (cursor.hasWhitespace()) {
                cursor.restore(mark);
            } else {
                var secondIdent = parseIdent(ReferenceType.MIXIN);
                if (secondIdent == null) {
                    return finish(node, ParseError.IDENTIFIER_EXPECTED, CLOSING_CURLY);
                }
                var module = Node.create(NodeType.MODULE, firstIdent.offset(), firstIdent.length());
                firstIdent.setReferenceTypes(Set.of(ReferenceType.MODULE));
                module.setIdentifier(firstIdent);
                node.addChild(module);
                node.setIdentifier(secondIdent);
            }
        }
        if (cursor.accept(PARENTHESIS_L)) {
            var error = parseArguments(node.list(Role.ARGUMENTS));
            if (error.isPresent()) {
                return finish(node, error.get());
            }
        }
        if (cursor.peekIdent("using") || cursor.peek(CURLY_L)) {
            node.set(Role.CONTENT, parseMixinContentDeclaration());
        }
        return finish(node);
    }

    /**
     * Content block passed to a mixin, optionally with {@code using ($params)}.
     */
    protected Node parseMixinContentDeclaration() {
        var node = create(NodeType.MIXIN_CONTENT_DECLARATION);
        if (cursor.acceptIdent("using")) {
            if (!cursor.accept(PARENTHESIS_L)) {
                return recoverToBody(node, ParseError.LEFT_PARENTHESIS_EXPECTED, this::parseMixinReferenceBodyStatement);
            }
            var error = parseParameters(node.list(Role.PARAMETERS));
            if (error.isPresent()) {
                return recoverToBody(node, error.get(), this::parseMixinReferenceBodyStatement);
            }
        }
        if (cursor.peek(CURLY_L)) {
            return parseBody(node, this::parseMixinReferenceBodyStatement);
        }
        return finish(node);
    }

    protected Node parseMixinReferenceBodyStatement() {
        return first(this::tryParseKeyframeSelector, this::parseRuleSetDeclaration);
    }

    // === Module system ===

    protected Node parseUse() {
        if (!cursor.peekKeyword("@use")) {
            return null;
        }
        var node = create(NodeType.USE);
        cursor.consume();
        if (!node.addChild(parseStringLiteral())) {
            return finish(node, ParseError.STRING_LITERAL_EXPECTED);
        }
        if (!cursor.peek(SEMICOLON) && !cursor.isAtEnd()) {
            if (!cursor.peekText(IDENT, AS_OR_WITH)) {
                return finish(node, ParseError.UNKNOWN_KEYWORD);
            }
            if (cursor.acceptIdent("as")
                && !node.setIdentifier(parseIdent(ReferenceType.MODULE))
                && !cursor.acceptDelim("*")) {
                return finish(node, ParseError.IDENTIFIER_OR_WILDCARD_EXPECTED);
            }
            if (cursor.acceptIdent("with")) {
                if (!cursor.accept(PARENTHESIS_L)) {
                    return finish(node, ParseError.LEFT_PARENTHESIS_EXPECTED, CLOSING_PARENTHESIS);
                }
                var error = parseModuleConfiguration(node.list(Role.PARAMETERS));
                if (error.isPresent()) {
                    return finish(node, error.get());
                }
            }
        }
        if (!cursor.accept(SEMICOLON) && !cursor.isAtEnd()) {
            return finish(node, ParseError.SEMICOLON_EXPECTED);
        }
        return finish(node);
    }

    /**
     * Configuration entries of {@code with (...)}, after the opening parenthesis.
     */
    private Optional<ErrorKind> parseModuleConfiguration(Node parameters) {
        if (!parameters.addChild(parseModuleConfigDeclaration())) {
            return Optional.of(ParseError.VARIABLE_NAME_EXPECTED);
        }
        while (cursor.accept(COMMA)) {
            if (cursor.peek(PARENTHESIS_R)) {
                break;
            }
            if (!parameters.addChild(parseModuleConfigDeclaration())) {
                return Optional.of(ParseError.VARIABLE_NAME_EXPECTED);
            }
        }
        if (!cursor.accept(PARENTHESIS_R)) {
            return Optional.of(ParseError.RIGHT_PARENTHESIS_EXPECTED);
        }
        return Optional.empty();
    }

    protected Node parseModuleConfigDeclaration() {
        var node = create(NodeType.MODULE_CONFIGURATION);
        if (!node.setIdentifier(parseVariable())) {
            return null;
        }
        if (!cursor.accept(COLON) || !node.setValue(parseExpr(true))) {
            return finish(node, ParseError.VARIABLE_VALUE_EXPECTED, NONE, PARAMETER_END);
        }
        if (cursor.accept(EXCLAMATION) && (cursor.hasWhitespace() || !cursor.acceptIdent("default"))) {
            return finish(node, ParseError.UNKNOWN_KEYWORD);
        }
        return finish(node);
    }

    protected Node parseForward() {
        if (!cursor.peekKeyword("@forward")) {
            return null;
        }
        var node = create(NodeType.FORWARD);
        cursor.consume();
        if (!node.addChild(parseStringLiteral())) {
            return finish(node, ParseError.STRING_LITERAL_EXPECTED);
        }
        if (cursor.acceptIdent("as")) {
            if (!node.setIdentifier(parseIdent(ReferenceType.FORWARD))) {
                return finish(node, ParseError.IDENTIFIER_EXPECTED);
            }
            if (cursor.hasWhitespace() || !cursor.acceptDelim("*")) {
                return finish(node, ParseError.WILDCARD_EXPECTED);
            }
        }
        if (cursor.acceptIdent("with")) {
            if (!cursor.accept(PARENTHESIS_L)) {
                return finish(node, ParseError.LEFT_PARENTHESIS_EXPECTED, CLOSING_PARENTHESIS);
            }
            var error = parseModuleConfiguration(node.list(Role.PARAMETERS));
            if (error.isPresent()) {
                return finish(node, error.get());
            }
        } else if (cursor.peekIdent("hide") || cursor.peekIdent("show")) {
            if (!node.addChild(parseForwardVisibility())) {
                return finish(node, ParseError.IDENTIFIER_OR_VARIABLE_EXPECTED, NONE, SEMICOLON_ONLY);
            }
        }
        if (!cursor.accept(SEMICOLON) && !cursor.isAtEnd()) {
            return finish(node, ParseError.SEMICOLON_EXPECTED);
        }
        return finish(node);
    }

    /**
     * {@code hide|show} followed by member names. A bare keyword without names is no visibility clause.
     */
    protected Node parseForwardVisibility() {
        var mark = cursor.mark();
        var node = create(NodeType.FORWARD_VISIBILITY);
        node.setIdentifier(parseIdent());
        while (node.addChild(first(this::parseVariable, () -> parseIdent()))) {
            cursor.accept(COMMA);
        }
        if (node.children()
                .size() > 1) {
            return finish(node);
        }
        cursor.restore(mark);
        return null;
    }
}
