package org.pragmatica.spacing.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.JavaToken;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import org.pragmatica.spacing.core.ParentKinds;
import org.pragmatica.spacing.core.SourceLocation;
import org.pragmatica.spacing.core.TokenKind;
import org.pragmatica.spacing.core.TokenStream;
import org.pragmatica.spacing.core.Trivia;
import org.pragmatica.spacing.core.TriviaAttacher;
import org.pragmatica.spacing.lint.LintError;
import org.pragmatica.spacing.lint.LintException;
import org.pragmatica.spacing.shared.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Token source for Java files backed by JavaParser.
 *
 * <p>Every lexical token is visited, including whitespace and comments, which become trivia.
 * The parent kind of a token is the simple class name of the innermost AST node containing it
 * (e.g. {@code ArrayAccessExpr}, {@code ArrayType}).
 */
public final class JavaTokenStreams {

    private static final Logger log = LoggerFactory.getLogger(JavaTokenStreams.class);

    private JavaTokenStreams() {}

    /**
     * Parse the source and convert it into a token stream.
     *
     * @throws LintException with {@link LintError.ParseError} when the source does not parse
     */
    public static TokenStream tokenStream(SourceFile source) throws LintException {
        var cu = parse(source);
        var attacher = TriviaAttacher.triviaAttacher();
        var cursor = cu.getTokenRange()
                .map(TokenRange::getBegin)
                .map(JavaTokenStreams::rewind);
        var count = 0;

        while (cursor.isPresent()) {
            var token = cursor.get();
            append(attacher, cu, token);
            count++;
            cursor = token.getNextToken();
        }

        log.debug("Read {} lexical tokens from {}", count, source.fileName());
        return attacher.build();
    }

    private static CompilationUnit parse(SourceFile source) throws LintException {
        ParseResult<CompilationUnit> result = createParser().parse(source.content());

        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }

        var problem = result.getProblems().stream().findFirst();
        var begin = problem.flatMap(Problem::getLocation)
                .map(TokenRange::getBegin)
                .flatMap(JavaToken::getRange);
        var line = begin.map(range -> range.begin.line).orElse(1);
        var column = begin.map(range -> range.begin.column).orElse(1);
        var message = problem.map(Problem::getMessage).orElse("Unknown parse error");

        throw LintError.parseError(source.fileName(), line, column, message).exception();
    }

    private static JavaParser createParser() {
        var configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setStoreTokens(true);
        return new JavaParser(configuration);
    }

    private static JavaToken rewind(JavaToken token) {
        var first = token;
        var previous = first.getPreviousToken();

        while (previous.isPresent()) {
            first = previous.get();
            previous = first.getPreviousToken();
        }
        return first;
    }

    private static void append(TriviaAttacher attacher, CompilationUnit cu, JavaToken token) {
        var text = token.getText();

        if (token.getKind() == JavaToken.Kind.EOF.getKind()) {
            attacher.token(TokenKind.END_OF_FILE, "", ParentKinds.UNKNOWN, location(token));
            return;
        }

        switch (token.getCategory()) {
            case WHITESPACE_NO_EOL -> attacher.trivia(Trivia.whitespace(text));
            case EOL -> attacher.trivia(Trivia.endOfLine(text));
            case COMMENT -> appendComment(attacher, text);
            default -> appendToken(attacher, cu, token);
        }
    }

    private static void appendToken(TriviaAttacher attacher, CompilationUnit cu, JavaToken token) {
        var kind = tokenKind(token);
        // parent kinds are only consulted for opening brackets
        var parentKind = kind == TokenKind.OPEN_BRACKET
                         ? parentKind(cu, token)
                         : ParentKinds.UNKNOWN;

        attacher.token(kind, token.getText(), parentKind, location(token));
    }

    private static void appendComment(TriviaAttacher attacher, String text) {
        // a line comment may carry its terminator depending on the lexer version
        var body = text.stripTrailing();
        attacher.trivia(Trivia.comment(body));

        if (body.length() < text.length() && (text.endsWith("\n") || text.endsWith("\r"))) {
            attacher.trivia(Trivia.endOfLine(text.substring(body.length())));
        }
    }

    static TokenKind tokenKind(JavaToken token) {
        return switch (JavaToken.Kind.valueOf(token.getKind())) {
            case LBRACKET -> TokenKind.OPEN_BRACKET;
            case RBRACKET -> TokenKind.CLOSE_BRACKET;
            case LPAREN -> TokenKind.OPEN_PAREN;
            case RPAREN -> TokenKind.CLOSE_PAREN;
            case NEW -> TokenKind.NEW_KEYWORD;
            case EOF -> TokenKind.END_OF_FILE;
            default -> categoryKind(token.getCategory());
        };
    }

    private static TokenKind categoryKind(JavaToken.Category category) {
        return switch (category) {
            case KEYWORD -> TokenKind.KEYWORD;
            case IDENTIFIER -> TokenKind.IDENTIFIER;
            case LITERAL -> TokenKind.LITERAL;
            case SEPARATOR -> TokenKind.SEPARATOR;
            case OPERATOR -> TokenKind.OPERATOR;
            default -> TokenKind.OTHER;
        };
    }

    private static SourceLocation location(JavaToken token) {
        return token.getRange()
                .map(range -> SourceLocation.sourceLocation(range.begin.line - 1, range.begin.column - 1))
                .orElse(SourceLocation.unknown());
    }

    private static String parentKind(CompilationUnit cu, JavaToken token) {
        return token.getRange()
                .map(range -> innermostNode(cu, range.begin).getClass().getSimpleName())
                .orElse(ParentKinds.UNKNOWN);
    }

    private static Node innermostNode(Node root, Position position) {
        var current = root;
        var child = enclosingChild(current, position);

        while (child.isPresent()) {
            current = child.get();
            child = enclosingChild(current, position);
        }
        return current;
    }

    private static Optional<Node> enclosingChild(Node node, Position position) {
        return node.getChildNodes()
                .stream()
                .filter(child -> child.getRange()
                        .map(range -> !position.isBefore(range.begin) && !position.isAfter(range.end))
                        .orElse(false))
                .findFirst();
    }
}
