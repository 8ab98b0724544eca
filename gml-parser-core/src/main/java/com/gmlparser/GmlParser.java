package com.gmlparser;

import com.gmlparser.ast.Comment;
import com.gmlparser.ast.Program;
import com.gmlparser.ast.Whitespace;
import com.gmlparser.builder.GmlAstBuilder;
import com.gmlparser.diagnostics.GmlSyntaxError;
import com.gmlparser.diagnostics.LexerErrorListener;
import com.gmlparser.diagnostics.ParserErrorListener;
import com.gmlparser.diagnostics.SyntaxErrorFormatter;
import com.gmlparser.grammar.GameMakerLanguageLexer;
import com.gmlparser.grammar.GameMakerLanguageParser;
import com.gmlparser.grammar.LineBreaks;
import com.gmlparser.grammar.ParseNode;
import com.gmlparser.grammar.Token;
import com.gmlparser.hidden.HiddenTokenProcessor;
import com.gmlparser.sanitize.ConditionalAssignmentSanitizer;
import com.gmlparser.sanitize.IndexMapper;
import com.gmlparser.sanitize.LocationRemapper;
import com.gmlparser.sanitize.SanitizedSource;
import com.gmlparser.scope.GlobalIdentifierRegistry;
import com.gmlparser.scope.IdentifierRoleTracker;
import com.gmlparser.scope.IdentifierScopeCoordinator;
import com.gmlparser.scope.ScopeOccurrences;
import com.gmlparser.scope.ScopeTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point: GML source text in, located AST out.
 *
 * <p>Each call runs the whole pipeline on fresh state (sanitize, lex, parse, classify
 * hidden tokens, build, remap), so concurrent calls need no coordination.</p>
 */
public final class GmlParser {
    private static final Logger log = LoggerFactory.getLogger(GmlParser.class);

    private GmlParser() {
    }

    public static Program parse(String source) {
        return parse(source, ParserOptions.defaults());
    }

    /**
     * @throws GmlSyntaxError                                  if the source is not valid GML
     * @throws com.gmlparser.diagnostics.AstBuildException    if the parse tree and the builder disagree
     */
    public static Program parse(String source, ParserOptions options) {
        return run(source, options).program();
    }

    public static ParseResult tryParse(String source) {
        return tryParse(source, ParserOptions.defaults());
    }

    /**
     * Like {@link #parse(String, ParserOptions)}, but a syntax error comes back as a
     * {@link ParseResult.Failure}. Builder errors are still thrown.
     */
    public static ParseResult tryParse(String source, ParserOptions options) {
        try {
            return run(source, options);
        } catch (GmlSyntaxError e) {
            log.debug("Parse failed: {}", e.getMessage());
            return new ParseResult.Failure(e);
        }
    }

    private static ParseResult.Success run(String source, ParserOptions options) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
        long started = System.nanoTime();

        SanitizedSource sanitized = options.sanitizeConditionalAssignments()
            ? ConditionalAssignmentSanitizer.sanitize(source)
            : SanitizedSource.unchanged(source);

        ParseResult.Success result;
        try {
            result = build(sanitized.text(), options);
        } catch (StackOverflowError e) {
            throw SyntaxErrorFormatter.nestingDepthError(e);
        } catch (GmlSyntaxError e) {
            throw sanitized.isModified() ? toOriginalColumn(e, sanitized) : e;
        }

        if (sanitized.isModified()) {
            LocationRemapper.remap(result, sanitized.indexMapper());
        }

        if (log.isDebugEnabled()) {
            log.debug("Parsed {} chars into {} statement(s), {} comment(s) in {} us",
                source.length(), result.program().body().size(), result.comments().size(),
                (System.nanoTime() - started) / 1_000);
        }
        return result;
    }

    /**
     * Sanitizing only inserts characters within a line, so the line stays and the column
     * shifts by the insertions between the line start and the error.
     */
    private static GmlSyntaxError toOriginalColumn(GmlSyntaxError error, SanitizedSource sanitized) {
        if (error.getLine() == null || error.getColumn() == null) {
            return error;
        }
        int lineStart = LineBreaks.lineStart(sanitized.text(), error.getLine());
        if (lineStart < 0) {
            return error;
        }
        IndexMapper mapper = sanitized.indexMapper();
        int column = mapper.map(lineStart + error.getColumn()) - mapper.map(lineStart);
        return column == error.getColumn() ? error : SyntaxErrorFormatter.withColumn(error, column);
    }

    private static ParseResult.Success build(String text, ParserOptions options) {
        GameMakerLanguageLexer lexer = new GameMakerLanguageLexer(text);
        lexer.removeErrorListeners();
        lexer.addErrorListener(new LexerErrorListener());
        List<Token> tokens = lexer.tokenize();

        GameMakerLanguageParser parser = new GameMakerLanguageParser(tokens, options.maxNestingDepth());
        parser.removeErrorListeners();
        parser.addErrorListener(new ParserErrorListener());
        ParseNode tree = parser.program();

        List<Comment> comments = new ArrayList<>();
        List<Whitespace> whitespaces = new ArrayList<>();
        new HiddenTokenProcessor(comments, whitespaces).processAll(tokens);

        ScopeTracker scopeTracker = new ScopeTracker(options.scopeTracking());
        GmlAstBuilder builder = new GmlAstBuilder(
            new IdentifierScopeCoordinator(scopeTracker, new IdentifierRoleTracker()),
            new GlobalIdentifierRegistry()
        );
        Program program = builder.build(tree);
        if (options.getComments()) {
            program = program.withComments(comments);
        }

        List<ScopeOccurrences> scopes = scopeTracker.isEnabled() ? scopeTracker.exportOccurrences() : List.of();
        return new ParseResult.Success(program, comments, whitespaces, scopes);
    }
}
