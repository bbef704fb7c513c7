package org.dxworks.callframe.analyzer;

import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTreeWalker;
import org.dxworks.callframe.analyzer.generated.JavaLexer;
import org.dxworks.callframe.analyzer.generated.JavaParser;
import org.dxworks.callframe.syntax.TraversalListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates Java lexers and parsers with recovering error handling and walks their trees.
 * Syntax errors never abort a file; they are only reported at debug level.
 */
public final class JavaParserFactory {

    private static final Logger log = LoggerFactory.getLogger(JavaParserFactory.class);

    private JavaParserFactory() {
        // utility class
    }

    /**
     * Error listener for best-effort parsing: the parser recovers and the error is logged.
     */
    private static final ANTLRErrorListener LOGGING_LISTENER = new BaseErrorListener() {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            log.debug("syntax error at {}:{} - {}", line, charPositionInLine, msg);
        }
    };

    public static JavaParser createParser(String source) {
        JavaLexer lexer = new JavaLexer(CharStreams.fromString(source));
        configureLexer(lexer);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        JavaParser parser = new JavaParser(tokens);
        configureParser(parser);
        return parser;
    }

    /**
     * Parses {@code source} as a compilation unit and delivers the walk to {@code listener}.
     */
    public static void walk(String source, TraversalListener listener) {
        JavaParser parser = createParser(source);
        JavaParser.CompilationUnitContext tree = parser.compilationUnit();
        ParseTreeWalker.DEFAULT.walk(new JavaTreeBridge(listener), tree);
    }

    private static void configureLexer(Lexer lexer) {
        lexer.removeErrorListeners();
        lexer.addErrorListener(LOGGING_LISTENER);
    }

    private static void configureParser(Parser parser) {
        parser.removeErrorListeners();
        parser.addErrorListener(LOGGING_LISTENER);
        parser.setErrorHandler(new DefaultErrorStrategy());
    }
}
