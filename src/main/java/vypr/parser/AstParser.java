package vypr.parser;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import vypr.CompilerOptions;
import vypr.ast.Program;
import vypr.exception.Diagnostic;
import vypr.exception.SyntaxException;
import vypr.lexer.VyprToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the generated parser over a lexed token list and converts the parse tree to a Program.
 * Fails on the first syntax error; indentation problems the grammar tolerates become warnings.
 */
public class AstParser {
    private final List<VyprToken> tokens;
    private final CompilerOptions options;
    private final List<Diagnostic> warnings = new ArrayList<>();

    public AstParser(List<VyprToken> tokens) {
        this(tokens, CompilerOptions.DEFAULT);
    }

    public AstParser(List<VyprToken> tokens, CompilerOptions options) {
        this.tokens = tokens;
        this.options = options;
    }

    public static Program parse(List<VyprToken> tokens) throws SyntaxException {
        return new AstParser(tokens).parse();
    }

    public Program parse() throws SyntaxException {
        CommonTokenStream stream = new CommonTokenStream(new ListTokenSource(tokens));
        VyprParser parser = new VyprParser(stream);
        parser.removeErrorListeners();
        parser.addErrorListener(new SyntaxErrorListener(options.tabWidth()));
        try {
            VyprParser.ProgramContext tree = parser.program();
            return new AstBuilder(warnings).build(tree);
        } catch (ParseCancellationException e) {
            if (e.getCause() instanceof SyntaxException) {
                throw (SyntaxException) e.getCause();
            }
            throw e;
        }
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }
}
