package com.c2en.compiler.pipeline;

import com.c2en.compiler.analysis.AnalysisResult;
import com.c2en.compiler.analysis.SemanticAnalyzer;
import com.c2en.compiler.ast.decl.Program;
import com.c2en.compiler.lexer.Lexer;
import com.c2en.compiler.lexer.Token;
import com.c2en.compiler.parser.ParseResult;
import com.c2en.compiler.parser.Parser;
import com.c2en.compiler.translator.ProseTranslator;
import com.c2en.compiler.translator.TranslationConfig;

import java.io.PrintStream;
import java.util.List;
import java.util.logging.Logger;

/**
 * 编译流水线：词法分析 → 语法分析 → 语义检查 → 翻译。
 *
 * <p>各阶段按顺序执行，任一阶段失败即停止；诊断信息写入错误流。</p>
 */
public class CompilationPipeline {
    private static final Logger LOG = Logger.getLogger(CompilationPipeline.class.getName());

    private final TranslationConfig config;
    private final PrintStream errStream;

    public CompilationPipeline() {
        this(new TranslationConfig(), System.err);
    }

    public CompilationPipeline(TranslationConfig config, PrintStream errStream) {
        this.config = config;
        this.errStream = errStream;
    }

    /**
     * 编译一段源码
     *
     * @param source   C 源码
     * @param fileName 诊断信息中显示的文件名
     */
    public CompilationResult compile(String source, String fileName) {
        LOG.fine("Performing lexical analysis...");
        Lexer lexer = new Lexer(source, fileName, errStream);
        List<Token> tokens = lexer.scanTokens();
        if (lexer.hasError()) {
            return failed(CompilationStage.LEX, tokens, null, null, null);
        }

        LOG.fine(() -> "Performing syntax analysis of " + tokens.size() + " tokens...");
        ParseResult parsed = new Parser(tokens, fileName, errStream).parse();
        if (!parsed.isSuccess()) {
            return failed(CompilationStage.PARSE, tokens, null, parsed, null);
        }
        Program program = parsed.getProgram();

        LOG.fine("Performing semantic analysis...");
        AnalysisResult analysis = new SemanticAnalyzer(errStream).analyze(program);
        if (!analysis.isSuccess()) {
            return failed(CompilationStage.CHECK, tokens, program, parsed, analysis);
        }

        LOG.fine("Translating to British English...");
        String output = new ProseTranslator().translate(program, config);
        return new CompilationResult(null, tokens, program, parsed.getErrors(), analysis.getDiagnostics(), output);
    }

    private CompilationResult failed(CompilationStage stage, List<Token> tokens, Program program,
                                     ParseResult parsed, AnalysisResult analysis) {
        LOG.fine(() -> "Stage '" + stage.getDisplayName() + "' failed");
        return new CompilationResult(stage, tokens, program,
                parsed != null ? parsed.getErrors() : null,
                analysis != null ? analysis.getDiagnostics() : null,
                null);
    }
}
