package com.c2en.cli;

import com.c2en.compiler.json.AstJsonWriter;
import com.c2en.compiler.lexer.Token;
import com.c2en.compiler.pipeline.CompilationPipeline;
import com.c2en.compiler.pipeline.CompilationResult;
import com.c2en.compiler.translator.TranslationConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * 编译执行器：读取源文件，运行编译流水线并写出英文说明
 */
public class CompileRunner {
    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    private final PrintStream out;
    private final PrintStream err;
    private final TranslationConfig config = new TranslationConfig();
    private boolean verbose;
    private boolean showTokens;
    private boolean showAst;

    public CompileRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public TranslationConfig getConfig() {
        return config;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public void setShowTokens(boolean showTokens) {
        this.showTokens = showTokens;
    }

    public void setShowAst(boolean showAst) {
        this.showAst = showAst;
    }

    /**
     * 编译文件
     *
     * @param inputFile  C 源文件路径
     * @param outputFile 输出路径，null 时由输入路径推导
     * @return 进程退出码，0 成功，1 失败
     */
    public int compileFile(String inputFile, String outputFile) {
        ConsoleLogging.install(err, verbose);
        if (outputFile == null) {
            outputFile = defaultOutputPath(inputFile);
        }
        LOG.fine("Starting compilation of " + inputFile);

        LOG.fine("Reading source file...");
        String source;
        try {
            source = new String(Files.readAllBytes(Paths.get(inputFile)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("[ERROR] Failed to read input file: " + inputFile);
            return 1;
        }

        CompilationPipeline pipeline = new CompilationPipeline(config, err);
        CompilationResult result = pipeline.compile(source, inputFile);

        if (showTokens) {
            printTokens(result);
        }
        if (showAst && result.getProgram() != null) {
            out.println();
            out.println("=== ABSTRACT SYNTAX TREE ===");
            out.println(new AstJsonWriter().toJson(result.getProgram()));
            out.println();
        }

        if (!result.isSuccess()) {
            err.println("[ERROR] " + result.getFailedStage().getFailureMessage());
            return 1;
        }

        LOG.fine("Writing output to " + outputFile);
        try {
            Path target = Paths.get(outputFile);
            Files.write(target, result.getOutput().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            err.println("[ERROR] Failed to write output file: " + outputFile);
            return 1;
        }

        LOG.fine("Compilation completed successfully!");
        out.println("Successfully compiled " + inputFile + " to " + outputFile);
        return 0;
    }

    private void printTokens(CompilationResult result) {
        out.println();
        out.println("=== TOKENS ===");
        for (Token token : result.getTokens()) {
            out.println(String.format("%d:%d  %-15s  '%s'",
                    token.getLine(), token.getColumn(), token.getType().name(), token.getLexeme()));
        }
        out.println();
    }

    /**
     * 默认输出路径：去掉结尾的 .c 后追加 .txt
     */
    static String defaultOutputPath(String inputFile) {
        if (inputFile.length() > 2 && inputFile.endsWith(".c")) {
            return inputFile.substring(0, inputFile.length() - 2) + ".txt";
        }
        return inputFile + ".txt";
    }
}
