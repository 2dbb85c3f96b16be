package com.c2en.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;

/**
 * c2en CLI 入口点（picocli）
 */
@Command(name = "c2en",
         version = {"C to British English Compiler (c2en)", "Version: 1.0.0", "C Standard: C99"},
         mixinStandardHelpOptions = true,
         description = "Translates a C source file into a British English description of its behaviour.",
         footer = {"",
                 "Examples:",
                 "  c2en hello.c                    # Compile hello.c to hello.txt",
                 "  c2en factorial.c -o output.txt  # Compile to specific output file",
                 "  c2en test.c -v                  # Compile with verbose output"})
public class Main implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<input.c>", description = "C 源文件")
    String inputFile;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>",
            description = "输出文件（默认：输入文件名改为 .txt 扩展名）")
    String outputFile;

    @Option(names = {"-v", "--verbose"}, description = "显示各编译阶段")
    boolean verbose;

    @Option(names = "--show-tokens", description = "打印词法分析结果")
    boolean showTokens;

    @Option(names = "--show-ast", description = "以 JSON 打印语法树")
    boolean showAst;

    @Option(names = "--indent-size", defaultValue = "2", description = "每层缩进空格数（默认 2）")
    int indentSize;

    @Option(names = "--no-global-definitions", description = "不输出全局定义一节")
    boolean noGlobalDefinitions;

    @Override
    public Integer call() {
        CompileRunner runner = new CompileRunner(System.out, System.err);
        runner.setVerbose(verbose);
        runner.setShowTokens(showTokens);
        runner.setShowAst(showAst);
        runner.getConfig()
                .setIndentSize(indentSize)
                .setIncludeGlobalDefinitions(!noGlobalDefinitions);
        return runner.compileFile(inputFile, outputFile);
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，按系统原生编码输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名，native.encoding（Java 17+）反映操作系统原生编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
