package com.veritype.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.logging.LogManager;

/**
 * veritype 命令行入口（picocli）
 */
@Command(name = "veritype", version = "veritype 0.1.0",
         mixinStandardHelpOptions = true,
         description = "SystemVerilog 类型系统分析工具",
         subcommands = {TypesCommand.class, CheckCommand.class})
public class Main implements Runnable {

    /** 正常结束 */
    static final int EXIT_OK = 0;
    /** 设计存在语义错误 */
    static final int EXIT_DESIGN_ERRORS = 1;
    /** 输入文件或参数无法处理 */
    static final int EXIT_BAD_INPUT = 2;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new Main());
        cmd.getCommandSpec().exitCodeOnInvalidInput(EXIT_BAD_INPUT);
        return cmd;
    }

    public static void main(String[] args) {
        loadLoggingConfig();
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = createCommandLine();
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(createCommandLine().execute(args));
        }
    }

    private static void loadLoggingConfig() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("警告: 无法加载日志配置 - " + e.getMessage());
        }
    }

    /**
     * 控制台实际使用的字符编码；Windows 控制台通常仍为 GBK/CP936
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
