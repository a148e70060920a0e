package com.veritype.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * 各子命令共用的选项
 */
public class CommonOptions {

    @Option(names = "--json", description = "以 JSON 格式输出")
    boolean json;

    @Option(names = "--config", paramLabel = "FILE",
            description = "编译选项文件（alias.maxDepth, errors.limit, warnings.suppress）")
    Path config;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;
}
