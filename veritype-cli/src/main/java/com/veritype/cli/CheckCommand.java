package com.veritype.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli check 子命令：在设计的作用域内比较两个类型的兼容性
 */
@Command(name = "check", description = "比较两个类型的匹配、等价、赋值与转换兼容性")
public class CheckCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", paramLabel = "DESIGN",
            description = "JSON 设计文件（省略时只使用内置类型）")
    Path file;

    @Option(names = {"-l", "--left"}, required = true, paramLabel = "TYPE",
            description = "左侧（目标）类型：关键字、类型名或 JSON 类型对象")
    String left;

    @Option(names = {"-r", "--right"}, required = true, paramLabel = "TYPE",
            description = "右侧（源）类型")
    String right;

    @Mixin
    CommonOptions common;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        return new DesignRunner(common, spec.commandLine().getOut(), spec.commandLine().getErr())
                .check(file, left, right);
    }
}
