package com.veritype.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli types 子命令：解析设计并列出全部声明的类型
 */
@Command(name = "types", description = "解析设计文件并列出声明的类型与诊断")
public class TypesCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "DESIGN", description = "JSON 设计文件")
    Path file;

    @Mixin
    CommonOptions common;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        return new DesignRunner(common, spec.commandLine().getOut(), spec.commandLine().getErr())
                .describe(file);
    }
}
