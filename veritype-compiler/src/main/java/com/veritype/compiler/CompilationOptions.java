package com.veritype.compiler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * 编译选项
 */
public class CompilationOptions {
    private int maxAliasChainDepth = 64;
    private int errorLimit = 0;
    private boolean suppressWarnings = false;

    public CompilationOptions() {
    }

    /**
     * typedef 别名链长度的硬上限（默认 64）。规范化时链上的别名数超过该值即抛出
     * {@link InternalCompilerError}，即使链中没有环；环本身由访问集合单独检测。
     * 需要更长的链时通过 alias.maxDepth 调高。
     */
    public int getMaxAliasChainDepth() {
        return maxAliasChainDepth;
    }

    public void setMaxAliasChainDepth(int maxAliasChainDepth) {
        if (maxAliasChainDepth <= 0) {
            throw new IllegalArgumentException("maxAliasChainDepth must be positive");
        }
        this.maxAliasChainDepth = maxAliasChainDepth;
    }

    /** 保留的错误诊断上限，0 表示不限 */
    public int getErrorLimit() {
        return errorLimit;
    }

    public void setErrorLimit(int errorLimit) {
        if (errorLimit < 0) {
            throw new IllegalArgumentException("errorLimit must not be negative");
        }
        this.errorLimit = errorLimit;
    }

    public boolean isSuppressWarnings() {
        return suppressWarnings;
    }

    public void setSuppressWarnings(boolean suppressWarnings) {
        this.suppressWarnings = suppressWarnings;
    }

    /**
     * 从 properties 读取选项；未出现的键保持默认值。
     * 支持的键：alias.maxDepth, errors.limit, warnings.suppress
     */
    public static CompilationOptions fromProperties(Properties props) {
        CompilationOptions options = new CompilationOptions();
        String depth = props.getProperty("alias.maxDepth");
        if (depth != null) options.setMaxAliasChainDepth(parseInt("alias.maxDepth", depth));
        String limit = props.getProperty("errors.limit");
        if (limit != null) options.setErrorLimit(parseInt("errors.limit", limit));
        String suppress = props.getProperty("warnings.suppress");
        if (suppress != null) options.setSuppressWarnings(Boolean.parseBoolean(suppress.trim()));
        return options;
    }

    public static CompilationOptions load(Path file) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return fromProperties(props);
    }

    private static int parseInt(String key, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer for '" + key + "': " + text, e);
        }
    }
}
