package com.veritype.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CompilationOptionsTest {

    @Test
    @DisplayName("默认值")
    void defaults() {
        CompilationOptions options = new CompilationOptions();

        assertEquals(64, options.getMaxAliasChainDepth());
        assertEquals(0, options.getErrorLimit());
        assertFalse(options.isSuppressWarnings());
    }

    @Test
    @DisplayName("从文件加载，未出现的键保持默认")
    void loadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("veritype.properties");
        Files.write(file, "errors.limit = 5\nwarnings.suppress=true\n".getBytes(StandardCharsets.UTF_8));

        CompilationOptions options = CompilationOptions.load(file);

        assertEquals(5, options.getErrorLimit());
        assertTrue(options.isSuppressWarnings());
        assertEquals(64, options.getMaxAliasChainDepth());
    }

    @Test
    @DisplayName("非法整数报告键名")
    void invalidInteger() {
        Properties props = new Properties();
        props.setProperty("alias.maxDepth", "deep");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CompilationOptions.fromProperties(props));
        assertTrue(e.getMessage().contains("alias.maxDepth"));
    }

    @Test
    @DisplayName("取值范围检查")
    void rangeChecks() {
        CompilationOptions options = new CompilationOptions();

        assertThrows(IllegalArgumentException.class, () -> options.setMaxAliasChainDepth(0));
        assertThrows(IllegalArgumentException.class, () -> options.setErrorLimit(-1));

        Properties props = new Properties();
        props.setProperty("errors.limit", "-3");
        assertThrows(IllegalArgumentException.class, () -> CompilationOptions.fromProperties(props));
    }

    @Test
    @DisplayName("文件不存在时抛出 IOException")
    void missingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> CompilationOptions.load(dir.resolve("absent.properties")));
    }
}
