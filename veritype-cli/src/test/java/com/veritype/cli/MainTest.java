package com.veritype.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = Main.createCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path design(String name, String json) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, json.replace('\'', '"').getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private Path cleanDesign() throws IOException {
        return design("clean.json", "{'file': 'clean.sv', 'members': ["
                + "{'decl': 'typedef', 'name': 'word_t', 'type': {'kind': 'logic', 'dims': [[15, 0]]}},"
                + "{'decl': 'typedef', 'name': 'state_t', 'type': {'kind': 'enum', 'members': ['IDLE', 'RUN']}},"
                + "{'decl': 'parameter', 'name': 'W', 'value': 8},"
                + "{'decl': 'variable', 'type': 'word_t', 'names': ['bus']}]}");
    }

    @Test
    @DisplayName("无子命令时打印用法")
    void usageWithoutSubcommand() {
        assertThat(run()).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).contains("Usage: veritype").contains("types").contains("check");
    }

    @Test
    @DisplayName("未知选项的退出码为 2")
    void invalidInput() {
        assertThat(run("types", "--no-such-option")).isEqualTo(Main.EXIT_BAD_INPUT);
        assertThat(run("check", "-l", "int")).isEqualTo(Main.EXIT_BAD_INPUT);
    }

    @Nested
    @DisplayName("types")
    class Types {

        @Test
        @DisplayName("文本输出每个声明一行")
        void textOutput() throws IOException {
            int code = run("types", cleanDesign().toString());

            assertThat(code).isEqualTo(Main.EXIT_OK);
            assertThat(out.toString())
                    .contains("type_alias word_t = logic[15:0] (16 bits, unsigned, 4-state)")
                    .contains("type_alias state_t = enum{IDLE,RUN} (32 bits, signed, 2-state)")
                    .contains("parameter W : bit signed[31:0] = 32'sd8")
                    .contains("variable bus : word_t")
                    .doesNotContain("transparent_member");
            assertThat(err.toString()).isEmpty();
        }

        @Test
        @DisplayName("JSON 输出包含成员与诊断")
        void jsonOutput() throws IOException {
            int code = run("types", "--json", cleanDesign().toString());

            assertThat(code).isEqualTo(Main.EXIT_OK);
            JsonObject result = JsonParser.parseString(out.toString()).getAsJsonObject();
            JsonArray members = result.getAsJsonArray("members");
            assertThat(members.size()).isEqualTo(4);
            assertThat(members.get(0).getAsJsonObject().get("name").getAsString()).isEqualTo("word_t");
            assertThat(members.get(0).getAsJsonObject().get("width").getAsInt()).isEqualTo(16);
            assertThat(result.getAsJsonArray("diagnostics").size()).isZero();
        }

        @Test
        @DisplayName("存在语义错误时退出码为 1，诊断写到 stderr")
        void designErrors() throws IOException {
            Path file = design("bad.json", "{'file': 'bad.sv', 'members': ["
                    + "{'decl': 'typedef', 'name': 't', 'type': {'kind': 'named', 'name': 'missing', 'line': 2, 'column': 5}}]}");

            assertThat(run("types", file.toString())).isEqualTo(Main.EXIT_DESIGN_ERRORS);
            assertThat(err.toString()).contains("bad.sv:2:5: error: 未声明的标识符 'missing' [UndeclaredIdentifier]");
        }

        @Test
        @DisplayName("配置文件可以抑制警告与限制错误数")
        void configFile() throws IOException {
            Path file = design("many.json", "{'members': ["
                    + "{'decl': 'typedef', 'name': 'a', 'type': 'x1'},"
                    + "{'decl': 'typedef', 'name': 'b', 'type': 'x2'},"
                    + "{'decl': 'typedef', 'name': 'c', 'type': 'x3'}]}");
            Path config = dir.resolve("veritype.properties");
            Files.write(config, "errors.limit=1\n".getBytes(StandardCharsets.UTF_8));

            assertThat(run("types", "--json", "--config", config.toString(), file.toString()))
                    .isEqualTo(Main.EXIT_DESIGN_ERRORS);
            JsonObject result = JsonParser.parseString(out.toString()).getAsJsonObject();
            assertThat(result.getAsJsonArray("diagnostics").size()).isEqualTo(1);
        }

        @Test
        @DisplayName("文件不存在或格式错误时退出码为 2")
        void badInput() throws IOException {
            assertThat(run("types", dir.resolve("absent.json").toString())).isEqualTo(Main.EXIT_BAD_INPUT);
            assertThat(err.toString()).contains("错误: 文件不存在");

            Path broken = design("broken.json", "{'members': [{'decl': 'module'}]}");
            assertThat(run("types", broken.toString())).isEqualTo(Main.EXIT_BAD_INPUT);
            assertThat(err.toString()).contains("members[0].decl");
        }

        @Test
        @DisplayName("配置文件中的非法值同样是输入错误")
        void badConfig() throws IOException {
            Path config = dir.resolve("bad.properties");
            Files.write(config, "errors.limit=lots\n".getBytes(StandardCharsets.UTF_8));

            assertThat(run("types", "--config", config.toString(), cleanDesign().toString()))
                    .isEqualTo(Main.EXIT_BAD_INPUT);
            assertThat(err.toString()).contains("errors.limit");
        }
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("不带设计文件时比较内置类型")
        void builtinTypes() {
            assertThat(run("check", "-l", "int", "-r", "integer")).isEqualTo(Main.EXIT_OK);
            assertThat(out.toString())
                    .contains("left:  int")
                    .contains("right: integer")
                    .contains("matching:              no")
                    .contains("equivalent:            no")
                    .contains("assignment compatible: yes")
                    .contains("cast compatible:       yes");
        }

        @Test
        @DisplayName("JSON 类型对象与设计中的类型名")
        void namedTypesFromDesign() throws IOException {
            int code = run("check", cleanDesign().toString(), "--json",
                    "-l", "word_t", "-r", "{\"kind\": \"logic\", \"dims\": [[15, 0]]}");

            assertThat(code).isEqualTo(Main.EXIT_OK);
            JsonObject result = JsonParser.parseString(out.toString()).getAsJsonObject();
            assertThat(result.get("matching").getAsBoolean()).isTrue();
            assertThat(result.get("equivalent").getAsBoolean()).isTrue();
            assertThat(result.get("assignmentCompatible").getAsBoolean()).isTrue();
            assertThat(result.get("castCompatible").getAsBoolean()).isTrue();
            assertThat(result.getAsJsonObject("left").get("name").getAsString()).isEqualTo("word_t");
        }

        @Test
        @DisplayName("枚举只能通过转换接收整数")
        void enumTarget() throws IOException {
            assertThat(run("check", cleanDesign().toString(), "-l", "state_t", "-r", "int"))
                    .isEqualTo(Main.EXIT_OK);
            assertThat(out.toString())
                    .contains("assignment compatible: no")
                    .contains("cast compatible:       yes");
        }

        @Test
        @DisplayName("未知类型名是设计错误")
        void unknownType() {
            assertThat(run("check", "-l", "int", "-r", "mystery_t")).isEqualTo(Main.EXIT_DESIGN_ERRORS);
            assertThat(out.toString()).contains("right: <error>");
            assertThat(err.toString()).contains("UndeclaredIdentifier");
        }

        @Test
        @DisplayName("无法解析的类型对象是输入错误")
        void malformedType() {
            assertThat(run("check", "-l", "int", "-r", "{\"kind\": 42}")).isEqualTo(Main.EXIT_BAD_INPUT);
            assertThat(err.toString()).contains("错误:");
        }
    }
}
