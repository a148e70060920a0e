package com.veritype.cli;

import com.google.gson.JsonObject;
import com.veritype.compiler.Compilation;
import com.veritype.compiler.CompilationOptions;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.SemanticDiagnostic;
import com.veritype.compiler.analysis.Symbol;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.ast.decl.CompilationUnitSyntax;
import com.veritype.compiler.ast.type.DataTypeSyntax;
import com.veritype.compiler.json.DesignFormatException;
import com.veritype.compiler.json.DesignJsonReader;
import com.veritype.compiler.json.TypeJsonWriter;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 子命令的执行器：加载选项与设计文件，驱动编译并输出结果
 */
public class DesignRunner {

    private static final Logger LOG = Logger.getLogger(DesignRunner.class.getName());

    private final CommonOptions common;
    private final PrintWriter out;
    private final PrintWriter err;
    private final TypeJsonWriter writer = new TypeJsonWriter();

    public DesignRunner(CommonOptions common, PrintWriter out, PrintWriter err) {
        this.common = common;
        this.out = out;
        this.err = err;
        if (common.verbose) {
            enableVerboseLogging();
        }
    }

    /**
     * 列出设计中的声明与诊断
     */
    public int describe(Path file) {
        Compilation compilation;
        try {
            compilation = load(file);
        } catch (IOException | DesignFormatException | IllegalArgumentException e) {
            return badInput(e);
        }

        List<SemanticDiagnostic> diagnostics = compilation.getAllDiagnostics();
        if (common.json) {
            JsonObject result = new JsonObject();
            result.add("members", writer.writeScope(compilation.getRoot()));
            result.add("diagnostics", writer.writeDiagnostics(diagnostics));
            out.println(writer.toJson(result));
        } else {
            for (Symbol member : compilation.getRoot().getMembers()) {
                if (member.getKind() == SymbolKind.TRANSPARENT_MEMBER) continue;
                out.println(describeMember(member));
            }
            printDiagnostics(diagnostics);
        }
        out.flush();
        return compilation.hasErrors() ? Main.EXIT_DESIGN_ERRORS : Main.EXIT_OK;
    }

    /**
     * 在设计根作用域的末尾解析两个类型并比较
     */
    public int check(Path file, String leftText, String rightText) {
        Compilation compilation;
        SvType left;
        SvType right;
        try {
            compilation = file != null ? load(file) : new Compilation(loadOptions());
            DesignJsonReader reader = new DesignJsonReader();
            left = resolve(compilation, reader.readType(leftText));
            right = resolve(compilation, reader.readType(rightText));
        } catch (IOException | DesignFormatException | IllegalArgumentException e) {
            return badInput(e);
        }

        List<SemanticDiagnostic> diagnostics = compilation.getAllDiagnostics();
        if (common.json) {
            JsonObject result = new JsonObject();
            result.add("left", writer.writeType(left));
            result.add("right", writer.writeType(right));
            result.addProperty("matching", left.isMatching(right));
            result.addProperty("equivalent", left.isEquivalent(right));
            result.addProperty("assignmentCompatible", left.isAssignmentCompatible(right));
            result.addProperty("castCompatible", left.isCastCompatible(right));
            result.add("diagnostics", writer.writeDiagnostics(diagnostics));
            out.println(writer.toJson(result));
        } else {
            out.println("left:  " + left.toDisplayString());
            out.println("right: " + right.toDisplayString());
            out.println("matching:              " + yesNo(left.isMatching(right)));
            out.println("equivalent:            " + yesNo(left.isEquivalent(right)));
            out.println("assignment compatible: " + yesNo(left.isAssignmentCompatible(right)));
            out.println("cast compatible:       " + yesNo(left.isCastCompatible(right)));
            printDiagnostics(diagnostics);
        }
        out.flush();
        return compilation.hasErrors() ? Main.EXIT_DESIGN_ERRORS : Main.EXIT_OK;
    }

    private Compilation load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        CompilationUnitSyntax unit = new DesignJsonReader().read(file);
        Compilation compilation = new Compilation(loadOptions());
        compilation.addSyntaxTree(unit);
        LOG.fine("loaded " + file + " with " + unit.getMembers().size() + " members");
        return compilation;
    }

    private CompilationOptions loadOptions() throws IOException {
        if (common.config == null) {
            return new CompilationOptions();
        }
        LOG.fine("loading options from " + common.config);
        return CompilationOptions.load(common.config);
    }

    private static SvType resolve(Compilation compilation, DataTypeSyntax syntax) {
        return compilation.getType(syntax, LookupLocation.MAX, compilation.getRoot());
    }

    private String describeMember(Symbol member) {
        StringBuilder sb = new StringBuilder();
        sb.append(member.getKind().name().toLowerCase()).append(' ').append(member.getName());
        if (member instanceof SvType) {
            SvType type = (SvType) member;
            sb.append(" = ").append(type.getCanonicalType().toDisplayString());
            if (type.isIntegral()) {
                sb.append(" (").append(type.getBitWidth()).append(" bits, ")
                        .append(type.isSigned() ? "signed" : "unsigned").append(", ")
                        .append(type.isFourState() ? "4-state" : "2-state").append(')');
            }
        } else {
            JsonObject obj = writer.writeSymbol(member);
            if (obj.has("type")) {
                sb.append(" : ").append(obj.get("type").getAsString());
            }
            if (obj.has("returns")) {
                sb.append(" : ").append(obj.get("returns").getAsString());
            }
            if (obj.has("value")) {
                sb.append(" = ").append(obj.get("value").getAsString());
            }
        }
        return sb.toString();
    }

    private void printDiagnostics(List<SemanticDiagnostic> diagnostics) {
        for (SemanticDiagnostic diag : diagnostics) {
            err.println(diag);
            for (SemanticDiagnostic note : diag.getNotes()) {
                err.println("  " + note);
            }
        }
        err.flush();
    }

    private int badInput(Exception e) {
        if (e instanceof NoSuchFileException) {
            err.println("错误: 文件不存在 - " + e.getMessage());
        } else {
            err.println("错误: " + e.getMessage());
        }
        LOG.log(Level.FINE, "input rejected", e);
        err.flush();
        return Main.EXIT_BAD_INPUT;
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("com.veritype");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            if (handler instanceof ConsoleHandler) return;
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
    }
}
