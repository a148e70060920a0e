package com.veritype.compiler.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.veritype.compiler.ast.NameSyntax;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.decl.CompilationUnitSyntax;
import com.veritype.compiler.ast.decl.DataDeclarationSyntax;
import com.veritype.compiler.ast.decl.ForwardTypedefDeclarationSyntax;
import com.veritype.compiler.ast.decl.FunctionDeclarationSyntax;
import com.veritype.compiler.ast.decl.MemberSyntax;
import com.veritype.compiler.ast.decl.NetTypeDeclarationSyntax;
import com.veritype.compiler.ast.decl.ParameterDeclarationSyntax;
import com.veritype.compiler.ast.decl.TypedefDeclarationSyntax;
import com.veritype.compiler.ast.expr.BinaryExpressionSyntax;
import com.veritype.compiler.ast.expr.ExpressionSyntax;
import com.veritype.compiler.ast.expr.IntegerLiteralSyntax;
import com.veritype.compiler.ast.expr.NameExpressionSyntax;
import com.veritype.compiler.ast.expr.RealLiteralSyntax;
import com.veritype.compiler.ast.expr.StringLiteralSyntax;
import com.veritype.compiler.ast.expr.UnaryExpressionSyntax;
import com.veritype.compiler.ast.type.DataTypeSyntax;
import com.veritype.compiler.ast.type.DeclaratorSyntax;
import com.veritype.compiler.ast.type.EnumTypeSyntax;
import com.veritype.compiler.ast.type.ImplicitTypeSyntax;
import com.veritype.compiler.ast.type.IntegerTypeSyntax;
import com.veritype.compiler.ast.type.KeywordTypeSyntax;
import com.veritype.compiler.ast.type.NamedTypeSyntax;
import com.veritype.compiler.ast.type.Signing;
import com.veritype.compiler.ast.type.StructTypeSyntax;
import com.veritype.compiler.ast.type.TypeKeyword;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * 把 JSON 形式的设计描述读成语法树。
 *
 * <pre>
 * { "file": "top.sv",
 *   "members": [
 *     { "decl": "typedef", "name": "word_t", "type": { "kind": "logic", "dims": [[15, 0]] } },
 *     { "decl": "parameter", "name": "W", "type": "int", "value": 8 },
 *     { "decl": "variable", "type": "word_t", "names": ["a", "b"] } ] }
 * </pre>
 *
 * 类型可以是字符串（关键字或类型名），也可以是带 kind 的对象；
 * 维度 [l, r] 为范围，[] 为未定大小，其他值按大小表达式处理；
 * 表达式中 JSON 数字为字面量，字符串为标识符。
 */
public final class DesignJsonReader {

    private static final Logger LOG = Logger.getLogger(DesignJsonReader.class.getName());

    private String file = "<json>";

    public CompilationUnitSyntax read(Path path) throws IOException {
        file = path.getFileName().toString();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public CompilationUnitSyntax read(String text) {
        return read(new StringReader(text));
    }

    public CompilationUnitSyntax read(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new DesignFormatException("$", "JSON 语法错误: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new DesignFormatException("$", "顶层必须是对象");
        }
        JsonObject obj = root.getAsJsonObject();
        if (obj.has("file")) {
            file = obj.get("file").getAsString();
        }
        JsonArray members = requireArray(obj, "members", "$");
        List<MemberSyntax> result = new ArrayList<MemberSyntax>();
        for (int i = 0; i < members.size(); i++) {
            String path = "members[" + i + "]";
            result.add(readMember(requireObject(members.get(i), path), path));
        }
        LOG.fine("读取设计 " + file + "，共 " + result.size() + " 个成员");
        return new CompilationUnitSyntax(new SourceLocation(file, 1, 1), result);
    }

    /**
     * 读取单个类型描述：以 { 开头时按 JSON 类型对象解析，否则视为关键字或类型名
     */
    public DataTypeSyntax readType(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("{")) {
            return readType(new JsonPrimitive(trimmed), "$");
        }
        try {
            return readType(JsonParser.parseString(trimmed), "$");
        } catch (JsonParseException e) {
            throw new DesignFormatException("$", "JSON 语法错误: " + e.getMessage(), e);
        }
    }

    // ============ 声明 ============

    private MemberSyntax readMember(JsonObject obj, String path) {
        String decl = requireString(obj, "decl", path);
        SourceLocation loc = location(obj);
        switch (decl) {
            case "typedef":
                return new TypedefDeclarationSyntax(loc, requireString(obj, "name", path),
                        readType(require(obj, "type", path), path + ".type"),
                        readDims(obj.get("dims"), path + ".dims"));
            case "forwardTypedef":
                return new ForwardTypedefDeclarationSyntax(loc, requireString(obj, "name", path),
                        readForwardKeyword(obj, path));
            case "nettype":
                return new NetTypeDeclarationSyntax(loc, requireString(obj, "name", path),
                        readType(require(obj, "type", path), path + ".type"),
                        obj.has("with") ? obj.get("with").getAsString() : null);
            case "parameter":
                return new ParameterDeclarationSyntax(loc, requireString(obj, "name", path),
                        obj.has("type") ? readType(obj.get("type"), path + ".type") : null,
                        readExpr(require(obj, "value", path), path + ".value"));
            case "variable":
                return readVariable(obj, loc, path);
            case "function":
                return new FunctionDeclarationSyntax(loc, requireString(obj, "name", path),
                        readType(require(obj, "returns", path), path + ".returns"));
            default:
                throw new DesignFormatException(path + ".decl", "未知的声明种类 '" + decl + "'");
        }
    }

    private DataDeclarationSyntax readVariable(JsonObject obj, SourceLocation loc, String path) {
        DataTypeSyntax type = readType(require(obj, "type", path), path + ".type");
        List<DeclaratorSyntax> declarators = new ArrayList<DeclaratorSyntax>();
        if (obj.has("names")) {
            JsonArray names = requireArray(obj, "names", path);
            for (int i = 0; i < names.size(); i++) {
                declarators.add(readDeclarator(names.get(i), path + ".names[" + i + "]"));
            }
        } else {
            declarators.add(new DeclaratorSyntax(loc, requireString(obj, "name", path),
                    readDims(obj.get("dims"), path + ".dims"),
                    obj.has("init") ? readExpr(obj.get("init"), path + ".init") : null));
        }
        return new DataDeclarationSyntax(loc, type, declarators);
    }

    /** 声明符：字符串名，或 {name, dims, init} */
    private DeclaratorSyntax readDeclarator(JsonElement element, String path) {
        if (isString(element)) {
            return new DeclaratorSyntax(new SourceLocation(file, 0, 0), element.getAsString(),
                    Collections.<VariableDimensionSyntax>emptyList(), null);
        }
        JsonObject obj = requireObject(element, path);
        return new DeclaratorSyntax(location(obj), requireString(obj, "name", path),
                readDims(obj.get("dims"), path + ".dims"),
                obj.has("init") ? readExpr(obj.get("init"), path + ".init") : null);
    }

    private ForwardTypedefDeclarationSyntax.Keyword readForwardKeyword(JsonObject obj, String path) {
        if (!obj.has("category")) return ForwardTypedefDeclarationSyntax.Keyword.NONE;
        String text = obj.get("category").getAsString();
        try {
            return ForwardTypedefDeclarationSyntax.Keyword.valueOf(
                    text.replace(' ', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DesignFormatException(path + ".category", "未知的前向 typedef 类别 '" + text + "'", e);
        }
    }

    // ============ 类型 ============

    DataTypeSyntax readType(JsonElement element, String path) {
        if (isString(element)) {
            String text = element.getAsString();
            TypeKeyword keyword = TypeKeyword.fromText(text);
            if (keyword != null) {
                return keywordType(new SourceLocation(file, 0, 0), keyword, Signing.NONE,
                        Collections.<VariableDimensionSyntax>emptyList());
            }
            return new NamedTypeSyntax(new SourceLocation(file, 0, 0),
                    new NameSyntax(new SourceLocation(file, 0, 0), text));
        }

        JsonObject obj = requireObject(element, path);
        SourceLocation loc = location(obj);
        String kind = requireString(obj, "kind", path);
        Signing signing = readSigning(obj, path);
        List<VariableDimensionSyntax> dims = readDims(obj.get("dims"), path + ".dims");
        switch (kind) {
            case "implicit":
                return new ImplicitTypeSyntax(loc, signing, dims);
            case "named":
                return new NamedTypeSyntax(loc, new NameSyntax(loc, requireString(obj, "name", path), dims));
            case "enum":
                return readEnum(obj, loc, dims, path);
            case "struct":
                return readStruct(obj, loc, signing, dims, path);
            default:
                TypeKeyword keyword = TypeKeyword.fromText(kind);
                if (keyword == null) {
                    throw new DesignFormatException(path + ".kind", "未知的类型种类 '" + kind + "'");
                }
                return keywordType(loc, keyword, signing, dims);
        }
    }

    private DataTypeSyntax keywordType(SourceLocation loc, TypeKeyword keyword, Signing signing,
                                       List<VariableDimensionSyntax> dims) {
        if (keyword.isIntegerVector() || keyword.isIntegerAtom()) {
            return new IntegerTypeSyntax(loc, keyword, signing, dims);
        }
        return new KeywordTypeSyntax(loc, keyword);
    }

    private EnumTypeSyntax readEnum(JsonObject obj, SourceLocation loc, List<VariableDimensionSyntax> dims,
                                    String path) {
        DataTypeSyntax base = obj.has("base") ? readType(obj.get("base"), path + ".base") : null;
        JsonArray values = requireArray(obj, "members", path);
        List<EnumTypeSyntax.EnumMemberSyntax> members = new ArrayList<EnumTypeSyntax.EnumMemberSyntax>();
        for (int i = 0; i < values.size(); i++) {
            String memberPath = path + ".members[" + i + "]";
            JsonElement value = values.get(i);
            if (isString(value)) {
                members.add(new EnumTypeSyntax.EnumMemberSyntax(loc, value.getAsString(), null));
            } else {
                JsonObject m = requireObject(value, memberPath);
                members.add(new EnumTypeSyntax.EnumMemberSyntax(location(m), requireString(m, "name", memberPath),
                        m.has("value") ? readExpr(m.get("value"), memberPath + ".value") : null));
            }
        }
        return new EnumTypeSyntax(loc, base, members, dims);
    }

    private StructTypeSyntax readStruct(JsonObject obj, SourceLocation loc, Signing signing,
                                        List<VariableDimensionSyntax> dims, String path) {
        boolean packed = obj.has("packed") && obj.get("packed").getAsBoolean();
        JsonArray fields = requireArray(obj, "members", path);
        List<StructTypeSyntax.StructMemberSyntax> members = new ArrayList<StructTypeSyntax.StructMemberSyntax>();
        for (int i = 0; i < fields.size(); i++) {
            String memberPath = path + ".members[" + i + "]";
            JsonObject m = requireObject(fields.get(i), memberPath);
            DataTypeSyntax type = readType(require(m, "type", memberPath), memberPath + ".type");
            List<DeclaratorSyntax> declarators = new ArrayList<DeclaratorSyntax>();
            if (m.has("names")) {
                JsonArray names = requireArray(m, "names", memberPath);
                for (int j = 0; j < names.size(); j++) {
                    declarators.add(readDeclarator(names.get(j), memberPath + ".names[" + j + "]"));
                }
            } else {
                declarators.add(readDeclarator(m, memberPath));
            }
            members.add(new StructTypeSyntax.StructMemberSyntax(location(m), type, declarators));
        }
        return new StructTypeSyntax(loc, packed, signing, members, dims);
    }

    private Signing readSigning(JsonObject obj, String path) {
        if (!obj.has("signing")) return Signing.NONE;
        String text = obj.get("signing").getAsString();
        if ("signed".equals(text)) return Signing.SIGNED;
        if ("unsigned".equals(text)) return Signing.UNSIGNED;
        throw new DesignFormatException(path + ".signing", "signing 只能是 signed 或 unsigned");
    }

    private List<VariableDimensionSyntax> readDims(JsonElement element, String path) {
        if (element == null || element.isJsonNull()) {
            return Collections.emptyList();
        }
        if (!element.isJsonArray()) {
            throw new DesignFormatException(path, "维度列表必须是数组");
        }
        JsonArray array = element.getAsJsonArray();
        List<VariableDimensionSyntax> dims = new ArrayList<VariableDimensionSyntax>();
        for (int i = 0; i < array.size(); i++) {
            dims.add(readDim(array.get(i), path + "[" + i + "]"));
        }
        return dims;
    }

    private VariableDimensionSyntax readDim(JsonElement element, String path) {
        SourceLocation loc = new SourceLocation(file, 0, 0);
        if (element.isJsonArray()) {
            JsonArray pair = element.getAsJsonArray();
            if (pair.size() == 0) {
                return VariableDimensionSyntax.unsized(loc);
            }
            if (pair.size() != 2) {
                throw new DesignFormatException(path, "范围维度必须是 [left, right]");
            }
            return VariableDimensionSyntax.range(loc, readExpr(pair.get(0), path + "[0]"),
                    readExpr(pair.get(1), path + "[1]"));
        }
        return VariableDimensionSyntax.size(loc, readExpr(element, path));
    }

    // ============ 表达式 ============

    ExpressionSyntax readExpr(JsonElement element, String path) {
        SourceLocation loc = new SourceLocation(file, 0, 0);
        if (element != null && element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isNumber()) {
                return numberLiteral(loc, primitive.getAsBigDecimal());
            }
            if (primitive.isString()) {
                return new NameExpressionSyntax(loc, new NameSyntax(loc, primitive.getAsString()));
            }
        }
        JsonObject obj = requireObject(element, path);
        loc = location(obj);
        if (obj.has("int")) {
            BigInteger value = obj.get("int").getAsBigInteger();
            int width = obj.has("width") ? obj.get("width").getAsInt() : 0;
            boolean signed = obj.has("signed") ? obj.get("signed").getAsBoolean() : width == 0;
            return new IntegerLiteralSyntax(loc, value, width, signed);
        }
        if (obj.has("real")) {
            return new RealLiteralSyntax(loc, obj.get("real").getAsDouble());
        }
        if (obj.has("string")) {
            return new StringLiteralSyntax(loc, obj.get("string").getAsString());
        }
        if (obj.has("name")) {
            return new NameExpressionSyntax(loc, new NameSyntax(loc, obj.get("name").getAsString()));
        }
        if (obj.has("op")) {
            String symbol = obj.get("op").getAsString();
            if (obj.has("operand")) {
                UnaryExpressionSyntax.UnaryOp op = UnaryExpressionSyntax.UnaryOp.fromSymbol(symbol);
                if (op == null) {
                    throw new DesignFormatException(path + ".op", "未知的一元运算符 '" + symbol + "'");
                }
                return new UnaryExpressionSyntax(loc, op, readExpr(obj.get("operand"), path + ".operand"));
            }
            BinaryExpressionSyntax.BinaryOp op = BinaryExpressionSyntax.BinaryOp.fromSymbol(symbol);
            if (op == null) {
                throw new DesignFormatException(path + ".op", "未知的二元运算符 '" + symbol + "'");
            }
            return new BinaryExpressionSyntax(loc, op,
                    readExpr(require(obj, "left", path), path + ".left"),
                    readExpr(require(obj, "right", path), path + ".right"));
        }
        throw new DesignFormatException(path, "无法识别的表达式");
    }

    private ExpressionSyntax numberLiteral(SourceLocation loc, BigDecimal number) {
        if (number.scale() > 0 && number.stripTrailingZeros().scale() > 0) {
            return new RealLiteralSyntax(loc, number.doubleValue());
        }
        return new IntegerLiteralSyntax(loc, number.toBigIntegerExact(), 0, true);
    }

    // ============ 工具 ============

    private SourceLocation location(JsonObject obj) {
        int line = obj.has("line") ? obj.get("line").getAsInt() : 0;
        int column = obj.has("column") ? obj.get("column").getAsInt() : 0;
        return new SourceLocation(file, line, column);
    }

    private static boolean isString(JsonElement element) {
        return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private static JsonElement require(JsonObject obj, String key, String path) {
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull()) {
            throw new DesignFormatException(path, "缺少字段 '" + key + "'");
        }
        return element;
    }

    private static String requireString(JsonObject obj, String key, String path) {
        JsonElement element = require(obj, key, path);
        if (!isString(element)) {
            throw new DesignFormatException(path + "." + key, "必须是字符串");
        }
        return element.getAsString();
    }

    private static JsonArray requireArray(JsonObject obj, String key, String path) {
        JsonElement element = require(obj, key, path);
        if (!element.isJsonArray()) {
            throw new DesignFormatException(path + "." + key, "必须是数组");
        }
        return element.getAsJsonArray();
    }

    private static JsonObject requireObject(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new DesignFormatException(path, "必须是对象");
        }
        return element.getAsJsonObject();
    }
}
