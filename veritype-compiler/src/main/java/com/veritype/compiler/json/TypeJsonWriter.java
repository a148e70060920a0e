package com.veritype.compiler.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.veritype.compiler.analysis.ParameterSymbol;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.SemanticDiagnostic;
import com.veritype.compiler.analysis.SubroutineSymbol;
import com.veritype.compiler.analysis.Symbol;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.analysis.VariableSymbol;
import com.veritype.compiler.analysis.types.CHandleType;
import com.veritype.compiler.analysis.types.ConstantRange;
import com.veritype.compiler.analysis.types.EnumType;
import com.veritype.compiler.analysis.types.EnumValueSymbol;
import com.veritype.compiler.analysis.types.ErrorType;
import com.veritype.compiler.analysis.types.EventType;
import com.veritype.compiler.analysis.types.FieldSymbol;
import com.veritype.compiler.analysis.types.FloatingType;
import com.veritype.compiler.analysis.types.ForwardingTypedefSymbol;
import com.veritype.compiler.analysis.types.NetType;
import com.veritype.compiler.analysis.types.NullType;
import com.veritype.compiler.analysis.types.PackedArrayType;
import com.veritype.compiler.analysis.types.PackedStructType;
import com.veritype.compiler.analysis.types.PredefinedIntegerType;
import com.veritype.compiler.analysis.types.ScalarType;
import com.veritype.compiler.analysis.types.StringType;
import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.analysis.types.SvTypeVisitor;
import com.veritype.compiler.analysis.types.TypeAliasType;
import com.veritype.compiler.analysis.types.UnpackedArrayType;
import com.veritype.compiler.analysis.types.UnpackedStructType;
import com.veritype.compiler.analysis.types.VoidType;
import com.veritype.compiler.ast.SourceLocation;

import java.util.List;
import java.util.Locale;

/**
 * 把类型、符号和诊断输出为 JSON，供命令行和外部工具使用
 */
public final class TypeJsonWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public String toJson(JsonElement element) {
        return gson.toJson(element);
    }

    public JsonArray writeScope(Scope scope) {
        JsonArray array = new JsonArray();
        for (Symbol member : scope.getMembers()) {
            // 枚举值的透明导出只是查找入口，由枚举类型自身输出
            if (member.getKind() == SymbolKind.TRANSPARENT_MEMBER) continue;
            array.add(writeSymbol(member));
        }
        return array;
    }

    public JsonObject writeSymbol(Symbol symbol) {
        if (symbol instanceof SvType) {
            return writeType((SvType) symbol);
        }

        JsonObject obj = new JsonObject();
        obj.addProperty("kind", kindName(symbol.getKind()));
        obj.addProperty("name", symbol.getName());
        switch (symbol.getKind()) {
            case NET_TYPE: {
                NetType netType = (NetType) symbol;
                obj.addProperty("netKind", netType.getNetKind().getText());
                obj.addProperty("type", netType.getDataType().toDisplayString());
                if (netType.getAliasTarget() != null) {
                    obj.addProperty("aliasTarget", netType.getAliasTarget().getName());
                }
                if (netType.getResolutionFunction() != null) {
                    obj.addProperty("resolution", netType.getResolutionFunction().getName());
                }
                break;
            }
            case PARAMETER: {
                ParameterSymbol param = (ParameterSymbol) symbol;
                obj.addProperty("type", param.getType().toDisplayString());
                obj.addProperty("value", param.getValue().toString());
                break;
            }
            case VARIABLE: {
                VariableSymbol variable = (VariableSymbol) symbol;
                obj.addProperty("type", variable.getType().toDisplayString());
                obj.addProperty("default", variable.getType().getDefaultValue().toString());
                break;
            }
            case SUBROUTINE:
                obj.addProperty("returns", ((SubroutineSymbol) symbol).getReturnType().toDisplayString());
                break;
            case FORWARDING_TYPEDEF:
                obj.addProperty("category", ((ForwardingTypedefSymbol) symbol).getCategory().getText());
                break;
            case ENUM_VALUE:
                obj.addProperty("value", ((EnumValueSymbol) symbol).getValue().toString());
                break;
            case FIELD: {
                FieldSymbol field = (FieldSymbol) symbol;
                obj.addProperty("type", field.getType().toDisplayString());
                obj.addProperty("offset", field.getOffset());
                break;
            }
            default:
                break;
        }
        return obj;
    }

    public JsonObject writeType(SvType type) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", kindName(type.getKind()));
        if (!type.getName().isEmpty()) {
            obj.addProperty("name", type.getName());
        }
        obj.addProperty("display", type.toDisplayString());
        if (type.isIntegral() || type.isFloating()) {
            obj.addProperty("width", type.getBitWidth());
            obj.addProperty("signed", type.isSigned());
            obj.addProperty("fourState", type.isFourState());
        }
        type.accept(new DetailWriter(obj));
        return obj;
    }

    public JsonArray writeDiagnostics(List<SemanticDiagnostic> diagnostics) {
        JsonArray array = new JsonArray();
        for (SemanticDiagnostic diag : diagnostics) {
            array.add(writeDiagnostic(diag));
        }
        return array;
    }

    private JsonObject writeDiagnostic(SemanticDiagnostic diag) {
        JsonObject obj = new JsonObject();
        obj.addProperty("code", diag.getCode().getCodeName());
        obj.addProperty("severity", diag.getSeverity().name().toLowerCase(Locale.ROOT));
        SourceLocation loc = diag.getLocation();
        obj.addProperty("file", loc.getFile());
        obj.addProperty("line", loc.getLine());
        obj.addProperty("column", loc.getColumn());
        obj.addProperty("message", diag.getMessage());
        if (!diag.getNotes().isEmpty()) {
            obj.add("notes", writeDiagnostics(diag.getNotes()));
        }
        return obj;
    }

    private static JsonObject writeRange(ConstantRange range) {
        JsonObject obj = new JsonObject();
        obj.addProperty("left", range.getLeft());
        obj.addProperty("right", range.getRight());
        return obj;
    }

    /** PACKED_ARRAY_TYPE -> packedArrayType */
    static String kindName(SymbolKind kind) {
        String[] parts = kind.name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder sb = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            sb.append(Character.toUpperCase(parts[i].charAt(0))).append(parts[i].substring(1));
        }
        return sb.toString();
    }

    /**
     * 各类型变体的附加字段
     */
    private final class DetailWriter implements SvTypeVisitor<Void> {

        private final JsonObject obj;

        DetailWriter(JsonObject obj) {
            this.obj = obj;
        }

        @Override
        public Void visitPredefinedInteger(PredefinedIntegerType type) {
            obj.addProperty("keyword", type.getIntegerKind().getText());
            return null;
        }

        @Override
        public Void visitScalar(ScalarType type) {
            obj.addProperty("keyword", type.getScalarKind().getText());
            return null;
        }

        @Override
        public Void visitFloating(FloatingType type) {
            obj.addProperty("keyword", type.getFloatKind().getText());
            return null;
        }

        @Override
        public Void visitEnum(EnumType type) {
            obj.addProperty("base", type.getBaseType().toDisplayString());
            JsonArray values = new JsonArray();
            for (EnumValueSymbol value : type.getValues()) {
                values.add(writeSymbol(value));
            }
            obj.add("values", values);
            return null;
        }

        @Override
        public Void visitPackedArray(PackedArrayType type) {
            obj.add("range", writeRange(type.getRange()));
            obj.add("element", writeType(type.getElementType()));
            return null;
        }

        @Override
        public Void visitUnpackedArray(UnpackedArrayType type) {
            obj.add("range", writeRange(type.getRange()));
            obj.add("element", writeType(type.getElementType()));
            return null;
        }

        @Override
        public Void visitPackedStruct(PackedStructType type) {
            obj.add("fields", writeFields(type.getFields()));
            return null;
        }

        @Override
        public Void visitUnpackedStruct(UnpackedStructType type) {
            obj.add("fields", writeFields(type.getFields()));
            return null;
        }

        @Override
        public Void visitTypeAlias(TypeAliasType type) {
            // 目标可能经由前向 typedef 回指自身，这里只输出显示名
            obj.addProperty("target", type.getTargetType().toDisplayString());
            obj.addProperty("canonical", type.getCanonicalType().toDisplayString());
            JsonArray forwards = new JsonArray();
            for (ForwardingTypedefSymbol fwd = type.getFirstForwardDecl(); fwd != null;
                 fwd = fwd.getNextForwardDecl()) {
                forwards.add(writeSymbol(fwd));
            }
            if (forwards.size() > 0) {
                obj.add("forwardDecls", forwards);
            }
            return null;
        }

        @Override
        public Void visitVoid(VoidType type) { return null; }

        @Override
        public Void visitNull(NullType type) { return null; }

        @Override
        public Void visitCHandle(CHandleType type) { return null; }

        @Override
        public Void visitString(StringType type) { return null; }

        @Override
        public Void visitEvent(EventType type) { return null; }

        @Override
        public Void visitError(ErrorType type) { return null; }

        private JsonArray writeFields(List<FieldSymbol> fields) {
            JsonArray array = new JsonArray();
            for (FieldSymbol field : fields) {
                array.add(writeSymbol(field));
            }
            return array;
        }
    }
}
