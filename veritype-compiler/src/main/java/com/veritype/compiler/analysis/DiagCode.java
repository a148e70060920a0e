package com.veritype.compiler.analysis;

/**
 * 诊断代码及其消息模板（%s 依次替换为参数）
 */
public enum DiagCode {
    // 类型构建
    PACKED_DIMS_ON_PREDEFINED_TYPE("PackedDimsOnPredefinedType", Severity.ERROR,
            "预定义整数类型 '%s' 不允许带 packed 维度"),
    NOT_A_TYPE("NotAType", Severity.ERROR, "'%s' 不是类型"),
    INVALID_ENUM_BASE("InvalidEnumBase", Severity.ERROR,
            "'%s' 不能作为枚举基类型，基类型必须是简单位向量"),
    PACKED_MEMBER_NOT_INTEGRAL("PackedMemberNotIntegral", Severity.ERROR,
            "packed struct 成员必须是整数类型，实际为 '%s'"),
    PACKED_MEMBER_HAS_INITIALIZER("PackedMemberHasInitializer", Severity.ERROR,
            "packed struct 成员不允许带初始值"),
    PACKED_ARRAY_NOT_INTEGRAL("PackedArrayNotIntegral", Severity.ERROR,
            "packed 维度只能作用于整数类型，实际为 '%s'"),
    FORWARD_TYPEDEF_DOES_NOT_MATCH("ForwardTypedefDoesNotMatch", Severity.ERROR,
            "前向 typedef 声明为 '%s'，与实际定义不一致"),
    UNRESOLVED_FORWARD_TYPEDEF("UnresolvedForwardTypedef", Severity.ERROR,
            "前向 typedef '%s' 没有对应的完整定义"),
    RECURSIVE_DEFINITION("RecursiveDefinition", Severity.ERROR, "'%s' 的定义递归引用了自身"),

    // 作用域与查找
    REDEFINITION("Redefinition", Severity.ERROR, "'%s' 在此作用域中已定义"),
    UNDECLARED_IDENTIFIER("UndeclaredIdentifier", Severity.ERROR, "未声明的标识符 '%s'"),
    NOT_A_VALUE("NotAValue", Severity.ERROR, "'%s' 不是值"),
    NOT_A_SUBROUTINE("NotASubroutine", Severity.ERROR, "'%s' 不是函数"),

    // 常量与维度
    EXPRESSION_NOT_CONSTANT("ExpressionNotConstant", Severity.ERROR, "表达式不是编译期常量"),
    VALUE_MUST_BE_INTEGRAL("ValueMustBeIntegral", Severity.ERROR, "表达式必须是不含 X 的整数值"),
    PACKED_DIM_REQUIRES_RANGE("PackedDimRequiresRange", Severity.ERROR,
            "packed 维度必须写成 [msb:lsb] 形式"),
    INVALID_DIMENSION_SIZE("InvalidDimensionSize", Severity.ERROR, "维度大小必须为正数，实际为 %s"),
    PACKED_TYPE_TOO_LARGE("PackedTypeTooLarge", Severity.ERROR,
            "packed 类型位宽 %s 超过上限 %s"),
    ARRAY_DIMENSION_TOO_LARGE("ArrayDimensionTooLarge", Severity.ERROR,
            "数组维度大小 %s 超过上限 %s"),
    DIMENSION_REQUIRES_CONST_RANGE("DimensionRequiresConstRange", Severity.ERROR,
            "此处需要常量范围维度"),
    BAD_UNARY_EXPRESSION("BadUnaryExpression", Severity.ERROR, "一元运算符 '%s' 不能作用于 '%s'"),
    BAD_BINARY_EXPRESSION("BadBinaryExpression", Severity.ERROR,
            "二元运算符 '%s' 不能作用于 '%s' 和 '%s'"),

    // 时序控制
    DELAY_NOT_NUMERIC("DelayNotNumeric", Severity.ERROR, "延迟值必须是数值类型，实际为 '%s'"),
    INVALID_EVENT_EXPRESSION("InvalidEventExpression", Severity.ERROR,
            "'%s' 类型的表达式不能作为事件表达式"),
    INVALID_EDGE_EVENT_EXPRESSION("InvalidEdgeEventExpression", Severity.ERROR,
            "边沿事件表达式必须是整数类型"),
    EVENT_EXPRESSION_CONSTANT("EventExpressionConstant", Severity.WARNING,
            "事件表达式是常量，永远不会触发"),
    NOT_YET_SUPPORTED("NotYetSupported", Severity.ERROR, "暂不支持该语言特性"),

    NOTE_DECLARATION_HERE("NoteDeclarationHere", Severity.NOTE, "在此处声明");

    public enum Severity {
        ERROR, WARNING, NOTE
    }

    private final String codeName;
    private final Severity severity;
    private final String template;

    DiagCode(String codeName, Severity severity, String template) {
        this.codeName = codeName;
        this.severity = severity;
        this.template = template;
    }

    /** 对外展示的代码名，如 PackedDimsOnPredefinedType */
    public String getCodeName() {
        return codeName;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getTemplate() {
        return template;
    }
}
