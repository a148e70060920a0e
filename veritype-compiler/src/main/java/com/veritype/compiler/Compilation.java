package com.veritype.compiler;

import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.ParameterSymbol;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.SemanticDiagnostic;
import com.veritype.compiler.analysis.SubroutineSymbol;
import com.veritype.compiler.analysis.Symbol;
import com.veritype.compiler.analysis.VariableSymbol;
import com.veritype.compiler.analysis.types.CHandleType;
import com.veritype.compiler.analysis.types.ConstantRange;
import com.veritype.compiler.analysis.types.EnumType;
import com.veritype.compiler.analysis.types.EnumValueSymbol;
import com.veritype.compiler.analysis.types.ErrorType;
import com.veritype.compiler.analysis.types.EventType;
import com.veritype.compiler.analysis.types.FieldSymbol;
import com.veritype.compiler.analysis.types.FloatingType;
import com.veritype.compiler.analysis.types.IntegralFlag;
import com.veritype.compiler.analysis.types.IntegralType;
import com.veritype.compiler.analysis.types.NetType;
import com.veritype.compiler.analysis.types.NullType;
import com.veritype.compiler.analysis.types.PackedArrayType;
import com.veritype.compiler.analysis.types.PackedStructType;
import com.veritype.compiler.analysis.types.PredefinedIntegerType;
import com.veritype.compiler.analysis.types.ScalarType;
import com.veritype.compiler.analysis.types.StringType;
import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.analysis.types.TypeAliasType;
import com.veritype.compiler.analysis.types.TypeCache;
import com.veritype.compiler.analysis.types.TypeResolver;
import com.veritype.compiler.analysis.types.UnpackedArrayType;
import com.veritype.compiler.analysis.types.UnpackedStructType;
import com.veritype.compiler.analysis.types.VoidType;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.decl.CompilationUnitSyntax;
import com.veritype.compiler.ast.decl.MemberSyntax;
import com.veritype.compiler.ast.type.DataTypeSyntax;
import com.veritype.compiler.ast.type.TypeKeyword;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 一次编译的上下文：持有全部类型节点、内置类型、唯一化缓存、根作用域和诊断。
 *
 * <p>类型节点通过 {@link #emplace} 登记，获得稳定序号，生命周期与编译相同。</p>
 */
public class Compilation {

    private static final Logger LOG = Logger.getLogger(Compilation.class.getName());

    private final CompilationOptions options;
    private final List<SvType> types = new ArrayList<SvType>();
    private final List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();
    private int errorCount;

    private final Scope root;
    private final Map<TypeKeyword, SvType> builtins = new EnumMap<TypeKeyword, SvType>(TypeKeyword.class);
    private final ScalarType[] scalars = new ScalarType[8];
    private final SvType nullType;
    private final TypeCache typeCache = new TypeCache();
    private final Map<NetType.NetKind, NetType> netTypes = new EnumMap<NetType.NetKind, NetType>(NetType.NetKind.class);

    private boolean elaborated;

    public Compilation() {
        this(new CompilationOptions());
    }

    public Compilation(CompilationOptions options) {
        this.options = options;
        this.root = new Scope(this, null, null, null);

        // 标量按 {SIGNED, FOUR_STATE, REG} 位组合索引；reg 总是四态
        for (int bits = 0; bits < 8; bits++) {
            EnumSet<IntegralFlag> flags = flagsFromBits(bits);
            ScalarType.ScalarKind kind = flags.contains(IntegralFlag.REG) ? ScalarType.ScalarKind.REG
                    : flags.contains(IntegralFlag.FOUR_STATE) ? ScalarType.ScalarKind.LOGIC
                    : ScalarType.ScalarKind.BIT;
            if (bitsFromFlags(flags) == bits) {
                scalars[bits] = emplace(new ScalarType(kind, flags.contains(IntegralFlag.SIGNED)));
            }
        }
        for (int bits = 0; bits < 8; bits++) {
            if (scalars[bits] == null) {
                scalars[bits] = scalars[bitsFromFlags(flagsFromBits(bits))];
            }
        }

        builtins.put(TypeKeyword.BIT, scalars[0]);
        builtins.put(TypeKeyword.LOGIC, getScalarType(EnumSet.of(IntegralFlag.FOUR_STATE)));
        builtins.put(TypeKeyword.REG, getScalarType(EnumSet.of(IntegralFlag.FOUR_STATE, IntegralFlag.REG)));
        builtins.put(TypeKeyword.SHORTINT, emplace(new PredefinedIntegerType(PredefinedIntegerType.IntegerKind.SHORT_INT)));
        builtins.put(TypeKeyword.INT, emplace(new PredefinedIntegerType(PredefinedIntegerType.IntegerKind.INT)));
        builtins.put(TypeKeyword.LONGINT, emplace(new PredefinedIntegerType(PredefinedIntegerType.IntegerKind.LONG_INT)));
        builtins.put(TypeKeyword.BYTE, emplace(new PredefinedIntegerType(PredefinedIntegerType.IntegerKind.BYTE)));
        builtins.put(TypeKeyword.INTEGER, emplace(new PredefinedIntegerType(PredefinedIntegerType.IntegerKind.INTEGER)));
        builtins.put(TypeKeyword.TIME, emplace(new PredefinedIntegerType(PredefinedIntegerType.IntegerKind.TIME)));
        builtins.put(TypeKeyword.REAL, emplace(new FloatingType(FloatingType.FloatKind.REAL)));
        builtins.put(TypeKeyword.REALTIME, emplace(new FloatingType(FloatingType.FloatKind.REAL_TIME)));
        builtins.put(TypeKeyword.SHORTREAL, emplace(new FloatingType(FloatingType.FloatKind.SHORT_REAL)));
        builtins.put(TypeKeyword.STRING, emplace(new StringType()));
        builtins.put(TypeKeyword.CHANDLE, emplace(new CHandleType()));
        builtins.put(TypeKeyword.EVENT, emplace(new EventType()));
        builtins.put(TypeKeyword.VOID, emplace(new VoidType()));
        nullType = emplace(new NullType());

        SvType logic = builtins.get(TypeKeyword.LOGIC);
        for (NetType.NetKind kind : NetType.NetKind.values()) {
            if (kind == NetType.NetKind.USER_DEFINED) continue;
            netTypes.put(kind, new NetType(kind, kind.getText(), logic));
        }
    }

    private static EnumSet<IntegralFlag> flagsFromBits(int bits) {
        EnumSet<IntegralFlag> flags = EnumSet.noneOf(IntegralFlag.class);
        if ((bits & 1) != 0) flags.add(IntegralFlag.SIGNED);
        if ((bits & 2) != 0) flags.add(IntegralFlag.FOUR_STATE);
        if ((bits & 4) != 0) flags.add(IntegralFlag.REG);
        return flags;
    }

    private static int bitsFromFlags(EnumSet<IntegralFlag> flags) {
        int bits = 0;
        if (flags.contains(IntegralFlag.SIGNED)) bits |= 1;
        if (flags.contains(IntegralFlag.FOUR_STATE) || flags.contains(IntegralFlag.REG)) bits |= 2;
        if (flags.contains(IntegralFlag.REG)) bits |= 4;
        return bits;
    }

    public CompilationOptions getOptions() {
        return options;
    }

    public Scope getRoot() {
        return root;
    }

    // ============ 类型表 ============

    /** 登记一个新分配的类型节点 */
    public <T extends SvType> T emplace(T type) {
        type.assignId(types.size());
        types.add(type);
        return type;
    }

    public List<SvType> getTypes() {
        return Collections.unmodifiableList(types);
    }

    public TypeCache getTypeCache() {
        return typeCache;
    }

    // ============ 内置与缓存类型 ============

    public SvType getType(TypeKeyword keyword) {
        SvType type = builtins.get(keyword);
        if (type == null) {
            throw InternalCompilerError.unreachable(keyword);
        }
        return type;
    }

    /** 给定位宽与标志的共享向量类型，形如 logic[w-1:0]；位宽为 1 时也是 [0:0] 的 packed 数组 */
    public SvType getType(int width, EnumSet<IntegralFlag> flags) {
        if (width <= 0) {
            throw new InternalCompilerError("vector width must be positive: " + width);
        }
        return typeCache.getVector(width, flags, key -> emplace(
                new PackedArrayType(getScalarType(key.toFlags()), new ConstantRange(width - 1, 0))));
    }

    public ScalarType getScalarType(EnumSet<IntegralFlag> flags) {
        return scalars[bitsFromFlags(flags)];
    }

    /** 内置整数类型；有符号性与默认不同时取结构相同的共享向量类型 */
    public SvType getPredefinedType(TypeKeyword keyword, boolean signed) {
        IntegralType predef = (IntegralType) getType(keyword);
        if (signed == predef.isSigned()) return predef;

        EnumSet<IntegralFlag> flags = predef.getIntegralFlags();
        if (signed) {
            flags.add(IntegralFlag.SIGNED);
        } else {
            flags.remove(IntegralFlag.SIGNED);
        }
        return getType(predef.getBitWidth(), flags);
    }

    public SvType getIntType() {
        return getType(TypeKeyword.INT);
    }

    public SvType getLogicType() {
        return getType(TypeKeyword.LOGIC);
    }

    public SvType getNullType() {
        return nullType;
    }

    public SvType getErrorType() {
        return ErrorType.INSTANCE;
    }

    public NetType getNetType(NetType.NetKind kind) {
        NetType netType = netTypes.get(kind);
        if (netType == null) {
            throw InternalCompilerError.unreachable(kind);
        }
        return netType;
    }

    // ============ 语法 → 类型 ============

    public SvType getType(DataTypeSyntax syntax, LookupLocation location, Scope scope) {
        return getType(syntax, location, scope, false);
    }

    public SvType getType(DataTypeSyntax syntax, LookupLocation location, Scope scope, boolean forceSigned) {
        return syntax.accept(new TypeResolver(this, location, scope, forceSigned));
    }

    /** 在 elementType 上套用声明符的 unpacked 维度 */
    public SvType getType(SvType elementType, List<VariableDimensionSyntax> dimensions,
                          LookupLocation location, Scope scope) {
        if (dimensions.isEmpty()) return elementType;
        return UnpackedArrayType.fromSyntax(this, elementType, location, scope, dimensions);
    }

    // ============ 语法树与诊断 ============

    public void addSyntaxTree(CompilationUnitSyntax unit) {
        if (elaborated) {
            throw new InternalCompilerError("cannot add syntax trees after elaboration");
        }
        for (MemberSyntax member : unit.getMembers()) {
            root.addMembers(member);
        }
    }

    /**
     * 创建诊断并加入列表。被警告抑制或超出错误上限的诊断仍返回给调用方以便继续追加参数，
     * 但不会被记录。
     */
    public SemanticDiagnostic addDiag(DiagCode code, SourceLocation location) {
        SemanticDiagnostic diag = new SemanticDiagnostic(code, location);
        record(diag);
        return diag;
    }

    public void addDiagnostics(List<SemanticDiagnostic> diags) {
        for (SemanticDiagnostic diag : diags) {
            record(diag);
        }
    }

    private void record(SemanticDiagnostic diag) {
        switch (diag.getSeverity()) {
            case WARNING:
                if (options.isSuppressWarnings()) return;
                break;
            case ERROR:
                if (options.getErrorLimit() > 0 && errorCount >= options.getErrorLimit()) return;
                errorCount++;
                break;
            default:
                break;
        }
        diagnostics.add(diag);
    }

    /** 已产生的诊断，不触发全局检查 */
    public List<SemanticDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /** 强制解析所有声明后返回全部诊断 */
    public List<SemanticDiagnostic> getAllDiagnostics() {
        if (!elaborated) {
            elaborated = true;
            new Elaborator().elaborateScope(root);
            LOG.fine("elaborated " + root.getMembers().size() + " root members, " + types.size()
                    + " types, " + diagnostics.size() + " diagnostics");
            typeCache.logStats();
        }
        return getDiagnostics();
    }

    public boolean hasErrors() {
        for (SemanticDiagnostic diag : getAllDiagnostics()) {
            if (diag.isError()) return true;
        }
        return false;
    }

    /**
     * 全局检查：解析每个声明的类型、核对前向 typedef、解析 nettype，
     * 并深入枚举与结构体的成员作用域。
     */
    private final class Elaborator {
        private final Set<Scope> visitedScopes = Collections.newSetFromMap(new IdentityHashMap<Scope, Boolean>());

        void elaborateScope(Scope scope) {
            if (!visitedScopes.add(scope)) return;

            // 解析过程中可能追加枚举成员，遍历快照
            for (Symbol member : new ArrayList<Symbol>(scope.getMembers())) {
                elaborateMember(scope, member);
            }
        }

        private void elaborateMember(Scope scope, Symbol member) {
            switch (member.getKind()) {
                case TYPE_ALIAS: {
                    TypeAliasType alias = (TypeAliasType) member;
                    alias.checkForwardDecls();
                    elaborateType(alias.getTargetType());
                    break;
                }
                case FORWARDING_TYPEDEF:
                    // 名字表中仍是前向声明，说明没有完整定义
                    if (scope.find(member.getName()) == member) {
                        addDiag(DiagCode.UNRESOLVED_FORWARD_TYPEDEF, member.getLocation()).addArg(member.getName());
                    }
                    break;
                case NET_TYPE: {
                    NetType netType = (NetType) member;
                    netType.getResolutionFunction();
                    elaborateType(netType.getDataType());
                    break;
                }
                case PARAMETER: {
                    ParameterSymbol param = (ParameterSymbol) member;
                    elaborateType(param.getType());
                    param.getValue();
                    break;
                }
                case VARIABLE:
                    elaborateType(((VariableSymbol) member).getType());
                    break;
                case SUBROUTINE:
                    elaborateType(((SubroutineSymbol) member).getReturnType());
                    break;
                case ENUM_VALUE:
                    ((EnumValueSymbol) member).getValue();
                    break;
                case FIELD:
                    elaborateType(((FieldSymbol) member).getType());
                    break;
                case TRANSPARENT_MEMBER:
                    break;
                default:
                    throw InternalCompilerError.unreachable(member.getKind());
            }
        }

        private void elaborateType(SvType type) {
            SvType ct = type.getCanonicalType();
            if (ct instanceof EnumType) {
                elaborateScope(((EnumType) ct).getMemberScope());
            } else if (ct instanceof PackedStructType) {
                elaborateScope(((PackedStructType) ct).getMemberScope());
            } else if (ct instanceof UnpackedStructType) {
                elaborateScope(((UnpackedStructType) ct).getMemberScope());
            } else if (ct instanceof PackedArrayType) {
                elaborateType(((PackedArrayType) ct).getElementType());
            } else if (ct instanceof UnpackedArrayType) {
                elaborateType(((UnpackedArrayType) ct).getElementType());
            }
        }
    }
}
