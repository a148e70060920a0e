package com.veritype.compiler.ast.timing;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 时序控制语法基类（#delay、@event、##cycle）
 */
public abstract class TimingControlSyntax extends AstNode {

    protected TimingControlSyntax(SourceLocation location) {
        super(location);
    }
}
