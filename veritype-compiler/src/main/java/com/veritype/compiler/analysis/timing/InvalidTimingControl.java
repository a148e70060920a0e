package com.veritype.compiler.analysis.timing;

/**
 * 绑定失败的时序控制，保留失败前构建出的部分结果（可能为 null）
 */
public final class InvalidTimingControl extends TimingControl {

    private final TimingControl child;

    public InvalidTimingControl(TimingControl child) {
        super(Kind.INVALID);
        this.child = child;
    }

    public TimingControl getChild() {
        return child;
    }
}
