package com.veritype.compiler.analysis.types;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.EnumSet;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * 整数向量类型的唯一化缓存：同一 (位宽, 有符号, 四态, reg) 在一次编译内只有一个实例，
 * 因此引用相同即可判定类型匹配。
 *
 * <p>缓存不设上限、永不淘汰，条目的生命周期与编译相同。</p>
 */
public final class TypeCache {

    private static final Logger LOG = Logger.getLogger(TypeCache.class.getName());

    private final Cache<VectorKey, SvType> vectors;

    public TypeCache() {
        this.vectors = Caffeine.newBuilder()
                .recordStats()
                .build();
    }

    /** 取已有实例，不存在时用 factory 创建并登记 */
    public SvType getVector(int width, EnumSet<IntegralFlag> flags, Function<VectorKey, SvType> factory) {
        return vectors.get(new VectorKey(width, flags), factory);
    }

    public long size() {
        return vectors.estimatedSize();
    }

    public CacheStats getStats() {
        return vectors.stats();
    }

    public void logStats() {
        CacheStats stats = vectors.stats();
        LOG.fine("vector type cache: " + size() + " entries, "
                + stats.hitCount() + " hits, " + stats.missCount() + " misses");
    }

    /** 缓存键 */
    public static final class VectorKey {
        private final int width;
        private final boolean signed;
        private final boolean fourState;
        private final boolean reg;

        VectorKey(int width, EnumSet<IntegralFlag> flags) {
            this.width = width;
            this.signed = flags.contains(IntegralFlag.SIGNED);
            this.reg = flags.contains(IntegralFlag.REG);
            this.fourState = reg || flags.contains(IntegralFlag.FOUR_STATE);
        }

        public int getWidth() { return width; }
        public boolean isSigned() { return signed; }
        public boolean isFourState() { return fourState; }
        public boolean isReg() { return reg; }

        public EnumSet<IntegralFlag> toFlags() {
            EnumSet<IntegralFlag> flags = EnumSet.noneOf(IntegralFlag.class);
            if (signed) flags.add(IntegralFlag.SIGNED);
            if (fourState) flags.add(IntegralFlag.FOUR_STATE);
            if (reg) flags.add(IntegralFlag.REG);
            return flags;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof VectorKey)) return false;
            VectorKey that = (VectorKey) o;
            return width == that.width && signed == that.signed
                    && fourState == that.fourState && reg == that.reg;
        }

        @Override
        public int hashCode() {
            int h = width;
            h = 31 * h + (signed ? 1 : 0);
            h = 31 * h + (fourState ? 1 : 0);
            h = 31 * h + (reg ? 1 : 0);
            return h;
        }

        @Override
        public String toString() {
            return width + (signed ? "s" : "u") + (fourState ? "4" : "2") + (reg ? "r" : "");
        }
    }
}
