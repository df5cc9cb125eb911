package com.ginindex.postings;

import org.roaringbitmap.RoaringBitmap;

/**
 * 反序列化得到的不可变倒排列表：行ID集合及其磁盘编码。
 *
 * 编码方式不影响集合内容，两个行ID相同的列表视为相等。
 */
public final class PostingsList {
    private final RoaringBitmap rowIds;
    private final PostingsEncoding encoding;

    PostingsList(RoaringBitmap rowIds, PostingsEncoding encoding) {
        if (rowIds == null || encoding == null) {
            throw new IllegalArgumentException("rowIds与encoding不能为null");
        }
        this.rowIds = rowIds;
        this.encoding = encoding;
    }

    /**
     * 合并多个段的倒排列表，结果编码按合并后的基数重新判定。
     *
     * @param lists 各段倒排列表
     * @return 合并后的倒排列表
     */
    public static PostingsList union(Iterable<PostingsList> lists) {
        RoaringBitmap merged = new RoaringBitmap();
        for (PostingsList list : lists) {
            merged.or(list.rowIds);
        }
        return new PostingsList(merged, PostingsCodec.chooseEncoding(merged));
    }

    public PostingsEncoding encoding() {
        return encoding;
    }

    public int cardinality() {
        return rowIds.getCardinality();
    }

    public boolean isEmpty() {
        return rowIds.isEmpty();
    }

    public boolean contains(int rowId) {
        return rowIds.contains(rowId);
    }

    /**
     * 判断 [rangeStart, rangeEnd] 闭区间内是否存在行ID，供按行号区间裁剪使用。
     */
    public boolean intersectsRange(int rangeStart, int rangeEnd) {
        if (rangeStart > rangeEnd) {
            return false;
        }
        return rowIds.intersects(Integer.toUnsignedLong(rangeStart), Integer.toUnsignedLong(rangeEnd) + 1);
    }

    /**
     * 返回递增行ID数组副本。
     */
    public int[] toArray() {
        return rowIds.toArray();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingsList)) {
            return false;
        }
        return rowIds.equals(((PostingsList) other).rowIds);
    }

    @Override
    public int hashCode() {
        return rowIds.hashCode();
    }

    @Override
    public String toString() {
        return "PostingsList{encoding=" + encoding + ", cardinality=" + cardinality() + "}";
    }
}
