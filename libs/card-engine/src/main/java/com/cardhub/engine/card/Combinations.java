package com.cardhub.engine.card;

import java.util.ArrayList;
import java.util.List;

/**
 * 组合枚举（迭代实现，无递归）。手牌最多十几张，C(n,k) 很小，直接全量生成。
 */
public final class Combinations {

    private Combinations() {
    }

    /**
     * 返回 items 的全部 k 元子集，保持原有相对顺序。
     * k 非法（<0 或 >n）时返回空列表；k == 0 返回一个空子集。
     */
    public static <T> List<List<T>> of(List<T> items, int k) {
        int n = items.size();
        List<List<T>> out = new ArrayList<>();
        if (k < 0 || k > n) return out;
        int[] idx = new int[k];
        for (int i = 0; i < k; i++) idx[i] = i;
        while (true) {
            List<T> combo = new ArrayList<>(k);
            for (int i : idx) combo.add(items.get(i));
            out.add(combo);
            // 从右往左找第一个还能右移的位置
            int i = k - 1;
            while (i >= 0 && idx[i] == n - k + i) i--;
            if (i < 0) break;
            idx[i]++;
            for (int j = i + 1; j < k; j++) idx[j] = idx[j - 1] + 1;
        }
        return out;
    }
}
