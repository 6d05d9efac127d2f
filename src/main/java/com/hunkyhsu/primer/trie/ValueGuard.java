package com.hunkyhsu.primer.trie;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 读取结果。持有读取时的 Trie 版本，保证 value 所在的子树在 guard 存活期间不被回收。
 *
 * @param <T> 值类型
 */
@Getter
@AllArgsConstructor
public class ValueGuard<T> {

    private final Trie snapshot;

    private final T value;
}
