package com.hunkyhsu.primer.trie;

import lombok.Getter;

import java.util.Map;
import java.util.Objects;

/**
 * 携带值的终结节点。值的类型由调用方决定，只在 {@link Trie#get} 时检查。
 *
 * @param <T> 值类型
 */
@Getter
public class TrieNodeWithValue<T> extends TrieNode {

    private final T value;

    public TrieNodeWithValue(T value) {
        this(Map.of(), value);
    }

    public TrieNodeWithValue(Map<Character, TrieNode> children, T value) {
        super(children, true);
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    protected TrieNode copyWith(Map<Character, TrieNode> newChildren) {
        return new TrieNodeWithValue<>(newChildren, value);
    }
}
