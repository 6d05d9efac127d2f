package com.hunkyhsu.primer.trie;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * TrieNode - 持久化 Trie 的节点
 *
 * <p>节点构造后不可变。修改操作（{@link #withChild}、{@link #withoutChild}）返回浅拷贝：
 * 新节点拥有自己的 children 映射，但子树本身按引用共享。
 *
 * @author hunkyhsu
 * @see TrieNodeWithValue
 */
@Getter
public class TrieNode {

    private final Map<Character, TrieNode> children;

    private final boolean valueNode;

    public TrieNode() {
        this(Collections.emptyMap(), false);
    }

    public TrieNode(Map<Character, TrieNode> children) {
        this(children, false);
    }

    TrieNode(Map<Character, TrieNode> children, boolean valueNode) {
        this.children = children.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(children));
        this.valueNode = valueNode;
    }

    public TrieNode getChild(char ch) {
        return children.get(ch);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * 浅拷贝当前节点，并把 ch 对应的子节点替换为 child
     */
    public TrieNode withChild(char ch, TrieNode child) {
        Map<Character, TrieNode> copy = new HashMap<>(children);
        copy.put(ch, child);
        return copyWith(copy);
    }

    /**
     * 浅拷贝当前节点，并删除 ch 对应的子节点
     */
    public TrieNode withoutChild(char ch) {
        Map<Character, TrieNode> copy = new HashMap<>(children);
        copy.remove(ch);
        return copyWith(copy);
    }

    /**
     * 用新的 children 构造同类型节点（值节点保留原值）
     */
    protected TrieNode copyWith(Map<Character, TrieNode> newChildren) {
        return new TrieNode(newChildren);
    }
}
