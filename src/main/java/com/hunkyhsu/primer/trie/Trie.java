package com.hunkyhsu.primer.trie;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Trie - 持久化（copy-on-write）前缀树
 *
 * <p>每个 Trie 对象是一份完整的 key → value 快照，构造后不可变。
 * {@link #put} / {@link #remove} 只复制 key 路径上的节点，其余子树在新旧版本之间共享，
 * 所以代价是 O(key 长度)。
 *
 * <h2>线程安全</h2>
 * <p>Trie 本身不加锁：同一版本可被任意线程并发读取，也可以从同一版本并发派生新版本。
 * 哪个版本成为"当前版本"由调用方决定，见 {@link TrieStore}。
 *
 * <h2>值类型</h2>
 * <p>值以 Object 保存，{@link #get} 时按传入的 Class 检查。类型不匹配与 key 不存在等价，
 * 返回 {@link Optional#empty()}，不抛异常。
 *
 * @author hunkyhsu
 * @see TrieNode
 */
public final class Trie {

    private static final Logger logger = LoggerFactory.getLogger(Trie.class);

    /**
     * 根节点，空 Trie 为 null
     */
    @Getter
    private final TrieNode root;

    public Trie() {
        this(null);
    }

    Trie(TrieNode root) {
        this.root = root;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * 按 key 查找值
     *
     * <p>key 不存在、终结节点没有值、或值的类型不是 type 时都返回 {@link Optional#empty()}，
     * 不抛异常。返回的值在本版本（或共享该子树的任一版本）存活期间一直有效。
     *
     * @param key 查找的 key，空串表示根节点
     * @param type 期望的值类型（使用包装类型，如 Integer.class）
     * @return 值，找不到或类型不匹配时为 empty
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        TrieNode node = root;
        for (int i = 0; i < key.length() && node != null; i++) {
            node = node.getChild(key.charAt(i));
        }
        if (!(node instanceof TrieNodeWithValue)) {
            return Optional.empty();
        }
        Object value = ((TrieNodeWithValue<?>) node).getValue();
        if (!type.isInstance(value)) {
            logger.trace("Type mismatch for key '{}': stored {}, requested {}",
                    key, value.getClass().getName(), type.getName());
            return Optional.empty();
        }
        return Optional.of(type.cast(value));
    }

    /**
     * 生成 key 绑定到 value 的新版本，当前版本不变
     *
     * <p>已有的值（无论类型）会被覆盖，以 key 为前缀的更长的 key 保持不变。
     *
     * @param key key，空串表示绑定到根节点
     * @param value 值，不能为 null
     * @return 新版本
     */
    public <T> Trie put(String key, T value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        // path[i] 是 key[i] 的父节点（原版本中的，可能为 null）
        TrieNode[] path = new TrieNode[key.length()];
        TrieNode node = root;
        for (int i = 0; i < key.length(); i++) {
            path[i] = node;
            node = node == null ? null : node.getChild(key.charAt(i));
        }

        // 终结节点继承原节点的 children，保留以 key 为前缀的更长的 key
        TrieNode child = new TrieNodeWithValue<>(
                node == null ? Map.of() : node.getChildren(), value);
        for (int i = key.length() - 1; i >= 0; i--) {
            TrieNode parent = path[i] == null ? new TrieNode() : path[i];
            child = parent.withChild(key.charAt(i), child);
        }
        return new Trie(child);
    }

    /**
     * 生成删除 key 的新版本，当前版本不变
     *
     * <p>不再被任何 key 使用的节点会被逐级剪掉，全部删空时返回空 Trie。
     *
     * @param key 要删除的 key
     * @return 新版本；key 不存在时返回 this 本身
     */
    public Trie remove(String key) {
        Objects.requireNonNull(key, "key");

        TrieNode[] path = new TrieNode[key.length()];
        TrieNode node = root;
        for (int i = 0; i < key.length() && node != null; i++) {
            path[i] = node;
            node = node.getChild(key.charAt(i));
        }
        if (!(node instanceof TrieNodeWithValue)) {
            logger.trace("Key '{}' not present, remove is a no-op", key);
            return this;
        }

        // null 表示该节点被剪掉
        TrieNode child = node.hasChildren() ? new TrieNode(node.getChildren()) : null;
        for (int i = key.length() - 1; i >= 0; i--) {
            char ch = key.charAt(i);
            TrieNode parent = child == null ? path[i].withoutChild(ch) : path[i].withChild(ch, child);
            child = !parent.hasChildren() && !parent.isValueNode() ? null : parent;
        }
        return new Trie(child);
    }
}
