/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import java.util.HashMap;
import java.util.Map;

/**
 * A trie over formatted field values, used to intern {@link PivotKey keys} while tabulating. Records that share a
 * prefix of row (or column) values walk the same path and reuse the keys cached at its nodes, instead of building a new
 * key per record and per subtotal level.
 *
 * <p>Each node caches the key for its path. A row node also roots a {@link #tree() column trie}, holding the column
 * keys seen together with that row. Value-field children are kept apart from field-value children, so a field value
 * can never collide with a value field's header.
 */
final class KeyNode {
    private final PivotKey key;
    private final Map<String, KeyNode> children = new HashMap<>();
    private final Map<Integer, KeyNode> valueChildren = new HashMap<>(4);
    private KeyNode tree;
    
    KeyNode(PivotKey key) {
        this.key = key;
    }
    
    PivotKey key() {
        return key;
    }
    
    /**
     * Returns the node for the path of the given record's formatted values, over the first {@code fieldCount} fields,
     * followed by the value field at {@code valueFieldIndex} (if any). Missing nodes are created along the way.
     */
    KeyNode getNode(PivotFieldList owner, PivotField[] fields, int fieldCount, PivotField[] valueFields,
                    int valueFieldIndex, Map<String, ?> item) {
        KeyNode node = this;
        for (int i = 0; i < fieldCount; i++) {
            String value = fields[i].formattedValue(item);
            KeyNode child = node.children.get(value);
            if (child == null) {
                child = new KeyNode(new PivotKey(owner, fields, i + 1, null, -1, item));
                node.children.put(value, child);
            }
            node = child;
        }
        if (valueFields != null && valueFieldIndex > -1) {
            KeyNode child = node.valueChildren.get(valueFieldIndex);
            if (child == null) {
                child = new KeyNode(new PivotKey(owner, fields, fieldCount, valueFields, valueFieldIndex, item));
                node.valueChildren.put(valueFieldIndex, child);
            }
            node = child;
        }
        return node;
    }
    
    /**
     * Returns the root of the column trie for this node, creating it if needed.
     */
    KeyNode tree() {
        if (tree == null)
            tree = new KeyNode(null);
        return tree;
    }
}
