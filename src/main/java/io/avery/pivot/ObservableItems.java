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

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A mutable list of source records that notifies listeners after every structural or element change. An
 * {@link PivotEngine engine} whose {@link PivotEngine#setItemsSource items source} is an {@code ObservableItems}
 * invalidates its view whenever the list changes.
 *
 * <p>Changes made to the records themselves (the maps) are not observed; replace the record, or call
 * {@link #touch()}, to signal such changes.
 */
public final class ObservableItems extends AbstractList<Map<String, Object>> implements RandomAccess {
    private final List<Map<String, Object>> items;
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    
    public ObservableItems() {
        this.items = new ArrayList<>();
    }
    
    /**
     * @param items the initial records, copied
     */
    public ObservableItems(Collection<? extends Map<String, Object>> items) {
        this.items = new ArrayList<>(items);
    }
    
    public void addListener(Runnable listener) {
        listeners.add(Objects.requireNonNull(listener));
    }
    
    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }
    
    /**
     * Notifies listeners without changing the list.
     */
    public void touch() {
        changed();
    }
    
    @Override
    public Map<String, Object> get(int index) {
        return items.get(index);
    }
    
    @Override
    public int size() {
        return items.size();
    }
    
    @Override
    public Map<String, Object> set(int index, Map<String, Object> element) {
        Map<String, Object> old = items.set(index, Objects.requireNonNull(element));
        changed();
        return old;
    }
    
    @Override
    public void add(int index, Map<String, Object> element) {
        items.add(index, Objects.requireNonNull(element));
        modCount++;
        changed();
    }
    
    @Override
    public Map<String, Object> remove(int index) {
        Map<String, Object> old = items.remove(index);
        modCount++;
        changed();
        return old;
    }
    
    @Override
    public boolean addAll(Collection<? extends Map<String, Object>> c) {
        c.forEach(Objects::requireNonNull);
        boolean changed = items.addAll(c);
        if (changed) {
            modCount++;
            changed();
        }
        return changed;
    }
    
    @Override
    public void clear() {
        if (!items.isEmpty()) {
            items.clear();
            modCount++;
            changed();
        }
    }
    
    private void changed() {
        for (Runnable listener : listeners)
            listener.run();
    }
}
