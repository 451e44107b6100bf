package io.tabula.kernel;

import io.tabula.core.MutationNotAllowedException;

import java.util.AbstractList;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.RandomAccess;
import java.util.Set;

/**
 * Read-only views whose mutators fail with {@link MutationNotAllowedException}
 * instead of the bare {@link UnsupportedOperationException} of the JDK wrappers.
 * The backing collections must not be reachable by anyone else.
 */
public final class ReadOnlyViews {

    private ReadOnlyViews() {
    }

    public static <T> List<T> list(List<T> backing, String target) {
        return new ReadOnlyList<>(backing, target);
    }

    public static <K, V> Map<K, V> map(Map<K, V> backing, String target) {
        return new ReadOnlyMap<>(backing, target);
    }

    private static final class ReadOnlyList<T> extends AbstractList<T> implements RandomAccess {
        private final List<T> backing;
        private final String target;

        private ReadOnlyList(List<T> backing, String target) {
            this.backing = backing;
            this.target = target;
        }

        @Override
        public T get(int index) {
            return backing.get(index);
        }

        @Override
        public int size() {
            return backing.size();
        }

        @Override
        public T set(int index, T element) {
            throw new MutationNotAllowedException(target);
        }

        @Override
        public void add(int index, T element) {
            throw new MutationNotAllowedException(target);
        }

        @Override
        public T remove(int index) {
            throw new MutationNotAllowedException(target);
        }

        @Override
        public void clear() {
            throw new MutationNotAllowedException(target);
        }
    }

    private static final class ReadOnlyMap<K, V> extends AbstractMap<K, V> {
        private final Map<K, V> backing;
        private final String target;

        private ReadOnlyMap(Map<K, V> backing, String target) {
            this.backing = backing;
            this.target = target;
        }

        @Override
        public V get(Object key) {
            return backing.get(key);
        }

        @Override
        public boolean containsKey(Object key) {
            return backing.containsKey(key);
        }

        @Override
        public int size() {
            return backing.size();
        }

        @Override
        public V put(K key, V value) {
            throw new MutationNotAllowedException(target);
        }

        @Override
        public V remove(Object key) {
            throw new MutationNotAllowedException(target);
        }

        @Override
        public void putAll(Map<? extends K, ? extends V> other) {
            throw new MutationNotAllowedException(target);
        }

        @Override
        public void clear() {
            throw new MutationNotAllowedException(target);
        }

        @Override
        public Set<Entry<K, V>> entrySet() {
            return new AbstractSet<>() {
                @Override
                public Iterator<Entry<K, V>> iterator() {
                    Iterator<Entry<K, V>> delegate = backing.entrySet().iterator();
                    return new Iterator<>() {
                        @Override
                        public boolean hasNext() {
                            return delegate.hasNext();
                        }

                        @Override
                        public Entry<K, V> next() {
                            Entry<K, V> entry = delegate.next();
                            return new ReadOnlyEntry<>(entry.getKey(), entry.getValue(), target);
                        }

                        @Override
                        public void remove() {
                            throw new MutationNotAllowedException(target);
                        }
                    };
                }

                @Override
                public int size() {
                    return backing.size();
                }
            };
        }
    }

    private static final class ReadOnlyEntry<K, V> extends AbstractMap.SimpleImmutableEntry<K, V> {
        private final String target;

        private ReadOnlyEntry(K key, V value, String target) {
            super(key, value);
            this.target = target;
        }

        @Override
        public V setValue(V value) {
            throw new MutationNotAllowedException(target);
        }
    }
}
