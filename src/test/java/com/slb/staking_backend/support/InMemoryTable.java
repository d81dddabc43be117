package com.slb.staking_backend.support;

import org.springframework.beans.BeanUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 内存表：读取与写入都做拷贝，模拟数据库行与调用方对象相互独立；支持快照/恢复以模拟事务回滚。
 */
public abstract class InMemoryTable<K extends Comparable<K>, T> implements Rollbackable {

    private final Supplier<T> factory;
    protected TreeMap<K, T> rows = new TreeMap<>();

    protected InMemoryTable(Supplier<T> factory) {
        this.factory = factory;
    }

    protected T copy(T source) {
        T target = factory.get();
        BeanUtils.copyProperties(source, target);
        return target;
    }

    protected Optional<T> read(K key) {
        T row = rows.get(key);
        return row == null ? Optional.empty() : Optional.of(copy(row));
    }

    protected void write(K key, T row) {
        rows.put(key, copy(row));
    }

    protected List<T> select(Predicate<T> filter) {
        return rows.values().stream().filter(filter).map(this::copy).collect(Collectors.toCollection(ArrayList::new));
    }

    public int size() {
        return rows.size();
    }

    @Override
    public Object snapshot() {
        TreeMap<K, T> copy = new TreeMap<>();
        for (Map.Entry<K, T> e : rows.entrySet()) {
            copy.put(e.getKey(), copy(e.getValue()));
        }
        return copy;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void restore(Object snapshot) {
        rows = (TreeMap<K, T>) snapshot;
    }
}
