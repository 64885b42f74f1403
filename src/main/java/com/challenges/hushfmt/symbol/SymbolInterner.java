package com.challenges.hushfmt.symbol;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.ObjectIntMaps;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.primitive.MutableObjectIntMap;

/**
 * Insertion-ordered string interner. Handles are assigned densely starting at zero.
 * <p>
 * {@link #intern} reuses the handle of an earlier equal spelling; {@link #define} always takes the next handle, so a
 * table read from a dump keeps one handle per slot even when shadowed names repeat.
 */
public class SymbolInterner implements SymbolResolver {
    private final MutableList<String> names = Lists.mutable.empty();
    private final MutableObjectIntMap<String> handles = ObjectIntMaps.mutable.empty();

    public static SymbolInterner of(Iterable<String> spellings) {
        SymbolInterner interner = new SymbolInterner();
        for (String spelling : spellings) {
            interner.intern(spelling);
        }
        return interner;
    }

    public Symbol intern(String spelling) {
        if (spelling == null) {
            throw new IllegalArgumentException("Cannot intern a null spelling");
        }
        int handle = handles.getIfAbsentPut(spelling, names.size());
        if (handle == names.size()) {
            names.add(spelling);
        }
        return new Symbol(handle);
    }

    public Symbol define(String spelling) {
        if (spelling == null) {
            throw new IllegalArgumentException("Cannot define a null spelling");
        }
        int handle = names.size();
        names.add(spelling);
        handles.getIfAbsentPut(spelling, handle);
        return new Symbol(handle);
    }

    @Override
    public String resolve(Symbol symbol) {
        if (symbol.id() >= names.size()) {
            throw new IllegalArgumentException("Unknown symbol handle: " + symbol.id());
        }
        return names.get(symbol.id());
    }

    public int size() {
        return names.size();
    }

    public ImmutableList<String> spellings() {
        return names.toImmutable();
    }
}
